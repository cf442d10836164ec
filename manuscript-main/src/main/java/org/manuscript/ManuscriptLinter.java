package org.manuscript;

import org.manuscript.config.LintConfig;
import org.manuscript.diagnostic.Diagnostic;
import org.manuscript.diagnostic.DiagnosticRegistry;
import org.manuscript.lexer.Lexer;
import org.manuscript.lexer.LexerMode;
import org.manuscript.lexer.Token;
import org.manuscript.parser.EnvelopeParser;
import org.manuscript.parser.PluginEnvelope;
import org.manuscript.parser.PluginMember;
import org.manuscript.parser.StatementParser;
import org.manuscript.scope.LanguageData;
import org.manuscript.scope.ScopeAnalyzer;
import org.manuscript.structure.StructuralChecker;
import org.manuscript.structure.StyleChecker;
import org.manuscript.suppression.SuppressionDirectives;
import org.manuscript.suppression.SuppressionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the analysis pipeline.
 * <p>
 * A file is lexed as an envelope of named strings, checked for delimiter balance and
 * conventions, and each method string is lexed again and parsed with definedness
 * tracking. Everything lands in one registry; suppression and strict mode are applied
 * to the complete list and the survivors are sorted by position.
 * <p>
 * Instances hold only immutable state and may be shared between threads. Each call
 * builds its own per-file state.
 */
public final class ManuscriptLinter {

    private static final Logger LOG = LoggerFactory.getLogger(ManuscriptLinter.class);

    private final LintConfig config;
    private final LanguageData language;
    private final SuppressionEngine suppression;

    public ManuscriptLinter() {
        this(LintConfig.defaults());
    }

    public ManuscriptLinter(LintConfig config) {
        this(config, LanguageData.standard());
    }

    public ManuscriptLinter(LintConfig config, LanguageData language) {
        this.config = config;
        this.language = language;
        this.suppression = new SuppressionEngine(config);
    }

    public LintReport lint(String source) {
        long start = System.nanoTime();
        List<Diagnostic> raw = collect(source);
        List<Diagnostic> kept = new ArrayList<>(suppression.apply(raw, SuppressionDirectives.scan(source)));
        kept.sort(Diagnostic.BY_POSITION);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Linted {} chars in {} us: {} reported, {} kept",
                    source.length(), (System.nanoTime() - start) / 1_000, raw.size(), kept.size());
        }
        return new LintReport(kept, raw.size() - kept.size());
    }

    /**
     * Every diagnostic the analysis phases report, before suppression, in reporting
     * order.
     */
    public List<Diagnostic> collect(String source) {
        DiagnosticRegistry registry = new DiagnosticRegistry();
        List<Token> envelopeTokens = new Lexer(source, LexerMode.ENVELOPE).tokenize();

        new StructuralChecker(registry).check(envelopeTokens);
        PluginEnvelope envelope = new EnvelopeParser(registry).parse(envelopeTokens);

        StyleChecker style = new StyleChecker(registry, config.maxLineLength());
        style.checkLines(source);
        style.checkConventions(envelope);

        ScopeAnalyzer scope = new ScopeAnalyzer(registry, language, envelope.variableNames(), envelope.methodNames());
        for (PluginMember.Method method : envelope.methods()) {
            if (method.isTerminated()) {
                StatementParser.parseMethod(method, registry, scope, language);
            }
        }
        return registry.diagnostics();
    }

    public LintConfig config() {
        return config;
    }
}
