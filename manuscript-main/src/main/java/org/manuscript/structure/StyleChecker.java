package org.manuscript.structure;

import org.manuscript.diagnostic.DiagnosticCode;
import org.manuscript.diagnostic.DiagnosticRegistry;
import org.manuscript.diagnostic.Span;
import org.manuscript.lexer.Lexer;
import org.manuscript.lexer.LexerMode;
import org.manuscript.lexer.Token;
import org.manuscript.parser.PluginEnvelope;
import org.manuscript.parser.PluginMember;

import java.util.Optional;

/**
 * Line-level style rules and the plugin conventions every host expects: an
 * {@code Initialize} method that registers the plugin in the menu.
 */
public final class StyleChecker {

    public static final String INITIALIZE = "Initialize";
    public static final String MENU_REGISTRATION = "AddToPluginsMenu";

    private final DiagnosticRegistry registry;
    private final int maxLineLength;

    public StyleChecker(DiagnosticRegistry registry, int maxLineLength) {
        this.registry = registry;
        this.maxLineLength = maxLineLength;
    }

    public void checkLines(String source) {
        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].endsWith("\r") ? lines[i].substring(0, lines[i].length() - 1) : lines[i];
            int lineNumber = i + 1;
            String stripped = line.stripTrailing();
            if (stripped.length() < line.length()) {
                registry.report(DiagnosticCode.W002, Span.at(lineNumber, stripped.length() + 1));
            }
            if (line.length() > maxLineLength) {
                registry.report(DiagnosticCode.W003, Span.at(lineNumber, maxLineLength + 1), line.length());
            }
        }
    }

    public void checkConventions(PluginEnvelope envelope) {
        Optional<PluginMember.Method> initialize = envelope.method(INITIALIZE);
        if (initialize.isEmpty()) {
            registry.report(DiagnosticCode.W010, Span.at(1, 1));
            return;
        }
        PluginMember.Method method = initialize.get();
        boolean registers = false;
        for (Token token : new Lexer(method.content(), LexerMode.METHOD_BODY)) {
            if (token.text().equals(MENU_REGISTRATION)) {
                registers = true;
                break;
            }
        }
        if (!registers) {
            registry.report(DiagnosticCode.W011, method.nameToken().span());
        }
    }
}
