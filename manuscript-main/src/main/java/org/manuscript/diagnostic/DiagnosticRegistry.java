package org.manuscript.diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only collector for the diagnostics of one file. Not thread-safe; each file
 * gets its own registry.
 */
public final class DiagnosticRegistry {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int syntaxErrors;

    public Diagnostic report(DiagnosticCode code, Span span, Object... args) {
        Diagnostic diagnostic = Diagnostic.of(code, span, args);
        add(diagnostic);
        return diagnostic;
    }

    public void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        if (diagnostic.isError() && DiagnosticCode.fromCode(diagnostic.code())
                .map(DiagnosticRegistry::isSyntax).orElse(false)) {
            syntaxErrors++;
        }
    }

    private static boolean isSyntax(DiagnosticCode code) {
        return code.category() == Category.SYNTAX || code.category() == Category.TOKENIZATION;
    }

    /**
     * Read-only view in the order diagnostics were reported.
     */
    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Number of syntax and tokenization errors reported so far. Parsers compare it
     * before and after a construct to tell whether the construct already failed.
     */
    public int syntaxErrorCount() {
        return syntaxErrors;
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }
}
