package org.manuscript.diagnostic;

import java.util.Comparator;

/**
 * A single reported problem. Severity is carried separately from the code so that
 * strict mode can re-label a warning without touching the code table.
 */
public record Diagnostic(String code, Severity severity, String message, Span span) {

    public static final Comparator<Diagnostic> BY_POSITION = Comparator
            .comparing(Diagnostic::span)
            .thenComparing(Diagnostic::code);

    public static Diagnostic of(DiagnosticCode code, Span span, Object... args) {
        String message = args.length == 0 ? code.template() : String.format(code.template(), args);
        return new Diagnostic(code.code(), code.severity(), message, span);
    }

    public int line() {
        return span.line();
    }

    public int column() {
        return span.column();
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Diagnostic withSeverity(Severity newSeverity) {
        return newSeverity == severity ? this : new Diagnostic(code, newSeverity, message, span);
    }

    @Override
    public String toString() {
        return span.line() + ":" + span.column() + " [" + code + "] " + message;
    }
}
