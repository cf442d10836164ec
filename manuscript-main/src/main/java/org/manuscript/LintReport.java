package org.manuscript;

import org.manuscript.diagnostic.Diagnostic;
import org.manuscript.diagnostic.Severity;

import java.util.List;

/**
 * Final diagnostics of one file, sorted by position, after suppression and strict
 * mode were applied.
 *
 * @param suppressed number of diagnostics removed by configuration or directives
 */
public record LintReport(List<Diagnostic> diagnostics, int suppressed) {

    public LintReport {
        diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.ERROR).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.WARNING).toList();
    }

    public int errorCount() {
        return (int) diagnostics.stream().filter(Diagnostic::isError).count();
    }

    public int warningCount() {
        return diagnostics.size() - errorCount();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }

    public List<String> codes() {
        return diagnostics.stream().map(Diagnostic::code).toList();
    }
}
