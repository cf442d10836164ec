package org.manuscript.suppression;

import org.manuscript.config.LintConfig;
import org.manuscript.diagnostic.Category;
import org.manuscript.diagnostic.Diagnostic;
import org.manuscript.diagnostic.DiagnosticCode;
import org.manuscript.diagnostic.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies configuration and source directives to the raw diagnostics of a file.
 * <p>
 * Filtering always runs after collection, so the result does not depend on the order
 * in which analysis phases reported. Order of application:
 * <ol>
 *   <li>codes on the configuration ignore list are dropped, structural ones included</li>
 *   <li>non-structural diagnostics covered by an inline or region directive are dropped</li>
 *   <li>in strict mode, surviving warnings selected for elevation become errors</li>
 * </ol>
 */
public final class SuppressionEngine {

    private final LintConfig config;

    public SuppressionEngine(LintConfig config) {
        this.config = config;
    }

    public List<Diagnostic> apply(List<Diagnostic> diagnostics, SuppressionDirectives directives) {
        List<Diagnostic> kept = new ArrayList<>(diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            if (isSuppressed(diagnostic, directives)) {
                continue;
            }
            kept.add(isElevated(diagnostic) ? diagnostic.withSeverity(Severity.ERROR) : diagnostic);
        }
        return kept;
    }

    public boolean isSuppressed(Diagnostic diagnostic, SuppressionDirectives directives) {
        if (config.isIgnored(diagnostic.code())) {
            return true;
        }
        boolean structural = DiagnosticCode.fromCode(diagnostic.code())
                .map(DiagnosticCode::isStructural)
                .orElse(false);
        return !structural && directives.covers(diagnostic);
    }

    private boolean isElevated(Diagnostic diagnostic) {
        if (!config.strict() || diagnostic.severity() != Severity.WARNING) {
            return false;
        }
        if (!config.elevate().isEmpty()) {
            return config.elevate().contains(diagnostic.code());
        }
        Optional<DiagnosticCode> code = DiagnosticCode.fromCode(diagnostic.code());
        return code.isPresent() && code.get().category() == Category.DEFINEDNESS;
    }
}
