package org.manuscript.config;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lint settings for a run. Code sets hold upper-cased printed codes such as
 * {@code MS-W020}.
 *
 * @param ignore        codes dropped everywhere, structural ones included
 * @param strict        re-label selected warnings as errors
 * @param elevate       warnings to re-label in strict mode; empty means every
 *                      definedness warning
 * @param fixable       codes {@code --fix} may repair; empty means every fixable code
 * @param unfixable     codes {@code --fix} must leave alone
 * @param maxLineLength longest line accepted before a line-length warning
 */
public record LintConfig(Set<String> ignore,
                         boolean strict,
                         Set<String> elevate,
                         Set<String> fixable,
                         Set<String> unfixable,
                         int maxLineLength) {

    public static final int DEFAULT_MAX_LINE_LENGTH = 200;

    private static final LintConfig DEFAULTS =
            new LintConfig(Set.of(), false, Set.of(), Set.of(), Set.of(), DEFAULT_MAX_LINE_LENGTH);

    public LintConfig {
        ignore = normalize(ignore);
        elevate = normalize(elevate);
        fixable = normalize(fixable);
        unfixable = normalize(unfixable);
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive, got " + maxLineLength);
        }
    }

    public static LintConfig defaults() {
        return DEFAULTS;
    }

    private static Set<String> normalize(Collection<String> codes) {
        return codes.stream()
                .map(code -> code.trim().toUpperCase(Locale.ROOT))
                .filter(code -> !code.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isIgnored(String code) {
        return ignore.contains(code);
    }

    public boolean isFixable(String code) {
        return !unfixable.contains(code) && (fixable.isEmpty() || fixable.contains(code));
    }

    /**
     * Add codes to the ignore list, as the command line's {@code --ignore} does.
     */
    public LintConfig withIgnored(Collection<String> codes) {
        Set<String> merged = new HashSet<>(ignore);
        merged.addAll(codes);
        return new LintConfig(merged, strict, elevate, fixable, unfixable, maxLineLength);
    }

    public LintConfig withStrict(boolean enabled) {
        return new LintConfig(ignore, enabled, elevate, fixable, unfixable, maxLineLength);
    }
}
