package org.manuscript.suppression;

import org.manuscript.diagnostic.Diagnostic;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Suppression comments found in one source file.
 * <p>
 * Recognised forms, matched case-insensitively anywhere on a line:
 * <pre>
 *   // noqa                        every code on this line
 *   // noqa: MS-W020, MS-W025      listed codes on this line
 *   // manuscript: ignore MS-W020  listed codes on this line
 *   // manuscript: disable MS-W020 listed codes from here ...
 *   // manuscript: enable MS-W020  ... to here (inclusive)
 * </pre>
 * {@code mahlif:} is accepted in place of {@code manuscript:}. A line holding nothing but
 * a {@code noqa} or {@code ignore} comment also covers the following line. An
 * {@code ignore} without codes does nothing. A {@code disable} or {@code enable} without
 * codes means every code; a {@code disable} that is never matched runs to the end of the
 * file.
 */
public final class SuppressionDirectives {

    /** Stands for "every code" in line and region sets. */
    static final String ALL = "*";

    private static final String CODES = "([A-Za-z0-9][A-Za-z0-9-]*(?:\\s*,\\s*[A-Za-z0-9][A-Za-z0-9-]*)*)";

    private static final String MARKER = "//\\s*(?:manuscript|mahlif)\\s*:\\s*";

    private static final Pattern NOQA = Pattern.compile(
            "//\\s*noqa\\b(?:\\s*:\\s*" + CODES + ")?", Pattern.CASE_INSENSITIVE);
    private static final Pattern IGNORE = Pattern.compile(
            MARKER + "ignore\\s+" + CODES, Pattern.CASE_INSENSITIVE);
    private static final Pattern DISABLE = Pattern.compile(
            MARKER + "disable\\b\\s*" + CODES + "?", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENABLE = Pattern.compile(
            MARKER + "enable\\b\\s*" + CODES + "?", Pattern.CASE_INSENSITIVE);

    /** A suppressed line range for one code (or {@link #ALL}), both ends inclusive. */
    record Region(String code, int startLine, int endLine) {

        boolean covers(String candidate, int line) {
            return line >= startLine && line <= endLine && (code.equals(ALL) || code.equals(candidate));
        }
    }

    private static final SuppressionDirectives NONE = new SuppressionDirectives(Map.of(), List.of());

    private final Map<Integer, Set<String>> lineCodes;
    private final List<Region> regions;

    private SuppressionDirectives(Map<Integer, Set<String>> lineCodes, List<Region> regions) {
        this.lineCodes = lineCodes;
        this.regions = regions;
    }

    public static SuppressionDirectives none() {
        return NONE;
    }

    /**
     * Scan raw source lines for directives.
     */
    public static SuppressionDirectives scan(String source) {
        Map<Integer, Set<String>> lineCodes = new HashMap<>();
        List<Region> regions = new ArrayList<>();
        Map<String, Integer> openRegions = new LinkedHashMap<>();

        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i];

            Matcher lineDirective = NOQA.matcher(line);
            boolean found = lineDirective.find();
            if (!found) {
                lineDirective = IGNORE.matcher(line);
                found = lineDirective.find();
            }
            if (found) {
                Set<String> codes = parseCodes(lineDirective.group(1));
                lineCodes.computeIfAbsent(lineNumber, k -> new HashSet<>()).addAll(codes);
                if (line.stripLeading().startsWith("//")) {
                    lineCodes.computeIfAbsent(lineNumber + 1, k -> new HashSet<>()).addAll(codes);
                }
            }

            Matcher disable = DISABLE.matcher(line);
            if (disable.find()) {
                for (String code : parseCodes(disable.group(1))) {
                    openRegions.putIfAbsent(code, lineNumber);
                }
            }
            Matcher enable = ENABLE.matcher(line);
            if (enable.find()) {
                Set<String> codes = parseCodes(enable.group(1));
                List<String> closing = codes.contains(ALL) ? new ArrayList<>(openRegions.keySet()) : new ArrayList<>(codes);
                for (String code : closing) {
                    Integer start = openRegions.remove(code);
                    if (start != null) {
                        regions.add(new Region(code, start, lineNumber));
                    }
                }
            }
        }
        openRegions.forEach((code, start) -> regions.add(new Region(code, start, Integer.MAX_VALUE)));

        if (lineCodes.isEmpty() && regions.isEmpty()) {
            return NONE;
        }
        Map<Integer, Set<String>> frozen = new HashMap<>();
        lineCodes.forEach((line, codes) -> frozen.put(line, Set.copyOf(codes)));
        return new SuppressionDirectives(Map.copyOf(frozen), List.copyOf(regions));
    }

    private static Set<String> parseCodes(String group) {
        if (group == null || group.isBlank()) {
            return Set.of(ALL);
        }
        Set<String> codes = new HashSet<>();
        for (String code : group.split(",")) {
            if (!code.isBlank()) {
                codes.add(code.trim().toUpperCase(Locale.ROOT));
            }
        }
        return codes;
    }

    /**
     * Whether a directive covers {@code diagnostic}. Structural exemption is decided by
     * the caller.
     */
    public boolean covers(Diagnostic diagnostic) {
        int line = diagnostic.line();
        Set<String> codes = lineCodes.get(line);
        if (codes != null && (codes.contains(ALL) || codes.contains(diagnostic.code()))) {
            return true;
        }
        for (Region region : regions) {
            if (region.covers(diagnostic.code(), line)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return lineCodes.isEmpty() && regions.isEmpty();
    }
}
