package org.manuscript.scope;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Methods and properties of one host object.
 */
public record ObjectApi(Set<String> methods, Set<String> properties) {

    public ObjectApi {
        methods = Set.copyOf(methods);
        properties = Set.copyOf(properties);
    }

    public boolean hasMethod(String name) {
        return methods.contains(name);
    }

    /**
     * Properties and methods both count, since a method may be read without calling it.
     */
    public boolean hasMember(String name) {
        return properties.contains(name) || methods.contains(name);
    }

    /**
     * Closest member name to a misspelt {@code name}: a case-insensitive match first,
     * otherwise the nearest name within a small edit distance.
     */
    public Optional<String> suggest(String name) {
        Set<String> candidates = new HashSet<>(properties);
        candidates.addAll(methods);
        String lower = name.toLowerCase(Locale.ROOT);
        int limit = Math.max(1, name.length() / 4);
        return candidates.stream()
                .filter(candidate -> distance(lower, candidate.toLowerCase(Locale.ROOT)) <= limit)
                .min(Comparator.<String>comparingInt(candidate -> distance(lower, candidate.toLowerCase(Locale.ROOT)))
                        .thenComparing(Comparator.naturalOrder()));
    }

    // Levenshtein, two rows
    static int distance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j], current[j - 1]) + 1);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
