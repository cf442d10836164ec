package org.manuscript.scope;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Accepted argument count range of one call overload, inclusive on both ends.
 */
public record Arity(int min, int max) {

    public Arity {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid arity " + min + ".." + max);
        }
    }

    public boolean accepts(int count) {
        return count >= min && count <= max;
    }

    @Override
    public String toString() {
        return min == max ? Integer.toString(min) : min + "-" + max;
    }

    /**
     * Render a set of overloads the way they appear in messages, e.g. {@code "1 or 3-4"}.
     */
    public static String describe(List<Arity> overloads) {
        return overloads.stream().map(Arity::toString).collect(Collectors.joining(" or "));
    }
}
