package org.manuscript.parser;

import org.manuscript.diagnostic.Diagnostic;

/**
 * Outcome of a header production (condition, loop header). A failure carries the
 * diagnostic instead of reporting it, so the caller decides how to resynchronise
 * before recording it.
 */
public sealed interface ParseResult<T> {

    record Success<T>(T value) implements ParseResult<T> {}

    record Failure<T>(Diagnostic diagnostic) implements ParseResult<T> {}

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> failure(Diagnostic diagnostic) {
        return new Failure<>(diagnostic);
    }
}
