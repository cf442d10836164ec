package org.manuscript.diagnostic;

/**
 * Families of diagnostic codes. Suppression and strict mode select on these.
 */
public enum Category {
    STRUCTURAL,
    SYNTAX,
    ARITY,
    TOKENIZATION,
    DEFINEDNESS,
    SEMANTIC,
    STYLE
}
