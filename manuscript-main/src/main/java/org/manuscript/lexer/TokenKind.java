package org.manuscript.lexer;

/**
 * Coarse token classification shared by the checker and the formatter.
 */
public enum TokenKind {
    IDENTIFIER,
    KEYWORD,
    NUMBER,
    STRING,
    OPERATOR,
    PUNCTUATION,
    COMMENT,
    END_OF_INPUT
}
