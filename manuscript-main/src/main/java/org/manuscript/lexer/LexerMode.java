package org.manuscript.lexer;

/**
 * The plugin file is lexed twice: once as an envelope of named strings, then each
 * method string again as code.
 */
public enum LexerMode {

    /** Strings use {@code "} only and may span lines. */
    ENVELOPE,

    /** Strings use {@code '} or {@code "} and end at the line break. */
    METHOD_BODY
}
