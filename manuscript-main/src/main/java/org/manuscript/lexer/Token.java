package org.manuscript.lexer;

import org.manuscript.diagnostic.Span;

/**
 * A lexical token. {@code text} is the exact source slice, quotes and comment
 * markers included, so tokens can be re-emitted unchanged.
 */
public record Token(TokenType type, String text, int line, int column) {

    public TokenKind kind() {
        return type.kind();
    }

    public boolean is(TokenType candidate) {
        return type == candidate;
    }

    public boolean isAny(TokenType... candidates) {
        for (TokenType candidate : candidates) {
            if (type == candidate) {
                return true;
            }
        }
        return false;
    }

    /**
     * Identifiers and keywords both read as words; keywords may appear as member names
     * after {@code .} or {@code :}.
     */
    public boolean isWord() {
        return type == TokenType.IDENTIFIER || (type.kind() == TokenKind.KEYWORD);
    }

    /**
     * Line of the last character of this token; strings in the plugin envelope may
     * span several lines.
     */
    public int endLine() {
        int end = line;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                end++;
            }
        }
        return end;
    }

    public Span span() {
        int lastBreak = text.lastIndexOf('\n');
        if (lastBreak < 0) {
            return new Span(line, column, line, column + Math.max(0, text.length() - 1));
        }
        return new Span(line, column, endLine(), Math.max(1, text.length() - lastBreak - 1));
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + line + ":" + column;
    }
}
