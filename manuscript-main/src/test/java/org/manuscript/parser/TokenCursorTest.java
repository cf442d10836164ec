package org.manuscript.parser;

import org.junit.jupiter.api.Test;
import org.manuscript.lexer.Lexer;
import org.manuscript.lexer.LexerMode;
import org.manuscript.lexer.TokenType;

import static org.assertj.core.api.Assertions.assertThat;

class TokenCursorTest {

    private static TokenCursor cursor(String source) {
        return new TokenCursor(new Lexer(source, LexerMode.METHOD_BODY).tokenize());
    }

    @Test
    void advance_stopsAtEof() {
        TokenCursor cursor = cursor("a");
        cursor.advance();
        cursor.advance();
        cursor.advance();

        assertThat(cursor.atEnd()).isTrue();
        assertThat(cursor.position()).isEqualTo(1);
        assertThat(cursor.peek(5).type()).isEqualTo(TokenType.EOF);
    }

    @Test
    void copy_isIndependent() {
        TokenCursor cursor = cursor("a = b");
        TokenCursor lookahead = cursor.copy();
        lookahead.advance();
        lookahead.advance();

        assertThat(cursor.peek().text()).isEqualTo("a");
        assertThat(lookahead.peek().text()).isEqualTo("b");
    }

    @Test
    void skipBalanced_crossesNestedDelimiters() {
        TokenCursor cursor = cursor("(a[1], {b}) c");

        assertThat(cursor.skipBalanced()).isTrue();
        assertThat(cursor.peek().text()).isEqualTo("c");
        assertThat(cursor.previous().type()).isEqualTo(TokenType.RPAREN);
    }

    @Test
    void skipBalanced_reportsEndOfInput() {
        TokenCursor cursor = cursor("(a, (b)");

        assertThat(cursor.skipBalanced()).isFalse();
        assertThat(cursor.atEnd()).isTrue();
    }
}
