package org.manuscript.parser;

import org.manuscript.lexer.Token;
import org.manuscript.lexer.TokenType;

import java.util.List;

/**
 * Position over a token list with lookahead. The cursor never moves past the final
 * {@link TokenType#EOF} token, so every lookahead is safe.
 * <p>
 * {@link #copy()} gives an independent cursor at the same position; speculative scans
 * run on the copy and are simply dropped when they do not pan out.
 */
public final class TokenCursor {

    private final List<Token> tokens;
    private int position;

    /**
     * @param tokens tokens to walk; must end with an {@link TokenType#EOF} token
     */
    public TokenCursor(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
    }

    private TokenCursor(List<Token> tokens, int position) {
        this.tokens = tokens;
        this.position = position;
    }

    public TokenCursor copy() {
        return new TokenCursor(tokens, position);
    }

    public Token peek() {
        return tokens.get(position);
    }

    public Token peek(int ahead) {
        return tokens.get(Math.min(position + ahead, tokens.size() - 1));
    }

    /**
     * The most recently consumed token, or the current one when nothing has been
     * consumed yet.
     */
    public Token previous() {
        return tokens.get(Math.max(0, position - 1));
    }

    public Token advance() {
        Token current = tokens.get(position);
        if (!current.is(TokenType.EOF)) {
            position++;
        }
        return current;
    }

    public boolean check(TokenType type) {
        return peek().is(type);
    }

    public boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    public boolean atEnd() {
        return peek().is(TokenType.EOF);
    }

    public int position() {
        return position;
    }

    /**
     * Skip from an opening delimiter past its matching closer, counting all three
     * delimiter kinds.
     *
     * @return {@code false} if the input ended first
     */
    public boolean skipBalanced() {
        int depth = 0;
        do {
            Token token = advance();
            if (token.type().isOpeningDelimiter()) {
                depth++;
            } else if (token.type().isClosingDelimiter()) {
                depth--;
            } else if (token.is(TokenType.EOF)) {
                return false;
            }
        } while (depth > 0);
        return true;
    }
}
