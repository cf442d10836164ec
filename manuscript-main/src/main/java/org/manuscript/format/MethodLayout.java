package org.manuscript.format;

import org.manuscript.lexer.Lexer;
import org.manuscript.lexer.LexerMode;
import org.manuscript.lexer.Token;
import org.manuscript.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A method string that is regular enough to re-layout: a parameter list of plain
 * names, a body in braces that ends the string, and only well-formed tokens. Anything
 * else is left for the caller to copy verbatim.
 */
final class MethodLayout {

    private final List<String> parameters;
    private final Token open;
    private final List<Token> body;

    private MethodLayout(List<String> parameters, Token open, List<Token> body) {
        this.parameters = parameters;
        this.open = open;
        this.body = body;
    }

    static Optional<MethodLayout> of(String content) {
        List<Token> tokens = new ArrayList<>(new Lexer(content, LexerMode.METHOD_BODY).tokenize());
        tokens.remove(tokens.size() - 1);
        for (Token token : tokens) {
            if (token.isAny(TokenType.UNKNOWN, TokenType.UNTERMINATED_STRING)) {
                return Optional.empty();
            }
        }
        if (tokens.isEmpty() || !tokens.get(0).is(TokenType.LPAREN)) {
            return Optional.empty();
        }

        List<String> parameters = new ArrayList<>();
        int i = 1;
        boolean expectName = true;
        while (i < tokens.size() && !tokens.get(i).is(TokenType.RPAREN)) {
            Token token = tokens.get(i);
            if (expectName && token.is(TokenType.IDENTIFIER)) {
                parameters.add(token.text());
            } else if (expectName || !token.is(TokenType.COMMA)) {
                return Optional.empty();
            }
            expectName = !expectName;
            i++;
        }
        if (i + 1 >= tokens.size() || !tokens.get(i + 1).is(TokenType.LBRACE)) {
            return Optional.empty();
        }
        int openIndex = i + 1;
        int last = tokens.size() - 1;
        if (!tokens.get(last).is(TokenType.RBRACE)) {
            return Optional.empty();
        }
        int depth = 0;
        for (int j = openIndex; j <= last; j++) {
            Token token = tokens.get(j);
            if (token.is(TokenType.LBRACE)) {
                depth++;
            } else if (token.is(TokenType.RBRACE)) {
                depth--;
                if (depth == 0 && j != last) {
                    return Optional.empty();
                }
            }
        }
        if (depth != 0) {
            return Optional.empty();
        }
        return Optional.of(new MethodLayout(List.copyOf(parameters), tokens.get(openIndex),
                List.copyOf(tokens.subList(openIndex + 1, last))));
    }

    /**
     * Whether the layout spans several lines once printed.
     */
    boolean isBlock() {
        return !body.isEmpty();
    }

    void print(SourcePrinter printer) {
        printer.print("\"(" + String.join(", ", parameters) + ") {");
        if (body.isEmpty()) {
            printer.print(" }\"");
            return;
        }
        printer.indent();
        Token previous = open;
        Token previousCode = open;
        boolean lineStart = true;
        boolean previousUnaryMinus = false;
        int nesting = 0;

        for (Token token : body) {
            int gap = token.line() - previous.endLine();
            if (token.is(TokenType.COMMENT)) {
                if (gap == 0) {
                    printer.print(" " + token.text());
                } else {
                    printer.startLine(gap > 1 && !previous.is(TokenType.LBRACE));
                    printer.print(token.text());
                }
                lineStart = true;
                previous = token;
                continue;
            }

            boolean joinsClosingBrace = previous == previousCode && previousCode.is(TokenType.RBRACE)
                    && token.isAny(TokenType.ELSE, TokenType.SEMICOLON);
            if (token.is(TokenType.RBRACE)) {
                printer.unindent();
                printer.startLine(false);
                printer.print("}");
            } else if (lineStart && joinsClosingBrace) {
                printer.print(token.is(TokenType.ELSE) ? " else" : ";");
                lineStart = token.is(TokenType.SEMICOLON);
            } else if (lineStart) {
                printer.startLine(gap > 1 && !previous.is(TokenType.LBRACE));
                printer.print(token.text());
                lineStart = false;
            } else {
                if (needsSpace(previousCode, previousUnaryMinus, token)) {
                    printer.print(" ");
                }
                printer.print(token.text());
            }

            previousUnaryMinus = token.is(TokenType.MINUS) && !endsOperand(previousCode);
            if (token.isAny(TokenType.LPAREN, TokenType.LBRACKET)) {
                nesting++;
            } else if (token.isAny(TokenType.RPAREN, TokenType.RBRACKET) && nesting > 0) {
                nesting--;
            }
            if (token.is(TokenType.LBRACE)) {
                printer.indent();
                nesting = 0;
                lineStart = true;
            } else if (token.is(TokenType.RBRACE) || (token.is(TokenType.SEMICOLON) && nesting == 0)) {
                lineStart = true;
            }
            previous = token;
            previousCode = token;
        }

        printer.unindent();
        printer.startLine(false);
        printer.print("}\"");
    }

    private static boolean needsSpace(Token previous, boolean previousUnaryMinus, Token token) {
        if (token.isAny(TokenType.SEMICOLON, TokenType.COMMA, TokenType.RPAREN, TokenType.RBRACKET,
                TokenType.DOT, TokenType.COLON)) {
            return false;
        }
        if (previous.isAny(TokenType.DOT, TokenType.COLON, TokenType.LPAREN, TokenType.LBRACKET)
                || previousUnaryMinus) {
            return false;
        }
        if (token.is(TokenType.LPAREN)) {
            return !previous.isAny(TokenType.IDENTIFIER, TokenType.RPAREN, TokenType.RBRACKET);
        }
        if (token.is(TokenType.LBRACKET)) {
            return !previous.isAny(TokenType.IDENTIFIER, TokenType.RPAREN, TokenType.RBRACKET, TokenType.STRING);
        }
        return true;
    }

    /**
     * Tokens after which a {@code -} is binary.
     */
    private static boolean endsOperand(Token token) {
        return token.isAny(TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.STRING, TokenType.RPAREN,
                TokenType.RBRACKET, TokenType.TRUE, TokenType.FALSE, TokenType.NULL);
    }
}
