package org.manuscript.lexer;

import java.util.Map;
import java.util.Optional;

/**
 * Fine-grained token types. Each maps onto one {@link TokenKind}.
 */
public enum TokenType {

    // ── Literals ────────────────────────────────────────────────
    IDENTIFIER(TokenKind.IDENTIFIER, null),
    NUMBER(TokenKind.NUMBER, null),
    STRING(TokenKind.STRING, null),
    UNTERMINATED_STRING(TokenKind.STRING, null),
    COMMENT(TokenKind.COMMENT, null),

    // ── Keywords ────────────────────────────────────────────────
    IF(TokenKind.KEYWORD, "if"),
    ELSE(TokenKind.KEYWORD, "else"),
    FOR(TokenKind.KEYWORD, "for"),
    EACH(TokenKind.KEYWORD, "each"),
    IN(TokenKind.KEYWORD, "in"),
    TO(TokenKind.KEYWORD, "to"),
    WHILE(TokenKind.KEYWORD, "while"),
    SWITCH(TokenKind.KEYWORD, "switch"),
    CASE(TokenKind.KEYWORD, "case"),
    DEFAULT(TokenKind.KEYWORD, "default"),
    RETURN(TokenKind.KEYWORD, "return"),
    TRUE(TokenKind.KEYWORD, "true"),
    FALSE(TokenKind.KEYWORD, "false"),
    NULL(TokenKind.KEYWORD, "null"),
    AND(TokenKind.KEYWORD, "and"),
    OR(TokenKind.KEYWORD, "or"),
    NOT(TokenKind.KEYWORD, "not"),

    // ── Operators ───────────────────────────────────────────────
    ASSIGN(TokenKind.OPERATOR, "="),
    PLUS(TokenKind.OPERATOR, "+"),
    MINUS(TokenKind.OPERATOR, "-"),
    STAR(TokenKind.OPERATOR, "*"),
    SLASH(TokenKind.OPERATOR, "/"),
    PERCENT(TokenKind.OPERATOR, "%"),
    AMPERSAND(TokenKind.OPERATOR, "&"),
    LESS(TokenKind.OPERATOR, "<"),
    GREATER(TokenKind.OPERATOR, ">"),
    LESS_EQUAL(TokenKind.OPERATOR, "<="),
    GREATER_EQUAL(TokenKind.OPERATOR, ">="),
    NOT_EQUAL(TokenKind.OPERATOR, "!="),
    DOT(TokenKind.OPERATOR, "."),
    COLON(TokenKind.OPERATOR, ":"),

    // ── Punctuation ─────────────────────────────────────────────
    LPAREN(TokenKind.PUNCTUATION, "("),
    RPAREN(TokenKind.PUNCTUATION, ")"),
    LBRACE(TokenKind.PUNCTUATION, "{"),
    RBRACE(TokenKind.PUNCTUATION, "}"),
    LBRACKET(TokenKind.PUNCTUATION, "["),
    RBRACKET(TokenKind.PUNCTUATION, "]"),
    COMMA(TokenKind.PUNCTUATION, ","),
    SEMICOLON(TokenKind.PUNCTUATION, ";"),

    UNKNOWN(TokenKind.PUNCTUATION, null),
    EOF(TokenKind.END_OF_INPUT, null);

    // The language spells the boolean literals both ways.
    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("if", IF),
            Map.entry("else", ELSE),
            Map.entry("for", FOR),
            Map.entry("each", EACH),
            Map.entry("in", IN),
            Map.entry("to", TO),
            Map.entry("while", WHILE),
            Map.entry("switch", SWITCH),
            Map.entry("case", CASE),
            Map.entry("default", DEFAULT),
            Map.entry("return", RETURN),
            Map.entry("true", TRUE),
            Map.entry("True", TRUE),
            Map.entry("false", FALSE),
            Map.entry("False", FALSE),
            Map.entry("null", NULL),
            Map.entry("and", AND),
            Map.entry("or", OR),
            Map.entry("not", NOT));

    private final TokenKind kind;
    private final String symbol;

    TokenType(TokenKind kind, String symbol) {
        this.kind = kind;
        this.symbol = symbol;
    }

    public TokenKind kind() {
        return kind;
    }

    /**
     * Canonical spelling for keywords, operators and punctuation; {@code null} for
     * token types whose text varies.
     */
    public String symbol() {
        return symbol;
    }

    public static Optional<TokenType> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word));
    }

    public boolean isOpeningDelimiter() {
        return this == LPAREN || this == LBRACE || this == LBRACKET;
    }

    public boolean isClosingDelimiter() {
        return this == RPAREN || this == RBRACE || this == RBRACKET;
    }

    /**
     * The closing delimiter matching this opening one.
     *
     * @throws IllegalStateException if this type does not open a delimiter pair
     */
    public TokenType closer() {
        return switch (this) {
            case LPAREN -> RPAREN;
            case LBRACE -> RBRACE;
            case LBRACKET -> RBRACKET;
            default -> throw new IllegalStateException(this + " is not an opening delimiter");
        };
    }
}
