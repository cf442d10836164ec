package org.manuscript.lexer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Converts plugin text into a token sequence.
 * <p>
 * The lexer never fails: characters outside the language become single-character
 * {@link TokenType#UNKNOWN} tokens and strings running off the end of their line (or
 * of the input) become {@link TokenType#UNTERMINATED_STRING}. Reporting either is
 * left to the parser. Whitespace is dropped, comments are kept.
 * <p>
 * Scanning is lazy and every call to {@link #iterator()} starts again from the first
 * character, so one instance may be walked any number of times.
 */
public final class Lexer implements Iterable<Token> {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final String source;
    private final LexerMode mode;
    private final int startLine;
    private final int startColumn;

    public Lexer(String source, LexerMode mode) {
        this(source, mode, 1, 1);
    }

    /**
     * @param startLine   line number of the first character of {@code source}
     * @param startColumn column number of the first character of {@code source}
     */
    public Lexer(String source, LexerMode mode, int startLine, int startColumn) {
        this.source = source;
        this.mode = mode;
        this.startLine = startLine;
        this.startColumn = startColumn;
    }

    /**
     * Scan the whole input. The returned list always ends with a single
     * {@link TokenType#EOF} token.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scanner();
    }

    private final class Scanner implements Iterator<Token> {

        private int pos;
        private int line = startLine;
        private int column = startColumn;
        private boolean finished;

        Scanner() {
            if (!source.isEmpty() && source.charAt(0) == BYTE_ORDER_MARK) {
                pos = 1;
            }
        }

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public Token next() {
            if (finished) {
                throw new NoSuchElementException();
            }
            skipWhitespace();
            if (pos >= source.length()) {
                finished = true;
                return new Token(TokenType.EOF, "", line, column);
            }

            int tokenLine = line;
            int tokenColumn = column;
            int start = pos;
            char c = source.charAt(pos);

            if (c == '/' && peek(1) == '/') {
                while (pos < source.length() && !isLineBreak(source.charAt(pos))) {
                    advance();
                }
                return token(TokenType.COMMENT, start, tokenLine, tokenColumn);
            }
            if (isQuote(c)) {
                return scanString(c, start, tokenLine, tokenColumn);
            }
            if (Character.isDigit(c)) {
                return scanNumber(start, tokenLine, tokenColumn);
            }
            if (Character.isLetter(c) || c == '_') {
                while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                    advance();
                }
                String word = source.substring(start, pos);
                TokenType type = TokenType.keyword(word).orElse(TokenType.IDENTIFIER);
                return new Token(type, word, tokenLine, tokenColumn);
            }
            return scanSymbol(c, start, tokenLine, tokenColumn);
        }

        // ── Token scanners ──────────────────────────────────────

        private Token scanString(char quote, int start, int tokenLine, int tokenColumn) {
            advance();
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == quote) {
                    advance();
                    return token(TokenType.STRING, start, tokenLine, tokenColumn);
                }
                if (mode == LexerMode.METHOD_BODY && isLineBreak(c)) {
                    break;
                }
                if (c == '\\' && pos + 1 < source.length()
                        && (mode == LexerMode.ENVELOPE || !isLineBreak(source.charAt(pos + 1)))) {
                    advance();
                }
                advance();
            }
            return token(TokenType.UNTERMINATED_STRING, start, tokenLine, tokenColumn);
        }

        private Token scanNumber(int start, int tokenLine, int tokenColumn) {
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                advance();
            }
            if (peek(0) == '.' && Character.isDigit(peek(1))) {
                advance();
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    advance();
                }
            }
            return token(TokenType.NUMBER, start, tokenLine, tokenColumn);
        }

        private Token scanSymbol(char c, int start, int tokenLine, int tokenColumn) {
            char next = peek(1);
            TokenType type = switch (c) {
                case '<' -> next == '=' ? TokenType.LESS_EQUAL : TokenType.LESS;
                case '>' -> next == '=' ? TokenType.GREATER_EQUAL : TokenType.GREATER;
                case '!' -> next == '=' ? TokenType.NOT_EQUAL : TokenType.UNKNOWN;
                case '=' -> TokenType.ASSIGN;
                case '+' -> TokenType.PLUS;
                case '-' -> TokenType.MINUS;
                case '*' -> TokenType.STAR;
                case '/' -> TokenType.SLASH;
                case '%' -> TokenType.PERCENT;
                case '&' -> TokenType.AMPERSAND;
                case '.' -> TokenType.DOT;
                case ':' -> TokenType.COLON;
                case '(' -> TokenType.LPAREN;
                case ')' -> TokenType.RPAREN;
                case '{' -> TokenType.LBRACE;
                case '}' -> TokenType.RBRACE;
                case '[' -> TokenType.LBRACKET;
                case ']' -> TokenType.RBRACKET;
                case ',' -> TokenType.COMMA;
                case ';' -> TokenType.SEMICOLON;
                default -> TokenType.UNKNOWN;
            };
            int width = type.symbol() != null ? type.symbol().length() : Character.charCount(source.codePointAt(pos));
            for (int i = 0; i < width; i++) {
                advance();
            }
            return token(type, start, tokenLine, tokenColumn);
        }

        // ── Character helpers ───────────────────────────────────

        private Token token(TokenType type, int start, int tokenLine, int tokenColumn) {
            return new Token(type, source.substring(start, pos), tokenLine, tokenColumn);
        }

        private void skipWhitespace() {
            while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
                advance();
            }
        }

        private void advance() {
            if (source.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }

        private char peek(int offset) {
            int index = pos + offset;
            return index < source.length() ? source.charAt(index) : '\0';
        }

        private boolean isQuote(char c) {
            return c == '"' || (mode == LexerMode.METHOD_BODY && c == '\'');
        }
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
