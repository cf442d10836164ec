package org.manuscript.parser;

import org.manuscript.diagnostic.Diagnostic;
import org.manuscript.diagnostic.DiagnosticCode;
import org.manuscript.diagnostic.DiagnosticRegistry;
import org.manuscript.diagnostic.Span;
import org.manuscript.lexer.Lexer;
import org.manuscript.lexer.LexerMode;
import org.manuscript.lexer.Token;
import org.manuscript.lexer.TokenType;
import org.manuscript.scope.LanguageData;
import org.manuscript.scope.ScopeAnalyzer;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for one method body, {@code (params) { statements }}.
 * <p>
 * The parser reports every problem it finds and keeps going. Recovery rules:
 * <ul>
 *   <li>a broken {@code if}/{@code while}/{@code switch}/{@code case} header or loop
 *       header skips to the next {@code {}, {@code ;} or {@code }}; a block found there
 *       is still parsed, so its statements are analysed</li>
 *   <li>a missing {@code {} after a header is reported and the following statements
 *       are parsed in the enclosing block</li>
 *   <li>a missing {@code ;} is reported and parsing resumes on the next line; a
 *       statement that already produced an error only skips to its {@code ;}</li>
 *   <li>a statement that consumed nothing is skipped one token, which bounds the
 *       work done on any input</li>
 * </ul>
 * Definedness tracking is delegated to the {@link ScopeAnalyzer}.
 */
public final class StatementParser {

    private final TokenCursor cursor;
    private final DiagnosticRegistry registry;
    private final ScopeAnalyzer scope;
    private final ExpressionParser expressions;
    private final List<Token> dropped = new ArrayList<>();

    private boolean unreachableReported;

    /**
     * @param tokens body-mode tokens of the method string, comments included
     */
    public StatementParser(List<Token> tokens, DiagnosticRegistry registry, ScopeAnalyzer scope, LanguageData language) {
        this.registry = registry;
        this.scope = scope;
        this.cursor = new TokenCursor(significant(tokens));
        this.expressions = new ExpressionParser(cursor, registry, scope, language);
    }

    /**
     * Lex and parse the body of a method member.
     */
    public static void parseMethod(PluginMember.Method method, DiagnosticRegistry registry,
                                   ScopeAnalyzer scope, LanguageData language) {
        List<Token> tokens = new Lexer(method.content(), LexerMode.METHOD_BODY,
                method.contentLine(), method.contentColumn()).tokenize();
        new StatementParser(tokens, registry, scope, language).parseMethodBody(method.nameToken());
    }

    private List<Token> significant(List<Token> tokens) {
        List<Token> kept = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.is(TokenType.UNKNOWN)) {
                registry.report(DiagnosticCode.E031, token.span(), token.text());
                dropped.add(token);
            } else if (!token.is(TokenType.COMMENT)) {
                kept.add(token);
            }
        }
        return kept;
    }

    // ── Method ──────────────────────────────────────────────────

    public void parseMethodBody(Token name) {
        scope.checkMethodName(name);
        unreachableReported = false;

        if (!cursor.match(TokenType.LPAREN)) {
            registry.report(DiagnosticCode.E013, cursor.peek().span(), name.text(), "expected '(' to open the parameter list");
            return;
        }
        List<Token> parameters = new ArrayList<>();
        while (cursor.check(TokenType.IDENTIFIER)) {
            parameters.add(cursor.advance());
            if (!cursor.match(TokenType.COMMA)) {
                break;
            }
        }
        if (!cursor.match(TokenType.RPAREN)) {
            registry.report(DiagnosticCode.E013, cursor.peek().span(), name.text(), "expected ')' to close the parameter list");
            return;
        }
        if (!cursor.check(TokenType.LBRACE)) {
            registry.report(DiagnosticCode.E013, cursor.peek().span(), name.text(), "expected '{' to open the body");
            return;
        }
        Token open = cursor.advance();

        scope.beginMethod(parameters);
        parseStatementList();
        if (!cursor.match(TokenType.RBRACE)) {
            registry.report(DiagnosticCode.E058, cursor.peek().span(), open.span());
        } else if (!cursor.atEnd()) {
            registry.report(DiagnosticCode.E048, cursor.peek().span(), cursor.peek().text());
        }
        scope.endMethod();
    }

    // ── Statements ──────────────────────────────────────────────

    /**
     * Parse statements up to a closing brace (left unconsumed) or the end of input.
     */
    private void parseStatementList() {
        boolean afterReturn = false;
        while (!cursor.check(TokenType.RBRACE) && !cursor.atEnd()) {
            if (afterReturn && !unreachableReported) {
                registry.report(DiagnosticCode.W026, cursor.peek().span());
                unreachableReported = true;
            }
            afterReturn = parseStatementWithProgress();
        }
    }

    /**
     * @return whether the statement was a {@code return}
     */
    private boolean parseStatementWithProgress() {
        int before = cursor.position();
        boolean isReturn = parseStatement();
        if (cursor.position() == before) {
            cursor.advance();
        }
        return isReturn;
    }

    private boolean parseStatement() {
        Token token = cursor.peek();
        switch (token.type()) {
            case IF -> parseIf();
            case WHILE -> parseWhile();
            case FOR -> parseFor();
            case SWITCH -> parseSwitch();
            case RETURN -> {
                parseReturn();
                return true;
            }
            case LBRACE -> parseBlock();
            case SEMICOLON -> cursor.advance();
            case RPAREN, RBRACKET, COMMA, ELSE, CASE, DEFAULT, TO, IN, EACH -> {
                registry.report(DiagnosticCode.E048, token.span(), token.text());
                cursor.advance();
            }
            default -> parseExpressionStatement();
        }
        return false;
    }

    private void parseBlock() {
        Token open = cursor.advance();
        scope.enterBlock();
        parseStatementList();
        scope.exitBlock();
        if (!cursor.match(TokenType.RBRACE)) {
            registry.report(DiagnosticCode.E058, cursor.peek().span(), open.span());
        }
    }

    /**
     * Parse the block that must follow a header, or report its absence.
     */
    private void parseRequiredBlock(String after) {
        if (cursor.check(TokenType.LBRACE)) {
            parseBlock();
        } else {
            registry.report(DiagnosticCode.E043, cursor.peek().span(), after);
        }
    }

    private void parseIf() {
        Token keyword = cursor.advance();
        ParseResult<Node> condition = parseCondition(keyword);
        if (condition instanceof ParseResult.Failure<Node> failure) {
            recoverIntoBody(failure.diagnostic());
            return;
        }
        checkConstantCondition(((ParseResult.Success<Node>) condition).value());
        if (!cursor.check(TokenType.LBRACE)) {
            registry.report(DiagnosticCode.E043, cursor.peek().span(), "'if' condition");
            return;
        }
        parseBlock();
        if (cursor.match(TokenType.ELSE)) {
            if (cursor.check(TokenType.IF)) {
                parseIf();
            } else {
                parseRequiredBlock("'else'");
            }
        }
    }

    private void parseWhile() {
        Token keyword = cursor.advance();
        ParseResult<Node> condition = parseCondition(keyword);
        if (condition instanceof ParseResult.Failure<Node> failure) {
            recoverIntoBody(failure.diagnostic());
            return;
        }
        parseRequiredBlock("'while' condition");
    }

    private ParseResult<Node> parseCondition(Token keyword) {
        if (!cursor.check(TokenType.LPAREN)) {
            return ParseResult.failure(Diagnostic.of(DiagnosticCode.E040, cursor.peek().span(), keyword.text()));
        }
        cursor.advance();
        if (cursor.check(TokenType.RPAREN)) {
            return ParseResult.failure(Diagnostic.of(DiagnosticCode.E049, cursor.peek().span(), ")"));
        }
        Node value = expressions.parseExpression();
        if (!cursor.match(TokenType.RPAREN)) {
            return ParseResult.failure(Diagnostic.of(DiagnosticCode.E050, cursor.peek().span(), "'" + keyword.text() + "'"));
        }
        return ParseResult.success(value);
    }

    private void checkConstantCondition(Node condition) {
        Node value = Node.unwrap(condition);
        if (!(value instanceof Node.Literal literal)) {
            return;
        }
        Token token = literal.token();
        Boolean constant = switch (token.type()) {
            case TRUE -> Boolean.TRUE;
            case FALSE, NULL -> Boolean.FALSE;
            case NUMBER -> Double.parseDouble(token.text()) != 0.0;
            default -> null;
        };
        if (constant != null) {
            registry.report(DiagnosticCode.W028, token.span(), constant ? "true" : "false");
        }
    }

    /**
     * Record a header failure, skip to where a body could start and parse that body if
     * there is one.
     */
    private void recoverIntoBody(Diagnostic diagnostic) {
        registry.add(diagnostic);
        while (!cursor.atEnd() && !cursor.check(TokenType.LBRACE) && !cursor.check(TokenType.RBRACE)) {
            if (cursor.match(TokenType.SEMICOLON)) {
                return;
            }
            cursor.advance();
        }
        if (cursor.check(TokenType.LBRACE)) {
            parseBlock();
        }
    }

    // ── Loops ───────────────────────────────────────────────────

    private void parseFor() {
        Token keyword = cursor.advance();
        ParseResult<Token> header = cursor.match(TokenType.EACH) ? parseForEachHeader() : parseForToHeader(keyword);
        if (header instanceof ParseResult.Failure<Token> failure) {
            recoverIntoBody(failure.diagnostic());
            return;
        }
        parseRequiredBlock("'for' header");
    }

    /**
     * {@code for v = start to end}
     */
    private ParseResult<Token> parseForToHeader(Token keyword) {
        if (!cursor.check(TokenType.IDENTIFIER)) {
            return ParseResult.failure(Diagnostic.of(DiagnosticCode.E041, cursor.peek().span(), keyword.text()));
        }
        Token variable = cursor.advance();
        scope.defineLoopVariable(variable);
        if (!cursor.match(TokenType.ASSIGN)) {
            return ParseResult.failure(Diagnostic.of(DiagnosticCode.E053, cursor.peek().span(), variable.text()));
        }
        if (ExpressionParser.endsExpression(cursor.peek())) {
            return ParseResult.failure(Diagnostic.of(DiagnosticCode.E045, cursor.peek().span()));
        }
        expressions.parseExpression();
        if (!cursor.match(TokenType.TO)) {
            return ParseResult.failure(Diagnostic.of(DiagnosticCode.E054, cursor.peek().span()));
        }
        if (ExpressionParser.endsExpression(cursor.peek())) {
            return ParseResult.failure(Diagnostic.of(DiagnosticCode.E049, cursor.peek().span(),
                    ExpressionParser.describe(cursor.peek())));
        }
        expressions.parseExpression();
        return ParseResult.success(variable);
    }

    /**
     * {@code for each [Type] v in collection}; the {@code each} is already consumed.
     */
    private ParseResult<Token> parseForEachHeader() {
        if (!cursor.check(TokenType.IDENTIFIER)) {
            return ParseResult.failure(Diagnostic.of(DiagnosticCode.E041, cursor.peek().span(), "for each"));
        }
        Token first = cursor.advance();
        Token variable;
        if (cursor.check(TokenType.IDENTIFIER)) {
            variable = cursor.advance();
            scope.defineLoopVariable(variable);
            if (!cursor.match(TokenType.IN)) {
                return ParseResult.failure(Diagnostic.of(DiagnosticCode.E051, cursor.peek().span(), variable.text()));
            }
        } else if (cursor.match(TokenType.IN)) {
            variable = first;
        } else {
            return ParseResult.failure(Diagnostic.of(DiagnosticCode.E052, cursor.peek().span(), first.text()));
        }
        if (ExpressionParser.endsExpression(cursor.peek())) {
            scope.defineLoopVariable(variable);
            return ParseResult.failure(Diagnostic.of(DiagnosticCode.E049, cursor.peek().span(),
                    ExpressionParser.describe(cursor.peek())));
        }
        expressions.parseExpression();
        scope.defineLoopVariable(variable);
        return ParseResult.success(variable);
    }

    // ── Switch ──────────────────────────────────────────────────

    private void parseSwitch() {
        Token keyword = cursor.advance();
        ParseResult<Node> subject = parseCondition(keyword);
        if (subject instanceof ParseResult.Failure<Node> failure) {
            registry.add(failure.diagnostic());
            while (!cursor.atEnd() && !cursor.check(TokenType.LBRACE) && !cursor.check(TokenType.RBRACE)) {
                cursor.advance();
            }
            if (cursor.check(TokenType.LBRACE)) {
                parseSwitchBody();
            }
            return;
        }
        if (!cursor.check(TokenType.LBRACE)) {
            registry.report(DiagnosticCode.E043, cursor.peek().span(), "'switch' subject");
            return;
        }
        parseSwitchBody();
    }

    private void parseSwitchBody() {
        Token open = cursor.advance();
        scope.enterBlock();
        boolean inStrayRun = false;
        while (!cursor.check(TokenType.RBRACE) && !cursor.atEnd()) {
            if (cursor.check(TokenType.CASE)) {
                parseCase();
                inStrayRun = false;
            } else if (cursor.check(TokenType.DEFAULT)) {
                cursor.advance();
                parseCaseBody("'default'");
                inStrayRun = false;
            } else {
                if (!inStrayRun) {
                    registry.report(DiagnosticCode.E042, cursor.peek().span(), cursor.peek().text());
                    inStrayRun = true;
                }
                if (cursor.check(TokenType.LBRACE)) {
                    cursor.skipBalanced();
                } else {
                    cursor.advance();
                }
            }
        }
        scope.exitBlock();
        if (!cursor.match(TokenType.RBRACE)) {
            registry.report(DiagnosticCode.E059, cursor.peek().span(), open.span());
        }
    }

    private void parseCase() {
        Token keyword = cursor.advance();
        ParseResult<Node> value = parseCondition(keyword);
        if (value instanceof ParseResult.Failure<Node> failure) {
            recoverIntoBody(failure.diagnostic());
            return;
        }
        parseCaseBody("'case' value");
    }

    /**
     * A case body without its opening brace is still analysed up to the next case
     * label. A closing brace directly followed by another label (or by the switch's own
     * closer) is taken as the body's.
     */
    private void parseCaseBody(String after) {
        if (cursor.check(TokenType.LBRACE)) {
            parseBlock();
            return;
        }
        registry.report(DiagnosticCode.E043, cursor.peek().span(), after);
        while (!cursor.atEnd() && !cursor.check(TokenType.RBRACE)
                && !cursor.check(TokenType.CASE) && !cursor.check(TokenType.DEFAULT)) {
            parseStatementWithProgress();
        }
        if (cursor.check(TokenType.RBRACE)
                && cursor.peek(1).isAny(TokenType.CASE, TokenType.DEFAULT, TokenType.RBRACE)) {
            cursor.advance();
        }
    }

    // ── Simple statements ───────────────────────────────────────

    private void parseReturn() {
        Token first = cursor.advance();
        int errors = registry.syntaxErrorCount();
        if (!cursor.check(TokenType.SEMICOLON) && !cursor.check(TokenType.RBRACE) && !cursor.atEnd()) {
            expressions.parseExpression();
        }
        expectTerminator("return statement", first, errors);
    }

    private void parseExpressionStatement() {
        Token first = cursor.peek();
        int errors = registry.syntaxErrorCount();
        if (isAssignment(cursor.copy())) {
            parseAssignment();
            expectTerminator("assignment", first, errors);
        } else {
            expressions.parseExpression();
            expectTerminator("expression", first, errors);
        }
    }

    /**
     * Scan ahead over an assignable target ({@code a}, {@code a.b}, {@code a[i]},
     * {@code a:b}, in any chain) and check that {@code =} follows.
     */
    private static boolean isAssignment(TokenCursor lookahead) {
        if (!lookahead.match(TokenType.IDENTIFIER)) {
            return false;
        }
        while (true) {
            if (lookahead.match(TokenType.DOT) || lookahead.match(TokenType.COLON)) {
                if (!lookahead.peek().isWord()) {
                    return false;
                }
                lookahead.advance();
            } else if (lookahead.check(TokenType.LBRACKET) || lookahead.check(TokenType.LPAREN)) {
                if (!lookahead.skipBalanced()) {
                    return false;
                }
            } else {
                return lookahead.check(TokenType.ASSIGN);
            }
        }
    }

    private void parseAssignment() {
        Token first = cursor.peek();
        Node target;
        if (cursor.peek(1).is(TokenType.ASSIGN)) {
            cursor.advance();
            // defined before the right-hand side so that it may refer to itself
            scope.assign(first);
            target = new Node.Name(first);
        } else {
            target = expressions.parsePostfix();
        }
        Token equals = cursor.advance();
        if (ExpressionParser.endsExpression(cursor.peek())) {
            registry.report(DiagnosticCode.E045, equals.span());
            return;
        }
        Node value = expressions.parseExpression();
        if (target instanceof Node.Name name
                && Node.unwrap(value) instanceof Node.Name source
                && name.text().equals(source.text())) {
            registry.report(DiagnosticCode.W029, first.span(), name.text());
        }
    }

    /**
     * Consume {@code ;} or report its absence and skip the rest of the line. A statement
     * whose own error left the cursor short of its {@code ;} is not reported twice.
     *
     * @param first  first token of the statement
     * @param errors syntax error count of the registry before the statement was parsed
     */
    private void expectTerminator(String after, Token first, int errors) {
        if (cursor.match(TokenType.SEMICOLON)) {
            return;
        }
        Token previous = cursor.previous();
        Span end = previous.span();
        if (registry.syntaxErrorCount() == errors && !droppedBetween(first, cursor.peek())) {
            registry.report(DiagnosticCode.E044, Span.at(end.endLine(), end.endColumn() + 1), after);
        }
        int line = end.endLine();
        while (!cursor.atEnd() && !cursor.check(TokenType.RBRACE) && cursor.peek().line() == line) {
            if (cursor.match(TokenType.SEMICOLON)) {
                return;
            }
            if (cursor.check(TokenType.LBRACE)) {
                cursor.skipBalanced();
            } else {
                cursor.advance();
            }
        }
    }

    /**
     * Whether an unexpected character was dropped from the stream between two tokens.
     */
    private boolean droppedBetween(Token from, Token to) {
        for (Token token : dropped) {
            if (isBefore(from, token) && (to.is(TokenType.EOF) || isBefore(token, to))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBefore(Token a, Token b) {
        return a.line() < b.line() || (a.line() == b.line() && a.column() < b.column());
    }
}
