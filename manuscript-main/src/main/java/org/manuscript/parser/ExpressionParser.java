package org.manuscript.parser;

import org.manuscript.diagnostic.DiagnosticCode;
import org.manuscript.diagnostic.DiagnosticRegistry;
import org.manuscript.lexer.Token;
import org.manuscript.lexer.TokenType;
import org.manuscript.scope.Arity;
import org.manuscript.scope.LanguageData;
import org.manuscript.scope.ObjectApi;
import org.manuscript.scope.ScopeAnalyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Precedence-climbing expression parser. Binary operators are left associative; from
 * loosest to tightest: {@code or}, {@code and}, comparison, additive (including string
 * concatenation {@code &}), multiplicative. Unary {@code not} and {@code -} bind
 * tighter, then postfix member access, calls, indexing and user properties.
 * <p>
 * Errors never abort the parse. A missing operand becomes a {@link Node.Missing}
 * placeholder and parsing continues from the offending token.
 */
final class ExpressionParser {

    private static final Map<TokenType, Integer> PRECEDENCE = Map.ofEntries(
            Map.entry(TokenType.OR, 1),
            Map.entry(TokenType.AND, 2),
            Map.entry(TokenType.ASSIGN, 3),
            Map.entry(TokenType.NOT_EQUAL, 3),
            Map.entry(TokenType.LESS, 3),
            Map.entry(TokenType.GREATER, 3),
            Map.entry(TokenType.LESS_EQUAL, 3),
            Map.entry(TokenType.GREATER_EQUAL, 3),
            Map.entry(TokenType.PLUS, 4),
            Map.entry(TokenType.MINUS, 4),
            Map.entry(TokenType.AMPERSAND, 4),
            Map.entry(TokenType.STAR, 5),
            Map.entry(TokenType.SLASH, 5),
            Map.entry(TokenType.PERCENT, 5));

    private static final int COMPARISON = 3;

    private final TokenCursor cursor;
    private final DiagnosticRegistry registry;
    private final ScopeAnalyzer scope;
    private final LanguageData language;

    ExpressionParser(TokenCursor cursor, DiagnosticRegistry registry, ScopeAnalyzer scope, LanguageData language) {
        this.cursor = cursor;
        this.registry = registry;
        this.scope = scope;
        this.language = language;
    }

    /**
     * Tokens that can never start an expression and close whatever encloses one.
     */
    static boolean endsExpression(Token token) {
        return token.isAny(TokenType.SEMICOLON, TokenType.RPAREN, TokenType.RBRACKET, TokenType.COMMA,
                TokenType.LBRACE, TokenType.RBRACE, TokenType.EOF);
    }

    static String describe(Token token) {
        return token.is(TokenType.EOF) ? "end of input" : token.text();
    }

    Node parseExpression() {
        return parseBinary(1);
    }

    private Node parseBinary(int minPrecedence) {
        Node left = parseUnary();
        while (true) {
            Token operator = cursor.peek();
            Integer precedence = PRECEDENCE.get(operator.type());
            if (precedence == null || precedence < minPrecedence) {
                return left;
            }
            cursor.advance();
            if (endsExpression(cursor.peek())) {
                registry.report(DiagnosticCode.E046, operator.span(), operator.text());
                return new Node.Binary(left, operator, new Node.Missing(cursor.peek()));
            }
            Node.Binary binary = new Node.Binary(left, operator, parseBinary(precedence + 1));
            checkBinary(binary, precedence);
            left = binary;
        }
    }

    private Node parseUnary() {
        if (cursor.check(TokenType.NOT) || cursor.check(TokenType.MINUS)) {
            Token operator = cursor.advance();
            if (endsExpression(cursor.peek())) {
                registry.report(DiagnosticCode.E046, operator.span(), operator.text());
                return new Node.Unary(operator, new Node.Missing(cursor.peek()));
            }
            return new Node.Unary(operator, parseUnary());
        }
        return parsePostfix();
    }

    Node parsePostfix() {
        Node node = parsePrimary();
        while (true) {
            if (cursor.match(TokenType.DOT)) {
                if (!cursor.peek().isWord()) {
                    registry.report(DiagnosticCode.E047, cursor.peek().span());
                    return node;
                }
                Token member = cursor.advance();
                if (!cursor.check(TokenType.LPAREN)) {
                    checkProperty(node, member);
                }
                node = new Node.Access(node, member);
            } else if (cursor.check(TokenType.LPAREN)) {
                node = parseCall(node);
            } else if (cursor.check(TokenType.LBRACKET)) {
                cursor.advance();
                Node index = parseExpression();
                if (!cursor.match(TokenType.RBRACKET)) {
                    registry.report(DiagnosticCode.E056, cursor.peek().span());
                    return new Node.Index(node, index);
                }
                node = new Node.Index(node, index);
            } else if (cursor.match(TokenType.COLON)) {
                if (!cursor.peek().isWord()) {
                    registry.report(DiagnosticCode.E057, cursor.peek().span());
                    return node;
                }
                node = new Node.UserProperty(node, cursor.advance());
            } else {
                return node;
            }
        }
    }

    private Node parseCall(Node callee) {
        Token open = cursor.advance();
        List<Node> arguments = new ArrayList<>();
        // a trailing comma before ')' is accepted
        while (!cursor.check(TokenType.RPAREN)) {
            if (cursor.check(TokenType.SEMICOLON) || cursor.check(TokenType.LBRACE)
                    || cursor.check(TokenType.RBRACE) || cursor.atEnd()) {
                break;
            }
            arguments.add(parseExpression());
            if (!cursor.match(TokenType.COMMA)) {
                break;
            }
        }
        Node.Call call = new Node.Call(callee, open, arguments);
        if (!cursor.match(TokenType.RPAREN)) {
            registry.report(DiagnosticCode.E055, cursor.peek().span(), calleeName(callee));
            return call;
        }
        checkCallee(call);
        checkArity(call);
        return call;
    }

    private Node parsePrimary() {
        Token token = cursor.peek();
        switch (token.type()) {
            case NUMBER, STRING, TRUE, FALSE, NULL -> {
                cursor.advance();
                return new Node.Literal(token);
            }
            case UNTERMINATED_STRING -> {
                cursor.advance();
                registry.report(DiagnosticCode.E030, token.span());
                return new Node.Literal(token);
            }
            case IDENTIFIER -> {
                cursor.advance();
                scope.read(token, cursor.check(TokenType.LPAREN) || cursor.check(TokenType.DOT));
                return new Node.Name(token);
            }
            case LPAREN -> {
                cursor.advance();
                Node inner = parseExpression();
                if (!cursor.match(TokenType.RPAREN)) {
                    registry.report(DiagnosticCode.E060, cursor.peek().span(), token.span());
                }
                return new Node.Group(token, inner);
            }
            default -> {
                if (endsExpression(token)) {
                    registry.report(DiagnosticCode.E049, token.span(), describe(token));
                } else {
                    registry.report(DiagnosticCode.E048, token.span(), token.text());
                    cursor.advance();
                }
                return new Node.Missing(token);
            }
        }
    }

    // ── Expression checks ───────────────────────────────────────

    private void checkBinary(Node.Binary binary, int precedence) {
        Token operator = binary.operator();
        if (operator.isAny(TokenType.SLASH, TokenType.PERCENT) && isZero(Node.unwrap(binary.right()))) {
            registry.report(DiagnosticCode.W031, operator.span(),
                    operator.is(TokenType.SLASH) ? "Division" : "Modulo");
        }
        if (precedence == COMPARISON
                && Node.unwrap(binary.left()) instanceof Node.Name left
                && Node.unwrap(binary.right()) instanceof Node.Name right
                && left.text().equals(right.text())) {
            boolean alwaysTrue = operator.isAny(TokenType.ASSIGN, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL);
            registry.report(DiagnosticCode.W032, operator.span(), left.text(), alwaysTrue ? "true" : "false");
        }
    }

    private static boolean isZero(Node node) {
        if (node instanceof Node.Literal literal && literal.isNumber()) {
            return Double.parseDouble(literal.token().text()) == 0.0;
        }
        return false;
    }

    private void checkCallee(Node.Call call) {
        Node callee = call.callee();
        if (callee instanceof Node.Name name) {
            if (!scope.isCallable(name.text())) {
                registry.report(DiagnosticCode.W022, name.token().span(), name.text());
            }
        } else if (callee instanceof Node.Access access) {
            Token method = access.name();
            knownObject(access.target()).ifPresent(object -> {
                if (!language.objectApi(object).orElseThrow().hasMethod(method.text())) {
                    registry.report(DiagnosticCode.W022, method.span(), object + "." + method.text());
                }
            });
        }
    }

    private void checkProperty(Node receiver, Token property) {
        knownObject(receiver).ifPresent(object -> {
            ObjectApi api = language.objectApi(object).orElseThrow();
            if (!api.hasMember(property.text())) {
                String hint = api.suggest(property.text()).map(s -> "; did you mean '" + s + "'?").orElse("");
                registry.report(DiagnosticCode.W024, property.span(), property.text(), object, hint);
            }
        });
    }

    /**
     * Name of a host object with a known API, when {@code receiver} is a bare reference
     * to one that no variable hides. Chained receivers are never resolved.
     */
    private Optional<String> knownObject(Node receiver) {
        if (receiver instanceof Node.Name name
                && !scope.isVariable(name.text())
                && language.objectApi(name.text()).isPresent()) {
            return Optional.of(name.text());
        }
        return Optional.empty();
    }

    private void checkArity(Node.Call call) {
        String name = calleeName(call.callee());
        List<Arity> overloads = language.signature(name).orElse(null);
        if (overloads == null) {
            return;
        }
        int count = call.arguments().size();
        if (overloads.stream().anyMatch(arity -> arity.accepts(count))) {
            return;
        }
        int min = overloads.stream().mapToInt(Arity::min).min().orElse(0);
        int max = overloads.stream().mapToInt(Arity::max).max().orElse(0);
        Token at = call.callee() instanceof Node.Access access ? access.name() : call.callee().start();
        if (count < min) {
            registry.report(DiagnosticCode.E020, at.span(), name, min, count);
        } else if (count > max) {
            registry.report(DiagnosticCode.E021, at.span(), name, max, count);
        } else {
            registry.report(DiagnosticCode.E022, at.span(), name, Arity.describe(overloads), count);
        }
    }

    private static String calleeName(Node callee) {
        if (callee instanceof Node.Name name) {
            return name.text();
        }
        if (callee instanceof Node.Access access) {
            return access.name().text();
        }
        return callee.start().text();
    }
}
