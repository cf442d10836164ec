package org.manuscript.parser;

import org.manuscript.lexer.Token;
import org.manuscript.lexer.TokenType;

import java.util.List;

/**
 * Expression summary built while parsing. It keeps just enough shape for the
 * expression-level checks (constant conditions, self-comparison, division by zero,
 * call arity); statements are never materialised.
 */
public sealed interface Node {

    /** First token of the expression. */
    Token start();

    record Literal(Token token) implements Node {
        @Override
        public Token start() {
            return token;
        }

        public boolean isNumber() {
            return token.is(TokenType.NUMBER);
        }
    }

    record Name(Token token) implements Node {
        @Override
        public Token start() {
            return token;
        }

        public String text() {
            return token.text();
        }
    }

    record Unary(Token operator, Node operand) implements Node {
        @Override
        public Token start() {
            return operator;
        }
    }

    record Binary(Node left, Token operator, Node right) implements Node {
        @Override
        public Token start() {
            return left.start();
        }
    }

    record Call(Node callee, Token open, List<Node> arguments) implements Node {
        @Override
        public Token start() {
            return callee.start();
        }
    }

    record Access(Node target, Token name) implements Node {
        @Override
        public Token start() {
            return target.start();
        }
    }

    record Index(Node target, Node index) implements Node {
        @Override
        public Token start() {
            return target.start();
        }
    }

    record UserProperty(Node target, Token name) implements Node {
        @Override
        public Token start() {
            return target.start();
        }
    }

    record Group(Token open, Node inner) implements Node {
        @Override
        public Token start() {
            return open;
        }
    }

    /** Placeholder where an expression was required and none could be parsed. */
    record Missing(Token at) implements Node {
        @Override
        public Token start() {
            return at;
        }
    }

    /**
     * Strip any number of enclosing parentheses.
     */
    static Node unwrap(Node node) {
        Node current = node;
        while (current instanceof Group group) {
            current = group.inner();
        }
        return current;
    }
}
