package org.manuscript.parser;

import org.manuscript.lexer.Token;
import org.manuscript.lexer.TokenType;

/**
 * A top-level {@code Name "string"} pair of the plugin envelope.
 */
public sealed interface PluginMember permits PluginMember.Variable, PluginMember.Method {

    Token nameToken();

    Token valueToken();

    default String name() {
        return nameToken().text();
    }

    default boolean isTerminated() {
        return valueToken().is(TokenType.STRING);
    }

    /**
     * String contents without the surrounding quotes.
     */
    default String content() {
        String text = valueToken().text();
        int end = isTerminated() ? text.length() - 1 : text.length();
        return text.substring(1, Math.max(1, end));
    }

    /** Line of the first content character. */
    default int contentLine() {
        return valueToken().line();
    }

    /** Column of the first content character. */
    default int contentColumn() {
        return valueToken().column() + 1;
    }

    record Variable(Token nameToken, Token valueToken) implements PluginMember {}

    record Method(Token nameToken, Token valueToken) implements PluginMember {}

    /**
     * Methods are the strings whose contents open with a parameter list.
     */
    static PluginMember of(Token name, Token value) {
        String text = value.text();
        String content = text.length() > 1 ? text.substring(1).stripLeading() : "";
        return content.startsWith("(") ? new Method(name, value) : new Variable(name, value);
    }
}
