package org.manuscript.parser;

import org.manuscript.diagnostic.DiagnosticCode;
import org.manuscript.diagnostic.DiagnosticRegistry;
import org.manuscript.lexer.Token;
import org.manuscript.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an envelope-mode token stream into plugin members.
 * <p>
 * Brace balance and the opening/closing braces are the structural checker's business;
 * this parser is lenient about them and only reports content that is not a
 * {@code Name "string"} pair, plus strings that never close.
 */
public final class EnvelopeParser {

    private final DiagnosticRegistry registry;

    public EnvelopeParser(DiagnosticRegistry registry) {
        this.registry = registry;
    }

    public PluginEnvelope parse(List<Token> tokens) {
        TokenCursor cursor = new TokenCursor(tokens.stream().filter(t -> !t.is(TokenType.COMMENT)).toList());
        List<PluginMember> members = new ArrayList<>();

        cursor.match(TokenType.LBRACE);
        boolean inStrayRun = false;
        while (!cursor.atEnd() && !cursor.check(TokenType.RBRACE)) {
            Token token = cursor.peek();
            Token next = cursor.peek(1);
            if (token.is(TokenType.IDENTIFIER) && next.isAny(TokenType.STRING, TokenType.UNTERMINATED_STRING)) {
                cursor.advance();
                cursor.advance();
                if (next.is(TokenType.UNTERMINATED_STRING)) {
                    registry.report(DiagnosticCode.E030, next.span());
                }
                members.add(PluginMember.of(token, next));
                inStrayRun = false;
                continue;
            }
            // delimiters are reported by the structural checker
            if (!inStrayRun && !token.type().isOpeningDelimiter() && !token.type().isClosingDelimiter()) {
                registry.report(DiagnosticCode.E012, token.span(), token.text());
                inStrayRun = true;
            }
            cursor.advance();
        }
        return new PluginEnvelope(members);
    }
}
