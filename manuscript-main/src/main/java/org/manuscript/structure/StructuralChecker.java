package org.manuscript.structure;

import org.manuscript.diagnostic.DiagnosticCode;
import org.manuscript.diagnostic.DiagnosticRegistry;
import org.manuscript.lexer.Token;
import org.manuscript.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Delimiter balance and envelope shape, checked on the envelope-mode token stream so
 * that delimiters inside strings and comments are invisible.
 * <p>
 * Diagnostics from this checker are structural: inline and region directives do not
 * remove them.
 */
public final class StructuralChecker {

    private final DiagnosticRegistry registry;

    public StructuralChecker(DiagnosticRegistry registry) {
        this.registry = registry;
    }

    public void check(List<Token> tokens) {
        List<Token> significant = tokens.stream()
                .filter(t -> !t.is(TokenType.COMMENT) && !t.is(TokenType.EOF))
                .toList();
        checkEnvelope(significant, tokens.get(tokens.size() - 1));
        checkDelimiters(significant);
    }

    private void checkEnvelope(List<Token> significant, Token eof) {
        if (significant.isEmpty()) {
            registry.report(DiagnosticCode.E010, eof.span());
            registry.report(DiagnosticCode.E011, eof.span());
            return;
        }
        Token first = significant.get(0);
        if (!first.is(TokenType.LBRACE)) {
            registry.report(DiagnosticCode.E010, first.span());
        }
        Token last = significant.get(significant.size() - 1);
        if (!last.is(TokenType.RBRACE)) {
            registry.report(DiagnosticCode.E011, last.span());
        }
    }

    private void checkDelimiters(List<Token> significant) {
        Deque<Token> open = new ArrayDeque<>();
        for (Token token : significant) {
            TokenType type = token.type();
            if (type.isOpeningDelimiter()) {
                open.push(token);
            } else if (type.isClosingDelimiter()) {
                if (open.isEmpty()) {
                    registry.report(DiagnosticCode.E001, token.span(), token.text());
                    continue;
                }
                Token opener = open.pop();
                if (opener.type().closer() != type) {
                    registry.report(DiagnosticCode.E002, token.span(),
                            opener.type().closer().symbol(), opener.span(), token.text());
                }
            }
        }
        // innermost first, matching the order a reader closes them
        for (Token unclosed : open) {
            registry.report(DiagnosticCode.E003, unclosed.span(), unclosed.text());
        }
    }
}
