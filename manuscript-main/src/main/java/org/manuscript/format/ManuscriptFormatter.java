package org.manuscript.format;

import org.manuscript.lexer.Lexer;
import org.manuscript.lexer.LexerMode;
import org.manuscript.lexer.Token;
import org.manuscript.lexer.TokenType;
import org.manuscript.parser.PluginMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Re-emits plugin source in the canonical layout.
 * <p>
 * The envelope braces sit at column 1 with every member indented one level. Method
 * strings are opened up to one statement per line, nested blocks indented one more
 * level each; string literals and comments are copied unchanged. Members and statements
 * keep at most one blank line between them, and a method spanning several lines is
 * always separated from its neighbours by one.
 * <p>
 * Formatting never fails. Method strings that cannot be laid out safely (unbalanced
 * braces, stray characters, unterminated strings) are copied verbatim, as is content
 * that is not a member. The output is a fixed point: formatting it again changes nothing.
 */
public final class ManuscriptFormatter {

    private static final Logger LOG = LoggerFactory.getLogger(ManuscriptFormatter.class);

    public static final String INDENT = "    ";

    private enum Item {
        NONE,
        ENVELOPE_OPEN,
        ENVELOPE_CLOSE,
        MEMBER,
        METHOD_BLOCK,
        COMMENT,
        STRAY
    }

    public String format(String source) {
        List<Token> tokens = new Lexer(source, LexerMode.ENVELOPE).tokenize();
        SourcePrinter printer = new SourcePrinter(INDENT);

        boolean envelopeOpen = false;
        boolean envelopeClosed = false;
        int strayDepth = 0;
        Token previous = null;
        Item previousItem = Item.NONE;

        for (int i = 0; i < tokens.size() && !tokens.get(i).is(TokenType.EOF); i++) {
            Token token = tokens.get(i);
            Token next = tokens.get(i + 1);
            int gap = previous == null ? 0 : token.line() - previous.endLine();
            boolean blank = gap > 1 && previousItem != Item.ENVELOPE_OPEN;

            if (token.is(TokenType.COMMENT)) {
                if (previous != null && gap == 0) {
                    printer.print(" " + token.text());
                } else {
                    printer.startLine(blank || previousItem == Item.METHOD_BLOCK);
                    printer.print(token.text());
                    previousItem = Item.COMMENT;
                }
            } else if (token.is(TokenType.LBRACE) && !envelopeOpen && strayDepth == 0) {
                printer.startLine(blank);
                printer.print("{");
                printer.indent();
                envelopeOpen = true;
                previousItem = Item.ENVELOPE_OPEN;
            } else if (token.is(TokenType.RBRACE) && envelopeOpen && !envelopeClosed && strayDepth == 0) {
                printer.unindent();
                printer.startLine(false);
                printer.print("}");
                envelopeClosed = true;
                previousItem = Item.ENVELOPE_CLOSE;
            } else if (token.is(TokenType.IDENTIFIER)
                    && next.isAny(TokenType.STRING, TokenType.UNTERMINATED_STRING)) {
                PluginMember member = PluginMember.of(token, next);
                Optional<MethodLayout> layout = member instanceof PluginMember.Method && member.isTerminated()
                        ? MethodLayout.of(member.content())
                        : Optional.empty();
                boolean block = layout.map(MethodLayout::isBlock).orElse(false);
                printer.startLine(blank || previousItem == Item.METHOD_BLOCK
                        || (block && previousItem == Item.MEMBER));
                printer.print(token.text() + " ");
                if (layout.isPresent()) {
                    layout.get().print(printer);
                } else {
                    if (member instanceof PluginMember.Method) {
                        LOG.debug("Keeping method '{}' verbatim", member.name());
                    }
                    printer.print(next.text());
                }
                previousItem = block ? Item.METHOD_BLOCK : Item.MEMBER;
                previous = next;
                i++;
                continue;
            } else {
                if (previous != null && gap == 0 && previousItem == Item.STRAY) {
                    printer.print(" " + token.text());
                } else {
                    printer.startLine(blank);
                    printer.print(token.text());
                }
                if (token.type().isOpeningDelimiter()) {
                    strayDepth++;
                } else if (token.type().isClosingDelimiter() && strayDepth > 0) {
                    strayDepth--;
                }
                previousItem = Item.STRAY;
            }
            previous = token;
        }

        String formatted = printer.result();
        boolean endsWithNewline = source.endsWith("\n");
        return endsWithNewline && !printer.isEmpty() ? formatted + "\n" : formatted;
    }

    /**
     * Whether formatting would change {@code source}.
     */
    public boolean needsFormatting(String source) {
        return !format(source).equals(source);
    }

    /**
     * Remove trailing spaces and tabs from every line, keeping line endings. This is the
     * only repair {@code check --fix} performs.
     */
    public static String stripTrailingWhitespace(String source) {
        String[] lines = source.split("\n", -1);
        StringBuilder out = new StringBuilder(source.length());
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            boolean carriageReturn = line.endsWith("\r");
            String stripped = line.stripTrailing();
            out.append(stripped);
            if (carriageReturn && i < lines.length - 1) {
                out.append('\r');
            }
            if (i < lines.length - 1) {
                out.append('\n');
            }
        }
        return out.toString();
    }
}
