package org.manuscript.format;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented output buffer with an indentation level. Indentation is fixed when a
 * line is started; text printed afterwards is appended as is.
 */
final class SourcePrinter {

    private final String indentation;
    private final List<String> lines = new ArrayList<>();
    private StringBuilder current;
    private int level;

    SourcePrinter(String indentation) {
        this.indentation = indentation;
    }

    SourcePrinter indent() {
        level++;
        return this;
    }

    SourcePrinter unindent() {
        if (level > 0) {
            level--;
        }
        return this;
    }

    /**
     * Close the current line and open a new one at the current level.
     *
     * @param blankBefore insert one empty line first, unless the output is empty or
     *                    already ends with an empty line
     */
    SourcePrinter startLine(boolean blankBefore) {
        flush();
        if (blankBefore && !lines.isEmpty() && !lines.get(lines.size() - 1).isEmpty()) {
            lines.add("");
        }
        current = new StringBuilder(indentation.repeat(level));
        return this;
    }

    SourcePrinter print(String text) {
        if (current == null) {
            startLine(false);
        }
        current.append(text);
        return this;
    }

    boolean isEmpty() {
        return lines.isEmpty() && current == null;
    }

    /**
     * The printed text, lines joined with {@code \n} and stripped of trailing
     * whitespace, without a final line break.
     */
    String result() {
        flush();
        StringBuilder out = new StringBuilder();
        for (String line : String.join("\n", lines).split("\n", -1)) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(line.stripTrailing());
        }
        return out.toString();
    }

    private void flush() {
        if (current != null) {
            lines.add(current.toString());
            current = null;
        }
    }
}
