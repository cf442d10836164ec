package org.manuscript.diagnostic;

/**
 * A 1-based source region. Point spans have the end equal to the start.
 */
public record Span(int line, int column, int endLine, int endColumn) implements Comparable<Span> {

    public Span {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Span positions are 1-based, got " + line + ":" + column);
        }
        if (endLine < line || (endLine == line && endColumn < column)) {
            endLine = line;
            endColumn = column;
        }
    }

    public static Span at(int line, int column) {
        return new Span(line, column, line, column);
    }

    public boolean coversLine(int target) {
        return target >= line && target <= endLine;
    }

    @Override
    public int compareTo(Span other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
