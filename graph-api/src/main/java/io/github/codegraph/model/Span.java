package io.github.codegraph.model;

/**
 * An inclusive, 0-based line range.
 *
 * @param startLine first line, inclusive
 * @param endLine last line, inclusive
 */
public record Span(int startLine, int endLine) {

    public Span {
        if (startLine < 0) {
            throw new IllegalArgumentException("startLine must be >= 0, was " + startLine);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException("endLine " + endLine + " is before startLine " + startLine);
        }
    }

    public static boolean wellFormed(int startLine, int endLine) {
        return startLine >= 0 && endLine >= startLine;
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }
}
