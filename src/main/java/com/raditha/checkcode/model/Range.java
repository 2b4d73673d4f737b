package com.raditha.checkcode.model;

/**
 * Inclusive line span of a declaration.
 *
 * @param startLine Starting line number (1-indexed)
 * @param endLine   Ending line number (1-indexed, inclusive)
 */
public record Range(int startLine, int endLine) {

    public Range {
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1, got: " + startLine);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException(
                    String.format("endLine (%d) must not precede startLine (%d)", endLine, startLine));
        }
    }

    /**
     * Create from JavaParser Range.
     */
    public static Range from(com.github.javaparser.Range jpRange) {
        return new Range(jpRange.begin.line, jpRange.end.line);
    }

    /**
     * Get total number of lines in this range.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
