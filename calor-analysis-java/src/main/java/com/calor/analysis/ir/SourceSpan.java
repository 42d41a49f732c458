package com.calor.analysis.ir;

/**
 * Line and column of a node in the source file, both 1-based.
 */
public record SourceSpan(int line, int column) implements Comparable<SourceSpan> {

    public static final SourceSpan UNKNOWN = new SourceSpan(0, 0);

    @Override
    public int compareTo(SourceSpan other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
