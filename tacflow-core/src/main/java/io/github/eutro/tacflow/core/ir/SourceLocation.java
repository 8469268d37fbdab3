package io.github.eutro.tacflow.core.ir;

/**
 * A span of source text that an instruction was lowered from.
 * <p>
 * Lines are one-based and columns zero-based. The all-zero location is the
 * {@link #UNKNOWN unknown} sentinel. Locations never affect control flow.
 */
public final class SourceLocation {
    /**
     * The unknown location.
     */
    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0, 0, 0);

    public final int startLine;
    public final int startCol;
    public final int endLine;
    public final int endCol;

    private SourceLocation(int startLine, int startCol, int endLine, int endCol) {
        this.startLine = startLine;
        this.startCol = startCol;
        this.endLine = endLine;
        this.endCol = endCol;
    }

    /**
     * Create a source location.
     *
     * @param startLine The first line.
     * @param startCol  The column on the first line.
     * @param endLine   The last line.
     * @param endCol    The column on the last line.
     * @return The location.
     */
    public static SourceLocation of(int startLine, int startCol, int endLine, int endCol) {
        if (startLine == 0 && startCol == 0 && endLine == 0 && endCol == 0) {
            return UNKNOWN;
        }
        return new SourceLocation(startLine, startCol, endLine, endCol);
    }

    public boolean isUnknown() {
        return this == UNKNOWN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceLocation that = (SourceLocation) o;
        return startLine == that.startLine
                && startCol == that.startCol
                && endLine == that.endLine
                && endCol == that.endCol;
    }

    @Override
    public int hashCode() {
        int result = startLine;
        result = 31 * result + startCol;
        result = 31 * result + endLine;
        result = 31 * result + endCol;
        return result;
    }

    @Override
    public String toString() {
        if (isUnknown()) {
            return "<unknown>";
        }
        return startLine + ":" + startCol + "-" + endLine + ":" + endCol;
    }
}
