package io.github.eutro.tacflow.core.tree.sexp;

/**
 * Thrown when S-expression tree text is malformed.
 */
public class SExprParseException extends RuntimeException {
    private final int offset;

    public SExprParseException(String message, int offset) {
        super(String.format("%s at offset %d", message, offset));
        this.offset = offset;
    }

    /**
     * Get the character offset of the error in the input.
     *
     * @return The offset.
     */
    public int getOffset() {
        return offset;
    }
}
