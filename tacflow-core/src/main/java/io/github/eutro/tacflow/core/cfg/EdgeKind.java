package io.github.eutro.tacflow.core.cfg;

/**
 * The kind of an {@link Edge} between two basic blocks.
 */
public enum EdgeKind {
    /**
     * The block runs off its end into the next block in stream order.
     */
    FALLTHROUGH,
    /**
     * The block ends in an unconditional branch.
     */
    UNCONDITIONAL,
    /**
     * The taken edge of a conditional branch.
     */
    TRUE,
    /**
     * The not-taken edge of a conditional branch.
     */
    FALSE,
    /**
     * The block calls a function whose entry block is known.
     * <p>
     * Call edges are informational, and are not control flow.
     */
    CALL,
    ;

    /**
     * Whether control can pass along edges of this kind.
     *
     * @return Whether this is not a call edge.
     */
    public boolean isFlow() {
        return this != CALL;
    }
}
