package io.github.eutro.tacflow.core.ir;

import java.util.Objects;

/**
 * The two targets of a {@link Opcode#BRANCH_IF conditional branch}.
 * <p>
 * The textual form joins them with a comma, taken-when-true first.
 */
public final class BranchTargets {
    /**
     * The separator of the two labels in the textual form.
     */
    public static final char SEPARATOR = ',';

    /**
     * The label jumped to when the condition holds.
     */
    public final String ifTrue;
    /**
     * The label jumped to otherwise.
     */
    public final String ifFalse;

    private BranchTargets(String ifTrue, String ifFalse) {
        this.ifTrue = checkLabel(ifTrue);
        this.ifFalse = checkLabel(ifFalse);
    }

    private static String checkLabel(String label) {
        if (label == null || label.isEmpty() || label.indexOf(SEPARATOR) != -1) {
            throw new IllegalArgumentException(String.format("invalid branch target '%s'", label));
        }
        return label;
    }

    /**
     * Create a pair of branch targets.
     *
     * @param ifTrue  The label to jump to if the condition holds.
     * @param ifFalse The label to jump to otherwise.
     * @return The targets.
     */
    public static BranchTargets of(String ifTrue, String ifFalse) {
        return new BranchTargets(ifTrue, ifFalse);
    }

    /**
     * Parse the comma-joined textual form.
     *
     * @param text The text, e.g. {@code "if_true_0,if_false_1"}.
     * @return The targets.
     * @throws IllegalArgumentException If the text does not contain exactly one comma.
     */
    public static BranchTargets parse(String text) {
        int comma = text.indexOf(SEPARATOR);
        if (comma == -1 || text.indexOf(SEPARATOR, comma + 1) != -1) {
            throw new IllegalArgumentException(String.format("expected two comma separated labels, got '%s'", text));
        }
        return new BranchTargets(text.substring(0, comma), text.substring(comma + 1));
    }

    /**
     * Join the two labels into the textual form.
     *
     * @return The serialized targets.
     */
    public String serialize() {
        return ifTrue + SEPARATOR + ifFalse;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BranchTargets that = (BranchTargets) o;
        return ifTrue.equals(that.ifTrue) && ifFalse.equals(that.ifFalse);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ifTrue, ifFalse);
    }

    @Override
    public String toString() {
        return serialize();
    }
}
