package io.github.eutro.tacflow.core.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single instruction of the flattened IR.
 * <p>
 * Instructions are immutable. Operands are either {@link Reg registers} or literal strings.
 * A {@link Opcode#LABEL} or {@link Opcode#BRANCH} names one label, and a {@link Opcode#BRANCH_IF}
 * holds {@link BranchTargets two targets}.
 */
public final class IRInstruction {
    private final Opcode opcode;
    private final @Nullable Reg result;
    private final List<Object> operands;
    private final @Nullable String label;
    private final @Nullable BranchTargets targets;
    private final SourceLocation location;

    private IRInstruction(
            Opcode opcode,
            @Nullable Reg result,
            List<?> operands,
            @Nullable String label,
            @Nullable BranchTargets targets,
            SourceLocation location
    ) {
        if (opcode.isProducer() != (result != null)) {
            throw new IllegalArgumentException(result == null
                    ? String.format("%s must produce a result register", opcode)
                    : String.format("%s cannot produce a result register", opcode));
        }
        for (Object operand : operands) {
            if (!(operand instanceof Reg) && !(operand instanceof String)) {
                throw new IllegalArgumentException(String.format("operand %s of %s is neither a register nor a string",
                        operand, opcode));
            }
        }
        switch (opcode) {
            case LABEL:
            case BRANCH:
                if (label == null || label.isEmpty()) {
                    throw new IllegalArgumentException(String.format("%s requires a label", opcode));
                }
                break;
            case BRANCH_IF:
                if (targets == null) {
                    throw new IllegalArgumentException("branch_if requires two targets");
                }
                break;
            default:
                if (label != null) {
                    throw new IllegalArgumentException(String.format("%s cannot carry a label", opcode));
                }
        }
        this.opcode = opcode;
        this.result = result;
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.label = label;
        this.targets = targets;
        this.location = location;
    }

    /**
     * Create a label pseudo-instruction.
     *
     * @param name The label name.
     * @return The instruction.
     */
    public static IRInstruction label(String name) {
        return new IRInstruction(Opcode.LABEL, null, Collections.emptyList(), name, null, SourceLocation.UNKNOWN);
    }

    /**
     * Create an unconditional branch.
     *
     * @param target   The label to jump to.
     * @param location The source location.
     * @return The instruction.
     */
    public static IRInstruction branch(String target, SourceLocation location) {
        return new IRInstruction(Opcode.BRANCH, null, Collections.emptyList(), target, null, location);
    }

    /**
     * Create a conditional branch.
     *
     * @param condition The register holding the condition.
     * @param targets   The branch targets.
     * @param location  The source location.
     * @return The instruction.
     */
    public static IRInstruction branchIf(Reg condition, BranchTargets targets, SourceLocation location) {
        return new IRInstruction(Opcode.BRANCH_IF, null, Collections.singletonList(condition), null, targets, location);
    }

    /**
     * Create an instruction that writes a result register.
     *
     * @param opcode   The opcode, which must be a producer.
     * @param result   The result register.
     * @param operands The operands.
     * @param location The source location.
     * @return The instruction.
     */
    public static IRInstruction produce(Opcode opcode, Reg result, List<?> operands, SourceLocation location) {
        return new IRInstruction(opcode, Objects.requireNonNull(result, "result"), operands, null, null, location);
    }

    /**
     * Create an instruction without a result, other than a branch or label.
     *
     * @param opcode   The opcode, which must be a consumer.
     * @param operands The operands.
     * @param location The source location.
     * @return The instruction.
     */
    public static IRInstruction consume(Opcode opcode, List<?> operands, SourceLocation location) {
        return new IRInstruction(opcode, null, operands, null, null, location);
    }

    /**
     * Rebuild this instruction with different register and label names.
     * <p>
     * Used to splice independently lowered fragments together.
     *
     * @param result   The new result register.
     * @param operands The new operands.
     * @param label    The new label, ignored for conditional branches.
     * @param targets  The new targets, ignored for anything but conditional branches.
     * @return The rebuilt instruction.
     */
    public IRInstruction rebuild(@Nullable Reg result, List<?> operands, @Nullable String label, @Nullable BranchTargets targets) {
        return new IRInstruction(
                opcode,
                result,
                operands,
                opcode == Opcode.BRANCH_IF ? null : label,
                opcode == Opcode.BRANCH_IF ? targets : null,
                location
        );
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public @Nullable Reg getResult() {
        return result;
    }

    public List<Object> getOperands() {
        return operands;
    }

    /**
     * Get the label field of this instruction.
     * <p>
     * For a conditional branch this is the comma-joined pair of targets.
     *
     * @return The label, or null if this instruction has none.
     */
    public @Nullable String getLabel() {
        return targets != null ? targets.serialize() : label;
    }

    public @Nullable BranchTargets getTargets() {
        return targets;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * Get the labels this instruction may jump to, in order.
     *
     * @return The jump targets, empty if this is not a branch.
     */
    @NotNull
    public List<String> jumpTargets() {
        if (opcode == Opcode.BRANCH) {
            return Collections.singletonList(label);
        }
        if (targets != null) {
            return Arrays.asList(targets.ifTrue, targets.ifFalse);
        }
        return Collections.emptyList();
    }

    /**
     * Get the registers read by this instruction.
     *
     * @return The register operands, in order.
     */
    public List<Reg> readRegs() {
        List<Reg> regs = new ArrayList<>();
        for (Object operand : operands) {
            if (operand instanceof Reg) regs.add((Reg) operand);
        }
        return regs;
    }

    /**
     * Get the textual form of this instruction, without its source location.
     *
     * @return The text, {@code "<result> = <opcode> <operands...> <label>"} or {@code "<label>:"}.
     */
    public String toText() {
        if (opcode == Opcode.LABEL) {
            return label + ":";
        }
        StringBuilder sb = new StringBuilder();
        if (result != null) {
            sb.append(result).append(" = ");
        }
        sb.append(opcode.mnemonic());
        for (Object operand : operands) {
            sb.append(' ').append(operand);
        }
        String lbl = getLabel();
        if (lbl != null) {
            sb.append(' ').append(lbl);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IRInstruction that = (IRInstruction) o;
        return opcode == that.opcode
                && Objects.equals(result, that.result)
                && operands.equals(that.operands)
                && Objects.equals(label, that.label)
                && Objects.equals(targets, that.targets)
                && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opcode, result, operands, label, targets, location);
    }

    @Override
    public String toString() {
        String text = toText();
        return location.isUnknown() ? text : text + "  # " + location;
    }
}
