package io.github.eutro.tacflow.core.passes.misc;

import io.github.eutro.tacflow.core.ir.BranchTargets;
import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.IRNames;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * A pass that shifts every register id and every generated label counter of a fragment by fixed offsets.
 * <p>
 * Labels without a numeric counter, such as {@code entry}, are kept. The labels named by function and
 * class reference constants are shifted along with the labels themselves.
 */
public class Renumber implements IRPass<List<IRInstruction>, List<IRInstruction>> {
    private final int regOffset;
    private final int labelOffset;

    public Renumber(int regOffset, int labelOffset) {
        this.regOffset = regOffset;
        this.labelOffset = labelOffset;
    }

    @Override
    public List<IRInstruction> run(List<IRInstruction> instructions) {
        List<IRInstruction> out = new ArrayList<>(instructions.size());
        for (IRInstruction insn : instructions) {
            out.add(renumber(insn));
        }
        return out;
    }

    private IRInstruction renumber(IRInstruction insn) {
        List<Object> operands = new ArrayList<>();
        for (Object operand : insn.getOperands()) {
            operands.add(operand instanceof Reg
                    ? ((Reg) operand).shift(regOffset)
                    : shiftRefs((String) operand));
        }
        Reg result = insn.getResult();
        BranchTargets targets = insn.getTargets();
        return insn.rebuild(
                result == null ? null : result.shift(regOffset),
                operands,
                shiftLabel(insn.getLabel()),
                targets == null ? null : BranchTargets.of(shiftLabel(targets.ifTrue), shiftLabel(targets.ifFalse))
        );
    }

    /**
     * Shift the counter of a label.
     *
     * @param label The label.
     * @return The label with its counter shifted, or the label itself if it has no counter.
     */
    public @Nullable String shiftLabel(@Nullable String label) {
        if (label == null || labelOffset == 0) return label;
        Matcher m = IRNames.NUMBERED_LABEL.matcher(label);
        if (!m.matches()) return label;
        long counter = Long.parseLong(m.group(2)) + labelOffset;
        return m.group(1) + "_" + counter;
    }

    private String shiftRefs(String operand) {
        if (labelOffset == 0) return operand;
        Matcher m = IRNames.REF.matcher(operand);
        if (!m.find()) return operand;
        StringBuffer sb = new StringBuffer();
        do {
            String ref = "<" + m.group(1) + ":" + m.group(2) + "@" + shiftLabel(m.group(3)) + ">";
            m.appendReplacement(sb, Matcher.quoteReplacement(ref));
        } while (m.find());
        m.appendTail(sb);
        return sb.toString();
    }
}
