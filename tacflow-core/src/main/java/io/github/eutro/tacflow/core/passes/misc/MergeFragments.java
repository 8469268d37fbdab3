package io.github.eutro.tacflow.core.passes.misc;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.IRNames;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.passes.IRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * A pass that concatenates independently lowered fragments into one instruction stream.
 * <p>
 * Each fragment after the first is {@link Renumber renumbered} past every register and label counter
 * already used, and loses its leading {@code entry} label.
 */
public class MergeFragments implements IRPass<List<List<IRInstruction>>, List<IRInstruction>> {
    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * An instance of this pass.
     */
    public static final MergeFragments INSTANCE = new MergeFragments();

    @Override
    public List<IRInstruction> run(List<List<IRInstruction>> fragments) {
        List<IRInstruction> merged = new ArrayList<>();
        int nextReg = 0;
        long nextLabel = 0;
        for (int i = 0; i < fragments.size(); i++) {
            List<IRInstruction> fragment = fragments.get(i);
            if (i != 0) {
                fragment = new Renumber(nextReg, (int) nextLabel).run(fragment);
                if (!fragment.isEmpty() && isEntryLabel(fragment.get(0))) {
                    fragment = fragment.subList(1, fragment.size());
                }
            }
            for (IRInstruction insn : fragment) {
                Reg result = insn.getResult();
                if (result != null) nextReg = Math.max(nextReg, result.id() + 1);
                for (Reg reg : insn.readRegs()) {
                    nextReg = Math.max(nextReg, reg.id() + 1);
                }
                if (insn.getOpcode() == Opcode.LABEL) {
                    Matcher m = IRNames.NUMBERED_LABEL.matcher(insn.getLabel());
                    if (m.matches()) {
                        nextLabel = Math.max(nextLabel, Long.parseLong(m.group(2)) + 1);
                    }
                }
            }
            merged.addAll(fragment);
        }
        LOGGER.debug("merged {} fragments into {} instructions", fragments.size(), merged.size());
        return merged;
    }

    private static boolean isEntryLabel(IRInstruction insn) {
        return insn.getOpcode() == Opcode.LABEL && IRNames.ENTRY_LABEL.equals(insn.getLabel());
    }
}
