package io.github.eutro.tacflow.core.cfg;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.IRNames;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.passes.IRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass that slices one function's instructions out of a lowered unit, from its
 * {@code func_<name>_N} label through its matching {@code end_<name>_M} label.
 * Nested functions of the same name are skipped over.
 */
public class ExtractFunction implements IRPass<List<IRInstruction>, List<IRInstruction>> {
    private static final Logger LOGGER = LogManager.getLogger();

    private final String name;

    public ExtractFunction(String name) {
        this.name = name;
    }

    @Override
    public List<IRInstruction> run(List<IRInstruction> instructions) {
        return extract(instructions, name);
    }

    /**
     * Slice a function out of an instruction stream.
     *
     * @param instructions The instructions of the whole unit.
     * @param name         The function name.
     * @return The instructions from the function's entry label through its end label, inclusive.
     * @throws IllegalArgumentException If no function of that name is defined.
     */
    public static List<IRInstruction> extract(List<IRInstruction> instructions, String name) {
        String open = IRNames.FUNC_LABEL_PREFIX + name;
        String close = IRNames.END_LABEL_PREFIX + name;
        int start = -1;
        int nesting = 0;
        for (int i = 0; i < instructions.size(); i++) {
            IRInstruction insn = instructions.get(i);
            if (insn.getOpcode() != Opcode.LABEL) continue;
            String stripped = IRNames.stripCounter(insn.getLabel());
            if (start == -1) {
                if (stripped.equals(open)) start = i;
            } else if (stripped.equals(open)) {
                nesting++;
            } else if (stripped.equals(close)) {
                if (nesting == 0) {
                    return new ArrayList<>(instructions.subList(start, i + 1));
                }
                nesting--;
            }
        }
        if (start == -1) {
            throw new IllegalArgumentException(String.format("function '%s' not found", name));
        }
        LOGGER.warn("function '{}' has no end label, extracting to the end of the unit", name);
        return new ArrayList<>(instructions.subList(start, instructions.size()));
    }
}
