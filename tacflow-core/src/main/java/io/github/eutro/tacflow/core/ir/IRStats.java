package io.github.eutro.tacflow.core.ir;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics over instruction lists.
 */
public final class IRStats {
    private IRStats() {
    }

    /**
     * Count how often each opcode occurs.
     *
     * @param instructions The instructions.
     * @return The opcode frequencies, without entries for absent opcodes.
     */
    public static Map<Opcode, Integer> countOpcodes(List<IRInstruction> instructions) {
        Map<Opcode, Integer> counts = new EnumMap<>(Opcode.class);
        for (IRInstruction insn : instructions) {
            counts.merge(insn.getOpcode(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Count the placeholder instructions emitted for unsupported syntax.
     *
     * @param instructions The instructions.
     * @return The number of {@code SYMBOLIC "unsupported:..."} instructions.
     */
    public static int countUnsupported(List<IRInstruction> instructions) {
        int count = 0;
        for (IRInstruction insn : instructions) {
            if (insn.getOpcode() != Opcode.SYMBOLIC) continue;
            for (Object operand : insn.getOperands()) {
                if (operand instanceof String && ((String) operand).startsWith(IRNames.UNSUPPORTED_PREFIX)) {
                    count++;
                    break;
                }
            }
        }
        return count;
    }
}
