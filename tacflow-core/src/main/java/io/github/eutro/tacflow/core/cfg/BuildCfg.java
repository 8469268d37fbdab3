package io.github.eutro.tacflow.core.cfg;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.IRNames;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.passes.IRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * A pass that partitions an instruction stream into basic blocks and derives the edges between them.
 * <p>
 * Every {@link Opcode#LABEL} starts a new block. Instructions before the first label are placed in
 * a block named {@value #PRELUDE_LABEL}. Branches to labels that are not in the stream are dropped.
 */
public class BuildCfg implements IRPass<List<IRInstruction>, CFG> {
    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * An instance of this pass.
     */
    public static final BuildCfg INSTANCE = new BuildCfg();

    /**
     * The label given to instructions that precede every label.
     */
    public static final String PRELUDE_LABEL = "__block_0";

    @Override
    public CFG run(List<IRInstruction> instructions) {
        CFG cfg = new CFG();
        partition(cfg, instructions);

        Map<String, String> functionEntries = new HashMap<>();
        for (String label : cfg.blocks.keySet()) {
            if (label.startsWith(IRNames.FUNC_LABEL_PREFIX)) {
                String name = IRNames.stripCounter(label).substring(IRNames.FUNC_LABEL_PREFIX.length());
                functionEntries.putIfAbsent(name, label);
            }
        }

        List<String> order = new ArrayList<>(cfg.blocks.keySet());
        for (int i = 0; i < order.size(); i++) {
            BasicBlock block = cfg.blocks.get(order.get(i));
            IRInstruction terminator = block.getTerminator();
            if (terminator == null) {
                if (i + 1 < order.size()) {
                    cfg.addEdge(block.getLabel(), order.get(i + 1), EdgeKind.FALLTHROUGH);
                }
            } else if (terminator.getOpcode() == Opcode.BRANCH) {
                link(cfg, block, terminator.getLabel(), EdgeKind.UNCONDITIONAL);
            } else if (terminator.getOpcode() == Opcode.BRANCH_IF) {
                List<String> targets = terminator.jumpTargets();
                link(cfg, block, targets.get(0), EdgeKind.TRUE);
                link(cfg, block, targets.get(1), EdgeKind.FALSE);
            }

            for (IRInstruction insn : block.getInstructions()) {
                if (insn.getOpcode() != Opcode.CALL_FUNCTION || insn.getOperands().isEmpty()) continue;
                Object callee = insn.getOperands().get(0);
                if (!(callee instanceof String)) continue;
                String entry = functionEntries.get(callee);
                if (entry != null) {
                    cfg.addEdge(block.getLabel(), entry, EdgeKind.CALL);
                }
            }
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("built cfg with {} blocks and {} edges from {} instructions",
                    cfg.blocks.size(), cfg.edges().size(), instructions.size());
        }
        return cfg;
    }

    private static void partition(CFG cfg, List<IRInstruction> instructions) {
        String current = null;
        List<IRInstruction> buf = new ArrayList<>();
        for (IRInstruction insn : instructions) {
            if (insn.getOpcode() == Opcode.LABEL) {
                if (current != null || !buf.isEmpty()) {
                    addBlock(cfg, current == null ? PRELUDE_LABEL : current, buf);
                }
                current = insn.getLabel();
                buf.clear();
            } else {
                buf.add(insn);
            }
        }
        if (current != null || !buf.isEmpty()) {
            addBlock(cfg, current == null ? PRELUDE_LABEL : current, buf);
        }
    }

    private static void addBlock(CFG cfg, String label, List<IRInstruction> buf) {
        if (cfg.blocks.containsKey(label)) {
            LOGGER.warn("duplicate label '{}', later block replaces the earlier one", label);
        }
        cfg.blocks.put(label, new BasicBlock(label, buf));
        if (cfg.entry == null) cfg.entry = label;
    }

    private static void link(CFG cfg, BasicBlock block, String target, EdgeKind kind) {
        if (!cfg.blocks.containsKey(target)) {
            LOGGER.debug("dropping {} edge from '{}' to unknown label '{}'", kind, block.getLabel(), target);
            return;
        }
        cfg.addEdge(block.getLabel(), target, kind);
    }
}
