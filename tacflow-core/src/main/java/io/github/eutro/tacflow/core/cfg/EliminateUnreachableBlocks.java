package io.github.eutro.tacflow.core.cfg;

import io.github.eutro.tacflow.core.ir.IRNames;
import io.github.eutro.tacflow.core.passes.IRPass;
import io.github.eutro.tacflow.core.util.GraphWalker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * A pass that removes any blocks unreachable from the entry block or from a function entry block.
 * <p>
 * Functions may be defined and never called from visible flow, so each {@code func_*} block is a root.
 * Call edges are not followed. Edges into removed blocks are removed with them.
 */
public class EliminateUnreachableBlocks implements IRPass<CFG, CFG> {
    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * An instance of this pass.
     */
    public static final EliminateUnreachableBlocks INSTANCE = new EliminateUnreachableBlocks();

    @Override
    public CFG run(CFG cfg) {
        List<String> roots = new ArrayList<>();
        if (cfg.entry != null) roots.add(cfg.entry);
        if (cfg.blocks.containsKey(IRNames.ENTRY_LABEL)) roots.add(IRNames.ENTRY_LABEL);
        for (String label : cfg.blocks.keySet()) {
            if (label.startsWith(IRNames.FUNC_LABEL_PREFIX)) roots.add(label);
        }

        Set<BasicBlock> live = new HashSet<>(GraphWalker.blockWalker(cfg, roots)
                .breadthFirst()
                .toList());

        CFG pruned = new CFG();
        for (BasicBlock block : cfg.blocks.values()) {
            if (live.contains(block)) {
                pruned.blocks.put(block.getLabel(), new BasicBlock(block.getLabel(), block.getInstructions()));
            }
        }
        pruned.entry = cfg.entry != null && pruned.blocks.containsKey(cfg.entry) ? cfg.entry : null;
        for (Edge edge : cfg.edges()) {
            pruned.addEdge(edge.from, edge.to, edge.kind);
        }

        int dropped = cfg.blocks.size() - pruned.blocks.size();
        if (dropped > 0) {
            LOGGER.debug("dropped {} unreachable blocks", dropped);
        }
        return pruned;
    }
}
