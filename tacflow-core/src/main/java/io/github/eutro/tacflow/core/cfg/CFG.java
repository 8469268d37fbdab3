package io.github.eutro.tacflow.core.cfg;

import io.github.eutro.tacflow.core.ir.IRInstruction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A control flow graph of basic blocks, keyed by label in stream order.
 *
 * @see BuildCfg
 */
public final class CFG {
    /**
     * The blocks of the graph, in the order they appear in the instruction stream.
     */
    public final Map<String, BasicBlock> blocks = new LinkedHashMap<>();
    /**
     * The label of the first block, or null if the graph is empty.
     */
    public String entry;

    /**
     * Get every edge in the graph, block by block.
     *
     * @return The edges.
     */
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        for (BasicBlock block : blocks.values()) {
            edges.addAll(block.successors);
        }
        return edges;
    }

    /**
     * Get the block with the given label.
     *
     * @param label The label.
     * @return The block.
     * @throws IllegalArgumentException If there is no such block.
     */
    public BasicBlock getBlock(String label) {
        BasicBlock block = blocks.get(label);
        if (block == null) {
            throw new IllegalArgumentException(String.format("no block labelled '%s'", label));
        }
        return block;
    }

    void addEdge(String from, String to, EdgeKind kind) {
        BasicBlock source = blocks.get(from);
        BasicBlock target = blocks.get(to);
        if (source == null || target == null) return;
        Edge edge = new Edge(from, to, kind);
        if (source.successors.contains(edge)) return;
        source.successors.add(edge);
        if (kind.isFlow()) target.predecessors.add(from);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (BasicBlock block : blocks.values()) {
            sb.append('[').append(block.getLabel()).append(']')
                    .append("  preds=").append(block.predecessors)
                    .append("  succs=").append(block.successors.stream()
                            .map($ -> $.to)
                            .collect(Collectors.toList()))
                    .append('\n');
            for (IRInstruction insn : block.getInstructions()) {
                sb.append("  ").append(insn.toText()).append('\n');
            }
        }
        return sb.toString();
    }
}
