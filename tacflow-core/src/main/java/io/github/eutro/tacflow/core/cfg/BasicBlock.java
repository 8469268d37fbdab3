package io.github.eutro.tacflow.core.cfg;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.Opcode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A labelled run of instructions with its outgoing edges.
 * <p>
 * The instruction list never contains a {@link Opcode#LABEL}; the label of the block is held separately.
 */
public final class BasicBlock {
    private final String label;
    private final List<IRInstruction> instructions;
    final List<Edge> successors = new ArrayList<>();
    final Set<String> predecessors = new LinkedHashSet<>();

    BasicBlock(String label, List<IRInstruction> instructions) {
        this.label = label;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
    }

    public String getLabel() {
        return label;
    }

    public List<IRInstruction> getInstructions() {
        return instructions;
    }

    /**
     * Get the outgoing edges of this block, including call edges.
     *
     * @return The edges, in derivation order.
     */
    public List<Edge> getSuccessors() {
        return Collections.unmodifiableList(successors);
    }

    /**
     * Get the labels of the blocks with a control flow edge into this one.
     *
     * @return The predecessor labels.
     */
    public Set<String> getPredecessors() {
        return Collections.unmodifiableSet(predecessors);
    }

    /**
     * Get the instruction that ends control flow through this block.
     * <p>
     * Instructions after the first terminator are unreachable and do not contribute edges.
     *
     * @return The first terminator, or null if control falls through.
     */
    public @Nullable IRInstruction getTerminator() {
        for (IRInstruction insn : instructions) {
            if (insn.getOpcode().isTerminator()) return insn;
        }
        return null;
    }

    /**
     * Get the opcode of this block's terminator.
     *
     * @return The opcode, or null if control falls through.
     */
    public @Nullable Opcode getTerminatorOpcode() {
        IRInstruction terminator = getTerminator();
        return terminator == null ? null : terminator.getOpcode();
    }

    /**
     * Get the blocks control can pass to from this one, ignoring call edges.
     *
     * @param cfg The graph this block is in.
     * @return The successor blocks, in edge order.
     */
    @NotNull
    public List<BasicBlock> flowSuccessors(CFG cfg) {
        List<BasicBlock> blocks = new ArrayList<>();
        for (Edge edge : successors) {
            if (!edge.kind.isFlow()) continue;
            BasicBlock target = cfg.blocks.get(edge.to);
            if (target != null) blocks.add(target);
        }
        return blocks;
    }

    @Override
    public String toString() {
        return label;
    }
}
