package io.github.eutro.tacflow.core.passes;

import io.github.eutro.tacflow.core.cfg.*;
import io.github.eutro.tacflow.core.analysis.DataflowResult;
import io.github.eutro.tacflow.core.analysis.FunctionRegistry;
import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.passes.meta.AnalyzeDataflow;
import io.github.eutro.tacflow.core.passes.meta.BuildRegistry;

import java.util.List;

/**
 * Common pipelines over lowered instructions.
 */
public final class Passes {
    private Passes() {
    }

    /**
     * Partition instructions into blocks, derive edges, and drop unreachable blocks.
     */
    public static final IRPass<List<IRInstruction>, CFG> BUILD_CFG = BuildCfg.INSTANCE
            .then(EliminateUnreachableBlocks.INSTANCE);

    /**
     * {@link #BUILD_CFG}, then render the graph as a Mermaid flowchart.
     */
    public static final IRPass<List<IRInstruction>, String> TO_MERMAID = BUILD_CFG
            .then(MermaidRenderer.INSTANCE);

    /**
     * {@link #BUILD_CFG}, then compute reaching definitions, def-use chains and variable dependencies.
     */
    public static final IRPass<List<IRInstruction>, DataflowResult> DATAFLOW = BUILD_CFG
            .then(AnalyzeDataflow.INSTANCE);

    /**
     * Catalogue functions and classes. Blocks are not pruned first, as class bodies are
     * only reachable by reference.
     */
    public static final IRPass<List<IRInstruction>, FunctionRegistry> REGISTRY = BuildCfg.INSTANCE
            .then(BuildRegistry.INSTANCE);

    /**
     * Build the CFG of a single function.
     *
     * @param name The function name.
     * @return The pass, which throws {@link IllegalArgumentException} if the function is not defined.
     */
    public static IRPass<List<IRInstruction>, CFG> functionCfg(String name) {
        return new ExtractFunction(name).then(BUILD_CFG);
    }

    /**
     * Render the CFG of a single function.
     *
     * @param name The function name.
     * @return The pass, which throws {@link IllegalArgumentException} if the function is not defined.
     */
    public static IRPass<List<IRInstruction>, String> functionMermaid(String name) {
        return functionCfg(name).then(MermaidRenderer.INSTANCE);
    }
}
