package io.github.eutro.tacflow.core.analysis;

import java.util.*;

/**
 * The result of dataflow analysis over a control flow graph.
 *
 * @see io.github.eutro.tacflow.core.passes.meta.AnalyzeDataflow
 */
public final class DataflowResult {
    /**
     * Every definition in the graph, block by block.
     */
    public final List<Definition> definitions;
    /**
     * The reaching definition facts of each block, by label.
     */
    public final Map<String, BlockFacts> blockFacts;
    public final List<DefUseLink> defUseChains;
    /**
     * For each variable, the variables its stored values transitively depend on.
     */
    public final Map<String, Set<String>> dependencyGraph;

    public DataflowResult(
            List<Definition> definitions,
            Map<String, BlockFacts> blockFacts,
            List<DefUseLink> defUseChains,
            Map<String, Set<String>> dependencyGraph
    ) {
        this.definitions = definitions;
        this.blockFacts = blockFacts;
        this.defUseChains = defUseChains;
        this.dependencyGraph = dependencyGraph;
    }

    /**
     * Get the definitions that may reach a use.
     *
     * @param variable The name read.
     * @param block    The label of the block of the use.
     * @param index    The index of the using instruction in its block.
     * @return The definitions, in chain order.
     */
    public List<Definition> reachingDefinitions(String variable, String block, int index) {
        List<Definition> defs = new ArrayList<>();
        for (DefUseLink link : defUseChains) {
            Use use = link.use;
            if (use.index == index && use.variable.equals(variable) && use.block.equals(block)) {
                defs.add(link.definition);
            }
        }
        return defs;
    }

    /**
     * Get the variables a variable depends on.
     *
     * @param variable The variable.
     * @return The dependencies, empty if there are none.
     */
    public Set<String> dependenciesOf(String variable) {
        return dependencyGraph.getOrDefault(variable, Collections.emptySet());
    }
}
