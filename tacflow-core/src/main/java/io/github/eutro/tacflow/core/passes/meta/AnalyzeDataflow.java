package io.github.eutro.tacflow.core.passes.meta;

import io.github.eutro.tacflow.core.analysis.*;
import io.github.eutro.tacflow.core.cfg.BasicBlock;
import io.github.eutro.tacflow.core.cfg.CFG;
import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.passes.IRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A pass that computes reaching definitions, def-use chains and the variable dependency graph
 * of a control flow graph.
 * <p>
 * Both registers and named variables are tracked. Definitions flow along control flow edges
 * only, so a call does not carry definitions into the function it calls.
 */
public class AnalyzeDataflow implements IRPass<CFG, DataflowResult> {
    public static final AnalyzeDataflow INSTANCE = new AnalyzeDataflow();

    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * How many times each block may be visited before the solver gives up.
     */
    public static final int MAX_ITERATIONS = 1000;

    @Override
    public DataflowResult run(CFG cfg) {
        List<Definition> definitions = collectDefinitions(cfg);
        Map<String, BlockFacts> facts = solveReachingDefinitions(cfg);
        List<DefUseLink> chains = defUseChains(cfg, facts);
        Map<String, Set<String>> dependencies = dependencyGraph(cfg);
        LOGGER.debug("analysed {} blocks: {} definitions, {} def-use links, {} dependent variables",
                cfg.blocks.size(), definitions.size(), chains.size(), dependencies.size());
        return new DataflowResult(definitions, facts, chains, dependencies);
    }

    /**
     * Get the names an instruction writes.
     *
     * @param insn The instruction.
     * @return The stored variable, or the result register, or nothing.
     */
    @NotNull
    public static List<String> definedBy(IRInstruction insn) {
        if (insn.getOpcode() == Opcode.STORE_VAR && !insn.getOperands().isEmpty()) {
            return Collections.singletonList(String.valueOf(insn.getOperands().get(0)));
        }
        Reg result = insn.getResult();
        return result == null ? Collections.emptyList() : Collections.singletonList(result.toString());
    }

    /**
     * Get the names an instruction reads.
     *
     * @param insn The instruction.
     * @return The loaded variable, or the registers read.
     */
    @NotNull
    public static List<String> usedBy(IRInstruction insn) {
        if (insn.getOpcode() == Opcode.LOAD_VAR && !insn.getOperands().isEmpty()) {
            return Collections.singletonList(String.valueOf(insn.getOperands().get(0)));
        }
        List<String> uses = new ArrayList<>();
        for (Reg reg : insn.readRegs()) {
            uses.add(reg.toString());
        }
        return uses;
    }

    private static List<Definition> blockDefinitions(BasicBlock block) {
        List<Definition> defs = new ArrayList<>();
        List<IRInstruction> insns = block.getInstructions();
        for (int i = 0; i < insns.size(); i++) {
            for (String name : definedBy(insns.get(i))) {
                defs.add(new Definition(name, block.getLabel(), i, insns.get(i)));
            }
        }
        return defs;
    }

    public static List<Definition> collectDefinitions(CFG cfg) {
        List<Definition> defs = new ArrayList<>();
        for (BasicBlock block : cfg.blocks.values()) {
            defs.addAll(blockDefinitions(block));
        }
        return defs;
    }

    /**
     * Solve reaching definitions with a worklist, to a fixed point.
     *
     * @param cfg The graph.
     * @return The facts of each block, by label, in block order.
     */
    public static Map<String, BlockFacts> solveReachingDefinitions(CFG cfg) {
        Map<String, Set<Definition>> byName = new HashMap<>();
        for (Definition def : collectDefinitions(cfg)) {
            byName.computeIfAbsent(def.variable, $ -> new LinkedHashSet<>()).add(def);
        }

        Map<String, BlockFacts> facts = new LinkedHashMap<>();
        for (BasicBlock block : cfg.blocks.values()) {
            BlockFacts data = new BlockFacts();
            List<Definition> own = blockDefinitions(block);
            Map<String, Definition> last = new LinkedHashMap<>();
            for (Definition def : own) {
                last.put(def.variable, def);
            }
            data.gen.addAll(last.values());
            for (String name : last.keySet()) {
                for (Definition def : byName.get(name)) {
                    if (!own.contains(def)) data.kill.add(def);
                }
            }
            facts.put(block.getLabel(), data);
        }

        Set<BasicBlock> workQueue = new LinkedHashSet<>(cfg.blocks.values());
        int limit = MAX_ITERATIONS * Math.max(1, cfg.blocks.size());
        int steps = 0;
        while (!workQueue.isEmpty()) {
            if (steps++ >= limit) {
                LOGGER.warn("reaching definitions did not converge within {} steps", limit);
                break;
            }
            Iterator<BasicBlock> iterator = workQueue.iterator();
            BasicBlock next = iterator.next();
            iterator.remove();
            BlockFacts data = facts.get(next.getLabel());

            Set<Definition> reachIn = new LinkedHashSet<>();
            for (String pred : next.getPredecessors()) {
                BlockFacts predData = facts.get(pred);
                if (predData != null) reachIn.addAll(predData.reachOut);
            }
            Set<Definition> reachOut = new LinkedHashSet<>(data.gen);
            for (Definition def : reachIn) {
                if (!data.kill.contains(def)) reachOut.add(def);
            }
            data.reachIn.clear();
            data.reachIn.addAll(reachIn);
            if (!reachOut.equals(data.reachOut)) {
                data.reachOut.clear();
                data.reachOut.addAll(reachOut);
                workQueue.addAll(next.flowSuccessors(cfg));
            }
        }
        return facts;
    }

    /**
     * Link every use to the definitions that may reach it.
     * <p>
     * A definition earlier in the same block shadows every incoming one.
     *
     * @param cfg   The graph.
     * @param facts The solved facts.
     * @return The links, in instruction order.
     */
    public static List<DefUseLink> defUseChains(CFG cfg, Map<String, BlockFacts> facts) {
        List<DefUseLink> chains = new ArrayList<>();
        for (BasicBlock block : cfg.blocks.values()) {
            String label = block.getLabel();
            Set<Definition> reachIn = facts.get(label).reachIn;
            Map<String, Definition> local = new HashMap<>();
            List<IRInstruction> insns = block.getInstructions();
            for (int i = 0; i < insns.size(); i++) {
                IRInstruction insn = insns.get(i);
                for (String name : usedBy(insn)) {
                    Use use = new Use(name, label, i, insn);
                    Definition shadowing = local.get(name);
                    if (shadowing != null) {
                        chains.add(new DefUseLink(shadowing, use));
                        continue;
                    }
                    for (Definition def : reachIn) {
                        if (def.variable.equals(name)) chains.add(new DefUseLink(def, use));
                    }
                }
                // an instruction reads its operands before it writes
                for (String name : definedBy(insn)) {
                    local.put(name, new Definition(name, label, i, insn));
                }
            }
        }
        return chains;
    }

    /**
     * Build the variable dependency graph: each stored variable maps to the named variables
     * its stored values are computed from, closed transitively.
     *
     * @param cfg The graph.
     * @return The dependencies of each stored variable, in order of first store.
     */
    public static Map<String, Set<String>> dependencyGraph(CFG cfg) {
        Map<String, Set<String>> producedFrom = new HashMap<>();
        for (Definition def : collectDefinitions(cfg)) {
            producedFrom.computeIfAbsent(def.variable, $ -> new LinkedHashSet<>())
                    .addAll(usedBy(def.instruction));
        }

        Map<String, Set<String>> graph = new LinkedHashMap<>();
        for (BasicBlock block : cfg.blocks.values()) {
            for (IRInstruction insn : block.getInstructions()) {
                if (insn.getOpcode() != Opcode.STORE_VAR || insn.getOperands().size() < 2) continue;
                Set<String> deps = graph.computeIfAbsent(String.valueOf(insn.getOperands().get(0)),
                        $ -> new LinkedHashSet<>());
                traceNamed(String.valueOf(insn.getOperands().get(1)), producedFrom, deps, new HashSet<>());
            }
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (Set<String> deps : graph.values()) {
                for (String dep : new ArrayList<>(deps)) {
                    Set<String> transitive = graph.get(dep);
                    if (transitive != null && deps.addAll(transitive)) changed = true;
                }
            }
        }
        return graph;
    }

    private static void traceNamed(String name, Map<String, Set<String>> producedFrom,
                                   Set<String> found, Set<String> visited) {
        if (!visited.add(name)) return;
        if (!name.startsWith(Reg.PREFIX)) {
            found.add(name);
            return;
        }
        for (String source : producedFrom.getOrDefault(name, Collections.emptySet())) {
            traceNamed(source, producedFrom, found, visited);
        }
    }
}
