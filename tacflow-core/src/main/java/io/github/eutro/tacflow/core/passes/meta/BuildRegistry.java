package io.github.eutro.tacflow.core.passes.meta;

import io.github.eutro.tacflow.core.analysis.FunctionRegistry;
import io.github.eutro.tacflow.core.cfg.BasicBlock;
import io.github.eutro.tacflow.core.cfg.CFG;
import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.IRNames;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.passes.IRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.regex.Matcher;

/**
 * A pass that catalogues functions and classes from a control flow graph.
 * <p>
 * Function parameters are read from the {@code param:} symbolic values at the head of each
 * {@code func_} block. Classes are found through their {@code <class:...>} reference constants,
 * and a class's methods are the {@code <function:...>} references stored between its body label
 * and its {@code end_class_} label.
 * <p>
 * Class bodies are skipped over by a branch, so they must not have been pruned as unreachable:
 * run this on the graph as partitioned by {@link io.github.eutro.tacflow.core.cfg.BuildCfg}.
 */
public class BuildRegistry implements IRPass<CFG, FunctionRegistry> {
    public static final BuildRegistry INSTANCE = new BuildRegistry();

    private static final Logger LOGGER = LogManager.getLogger();

    @Override
    public FunctionRegistry run(CFG cfg) {
        FunctionRegistry registry = new FunctionRegistry();
        scanParams(cfg, registry);
        scanClasses(cfg, registry);
        LOGGER.debug("registered {} functions and {} classes",
                registry.functionParams.size(), registry.classes.size());
        return registry;
    }

    private static void scanParams(CFG cfg, FunctionRegistry registry) {
        for (BasicBlock block : cfg.blocks.values()) {
            if (!block.getLabel().startsWith(IRNames.FUNC_LABEL_PREFIX)) continue;
            List<String> params = new ArrayList<>();
            for (IRInstruction insn : block.getInstructions()) {
                String name = constantOperand(insn, Opcode.SYMBOLIC);
                if (name != null && name.startsWith(IRNames.PARAM_PREFIX)) {
                    params.add(name.substring(IRNames.PARAM_PREFIX.length()));
                }
            }
            registry.functionParams.put(block.getLabel(), params);
        }
    }

    private static void scanClasses(CFG cfg, FunctionRegistry registry) {
        Map<String, String> byLabel = new HashMap<>();
        for (BasicBlock block : cfg.blocks.values()) {
            for (IRInstruction insn : block.getInstructions()) {
                Matcher m = reference(insn);
                if (m != null && m.group(1).equals("class")) {
                    registry.classes.put(m.group(2), m.group(3));
                    byLabel.put(m.group(3), m.group(2));
                }
            }
        }

        // classes nest, so the innermost open class owns a method
        Deque<String> open = new ArrayDeque<>();
        for (BasicBlock block : cfg.blocks.values()) {
            String label = block.getLabel();
            String className = byLabel.get(label);
            if (className != null) {
                open.push(className);
                registry.classMethods.computeIfAbsent(className, $ -> new LinkedHashMap<>());
            } else if (label.startsWith(IRNames.END_CLASS_LABEL_PREFIX) && !open.isEmpty()) {
                open.pop();
            }
            if (open.isEmpty()) continue;
            for (IRInstruction insn : block.getInstructions()) {
                Matcher m = reference(insn);
                if (m != null && m.group(1).equals("function")) {
                    registry.classMethods.get(open.peek()).put(m.group(2), m.group(3));
                }
            }
        }
    }

    private static @Nullable Matcher reference(IRInstruction insn) {
        String value = constantOperand(insn, Opcode.CONST);
        if (value == null) return null;
        Matcher m = IRNames.REF.matcher(value);
        return m.matches() ? m : null;
    }

    private static @Nullable String constantOperand(IRInstruction insn, Opcode opcode) {
        if (insn.getOpcode() != opcode || insn.getOperands().isEmpty()) return null;
        Object operand = insn.getOperands().get(0);
        return operand instanceof String ? (String) operand : null;
    }
}
