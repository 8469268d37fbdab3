package io.github.eutro.tacflow.core.cfg;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.IRNames;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.passes.IRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass that renders a {@link CFG} as a Mermaid flowchart.
 * <p>
 * Function and class bodies are grouped into subgraphs by their bracketing labels,
 * {@code func_<name>_N ... end_<name>_M} and {@code class_<name>_N ... end_class_<name>_M}.
 * The counters of the two ends need not agree.
 */
public class MermaidRenderer implements IRPass<CFG, String> {
    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * An instance of this pass.
     */
    public static final MermaidRenderer INSTANCE = new MermaidRenderer();

    /**
     * Blocks with more instruction lines than this are collapsed.
     */
    public static final int COLLAPSE_THRESHOLD = 6;
    /**
     * The number of leading lines kept when a block is collapsed.
     */
    public static final int COLLAPSED_LINES = 4;

    public static final String ENTRY_STYLE = "fill:#28a745,color:#fff";

    private static final String INDENT = "    ";

    @Override
    public String run(CFG cfg) {
        List<BasicBlock> blocks = new ArrayList<>(cfg.blocks.values());
        int[] groupEnds = findGroups(blocks);

        StringBuilder sb = new StringBuilder("flowchart TD\n");
        emitRange(sb, cfg, blocks, groupEnds, 0, blocks.size(), 1);

        for (Edge edge : cfg.edges()) {
            sb.append(INDENT).append(nodeId(edge.from)).append(' ').append(arrow(edge.kind))
                    .append(' ').append(nodeId(edge.to)).append('\n');
        }
        if (cfg.entry != null) {
            sb.append(INDENT).append("style ").append(nodeId(cfg.entry)).append(' ').append(ENTRY_STYLE).append('\n');
        }
        LOGGER.debug("rendered {} blocks", blocks.size());
        return sb.toString();
    }

    // groupEnds[i] is the index of the block closing the group opened at i, or -1.
    // Groups of the same name nest, so each opener pairs with its own closer.
    private static int[] findGroups(List<BasicBlock> blocks) {
        int[] ends = new int[blocks.size()];
        for (int i = 0; i < blocks.size(); i++) {
            ends[i] = -1;
            String closing = closingLabel(blocks.get(i).getLabel());
            if (closing == null) continue;
            int nesting = 0;
            for (int j = i + 1; j < blocks.size(); j++) {
                String label = blocks.get(j).getLabel();
                if (closing.equals(closingLabel(label))) {
                    nesting++;
                } else if (IRNames.stripCounter(label).equals(closing)) {
                    if (nesting == 0) {
                        ends[i] = j;
                        break;
                    }
                    nesting--;
                }
            }
        }
        return ends;
    }

    private static @Nullable String closingLabel(String label) {
        if (label.startsWith(IRNames.FUNC_LABEL_PREFIX)) {
            return IRNames.END_LABEL_PREFIX + groupName(label);
        }
        if (label.startsWith(IRNames.CLASS_LABEL_PREFIX)) {
            return IRNames.END_CLASS_LABEL_PREFIX + groupName(label);
        }
        return null;
    }

    private static String groupName(String label) {
        String stripped = IRNames.stripCounter(label);
        String prefix = stripped.startsWith(IRNames.FUNC_LABEL_PREFIX)
                ? IRNames.FUNC_LABEL_PREFIX
                : IRNames.CLASS_LABEL_PREFIX;
        return stripped.substring(prefix.length());
    }

    private static void emitRange(StringBuilder sb, CFG cfg, List<BasicBlock> blocks, int[] groupEnds,
                                  int from, int to, int depth) {
        int i = from;
        while (i < to) {
            int end = groupEnds[i];
            if (end != -1 && end < to) {
                String label = blocks.get(i).getLabel();
                String title = label.startsWith(IRNames.CLASS_LABEL_PREFIX)
                        ? "class " + groupName(label)
                        : groupName(label);
                indent(sb, depth).append("subgraph sg_").append(nodeId(label))
                        .append(" [\"").append(escape(title)).append("\"]\n");
                emitNode(sb, cfg, blocks.get(i), depth + 1);
                emitRange(sb, cfg, blocks, groupEnds, i + 1, end + 1, depth + 1);
                indent(sb, depth).append("end\n");
                i = end + 1;
            } else {
                emitNode(sb, cfg, blocks.get(i), depth);
                i++;
            }
        }
    }

    private static void emitNode(StringBuilder sb, CFG cfg, BasicBlock block, int depth) {
        String text = String.join("<br/>", nodeLines(block));
        String label = block.getLabel();
        Opcode terminator = block.getTerminatorOpcode();
        String open, close;
        if (label.equals(cfg.entry) || terminator == Opcode.RETURN) {
            open = "([\"";
            close = "\"])";
        } else if (terminator == Opcode.BRANCH_IF) {
            open = "{\"";
            close = "\"}";
        } else {
            open = "[\"";
            close = "\"]";
        }
        indent(sb, depth).append(nodeId(label)).append(open).append(text).append(close).append('\n');
    }

    static List<String> nodeLines(BasicBlock block) {
        List<IRInstruction> insns = block.getInstructions();
        List<String> lines = new ArrayList<>();
        lines.add(escape(block.getLabel()) + ":");
        if (insns.size() > COLLAPSE_THRESHOLD) {
            for (int i = 0; i < COLLAPSED_LINES; i++) {
                lines.add(escape(insns.get(i).toText()));
            }
            lines.add("... (" + (insns.size() - COLLAPSED_LINES - 1) + " more)");
            IRInstruction terminator = block.getTerminator();
            lines.add(escape((terminator == null ? insns.get(insns.size() - 1) : terminator).toText()));
        } else {
            for (IRInstruction insn : insns) {
                lines.add(escape(insn.toText()));
            }
        }
        return lines;
    }

    /**
     * Escape text for use inside a quoted Mermaid node label.
     *
     * @param text The text.
     * @return The escaped text.
     */
    public static String escape(String text) {
        return text.replace("\"", "#quot;").replace("<", "#lt;");
    }

    /**
     * Get the Mermaid node id of a block label.
     *
     * @param label The label.
     * @return The id.
     */
    public static String nodeId(String label) {
        String id = label.replaceAll("[^A-Za-z0-9_]", "_");
        return id.equalsIgnoreCase("end") ? id + "_" : id;
    }

    private static String arrow(EdgeKind kind) {
        switch (kind) {
            case TRUE:
                return "-->|T|";
            case FALSE:
                return "-->|F|";
            case CALL:
                return "-.->";
            default:
                return "-->";
        }
    }

    private static StringBuilder indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
        return sb;
    }
}
