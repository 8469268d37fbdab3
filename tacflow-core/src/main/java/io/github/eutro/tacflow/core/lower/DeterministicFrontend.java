package io.github.eutro.tacflow.core.lower;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.tree.SyntaxTree;
import io.github.eutro.tacflow.core.tree.TreeParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A {@link Frontend} which lowers parse trees with the handlers of a {@link LanguageProfile}.
 * <p>
 * Every call gets its own {@link LoweringContext}, so one instance may lower several
 * programs concurrently.
 */
public class DeterministicFrontend implements Frontend {
    private static final Logger LOGGER = LogManager.getLogger();

    private final LanguageProfile profile;
    private final @Nullable TreeParser parser;

    /**
     * Construct a frontend which must be given parse trees.
     *
     * @param profile The profile of the language.
     */
    public DeterministicFrontend(LanguageProfile profile) {
        this(profile, null);
    }

    /**
     * Construct a frontend which parses the source itself when not given a tree.
     * The profile is frozen.
     *
     * @param profile The profile of the language.
     * @param parser  The parser, or null.
     */
    public DeterministicFrontend(LanguageProfile profile, @Nullable TreeParser parser) {
        this.profile = profile.freeze();
        this.parser = parser;
    }

    public LanguageProfile getProfile() {
        return profile;
    }

    /**
     * Get a frontend for the same language that parses source with the given parser.
     *
     * @param parser The parser.
     * @return The new frontend.
     */
    public DeterministicFrontend withParser(@NotNull TreeParser parser) {
        return new DeterministicFrontend(profile, parser);
    }

    @Override
    public List<IRInstruction> lower(@Nullable SyntaxTree tree, byte[] source) {
        if (tree == null) {
            if (parser == null) {
                throw new IllegalArgumentException(String.format(
                        "no parse tree given, and the %s frontend has no parser", profile.name));
            }
            tree = parser.parse(source);
        }
        byte[] treeSource = tree.getSource();
        LoweringContext ctx = new LoweringContext(profile, treeSource != null ? treeSource : source);
        List<IRInstruction> insns = ctx.lowerRoot(tree.getRootNode());
        LOGGER.debug("lowered {} program to {} instructions", profile.name, insns.size());
        return insns;
    }

    @Override
    public String toString() {
        return "DeterministicFrontend(" + profile.name + ")";
    }
}
