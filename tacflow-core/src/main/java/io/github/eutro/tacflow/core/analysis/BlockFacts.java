package io.github.eutro.tacflow.core.analysis;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reaching definition facts of one basic block.
 */
public final class BlockFacts {
    /**
     * The last definition of each name written in the block.
     */
    public final Set<Definition> gen = new LinkedHashSet<>();
    /**
     * Every definition elsewhere of a name the block writes.
     */
    public final Set<Definition> kill = new LinkedHashSet<>();
    public final Set<Definition> reachIn = new LinkedHashSet<>();
    public final Set<Definition> reachOut = new LinkedHashSet<>();
}
