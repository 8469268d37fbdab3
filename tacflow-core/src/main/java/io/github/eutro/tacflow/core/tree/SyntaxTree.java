package io.github.eutro.tacflow.core.tree;

import org.jetbrains.annotations.Nullable;

/**
 * A parsed source file.
 */
public interface SyntaxTree {
    /**
     * Get the root node of the tree.
     *
     * @return The root.
     */
    SyntaxNode getRootNode();

    /**
     * Get the source the byte offsets of this tree refer to, if the tree carries it.
     * <p>
     * Trees that do not carry their source refer to the bytes they were parsed from.
     *
     * @return The source bytes, or null.
     */
    default byte @Nullable [] getSource() {
        return null;
    }
}
