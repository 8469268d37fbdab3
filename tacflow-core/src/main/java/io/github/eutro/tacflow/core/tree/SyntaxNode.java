package io.github.eutro.tacflow.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of a concrete syntax tree, in the shape produced by incremental parsers such as tree-sitter.
 * <p>
 * Named nodes correspond to grammar rules, unnamed nodes to literal tokens such as
 * keywords and punctuation. The text of a node is recovered from the source bytes
 * through its byte offsets.
 */
public interface SyntaxNode {
    /**
     * Get the kind of this node, e.g. {@code "if_statement"} or {@code "+"}.
     *
     * @return The type tag.
     */
    String getType();

    /**
     * Whether this node corresponds to a named grammar rule.
     *
     * @return Whether the node is named.
     */
    boolean isNamed();

    /**
     * Get all the children of this node, named or not, in source order.
     *
     * @return The children.
     */
    List<SyntaxNode> getChildren();

    /**
     * Get the child stored under the given field, if any.
     *
     * @param name The field name.
     * @return The child, or null.
     */
    @Nullable SyntaxNode getChildByFieldName(String name);

    int getStartByte();

    int getEndByte();

    Point getStartPoint();

    Point getEndPoint();

    /**
     * Get every child under a field, for fields that repeat.
     *
     * @param name The field name.
     * @return The children, in source order.
     */
    default List<SyntaxNode> getChildrenByFieldName(String name) {
        SyntaxNode child = getChildByFieldName(name);
        return child == null ? Collections.emptyList() : Collections.singletonList(child);
    }

    /**
     * Get the named children of this node, in source order.
     *
     * @return The named children.
     */
    default List<SyntaxNode> getNamedChildren() {
        List<SyntaxNode> named = new ArrayList<>();
        for (SyntaxNode child : getChildren()) {
            if (child.isNamed()) named.add(child);
        }
        return named;
    }
}
