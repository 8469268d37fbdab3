package io.github.eutro.tacflow.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural lookups over {@link SyntaxNode}s, for grammars that do not expose a field for
 * everything a lowering needs.
 */
public final class Nodes {
    private Nodes() {
    }

    /**
     * Find the first child of one of the given types.
     *
     * @param node  The parent.
     * @param types The accepted types.
     * @return The child, or null.
     */
    public static @Nullable SyntaxNode firstChildOfType(SyntaxNode node, String... types) {
        for (SyntaxNode child : node.getChildren()) {
            for (String type : types) {
                if (child.getType().equals(type)) return child;
            }
        }
        return null;
    }

    /**
     * Find all children of one of the given types.
     *
     * @param node  The parent.
     * @param types The accepted types.
     * @return The children, in order.
     */
    public static List<SyntaxNode> childrenOfType(SyntaxNode node, String... types) {
        Set<String> accepted = new HashSet<>(Arrays.asList(types));
        List<SyntaxNode> found = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            if (accepted.contains(child.getType())) found.add(child);
        }
        return found;
    }

    /**
     * Find the first named child, if any.
     *
     * @param node The parent.
     * @return The first named child, or null.
     */
    public static @Nullable SyntaxNode firstNamedChild(SyntaxNode node) {
        for (SyntaxNode child : node.getChildren()) {
            if (child.isNamed()) return child;
        }
        return null;
    }

    /**
     * Get the named children whose types are not in the excluded set.
     *
     * @param node     The parent.
     * @param excluded The types to skip.
     * @return The remaining named children.
     */
    public static List<SyntaxNode> namedChildrenExcept(SyntaxNode node, Collection<String> excluded) {
        List<SyntaxNode> found = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            if (child.isNamed() && !excluded.contains(child.getType())) found.add(child);
        }
        return found;
    }

    /**
     * Get the children, named or not, whose types are not in the excluded list.
     *
     * @param node     The parent.
     * @param excluded The types to skip.
     * @return The remaining children.
     */
    public static List<SyntaxNode> childrenExcept(SyntaxNode node, String... excluded) {
        Set<String> skip = new HashSet<>(Arrays.asList(excluded));
        List<SyntaxNode> found = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            if (!skip.contains(child.getType())) found.add(child);
        }
        return found;
    }

    /**
     * Look up a field, falling back to the first child of one of the given types.
     *
     * @param node  The parent.
     * @param field The field name.
     * @param types The types to scan for when the field is absent.
     * @return The child, or null.
     */
    public static @Nullable SyntaxNode fieldOrType(SyntaxNode node, String field, String... types) {
        SyntaxNode child = node.getChildByFieldName(field);
        return child != null ? child : firstChildOfType(node, types);
    }

    /**
     * Whether the node has a direct child, named or not, of the given type.
     *
     * @param node The parent.
     * @param type The type.
     * @return Whether such a child exists.
     */
    public static boolean hasChildOfType(SyntaxNode node, String type) {
        return firstChildOfType(node, type) != null;
    }
}
