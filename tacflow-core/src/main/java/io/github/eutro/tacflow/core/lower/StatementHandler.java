package io.github.eutro.tacflow.core.lower;

import io.github.eutro.tacflow.core.tree.SyntaxNode;

/**
 * Lowers a statement node, emitting instructions into the context.
 */
@FunctionalInterface
public interface StatementHandler {
    void lower(LoweringContext ctx, SyntaxNode node);
}
