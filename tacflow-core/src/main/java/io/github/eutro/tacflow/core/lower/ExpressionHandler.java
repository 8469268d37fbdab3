package io.github.eutro.tacflow.core.lower;

import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.tree.SyntaxNode;

/**
 * Lowers an expression node, returning the register holding its value.
 */
@FunctionalInterface
public interface ExpressionHandler {
    Reg lower(LoweringContext ctx, SyntaxNode node);
}
