package io.github.eutro.tacflow.core.tree.sexp;

import io.github.eutro.tacflow.core.tree.SyntaxNode;
import io.github.eutro.tacflow.core.tree.SyntaxTree;

import java.nio.charset.StandardCharsets;

/**
 * A tree read by {@link SExprReader}, together with the source text synthesized for it.
 */
public final class SExprTree implements SyntaxTree {
    private final SExprNode root;
    private final byte[] source;

    SExprTree(SExprNode root, byte[] source) {
        this.root = root;
        this.source = source;
    }

    @Override
    public SyntaxNode getRootNode() {
        return root;
    }

    /**
     * Get the synthesized source, whose byte offsets the nodes refer to.
     *
     * @return The UTF-8 source bytes.
     */
    @Override
    public byte[] getSource() {
        return source.clone();
    }

    public String getSourceText() {
        return new String(source, StandardCharsets.UTF_8);
    }
}
