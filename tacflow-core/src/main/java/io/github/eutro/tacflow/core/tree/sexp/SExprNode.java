package io.github.eutro.tacflow.core.tree.sexp;

import io.github.eutro.tacflow.core.tree.Point;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link SyntaxNode} read by {@link SExprReader}.
 */
public final class SExprNode implements SyntaxNode {
    private final String type;
    private final boolean named;
    final List<SyntaxNode> children = new ArrayList<>();
    final Map<String, List<SyntaxNode>> fields = new HashMap<>();
    int startByte, endByte;
    Point startPoint, endPoint;

    SExprNode(String type, boolean named) {
        this.type = type;
        this.named = named;
    }

    @Override
    public String getType() {
        return type;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public @Nullable SyntaxNode getChildByFieldName(String name) {
        List<SyntaxNode> field = fields.get(name);
        return field == null ? null : field.get(0);
    }

    @Override
    public List<SyntaxNode> getChildrenByFieldName(String name) {
        return Collections.unmodifiableList(fields.getOrDefault(name, Collections.emptyList()));
    }

    @Override
    public int getStartByte() {
        return startByte;
    }

    @Override
    public int getEndByte() {
        return endByte;
    }

    @Override
    public Point getStartPoint() {
        return startPoint;
    }

    @Override
    public Point getEndPoint() {
        return endPoint;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('(').append(type);
        for (SyntaxNode child : children) {
            sb.append(' ').append(child);
        }
        return sb.append(')').toString();
    }
}
