package io.github.eutro.tacflow.core.cfg;

import java.util.Objects;

/**
 * A directed edge between two basic blocks, identified by their labels.
 */
public final class Edge {
    public final String from;
    public final String to;
    public final EdgeKind kind;

    public Edge(String from, String to, EdgeKind kind) {
        this.from = from;
        this.to = to;
        this.kind = kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge edge = (Edge) o;
        return from.equals(edge.from) && to.equals(edge.to) && kind == edge.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, kind);
    }

    @Override
    public String toString() {
        return from + " -" + kind.name().toLowerCase(java.util.Locale.ROOT) + "-> " + to;
    }
}
