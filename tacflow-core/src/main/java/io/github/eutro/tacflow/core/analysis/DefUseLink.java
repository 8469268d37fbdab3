package io.github.eutro.tacflow.core.analysis;

import java.util.Objects;

/**
 * A definition that may be the value seen by a use.
 */
public final class DefUseLink {
    public final Definition definition;
    public final Use use;

    public DefUseLink(Definition definition, Use use) {
        this.definition = definition;
        this.use = use;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DefUseLink that = (DefUseLink) o;
        return definition.equals(that.definition) && use.equals(that.use);
    }

    @Override
    public int hashCode() {
        return Objects.hash(definition, use);
    }

    @Override
    public String toString() {
        return definition + " -> " + use;
    }
}
