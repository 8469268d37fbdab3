package io.github.eutro.tacflow.core.analysis;

import io.github.eutro.tacflow.core.ir.IRInstruction;

import java.util.Objects;

/**
 * A point where a variable or register is read.
 * <p>
 * Registers are named by their textual form, e.g. {@code %3}, and variables by their source name.
 * Two uses are equal if they read the same name at the same instruction.
 */
public final class Use {
    public final String variable;
    public final String block;
    public final int index;
    public final IRInstruction instruction;

    public Use(String variable, String block, int index, IRInstruction instruction) {
        this.variable = variable;
        this.block = block;
        this.index = index;
        this.instruction = instruction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Use that = (Use) o;
        return index == that.index && variable.equals(that.variable) && block.equals(that.block);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, block, index);
    }

    @Override
    public String toString() {
        return variable + "@" + block + ":" + index;
    }
}
