package io.github.eutro.tacflow.core.ir;

/**
 * A numbered, single-assignment register.
 * <p>
 * Registers are allocated in increasing order by a single lowering call,
 * and are never written twice.
 */
public final class Reg implements Comparable<Reg> {
    /**
     * The prefix of a register in the textual form.
     */
    public static final String PREFIX = "%";

    private final int id;

    private Reg(int id) {
        if (id < 0) {
            throw new IllegalArgumentException(String.format("negative register id %d", id));
        }
        this.id = id;
    }

    /**
     * Get the register with the given id.
     *
     * @param id The id.
     * @return The register.
     */
    public static Reg of(int id) {
        return new Reg(id);
    }

    /**
     * Get the numeric id of this register.
     *
     * @return The id.
     */
    public int id() {
        return id;
    }

    /**
     * Get the register with this id plus an offset.
     *
     * @param offset The offset.
     * @return The shifted register.
     */
    public Reg shift(int offset) {
        return offset == 0 ? this : new Reg(id + offset);
    }

    @Override
    public int compareTo(Reg o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id == ((Reg) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return PREFIX + id;
    }
}
