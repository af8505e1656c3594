package net.littleredcomputer.rsolver;

import com.google.common.primitives.Booleans;

import java.util.Arrays;
import java.util.List;

/**
 * Truth values for the literals of a formula, indexed as in its
 * {@link LiteralRegistry}. The first {@link #frozenCount()} values are fixed
 * for the current branch of the search; the rest are thawed and read as false.
 * Instances are immutable: freezing another literal produces a new assignment.
 */
public final class Assignment {
    private final boolean[] values;
    private final int frozen;

    private Assignment(boolean[] values, int frozen) {
        this.values = values;
        this.frozen = frozen;
    }

    /** @return an assignment over n literals, none of them frozen */
    public static Assignment allThawed(int n) {
        if (n < 0) throw new IllegalArgumentException("negative literal count");
        return new Assignment(new boolean[n], 0);
    }

    /** @return an assignment in which every literal is frozen at the given value */
    public static Assignment of(boolean... values) {
        return new Assignment(values.clone(), values.length);
    }

    public int size() { return values.length; }

    public int frozenCount() { return frozen; }

    public int thawedCount() { return values.length - frozen; }

    public boolean hasThawed() { return frozen < values.length; }

    public boolean isFrozen(int index) { return index < frozen; }

    public boolean value(int index) { return values[index]; }

    /**
     * Move the first thawed literal into the frozen region.
     *
     * @param value the truth value to fix it at
     * @return a new assignment; this one is unchanged
     */
    public Assignment freezeNext(boolean value) {
        if (!hasThawed()) throw new IllegalStateException("no thawed literal left to freeze");
        boolean[] v = Arrays.copyOf(values, values.length);
        v[frozen] = value;
        return new Assignment(v, frozen + 1);
    }

    public List<Boolean> values() { return Booleans.asList(values.clone()); }

    /** @return the frozen prefix as a string of 0s and 1s, e.g. for progress reports */
    String frozenPrefix() {
        StringBuilder s = new StringBuilder(frozen);
        for (int i = 0; i < frozen; ++i) s.append(values[i] ? '1' : '0');
        return s.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment)) return false;
        Assignment a = (Assignment) o;
        return frozen == a.frozen && Arrays.equals(values, a.values);
    }

    @Override
    public int hashCode() { return 31 * Arrays.hashCode(values) + frozen; }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder(frozenPrefix());
        for (int i = frozen; i < values.length; ++i) s.append('.');
        return s.toString();
    }
}
