package com.calor.analysis.dataflow;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Powerset lattice ordered by inclusion, with union as join. Used by the "may" analyses.
 */
public final class SetLattice<E> implements Lattice<Set<E>> {

    private final int universeSize;

    public SetLattice(int universeSize) {
        this.universeSize = universeSize;
    }

    @Override
    public Set<E> bottom() {
        return Set.of();
    }

    @Override
    public Set<E> join(Set<E> left, Set<E> right) {
        if (left.isEmpty()) return right;
        if (right.isEmpty() || left.equals(right)) return left;
        Set<E> union = new HashSet<>(left);
        union.addAll(right);
        return Collections.unmodifiableSet(union);
    }

    @Override
    public boolean lessOrEqual(Set<E> left, Set<E> right) {
        return right.containsAll(left);
    }

    @Override
    public int height() {
        return universeSize;
    }
}
