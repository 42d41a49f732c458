package com.calor.analysis.dataflow;

/**
 * Join semi-lattice of abstract facts. Facts must have value equality.
 */
public interface Lattice<F> {

    F bottom();

    F join(F left, F right);

    /** Partial order: {@code left} is at or below {@code right}. */
    boolean lessOrEqual(F left, F right);

    /**
     * Longest strictly ascending chain, bounding how often one fact can grow. For a set lattice
     * this is the size of the universe.
     */
    int height();
}
