package com.calor.analysis.dataflow;

import java.util.Collections;
import java.util.Map;

/**
 * Fixpoint solution. Only ever constructed after the engine has converged.
 */
public final class DataflowResult<F> {

    private final Map<Integer, BlockFacts<F>> facts;
    private final int passes;

    DataflowResult(Map<Integer, BlockFacts<F>> facts, int passes) {
        this.facts = Collections.unmodifiableMap(facts);
        this.passes = passes;
    }

    public F in(int blockId)  { return facts(blockId).in(); }
    public F out(int blockId) { return facts(blockId).out(); }

    public BlockFacts<F> facts(int blockId) {
        BlockFacts<F> f = facts.get(blockId);
        if (f == null) {
            throw new IllegalArgumentException("No facts for block B" + blockId);
        }
        return f;
    }

    /** Full passes over the blocks, including the final pass that observed no change. */
    public int passes() {
        return passes;
    }
}
