package com.calor.analysis.dataflow;

import com.calor.analysis.cfg.BasicBlock;
import com.calor.analysis.cfg.Instruction;

/**
 * Per-instruction transfer. Implementations must be pure and monotonic.
 *
 * <p>The fact passed in is the one flowing into the instruction in the analysis direction: the
 * fact before it for forward analyses, after it for backward ones.
 */
public interface TransferFunction<F> {

    F apply(Instruction instruction, F fact);

    /**
     * Transfer across the block's exit branch condition. It is applied last in a forward
     * analysis and first in a backward one. Identity by default.
     */
    default F applyBranch(BasicBlock block, F fact) {
        return fact;
    }
}
