package com.calor.verification.solver;

/**
 * Seam to the external SMT-style solver. Implementations translate the query, run the solver
 * and classify the outcome. Calls may block for a long time; see {@link TimeBoundedSolver}.
 */
public interface ConstraintSolver {

    /**
     * Version string of the loaded solver. Cached results recorded under a different
     * version are discarded on read.
     */
    String version();

    VerificationResult verify(ContractQuery query);
}
