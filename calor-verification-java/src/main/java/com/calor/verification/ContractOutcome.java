package com.calor.verification;

import com.calor.verification.contract.ContractKind;
import com.calor.verification.solver.VerificationResult;

/**
 * Result of checking one contract, with the cache key it was stored under and whether the
 * answer came from the cache.
 */
public record ContractOutcome(
        String functionName,
        ContractKind kind,
        int index,
        String contractHash,
        VerificationResult result,
        boolean fromCache
) {
    public String label() {
        return kind.label(functionName, index);
    }
}
