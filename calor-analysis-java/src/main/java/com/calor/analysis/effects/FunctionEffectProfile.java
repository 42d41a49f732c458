package com.calor.analysis.effects;

import com.calor.analysis.diagnostics.CallSite;

import java.util.List;

/**
 * Declared against computed effects for one function. {@code violationChain} is empty when the
 * function is accepted, otherwise the shortest chain to the first undeclared effect.
 */
public record FunctionEffectProfile(
        String function,
        EffectSet declared,
        EffectSet computed,
        Effect firstViolation,
        List<CallSite> violationChain
) {
    public FunctionEffectProfile {
        violationChain = List.copyOf(violationChain);
    }

    public boolean accepted() {
        return computed.isSubsetOf(declared);
    }
}
