package com.calor.analysis.effects;

import java.util.List;

/**
 * Result of looking up an external call. For {@link Status#AMBIGUOUS} the effects are the union
 * of all candidates, so inference stays sound while the ambiguity is reported.
 */
public record CatalogResolution(Status status, EffectSet effects, List<CatalogEntry> candidates) {

    public enum Status { RESOLVED, AMBIGUOUS, UNRESOLVED }

    static final CatalogResolution UNRESOLVED = new CatalogResolution(Status.UNRESOLVED, EffectSet.EMPTY, List.of());

    public CatalogResolution {
        candidates = List.copyOf(candidates);
    }
}
