package com.calor.verification.cache;

import com.calor.verification.solver.VerificationResult;

/**
 * Outcome of a cache lookup. Lookups never throw: I/O problems come back as {@link Kind#ERROR}.
 */
public record CacheResult(Kind kind, CacheEntry entry, IoErrorKind errorKind) {

    public enum Kind { HIT, MISS, ERROR }

    private static final CacheResult MISS = new CacheResult(Kind.MISS, null, null);

    public static CacheResult hit(CacheEntry entry) {
        return new CacheResult(Kind.HIT, entry, null);
    }

    public static CacheResult miss() {
        return MISS;
    }

    public static CacheResult error(IoErrorKind errorKind) {
        return new CacheResult(Kind.ERROR, null, errorKind);
    }

    public boolean isHit() {
        return kind == Kind.HIT;
    }

    /** The cached outcome; only valid for hits. */
    public VerificationResult result() {
        if (entry == null) {
            throw new IllegalStateException("No cached result for a " + kind + " lookup");
        }
        return entry.toResult();
    }
}
