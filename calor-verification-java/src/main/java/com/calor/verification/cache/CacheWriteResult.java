package com.calor.verification.cache;

public record CacheWriteResult(Outcome outcome, IoErrorKind errorKind) {

    public enum Outcome { WRITTEN, NOT_CACHEABLE, DISABLED, ERROR }

    static CacheWriteResult written()      { return new CacheWriteResult(Outcome.WRITTEN, null); }
    static CacheWriteResult notCacheable() { return new CacheWriteResult(Outcome.NOT_CACHEABLE, null); }
    static CacheWriteResult disabled()     { return new CacheWriteResult(Outcome.DISABLED, null); }

    static CacheWriteResult error(IoErrorKind kind) {
        return new CacheWriteResult(Outcome.ERROR, kind);
    }
}
