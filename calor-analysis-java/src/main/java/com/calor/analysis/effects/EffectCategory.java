package com.calor.analysis.effects;

public enum EffectCategory {
    IO,
    MUTATION,
    NONDETERMINISM,
    EXCEPTION,
    /** Worst case for calls nothing is known about; covers every other effect. */
    UNKNOWN
}
