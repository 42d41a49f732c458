package com.calor.analysis.effects;

/**
 * Where a catalog entry came from. A later layer overrides an earlier one.
 */
public enum CatalogLayer {
    BUILT_IN,
    USER,
    PROJECT
}
