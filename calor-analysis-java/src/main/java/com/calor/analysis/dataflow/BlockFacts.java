package com.calor.analysis.dataflow;

/**
 * Facts at a block's entry ({@code in}) and exit ({@code out}), in program order regardless of
 * the analysis direction.
 */
public record BlockFacts<F>(F in, F out) {}
