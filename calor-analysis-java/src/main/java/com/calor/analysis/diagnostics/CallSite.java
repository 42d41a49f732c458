package com.calor.analysis.diagnostics;

import com.calor.analysis.ir.SourceSpan;

/**
 * One step of a call chain: the function, and the span inside it where the chain continues
 * (a call) or ends (the statement that introduces an effect).
 */
public record CallSite(String function, SourceSpan span) {

    @Override
    public String toString() {
        return function + " @ " + span;
    }
}
