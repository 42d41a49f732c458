package com.calor.analysis.diagnostics;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * A finding of one pass. {@code callChain} is empty unless the finding is about effects that
 * travel through calls.
 */
public record Diagnostic(String code, Severity severity, String function, String message, List<CallSite> callChain) {

    public static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::function)
            .thenComparing(Diagnostic::code)
            .thenComparing(Diagnostic::message);

    public Diagnostic {
        callChain = List.copyOf(callChain);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.name().toLowerCase(Locale.ROOT)).append(' ').append(code).append(": ").append(message);
        for (CallSite step : callChain) {
            sb.append("\n    at ").append(step);
        }
        return sb.toString();
    }
}
