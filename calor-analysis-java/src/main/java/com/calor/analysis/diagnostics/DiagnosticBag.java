package com.calor.analysis.diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Thread-safe collector. Passes running on worker threads report into a shared bag; readers get
 * the diagnostics in a fixed order independent of scheduling.
 */
public final class DiagnosticBag {

    private final ConcurrentLinkedQueue<Diagnostic> diagnostics = new ConcurrentLinkedQueue<>();

    public void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void error(String code, String function, String message, List<CallSite> chain) {
        add(new Diagnostic(code, Severity.ERROR, function, message, chain));
    }

    public void error(String code, String function, String message) {
        error(code, function, message, List.of());
    }

    public void warning(String code, String function, String message) {
        add(new Diagnostic(code, Severity.WARNING, function, message, List.of()));
    }

    public void info(String code, String function, String message) {
        add(new Diagnostic(code, Severity.INFO, function, message, List.of()));
    }

    /** All diagnostics ordered by function, code and message. */
    public List<Diagnostic> sorted() {
        List<Diagnostic> copy = new ArrayList<>(diagnostics);
        copy.sort(Diagnostic.ORDER);
        return copy;
    }

    public List<Diagnostic> withCode(String code) {
        return sorted().stream().filter(d -> d.code().equals(code)).toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public int size() {
        return diagnostics.size();
    }
}
