package com.calor.analysis.effects;

import com.calor.analysis.ir.SourceSpan;

import java.util.*;

/**
 * Caller/callee relation over the program's functions, stored as adjacency lists over node
 * indices. Calls that leave the program are kept separately per caller.
 */
public final class CallGraph {

    public record Edge(int caller, int callee, SourceSpan span) {}

    public record ExternalCall(int caller, String signature, SourceSpan span) {}

    private final List<String> functions;
    private final Map<String, Integer> index;
    private final List<List<Edge>> outgoing;
    private final List<List<ExternalCall>> external;

    CallGraph(List<String> functions, List<List<Edge>> outgoing, List<List<ExternalCall>> external) {
        this.functions = List.copyOf(functions);
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < functions.size(); i++) idx.put(functions.get(i), i);
        this.index = Collections.unmodifiableMap(idx);
        this.outgoing = outgoing.stream().map(List::copyOf).toList();
        this.external = external.stream().map(List::copyOf).toList();
    }

    public int size() {
        return functions.size();
    }

    public String function(int node) {
        return functions.get(node);
    }

    /** Node index of {@code signature}, or -1 when it is not a program function. */
    public int indexOf(String signature) {
        Integer i = index.get(signature);
        return i != null ? i : -1;
    }

    /** Calls to program functions, one edge per distinct callee, in source order. */
    public List<Edge> callees(int node) {
        return outgoing.get(node);
    }

    /** Calls leaving the program, one per distinct signature, in source order. */
    public List<ExternalCall> externalCalls(int node) {
        return external.get(node);
    }

    public int edgeCount() {
        return outgoing.stream().mapToInt(List::size).sum();
    }
}
