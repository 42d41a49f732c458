package com.calor.analysis.effects;

import com.calor.analysis.diagnostics.CallSite;
import com.calor.analysis.diagnostics.DiagnosticBag;
import com.calor.analysis.diagnostics.DiagnosticCode;
import com.calor.analysis.ir.BoundFunction;
import com.calor.analysis.ir.BoundModule;
import com.calor.analysis.ir.SourceSpan;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Whole-program effect inference.
 *
 * <p>A function's computed effects are its own effects plus the computed effects of everything it
 * calls. Components of the call graph are processed callees first; inside a component the members
 * are recomputed until none changes. Components that do not depend on each other may run in
 * parallel on the supplied executor, but each component is iterated by a single task.
 *
 * <p>Every function whose computed set is not covered by its declared set gets one
 * {@code Calor0410} error naming the first uncovered effect and the shortest call chain to the
 * place that introduces it.
 */
public class EffectInference {

    private final EffectCatalog catalog;
    private final UnknownCallPolicy policy;
    private final Executor executor;

    /** Sequential inference. */
    public EffectInference(EffectCatalog catalog, UnknownCallPolicy policy) {
        this(catalog, policy, null);
    }

    /**
     * @param executor runs independent components concurrently; null runs everything on the caller
     */
    public EffectInference(EffectCatalog catalog, UnknownCallPolicy policy, Executor executor) {
        this.catalog = catalog;
        this.policy = policy;
        this.executor = executor;
    }

    public EffectInferenceResult infer(BoundModule module, DiagnosticBag diagnostics) {
        return infer(module, new CallGraphBuilder().build(module), diagnostics);
    }

    public EffectInferenceResult infer(BoundModule module, CallGraph graph, DiagnosticBag diagnostics) {
        int n = graph.size();
        List<BoundFunction> functions = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            String signature = graph.function(i);
            functions.add(module.function(signature).orElseThrow(
                    () -> new IllegalArgumentException("Call graph node not in module: " + signature)));
        }

        List<Map<Effect, SourceSpan>> direct = new ArrayList<>(n);
        List<EffectSet> directSets = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Map<Effect, SourceSpan> own = directEffects(functions.get(i), graph, i, diagnostics);
            direct.add(own);
            directSets.add(EffectSet.of(own.keySet()));
        }

        List<List<Integer>> components = TarjanScc.compute(graph);
        Map<Integer, EffectSet> computed = new ConcurrentHashMap<>();
        int universe = 1 + (int) directSets.stream().flatMap(s -> s.effects().stream()).distinct().count();
        runComponents(components, graph, directSets, computed, universe, diagnostics);

        Map<String, FunctionEffectProfile> profiles = new HashMap<>();
        for (int i = 0; i < n; i++) {
            BoundFunction fn = functions.get(i);
            EffectSet declared = EffectSet.parse(fn.declaredEffects(), code ->
                    diagnostics.warning(DiagnosticCode.UNRECOGNIZED_EFFECT_CODE, fn.signature(),
                            "Unrecognized effect code '" + code + "' declared on " + fn.signature()));
            EffectSet actual = computed.getOrDefault(i, directSets.get(i));
            List<Effect> missing = actual.notCoveredBy(declared);
            if (missing.isEmpty()) {
                profiles.put(fn.signature(), new FunctionEffectProfile(fn.signature(), declared, actual, null, List.of()));
                continue;
            }
            Effect first = missing.get(0);
            List<CallSite> chain = shortestChain(i, first, graph, direct, computed);
            diagnostics.error(DiagnosticCode.FORBIDDEN_EFFECT, fn.signature(),
                    "Function '" + fn.signature() + "' performs undeclared effect '" + first.surfaceCode()
                            + "' (declared: " + declared.toDisplayString() + ", computed: "
                            + actual.toDisplayString() + ")",
                    chain);
            profiles.put(fn.signature(), new FunctionEffectProfile(fn.signature(), declared, actual, first, chain));
        }

        List<List<String>> named = new ArrayList<>();
        for (List<Integer> component : components) {
            named.add(component.stream().map(graph::function).toList());
        }
        return new EffectInferenceResult(profiles, named);
    }

    /** Local effects plus resolved external calls, each mapped to the first span that causes it. */
    private Map<Effect, SourceSpan> directEffects(BoundFunction fn, CallGraph graph, int node, DiagnosticBag diagnostics) {
        Map<Effect, SourceSpan> own = new TreeMap<>(LocalEffectCollector.collect(fn));
        for (CallGraph.ExternalCall call : graph.externalCalls(node)) {
            CatalogResolution resolution = catalog.resolve(call.signature());
            switch (resolution.status()) {
                case RESOLVED -> addAll(own, resolution.effects(), call.span());
                case AMBIGUOUS -> {
                    diagnostics.error(DiagnosticCode.AMBIGUOUS_STUB, fn.signature(),
                            "Call to '" + call.signature() + "' at " + call.span() + " matches "
                                    + resolution.candidates().size() + " catalog entries with different effects: "
                                    + describe(resolution.candidates())
                                    + "; add an exact stub to disambiguate");
                    addAll(own, resolution.effects(), call.span());
                }
                case UNRESOLVED -> {
                    String message = "Call to '" + call.signature() + "' at " + call.span()
                            + " is neither a program function nor in the effect catalog";
                    if (policy == UnknownCallPolicy.STRICT) {
                        diagnostics.error(DiagnosticCode.UNKNOWN_EXTERNAL_CALL, fn.signature(),
                                message + "; add a stub to declare its effects");
                        own.putIfAbsent(Effect.UNKNOWN, call.span());
                    } else {
                        diagnostics.warning(DiagnosticCode.UNKNOWN_EXTERNAL_CALL, fn.signature(), message);
                    }
                }
            }
        }
        return own;
    }

    private static void addAll(Map<Effect, SourceSpan> target, EffectSet effects, SourceSpan span) {
        for (Effect effect : effects.effects()) {
            target.putIfAbsent(effect, span);
        }
    }

    private static String describe(List<CatalogEntry> candidates) {
        StringJoiner joiner = new StringJoiner("; ");
        for (CatalogEntry entry : candidates) {
            joiner.add(entry.signature() + " [" + entry.effects().toDisplayString() + "] from " + entry.source());
        }
        return joiner.toString();
    }

    private void runComponents(List<List<Integer>> components, CallGraph graph, List<EffectSet> directSets,
                               Map<Integer, EffectSet> computed, int universe, DiagnosticBag diagnostics) {
        if (executor == null) {
            for (List<Integer> component : components) {
                solveComponent(component, graph, directSets, computed, universe, diagnostics);
            }
            return;
        }

        int[] componentOf = new int[graph.size()];
        for (int c = 0; c < components.size(); c++) {
            for (int member : components.get(c)) componentOf[member] = c;
        }
        // Components arrive callees first, so every dependency already has its future.
        List<CompletableFuture<Void>> futures = new ArrayList<>(components.size());
        for (int c = 0; c < components.size(); c++) {
            List<Integer> component = components.get(c);
            Set<Integer> dependencies = new TreeSet<>();
            for (int member : component) {
                for (CallGraph.Edge edge : graph.callees(member)) {
                    int dep = componentOf[edge.callee()];
                    if (dep != c) dependencies.add(dep);
                }
            }
            CompletableFuture<?>[] waits = dependencies.stream().map(futures::get).toArray(CompletableFuture[]::new);
            futures.add(CompletableFuture.allOf(waits).thenRunAsync(
                    () -> solveComponent(component, graph, directSets, computed, universe, diagnostics), executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    private static void solveComponent(List<Integer> members, CallGraph graph, List<EffectSet> directSets,
                                       Map<Integer, EffectSet> computed, int universe, DiagnosticBag diagnostics) {
        for (int member : members) {
            computed.put(member, directSets.get(member));
        }
        // Each productive round adds at least one effect to some member.
        int maxRounds = members.size() * universe + 1;
        int rounds = 0;
        boolean changed = true;
        while (changed) {
            if (++rounds > maxRounds) {
                for (int member : members) {
                    diagnostics.error(DiagnosticCode.EFFECT_FIXPOINT_DIVERGED, graph.function(member),
                            "Effect inference for " + graph.function(member) + " did not converge after "
                                    + maxRounds + " rounds");
                }
                return;
            }
            changed = false;
            for (int member : members) {
                EffectSet next = directSets.get(member);
                for (CallGraph.Edge edge : graph.callees(member)) {
                    next = next.union(computed.getOrDefault(edge.callee(), EffectSet.EMPTY));
                }
                if (!next.equals(computed.get(member))) {
                    computed.put(member, next);
                    changed = true;
                }
            }
        }
    }

    /**
     * Breadth-first search from {@code start} for the nearest function that introduces
     * {@code effect} itself. Only callees whose computed set carries the effect are explored.
     */
    private static List<CallSite> shortestChain(int start, Effect effect, CallGraph graph,
                                                List<Map<Effect, SourceSpan>> direct,
                                                Map<Integer, EffectSet> computed) {
        Map<Integer, CallGraph.Edge> reachedBy = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        Set<Integer> seen = new HashSet<>();
        queue.add(start);
        seen.add(start);
        while (!queue.isEmpty()) {
            int node = queue.poll();
            SourceSpan origin = direct.get(node).get(effect);
            if (origin != null) {
                LinkedList<CallSite> chain = new LinkedList<>();
                chain.addFirst(new CallSite(graph.function(node), origin));
                int current = node;
                while (current != start) {
                    CallGraph.Edge edge = reachedBy.get(current);
                    chain.addFirst(new CallSite(graph.function(edge.caller()), edge.span()));
                    current = edge.caller();
                }
                return new ArrayList<>(chain);
            }
            for (CallGraph.Edge edge : graph.callees(node)) {
                int callee = edge.callee();
                EffectSet calleeEffects = computed.getOrDefault(callee, EffectSet.EMPTY);
                if (seen.add(callee) && calleeEffects.contains(effect)) {
                    reachedBy.put(callee, edge);
                    queue.add(callee);
                }
            }
        }
        return List.of(new CallSite(graph.function(start), SourceSpan.UNKNOWN));
    }
}
