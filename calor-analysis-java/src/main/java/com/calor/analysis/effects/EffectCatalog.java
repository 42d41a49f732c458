package com.calor.analysis.effects;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Known effects of code outside the program, keyed by fully-qualified signature.
 *
 * <p>A lookup tries the exact signature, then the parameterless {@code Type::Method} entry, then
 * the {@code Type::*} wildcard, and stops at the first of these that has entries. Among those
 * entries only the highest layer counts. If that layer holds entries with different effect sets
 * the call is ambiguous: the outcome never depends on the order entries were added.
 */
public final class EffectCatalog {

    private final Map<String, List<CatalogEntry>> bySignature = new ConcurrentHashMap<>();

    public void add(CatalogEntry entry) {
        bySignature.compute(entry.signature(), (k, existing) -> {
            List<CatalogEntry> list = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            list.add(entry);
            return List.copyOf(list);
        });
    }

    public int size() {
        return bySignature.values().stream().mapToInt(List::size).sum();
    }

    public CatalogResolution resolve(String signature) {
        for (String key : lookupKeys(signature)) {
            List<CatalogEntry> entries = bySignature.get(key);
            if (entries != null && !entries.isEmpty()) {
                return choose(entries);
            }
        }
        return CatalogResolution.UNRESOLVED;
    }

    static List<String> lookupKeys(String signature) {
        List<String> keys = new ArrayList<>(3);
        keys.add(signature);
        int paren = signature.indexOf('(');
        if (paren > 0) {
            keys.add(signature.substring(0, paren));
        }
        int separator = signature.indexOf("::");
        if (separator > 0) {
            String wildcard = signature.substring(0, separator) + "::*";
            if (!keys.contains(wildcard)) keys.add(wildcard);
        }
        return keys;
    }

    private static CatalogResolution choose(List<CatalogEntry> entries) {
        CatalogLayer top = entries.stream().map(CatalogEntry::layer).max(Comparator.naturalOrder()).orElseThrow();
        List<CatalogEntry> candidates = new ArrayList<>();
        Set<EffectSet> distinct = new HashSet<>();
        EffectSet union = EffectSet.EMPTY;
        for (CatalogEntry entry : entries) {
            if (entry.layer() == top) {
                candidates.add(entry);
                distinct.add(entry.effects());
                union = union.union(entry.effects());
            }
        }
        candidates.sort(Comparator.comparing(CatalogEntry::source).thenComparing(e -> e.effects().toDisplayString()));
        if (distinct.size() == 1) {
            return new CatalogResolution(CatalogResolution.Status.RESOLVED, union, candidates);
        }
        return new CatalogResolution(CatalogResolution.Status.AMBIGUOUS, union, candidates);
    }
}
