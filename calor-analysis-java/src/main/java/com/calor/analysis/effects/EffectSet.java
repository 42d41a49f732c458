package com.calor.analysis.effects;

import java.util.*;
import java.util.function.Consumer;

/**
 * Immutable set of effects. The unknown set absorbs every union and is a superset of everything.
 */
public final class EffectSet {

    public static final EffectSet EMPTY = new EffectSet(new TreeSet<>());
    public static final EffectSet UNKNOWN = new EffectSet(new TreeSet<>(Set.of(Effect.UNKNOWN)));

    private final SortedSet<Effect> effects;

    private EffectSet(SortedSet<Effect> effects) {
        this.effects = Collections.unmodifiableSortedSet(effects);
    }

    public static EffectSet of(Effect... effects) {
        return of(Arrays.asList(effects));
    }

    public static EffectSet of(Collection<Effect> effects) {
        if (effects.isEmpty()) return EMPTY;
        if (effects.contains(Effect.UNKNOWN)) return UNKNOWN;
        return new EffectSet(new TreeSet<>(effects));
    }

    /** Parses surface codes; each unparseable code is handed to {@code unrecognized} and skipped. */
    public static EffectSet parse(Collection<String> codes, Consumer<String> unrecognized) {
        List<Effect> parsed = new ArrayList<>();
        for (String code : codes) {
            Optional<Effect> effect = Effect.parse(code);
            if (effect.isPresent()) {
                parsed.add(effect.get());
            } else {
                unrecognized.accept(code);
            }
        }
        return of(parsed);
    }

    public boolean isEmpty()   { return effects.isEmpty(); }
    public boolean isUnknown() { return effects.contains(Effect.UNKNOWN); }
    public int size()          { return effects.size(); }

    /** Effects in category-then-kind order. */
    public SortedSet<Effect> effects() {
        return effects;
    }

    /** Exact membership; the unknown set contains everything. */
    public boolean contains(Effect effect) {
        return isUnknown() || effects.contains(effect);
    }

    public EffectSet union(EffectSet other) {
        if (isUnknown() || other.isUnknown()) return UNKNOWN;
        if (other.effects.isEmpty() || effects.containsAll(other.effects)) return this;
        if (effects.isEmpty()) return other;
        TreeSet<Effect> combined = new TreeSet<>(effects);
        combined.addAll(other.effects);
        return new EffectSet(combined);
    }

    /** Subset test honouring effect subtyping, so {@code {fs:r}} is a subset of {@code {fs:rw}}. */
    public boolean isSubsetOf(EffectSet declared) {
        return notCoveredBy(declared).isEmpty();
    }

    /** Effects of this set that no effect of {@code declared} covers, in sorted order. */
    public List<Effect> notCoveredBy(EffectSet declared) {
        if (declared.isUnknown()) return List.of();
        if (isUnknown()) return List.of(Effect.UNKNOWN);
        List<Effect> missing = new ArrayList<>();
        for (Effect effect : effects) {
            boolean covered = false;
            for (Effect allowed : declared.effects) {
                if (allowed.encompasses(effect)) {
                    covered = true;
                    break;
                }
            }
            if (!covered) missing.add(effect);
        }
        return missing;
    }

    public List<String> surfaceCodes() {
        return effects.stream().map(Effect::surfaceCode).toList();
    }

    public String toDisplayString() {
        if (isUnknown()) return "[unknown]";
        if (isEmpty()) return "[pure]";
        return String.join(", ", surfaceCodes());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EffectSet other && effects.equals(other.effects);
    }

    @Override
    public int hashCode() {
        return effects.hashCode();
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
