package com.calor.analysis.effects;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class EffectInferenceResult {

    private final Map<String, FunctionEffectProfile> profiles;
    private final List<List<String>> components;

    EffectInferenceResult(Map<String, FunctionEffectProfile> profiles, List<List<String>> components) {
        this.profiles = Collections.unmodifiableMap(new TreeMap<>(profiles));
        this.components = List.copyOf(components);
    }

    public FunctionEffectProfile profile(String function) {
        FunctionEffectProfile profile = profiles.get(function);
        if (profile == null) {
            throw new IllegalArgumentException("No effect profile for " + function);
        }
        return profile;
    }

    /** Profiles keyed by function signature, in signature order. */
    public Map<String, FunctionEffectProfile> profiles() {
        return profiles;
    }

    /** Strongly connected components in the order they were processed, callees first. */
    public List<List<String>> components() {
        return components;
    }

    public boolean allAccepted() {
        return profiles.values().stream().allMatch(FunctionEffectProfile::accepted);
    }
}
