package com.calor.analysis.ir;

import java.util.List;
import java.util.Optional;

public record BoundModule(String name, List<BoundFunction> functions) {

    public BoundModule {
        functions = List.copyOf(functions);
    }

    public Optional<BoundFunction> function(String signature) {
        return functions.stream().filter(f -> f.signature().equals(signature)).findFirst();
    }
}
