package com.calor.verification.contract;

import java.util.Locale;

public enum ContractKind {
    PRE,
    POST;

    /** Label for the {@code index}-th contract of this kind on {@code functionName}, e.g. {@code withdraw#post[1]}. */
    public String label(String functionName, int index) {
        return functionName + "#" + name().toLowerCase(Locale.ROOT) + "[" + index + "]";
    }
}
