package com.calor.analysis.effects;

import com.google.gson.annotations.SerializedName;

/**
 * What to assume about an external call that neither the program nor the catalog explains.
 */
public enum UnknownCallPolicy {
    /** Assume the worst (every effect) and report an error. */
    @SerializedName("strict") STRICT,
    /** Assume nothing and report a warning. */
    @SerializedName("warn")   WARN
}
