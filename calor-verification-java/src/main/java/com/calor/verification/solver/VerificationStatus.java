package com.calor.verification.solver;

import com.google.gson.annotations.SerializedName;

public enum VerificationStatus {
    @SerializedName("proven")      PROVEN,
    @SerializedName("disproven")   DISPROVEN,
    @SerializedName("unsupported") UNSUPPORTED,
    @SerializedName("skipped")     SKIPPED;

    /**
     * Unsupported and skipped outcomes depend on solver capabilities and budgets rather than
     * on the contract itself, so they are never persisted.
     */
    public boolean isCacheable() {
        return this == PROVEN || this == DISPROVEN;
    }
}
