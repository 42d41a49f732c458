package com.calor.verification.cache;

import com.calor.verification.solver.VerificationResult;
import com.calor.verification.solver.VerificationStatus;
import com.google.gson.annotations.SerializedName;

import java.time.Duration;
import java.time.Instant;

/**
 * On-disk form of one cached verification result, one JSON file per contract hash.
 */
public class CacheEntry {

    /** Bumped whenever the entry layout or the canonical hash format changes. */
    public static final int FORMAT_VERSION = 1;

    @SerializedName("format_version") public int formatVersion;
    @SerializedName("solver_version") public String solverVersion;
    @SerializedName("status")         public VerificationStatus status;
    @SerializedName("counterexample") public String counterexample;
    @SerializedName("duration_ms")    public long durationMillis;
    @SerializedName("created_at")     public String createdAt;
    @SerializedName("contract_hash")  public String contractHash;

    static CacheEntry fromResult(VerificationResult result, String contractHash, String solverVersion) {
        CacheEntry entry = new CacheEntry();
        entry.formatVersion = FORMAT_VERSION;
        entry.solverVersion = solverVersion;
        entry.status = result.status();
        entry.counterexample = result.counterexample();
        entry.durationMillis = result.duration().toMillis();
        entry.createdAt = Instant.now().toString();
        entry.contractHash = contractHash;
        return entry;
    }

    /**
     * True when this entry may answer a lookup for {@code expectedHash} under the running
     * format and the currently loaded solver.
     */
    boolean isValidFor(String expectedHash, String currentSolverVersion) {
        return formatVersion == FORMAT_VERSION
                && status != null
                && expectedHash.equals(contractHash)
                && (solverVersion == null ? currentSolverVersion == null : solverVersion.equals(currentSolverVersion));
    }

    /**
     * Rebuilds the cached result. The duration comes back at millisecond precision, since that
     * is all {@code duration_ms} records.
     */
    public VerificationResult toResult() {
        return new VerificationResult(status, counterexample, Duration.ofMillis(durationMillis));
    }
}
