package com.calor.analysis.config;

import com.calor.analysis.effects.UnknownCallPolicy;
import com.calor.verification.cache.VerificationCacheOptions;
import com.google.gson.annotations.SerializedName;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Deserialized form of a project's {@code calor.json}. Every key is optional.
 */
public class VerifierConfig {

    public static final String FILE_NAME = "calor.json";
    public static final String DEFAULT_EFFECTS_CATALOG = ".calor-effects.json";

    @SerializedName("cache_enabled")
    private Boolean cacheEnabled;

    /** Explicit cache location; wins over the project-local and home directories. */
    @SerializedName("cache_directory")
    private String cacheDirectory;

    /** Cache budget in bytes (default: 100 MiB). 0 or negative disables eviction. */
    @SerializedName("max_cache_size_bytes")
    private Long maxCacheSizeBytes;

    @SerializedName("clear_cache")
    private Boolean clearCache;

    @SerializedName("unknown_call_policy")
    private UnknownCallPolicy unknownCallPolicy;

    /** Project effect catalog, relative to the project directory (default: .calor-effects.json). */
    @SerializedName("effects_catalog")
    private String effectsCatalog;

    /** Per-contract solver budget; 0 means no limit. */
    @SerializedName("solver_timeout_millis")
    private Long solverTimeoutMillis;

    /** Worker threads for per-function analyses and independent call-graph components. */
    @SerializedName("parallelism")
    private Integer parallelism;

    @SerializedName("report_dead_assignments")
    private Boolean reportDeadAssignments;

    public static VerifierConfig defaults() {
        return new VerifierConfig();
    }

    public boolean isCacheEnabled()      { return cacheEnabled == null || cacheEnabled; }
    public String getCacheDirectory()    { return cacheDirectory; }
    public long getMaxCacheSizeBytes()   { return maxCacheSizeBytes != null ? maxCacheSizeBytes : VerificationCacheOptions.DEFAULT_MAX_SIZE_BYTES; }
    public boolean isClearCache()        { return clearCache != null && clearCache; }
    public UnknownCallPolicy getUnknownCallPolicy() { return unknownCallPolicy != null ? unknownCallPolicy : UnknownCallPolicy.STRICT; }
    public String getEffectsCatalog()    { return effectsCatalog != null ? effectsCatalog : DEFAULT_EFFECTS_CATALOG; }
    public long getSolverTimeoutMillis() { return solverTimeoutMillis != null ? Math.max(0, solverTimeoutMillis) : 0L; }
    public int getParallelism()          { return parallelism != null ? Math.max(1, parallelism) : 1; }
    public boolean isReportDeadAssignments() { return reportDeadAssignments == null || reportDeadAssignments; }

    /** Cache settings for a run rooted at {@code projectDirectory} (may be null). */
    public VerificationCacheOptions toCacheOptions(Path projectDirectory) {
        VerificationCacheOptions options = new VerificationCacheOptions(
                isCacheEnabled(), getMaxCacheSizeBytes(), null, projectDirectory, isClearCache());
        if (cacheDirectory != null) {
            Path dir = Paths.get(cacheDirectory);
            if (!dir.isAbsolute() && projectDirectory != null) {
                dir = projectDirectory.resolve(dir);
            }
            options = options.withDirectory(dir);
        }
        return options;
    }

    public Path resolveEffectsCatalog(Path projectDirectory) {
        Path catalog = Paths.get(getEffectsCatalog());
        return catalog.isAbsolute() || projectDirectory == null ? catalog : projectDirectory.resolve(catalog);
    }
}
