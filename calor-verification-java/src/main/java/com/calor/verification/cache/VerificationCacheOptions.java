package com.calor.verification.cache;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Settings for one {@link VerificationCache}. Immutable; use the {@code with*} methods to derive variants.
 */
public final class VerificationCacheOptions {

    public static final long DEFAULT_MAX_SIZE_BYTES = 100L * 1024 * 1024;
    static final String TOOL_DIRECTORY = ".calor";
    static final String CACHE_DIRECTORY = "verification-cache";

    public final boolean enabled;
    /** Upper bound on the summed size of all entry files; 0 or negative means unbounded. */
    public final long maxSizeBytes;
    /** Explicit cache directory; wins over every other location when set. */
    public final Path directoryOverride;
    /** Project root; when set the cache lives under {@code <project>/.calor/verification-cache}. */
    public final Path projectDirectory;
    public final boolean clearBeforeVerification;

    public VerificationCacheOptions(boolean enabled, long maxSizeBytes, Path directoryOverride,
                                    Path projectDirectory, boolean clearBeforeVerification) {
        this.enabled = enabled;
        this.maxSizeBytes = maxSizeBytes;
        this.directoryOverride = directoryOverride;
        this.projectDirectory = projectDirectory;
        this.clearBeforeVerification = clearBeforeVerification;
    }

    public static VerificationCacheOptions defaults() {
        return new VerificationCacheOptions(true, DEFAULT_MAX_SIZE_BYTES, null, null, false);
    }

    public static VerificationCacheOptions disabled() {
        return new VerificationCacheOptions(false, DEFAULT_MAX_SIZE_BYTES, null, null, false);
    }

    public VerificationCacheOptions withDirectory(Path directory) {
        return new VerificationCacheOptions(enabled, maxSizeBytes, directory, projectDirectory, clearBeforeVerification);
    }

    public VerificationCacheOptions withProjectDirectory(Path project) {
        return new VerificationCacheOptions(enabled, maxSizeBytes, directoryOverride, project, clearBeforeVerification);
    }

    public VerificationCacheOptions withMaxSizeBytes(long bytes) {
        return new VerificationCacheOptions(enabled, bytes, directoryOverride, projectDirectory, clearBeforeVerification);
    }

    public VerificationCacheOptions withClearBeforeVerification(boolean clear) {
        return new VerificationCacheOptions(enabled, maxSizeBytes, directoryOverride, projectDirectory, clear);
    }

    /** Override, then project-local, then the user's home directory. */
    public Path resolveCacheDirectory() {
        if (directoryOverride != null) {
            return directoryOverride.toAbsolutePath().normalize();
        }
        if (projectDirectory != null) {
            return projectDirectory.toAbsolutePath().normalize().resolve(TOOL_DIRECTORY).resolve(CACHE_DIRECTORY);
        }
        return Paths.get(System.getProperty("user.home")).resolve(TOOL_DIRECTORY).resolve(CACHE_DIRECTORY);
    }
}
