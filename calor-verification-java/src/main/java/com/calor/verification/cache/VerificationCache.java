package com.calor.verification.cache;

import com.calor.verification.solver.ContractQuery;
import com.calor.verification.solver.VerificationResult;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributeView;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Stream;

/**
 * Content-addressed, size-bounded store of solver results.
 *
 * <p>Each entry lives at {@code <dir>/<hash[0..2]>/<hash>.json}. Directory creation, eviction and
 * the write phase run under a single lock; reads only take it for the existence re-check and the
 * file read. Writes go to a process-unique temp file that is renamed over the destination, so a
 * crash never leaves a partial entry under the final name.
 *
 * <p>No operation throws on I/O trouble. Failures are counted and reported as {@link CacheResult}
 * or {@link CacheWriteResult} values; the caller keeps verifying without the cache.
 */
public class VerificationCache implements AutoCloseable {

    static final double EVICTION_TARGET_RATIO = 0.8;
    private static final String ENTRY_SUFFIX = ".json";

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private final VerificationCacheOptions options;
    private final String solverVersion;
    private final ContractHasher hasher;
    private final Path directory;
    private final Object lock = new Object();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder writes = new LongAdder();
    private final LongAdder errors = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    private volatile boolean closed;

    public VerificationCache(VerificationCacheOptions options, String solverVersion) {
        this(options, solverVersion, new ContractHasher());
    }

    public VerificationCache(VerificationCacheOptions options, String solverVersion, ContractHasher hasher) {
        this.options = options;
        this.solverVersion = solverVersion;
        this.hasher = hasher;
        this.directory = options.resolveCacheDirectory();
        if (options.enabled && options.clearBeforeVerification) {
            clear();
        }
    }

    public Path directory() {
        return directory;
    }

    public boolean isEnabled() {
        return options.enabled;
    }

    public CacheResult lookup(ContractQuery query) {
        return lookup(hasher.hash(query));
    }

    public CacheResult lookup(String contractHash) {
        ensureOpen();
        if (!options.enabled) {
            misses.increment();
            return CacheResult.miss();
        }
        Path file = entryPath(contractHash);
        if (!Files.exists(file)) {
            misses.increment();
            return CacheResult.miss();
        }

        String json;
        synchronized (lock) {
            // Another thread may have evicted it since the unlocked check.
            if (!Files.exists(file)) {
                misses.increment();
                return CacheResult.miss();
            }
            try {
                json = Files.readString(file, StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                misses.increment();
                return CacheResult.miss();
            } catch (CharacterCodingException e) {
                json = null;
            } catch (IOException e) {
                errors.increment();
                System.err.println("[calor-verifier] WARNING: could not read cache entry " + file + ": " + e.getMessage());
                return CacheResult.error(IoErrorKind.classify(e));
            }
        }

        // Undecodable bytes count as a corrupt entry.
        CacheEntry entry = null;
        if (json != null) {
            try {
                entry = GSON.fromJson(json, CacheEntry.class);
            } catch (JsonParseException e) {
                entry = null;
            }
        }
        if (entry == null || !entry.isValidFor(contractHash, solverVersion)) {
            discardStale(file);
            misses.increment();
            return CacheResult.miss();
        }

        touch(file);
        hits.increment();
        return CacheResult.hit(entry);
    }

    public CacheWriteResult store(ContractQuery query, VerificationResult result) {
        return store(hasher.hash(query), result);
    }

    /**
     * Records {@code result} under {@code contractHash}. Unsupported and skipped outcomes are
     * never written.
     */
    public CacheWriteResult store(String contractHash, VerificationResult result) {
        ensureOpen();
        if (!options.enabled) {
            return CacheWriteResult.disabled();
        }
        if (!result.status().isCacheable()) {
            return CacheWriteResult.notCacheable();
        }

        byte[] bytes = GSON.toJson(CacheEntry.fromResult(result, contractHash, solverVersion))
                .getBytes(StandardCharsets.UTF_8);
        Path target = entryPath(contractHash);

        synchronized (lock) {
            Path temp = null;
            try {
                Files.createDirectories(target.getParent());
                enforceSizeLimit(bytes.length);
                temp = Files.createTempFile(target.getParent(),
                        contractHash + "." + ProcessHandle.current().pid() + ".", ".tmp");
                Files.write(temp, bytes);
                moveIntoPlace(temp, target);
            } catch (IOException e) {
                errors.increment();
                System.err.println("[calor-verifier] WARNING: could not write cache entry " + target + ": " + e.getMessage());
                return CacheWriteResult.error(IoErrorKind.classify(e));
            } finally {
                if (temp != null) {
                    deleteTempFile(temp);
                }
            }
        }
        writes.increment();
        return CacheWriteResult.written();
    }

    /** Deletes every entry. Failures are logged and counted. */
    public void clear() {
        synchronized (lock) {
            if (!Files.isDirectory(directory)) {
                return;
            }
            try (Stream<Path> walk = Files.walk(directory)) {
                List<Path> paths = new ArrayList<>(walk.toList());
                paths.sort(Comparator.reverseOrder());
                for (Path p : paths) {
                    if (!p.equals(directory)) {
                        Files.deleteIfExists(p);
                    }
                }
            } catch (IOException | UncheckedIOException e) {
                errors.increment();
                System.err.println("[calor-verifier] WARNING: could not clear cache " + directory + ": " + e.getMessage());
            }
        }
    }

    public CacheStatistics statistics() {
        return new CacheStatistics(hits.sum(), misses.sum(), writes.sum(), errors.sum(), evictions.sum());
    }

    /** Summed size of all entry files currently on disk. */
    public long totalSizeBytes() {
        synchronized (lock) {
            try {
                return listEntries().stream().mapToLong(EntryFile::size).sum();
            } catch (IOException | UncheckedIOException e) {
                return 0L;
            }
        }
    }

    Path entryPath(String contractHash) {
        return directory.resolve(contractHash.substring(0, 2)).resolve(contractHash + ENTRY_SUFFIX);
    }

    @Override
    public void close() {
        closed = true;
    }

    // --- internals ---

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Verification cache is closed");
        }
    }

    /**
     * Evicts least-recently-accessed entries when adding {@code incomingBytes} would push the cache
     * past its budget, down to {@value #EVICTION_TARGET_RATIO} of the budget. Caller holds the lock.
     */
    private void enforceSizeLimit(long incomingBytes) {
        long max = options.maxSizeBytes;
        if (max <= 0) {
            return;
        }
        List<EntryFile> entries;
        try {
            entries = listEntries();
        } catch (IOException | UncheckedIOException e) {
            System.err.println("[calor-verifier] WARNING: could not size cache " + directory + ": " + e.getMessage());
            return;
        }

        long total = entries.stream().mapToLong(EntryFile::size).sum();
        if (total + incomingBytes <= max) {
            return;
        }

        long target = (long) (max * EVICTION_TARGET_RATIO);
        entries.sort(Comparator.comparing(EntryFile::lastAccess).thenComparing(e -> e.path().toString()));
        for (EntryFile entry : entries) {
            if (total + incomingBytes <= target) {
                break;
            }
            try {
                if (Files.deleteIfExists(entry.path())) {
                    total -= entry.size();
                    evictions.increment();
                }
            } catch (IOException e) {
                // Best effort: an entry we cannot delete stays and still counts toward the total.
                System.err.println("[calor-verifier] WARNING: could not evict " + entry.path() + ": " + e.getMessage());
            }
        }
    }

    private List<EntryFile> listEntries() throws IOException {
        List<EntryFile> entries = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return entries;
        }
        try (Stream<Path> walk = Files.walk(directory, 2)) {
            for (Path p : walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(ENTRY_SUFFIX))
                    .toList()) {
                try {
                    BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
                    entries.add(new EntryFile(p, attrs.size(), attrs.lastAccessTime()));
                } catch (NoSuchFileException e) {
                    // Removed concurrently by another process.
                    continue;
                }
            }
        }
        return entries;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** Records a read as the entry's last access so eviction sees real usage order. */
    private static void touch(Path file) {
        try {
            Files.getFileAttributeView(file, BasicFileAttributeView.class)
                    .setTimes(null, FileTime.from(Instant.now()), null);
        } catch (IOException e) {
            System.err.println("[calor-verifier] WARNING: could not update access time of " + file + ": " + e.getMessage());
        }
    }

    private void discardStale(Path file) {
        synchronized (lock) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                errors.increment();
                System.err.println("[calor-verifier] WARNING: could not delete stale cache entry " + file + ": " + e.getMessage());
            }
        }
    }

    private static void deleteTempFile(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            System.err.println("[calor-verifier] WARNING: could not delete temp file " + temp + ": " + e.getMessage());
        }
    }

    private record EntryFile(Path path, long size, FileTime lastAccess) {}
}
