package com.calor.verification.cache;

import com.calor.verification.solver.VerificationResult;
import com.calor.verification.solver.VerificationStatus;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributeView;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class VerificationCacheTest {

    private static final String SOLVER = "z3-4.12.2";

    private static String hashOf(String text) {
        return ContractHasher.sha256Hex(text);
    }

    private static VerificationCache cacheIn(Path dir) {
        return new VerificationCache(VerificationCacheOptions.defaults().withDirectory(dir), SOLVER);
    }

    private static void setLastAccess(Path file, long millis) throws IOException {
        Files.getFileAttributeView(file, BasicFileAttributeView.class)
                .setTimes(null, FileTime.fromMillis(millis), null);
    }

    @Test
    void storeThenLookupReturnsSameResult(@TempDir Path tmp) {
        VerificationCache cache = cacheIn(tmp);
        String hash = hashOf("PRE:x:i32::(> REF:x INT:0)");

        CacheWriteResult written = cache.store(hash, VerificationResult.disproven("x = -1", Duration.ofMillis(42)));
        assertEquals(CacheWriteResult.Outcome.WRITTEN, written.outcome());

        CacheResult found = cache.lookup(hash);
        assertTrue(found.isHit());
        assertEquals(VerificationStatus.DISPROVEN, found.result().status());
        assertEquals("x = -1", found.result().counterexample());
        assertEquals(Duration.ofMillis(42), found.result().duration());
    }

    @Test
    void entryIsStoredUnderTwoCharacterPrefix(@TempDir Path tmp) throws IOException {
        VerificationCache cache = cacheIn(tmp);
        String hash = hashOf("prefix");
        cache.store(hash, VerificationResult.proven(Duration.ofMillis(3)));

        Path expected = tmp.resolve(hash.substring(0, 2)).resolve(hash + ".json");
        assertTrue(Files.exists(expected));

        JsonObject json = new Gson().fromJson(Files.readString(expected), JsonObject.class);
        assertEquals(CacheEntry.FORMAT_VERSION, json.get("format_version").getAsInt());
        assertEquals(SOLVER, json.get("solver_version").getAsString());
        assertEquals("proven", json.get("status").getAsString());
        assertEquals(hash, json.get("contract_hash").getAsString());
        assertEquals(3, json.get("duration_ms").getAsLong());
    }

    @Test
    void noTempFilesRemainAfterWrite(@TempDir Path tmp) throws IOException {
        VerificationCache cache = cacheIn(tmp);
        for (int i = 0; i < 5; i++) {
            cache.store(hashOf("c" + i), VerificationResult.proven(Duration.ZERO));
        }
        try (Stream<Path> walk = Files.walk(tmp)) {
            assertTrue(walk.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void differentSolverVersionInvalidatesEntry(@TempDir Path tmp) {
        String hash = hashOf("versioned");
        cacheIn(tmp).store(hash, VerificationResult.proven(Duration.ZERO));

        VerificationCache upgraded = new VerificationCache(
                VerificationCacheOptions.defaults().withDirectory(tmp), "z3-4.13.0");
        CacheResult result = upgraded.lookup(hash);

        assertEquals(CacheResult.Kind.MISS, result.kind());
        assertFalse(Files.exists(upgraded.entryPath(hash)), "Stale entry should be deleted");
    }

    @Test
    void entryFiledUnderWrongHashIsMiss(@TempDir Path tmp) throws IOException {
        VerificationCache cache = cacheIn(tmp);
        String original = hashOf("original");
        String other = hashOf("other");
        cache.store(original, VerificationResult.proven(Duration.ZERO));

        Path misplaced = cache.entryPath(other);
        Files.createDirectories(misplaced.getParent());
        Files.copy(cache.entryPath(original), misplaced);

        assertEquals(CacheResult.Kind.MISS, cache.lookup(other).kind());
        assertFalse(Files.exists(misplaced));
        assertTrue(cache.lookup(original).isHit());
    }

    @Test
    void corruptEntryIsMissAndDeleted(@TempDir Path tmp) throws IOException {
        VerificationCache cache = cacheIn(tmp);
        String hash = hashOf("corrupt");
        Path file = cache.entryPath(hash);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{ this is not json");

        assertEquals(CacheResult.Kind.MISS, cache.lookup(hash).kind());
        assertFalse(Files.exists(file));
        assertEquals(0, cache.statistics().errors());
    }

    @Test
    void undecodableEntryIsMissAndDeleted(@TempDir Path tmp) throws IOException {
        VerificationCache cache = cacheIn(tmp);
        String hash = hashOf("binary");
        Path file = cache.entryPath(hash);
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[] {(byte) 0xC3, 0x28, (byte) 0xFF, (byte) 0xFE});

        assertEquals(CacheResult.Kind.MISS, cache.lookup(hash).kind());
        assertFalse(Files.exists(file));
        assertEquals(CacheResult.Kind.MISS, cache.lookup(hash).kind());

        CacheStatistics stats = cache.statistics();
        assertEquals(0, stats.errors());
        assertEquals(2, stats.misses());
    }

    @Test
    void hitKeepsDurationAtMillisecondPrecision(@TempDir Path tmp) {
        VerificationCache cache = cacheIn(tmp);
        String hash = hashOf("timed");
        cache.store(hash, VerificationResult.proven(Duration.ofNanos(1_234_567_890)));

        CacheResult hit = cache.lookup(hash);
        assertTrue(hit.isHit());
        assertEquals(Duration.ofMillis(1234), hit.result().duration());
    }

    @Test
    void unsupportedAndSkippedAreNeverCached(@TempDir Path tmp) {
        VerificationCache cache = cacheIn(tmp);
        String unsupported = hashOf("unsupported");
        String skipped = hashOf("skipped");

        assertEquals(CacheWriteResult.Outcome.NOT_CACHEABLE,
                cache.store(unsupported, VerificationResult.unsupported(Duration.ZERO)).outcome());
        assertEquals(CacheWriteResult.Outcome.NOT_CACHEABLE,
                cache.store(skipped, VerificationResult.skipped(Duration.ofSeconds(5))).outcome());

        assertFalse(cache.lookup(unsupported).isHit());
        assertFalse(cache.lookup(skipped).isHit());
        assertEquals(0, cache.statistics().writes());
    }

    @Test
    void statisticsCountLookupsAndWrites(@TempDir Path tmp) {
        VerificationCache cache = cacheIn(tmp);
        String hash = hashOf("stats");

        cache.lookup(hash);
        cache.store(hash, VerificationResult.proven(Duration.ZERO));
        cache.lookup(hash);
        cache.lookup(hash);

        CacheStatistics stats = cache.statistics();
        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(1, stats.writes());
        assertEquals(3, stats.totalLookups());
        assertEquals(200.0 / 3, stats.hitRate(), 1e-9);
    }

    @Test
    void disabledCacheTouchesNothing(@TempDir Path tmp) {
        Path dir = tmp.resolve("cache");
        VerificationCache cache = new VerificationCache(VerificationCacheOptions.disabled().withDirectory(dir), SOLVER);
        String hash = hashOf("disabled");

        assertEquals(CacheWriteResult.Outcome.DISABLED,
                cache.store(hash, VerificationResult.proven(Duration.ZERO)).outcome());
        assertEquals(CacheResult.Kind.MISS, cache.lookup(hash).kind());
        assertFalse(Files.exists(dir));
    }

    @Test
    void ioFailureIsReportedNotThrown(@TempDir Path tmp) throws IOException {
        Path blocker = tmp.resolve("not-a-directory");
        Files.writeString(blocker, "occupied");
        VerificationCache cache = cacheIn(blocker);

        CacheWriteResult result = cache.store(hashOf("io"), VerificationResult.proven(Duration.ZERO));
        assertEquals(CacheWriteResult.Outcome.ERROR, result.outcome());
        assertNotNull(result.errorKind());
        assertEquals(1, cache.statistics().errors());
    }

    @Test
    void clearRemovesAllEntries(@TempDir Path tmp) {
        VerificationCache cache = cacheIn(tmp);
        String hash = hashOf("clear");
        cache.store(hash, VerificationResult.proven(Duration.ZERO));

        cache.clear();

        assertFalse(cache.lookup(hash).isHit());
        assertEquals(0, cache.totalSizeBytes());
    }

    @Test
    void clearBeforeVerificationEmptiesExistingCache(@TempDir Path tmp) {
        String hash = hashOf("stale-run");
        cacheIn(tmp).store(hash, VerificationResult.proven(Duration.ZERO));

        VerificationCache fresh = new VerificationCache(
                VerificationCacheOptions.defaults().withDirectory(tmp).withClearBeforeVerification(true), SOLVER);
        assertFalse(fresh.lookup(hash).isHit());
    }

    @Test
    void evictionDropsLeastRecentlyAccessedDownToEightyPercent(@TempDir Path tmp) throws IOException {
        VerificationCache unbounded = new VerificationCache(
                VerificationCacheOptions.defaults().withDirectory(tmp).withMaxSizeBytes(0), SOLVER);
        List<String> hashes = new ArrayList<>();
        long base = System.currentTimeMillis() - 100_000;
        for (int i = 0; i < 10; i++) {
            String hash = hashOf("entry-" + i);
            hashes.add(hash);
            unbounded.store(hash, VerificationResult.proven(Duration.ofMillis(i)));
        }
        // entry-0 is the oldest access, entry-9 the newest
        for (int i = 0; i < hashes.size(); i++) {
            setLastAccess(unbounded.entryPath(hashes.get(i)), base + i * 1000L);
        }
        long budget = unbounded.totalSizeBytes();

        VerificationCache bounded = new VerificationCache(
                VerificationCacheOptions.defaults().withDirectory(tmp).withMaxSizeBytes(budget), SOLVER);
        bounded.store(hashOf("incoming"), VerificationResult.proven(Duration.ZERO));

        assertTrue(bounded.totalSizeBytes() <= (long) (budget * 0.8),
                "Total " + bounded.totalSizeBytes() + " should be within 80% of " + budget);
        assertTrue(Files.exists(bounded.entryPath(hashOf("incoming"))));
        assertTrue(bounded.statistics().evictions() > 0);

        // Evicted entries form a prefix of the access order.
        boolean seenSurvivor = false;
        for (String hash : hashes) {
            boolean present = Files.exists(bounded.entryPath(hash));
            if (present) {
                seenSurvivor = true;
            } else {
                assertFalse(seenSurvivor, "A more recently accessed entry was evicted before an older one");
            }
        }
        assertFalse(Files.exists(bounded.entryPath(hashes.get(0))));
        assertTrue(Files.exists(bounded.entryPath(hashes.get(9))));
    }

    @Test
    void lookupRefreshesAccessTime(@TempDir Path tmp) throws IOException {
        VerificationCache cache = cacheIn(tmp);
        String hash = hashOf("touch");
        cache.store(hash, VerificationResult.proven(Duration.ZERO));
        setLastAccess(cache.entryPath(hash), 1_000L);

        assertTrue(cache.lookup(hash).isHit());

        FileTime after = Files.readAttributes(cache.entryPath(hash),
                java.nio.file.attribute.BasicFileAttributes.class).lastAccessTime();
        assertTrue(after.toMillis() > 1_000L);
    }

    @Test
    void closedCacheRejectsUse(@TempDir Path tmp) {
        VerificationCache cache = cacheIn(tmp);
        cache.close();
        assertThrows(IllegalStateException.class, () -> cache.lookup(hashOf("closed")));
    }
}
