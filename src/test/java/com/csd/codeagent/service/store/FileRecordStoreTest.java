package com.csd.codeagent.service.store;

import com.csd.codeagent.config.AgentProperties;
import com.csd.codeagent.model.AggregatedResult;
import com.csd.codeagent.model.AnalysisStatus;
import com.csd.codeagent.model.CacheEntry;
import com.csd.codeagent.model.StatusEntry;
import com.csd.codeagent.service.cache.CacheKeyGenerator;
import com.csd.codeagent.service.cache.CacheKeyParams;
import com.csd.codeagent.service.cache.CacheLookup;
import com.csd.codeagent.service.cache.ResultCache;
import com.csd.codeagent.service.status.AnalysisStatusTracker;
import com.csd.codeagent.support.MutableClock;
import com.csd.codeagent.support.TestObjects;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class FileRecordStoreTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = TestObjects.objectMapper();
    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");

    @Test
    void upsertFindDelete() {
        FileRecordStore store = new FileRecordStore(dir);
        store.upsert("cache", "abc", "{\"a\":1}").block(WAIT);

        assertEquals("{\"a\":1}", store.find("cache", "abc").block(WAIT));
        assertTrue(Files.exists(dir.resolve("cache").resolve("abc.json")));

        store.upsert("cache", "abc", "{\"a\":2}").block(WAIT);
        assertEquals("{\"a\":2}", store.find("cache", "abc").block(WAIT));

        store.delete("cache", "abc").block(WAIT);
        assertNull(store.find("cache", "abc").block(WAIT));
    }

    @Test
    void keysCannotEscapeTheDirectory() {
        FileRecordStore store = new FileRecordStore(dir);
        Path file = store.fileFor("status", "../../etc/passwd");
        assertTrue(file.normalize().startsWith(dir));
    }

    @Test
    void failingStoreDegradesToNotFound() {
        RecordStore broken = new RecordStore() {
            @Override
            public Mono<Void> upsert(String namespace, String key, String json) {
                return Mono.error(new IllegalStateException("disk full"));
            }

            @Override
            public Mono<String> find(String namespace, String key) {
                return Mono.error(new IllegalStateException("disk gone"));
            }

            @Override
            public Mono<Void> delete(String namespace, String key) {
                return Mono.error(new IllegalStateException("disk gone"));
            }
        };
        BestEffortStore store = new BestEffortStore(broken);

        store.write("cache", "k", "{}");
        store.remove("cache", "k");
        assertNull(store.lookup("cache", "k").block(WAIT));
    }

    @Test
    void cacheRestoresEntriesFromStore() throws Exception {
        FileRecordStore files = new FileRecordStore(dir);
        CacheKeyGenerator keyGenerator = new CacheKeyGenerator();
        CacheKeyParams params = CacheKeyParams.builder().prompt("x").tag("codex").backends(List.of("codex")).build();
        String key = keyGenerator.generate(params);

        AggregatedResult stored = AggregatedResult.builder().success(true).findings(List.of()).overallAssessment("from disk").build();
        CacheEntry entry = CacheEntry.builder()
                .key(key)
                .tag("codex")
                .value(objectMapper.writeValueAsString(stored))
                .createdAt(clock.instant())
                .lastAccessedAt(clock.instant())
                .expiresAt(clock.instant().plus(Duration.ofHours(1)))
                .build();
        files.upsert(ResultCache.NAMESPACE, key, objectMapper.writeValueAsString(entry)).block(WAIT);

        AgentProperties.Cache settings = new AgentProperties.Cache();
        settings.setCleanupInterval(Duration.ZERO);
        try (ResultCache cache = new ResultCache(settings, objectMapper, clock, new BestEffortStore(files), keyGenerator)) {
            AtomicInteger computed = new AtomicInteger();
            CacheLookup<AggregatedResult> lookup = cache.getOrSet(params, AggregatedResult.class, () -> {
                computed.incrementAndGet();
                return Mono.just(AggregatedResult.builder().build());
            }).block(WAIT);

            assertEquals(0, computed.get());
            assertTrue(lookup.isFromCache());
            assertEquals("from disk", lookup.getValue().getOverallAssessment());
            assertEquals(1, cache.size());
        }
    }

    @Test
    void statusIsFoundInStoreAfterMemoryLoss() throws Exception {
        FileRecordStore files = new FileRecordStore(dir);
        StatusEntry entry = StatusEntry.builder()
                .id("codex-42")
                .tag("codex")
                .status(AnalysisStatus.COMPLETED)
                .startTime(clock.instant())
                .endTime(clock.instant())
                .expiresAt(clock.instant().plus(Duration.ofHours(1)))
                .build();
        files.upsert(AnalysisStatusTracker.NAMESPACE, "codex-42", objectMapper.writeValueAsString(entry)).block(WAIT);

        AgentProperties.Status settings = new AgentProperties.Status();
        settings.setSweepInterval(Duration.ZERO);
        try (AnalysisStatusTracker tracker = new AnalysisStatusTracker(settings, clock, new BestEffortStore(files), objectMapper)) {
            StatusEntry found = tracker.find("codex-42").block(WAIT);
            assertNotNull(found);
            assertEquals(AnalysisStatus.COMPLETED, found.getStatus());

            clock.advance(Duration.ofHours(2));
            assertNull(tracker.find("codex-42").block(WAIT));
        }
    }

    @Test
    void persistedStatusEndsAtLatestTransition() throws Exception {
        FileRecordStore files = new FileRecordStore(dir);
        BestEffortStore store = new BestEffortStore(files);
        AgentProperties.Status settings = new AgentProperties.Status();
        settings.setSweepInterval(Duration.ZERO);
        AggregatedResult result = AggregatedResult.builder().success(true).findings(List.of()).build();

        try (AnalysisStatusTracker tracker = new AnalysisStatusTracker(settings, clock, store, objectMapper)) {
            for (int i = 0; i < 200; i++) {
                String id = "combined-" + i;
                tracker.create(id, "combined");
                tracker.updateStatus(id, AnalysisStatus.RUNNING);
                tracker.setResult(id, result);
            }
            awaitIdle(store);

            for (int i = 0; i < 200; i++) {
                String json = files.find(AnalysisStatusTracker.NAMESPACE, "combined-" + i).block(WAIT);
                assertNotNull(json, "missing record for combined-" + i);
                StatusEntry persisted = objectMapper.readValue(json, StatusEntry.class);
                assertEquals(AnalysisStatus.COMPLETED, persisted.getStatus(), "stale record for combined-" + i);
                assertNotNull(persisted.getExpiresAt());
            }
        }
        try (Stream<Path> leftovers = Files.list(dir.resolve(AnalysisStatusTracker.NAMESPACE))) {
            assertTrue(leftovers.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void writesToOneKeyApplyInSubmissionOrder() {
        Map<String, String> stored = new ConcurrentHashMap<>();
        RecordStore slow = new RecordStore() {
            @Override
            public Mono<Void> upsert(String namespace, String key, String json) {
                // later writes tend to finish first unless they are held back
                long delay = Math.max(0, 20 - Integer.parseInt(json));
                return Mono.delay(Duration.ofMillis(delay))
                        .doOnNext(ignored -> stored.put(key, json))
                        .then();
            }

            @Override
            public Mono<String> find(String namespace, String key) {
                return Mono.justOrEmpty(stored.get(key));
            }

            @Override
            public Mono<Void> delete(String namespace, String key) {
                return Mono.fromRunnable(() -> stored.remove(key));
            }
        };
        BestEffortStore store = new BestEffortStore(slow);

        for (int i = 0; i < 20; i++) {
            store.write("status", "a", String.valueOf(i));
            store.write("status", "b", String.valueOf(i));
        }
        store.remove("status", "b");
        awaitIdle(store);

        assertEquals("19", stored.get("a"));
        assertFalse(stored.containsKey("b"));
    }

    private static void awaitIdle(BestEffortStore store) {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!store.isIdle()) {
            assertTrue(System.nanoTime() < deadline, "store writes did not drain");
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted while waiting for store writes");
            }
        }
    }
}
