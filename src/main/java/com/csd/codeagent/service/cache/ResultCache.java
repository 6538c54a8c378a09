package com.csd.codeagent.service.cache;

import com.csd.codeagent.config.AgentProperties;
import com.csd.codeagent.exception.CacheException;
import com.csd.codeagent.model.CacheEntry;
import com.csd.codeagent.model.CacheStats;
import com.csd.codeagent.service.store.BestEffortStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Content-addressed result cache with TTL expiry and batched LRU eviction.
 *
 * <p>Recency is tracked by an access-ordered map on every read, so eviction always
 * takes the least recently read entries first. The hit counter and
 * {@code lastAccessedAt} stamp on the record itself are only refreshed once per
 * touch interval per key, which bounds how often a hot key is re-written to the
 * backing store.
 *
 * <p>The cache is advisory. Serialization, deserialization and store failures are
 * logged and turned into misses; they never reach the caller.
 */
@Slf4j
public class ResultCache implements AutoCloseable {

    public static final String NAMESPACE = "cache";

    private final AgentProperties.Cache settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final BestEffortStore store;
    private final CacheKeyGenerator keyGenerator;
    private final Disposable cleanupTask;

    // access-ordered: iteration starts at the least recently used entry
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long hits;
    private long misses;
    private long evictions;

    public ResultCache(AgentProperties.Cache settings, ObjectMapper objectMapper, Clock clock,
                       BestEffortStore store, CacheKeyGenerator keyGenerator) {
        if (settings.getMaxSize() < 1) {
            throw new IllegalArgumentException("Cache max size must be at least 1");
        }
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.store = store;
        this.keyGenerator = keyGenerator;
        this.cleanupTask = startCleanup(settings.getCleanupInterval());
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    public String keyFor(CacheKeyParams params) {
        return keyGenerator.generate(params);
    }

    /**
     * Returns the cached value under {@code key}, or empty on miss, expiry or a broken
     * entry.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        if (!settings.isEnabled()) return Optional.empty();
        Optional<T> value = read(key, type);
        recordLookup(value.isPresent());
        return value;
    }

    public void set(String key, String tag, Object value) {
        set(key, tag, value, null);
    }

    /**
     * Stores {@code value} under {@code key}. A missing or non-positive TTL falls back to
     * the configured default, so {@code expiresAt} always follows {@code createdAt}.
     */
    public void set(String key, String tag, Object value, Duration ttl) {
        if (!settings.isEnabled()) return;
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to write to cache (best-effort) for key {}", CacheKeyGenerator.shortForm(key),
                    new CacheException("Cache value not serializable", e));
            return;
        }
        CacheEntry stored = put(key, tag, json, effectiveTtl(ttl));
        persist(stored);
    }

    /**
     * Serves {@code params} from memory, then from the backing store, and only on a
     * double miss runs {@code compute}, writing its value through. Errors from
     * {@code compute} propagate; cache errors never do.
     */
    public <T> Mono<CacheLookup<T>> getOrSet(CacheKeyParams params, Class<T> type, Supplier<Mono<T>> compute) {
        if (!settings.isEnabled()) {
            return Mono.defer(compute).map(value -> new CacheLookup<>(value, false, null));
        }
        return Mono.defer(() -> {
            String key;
            try {
                key = keyGenerator.generate(params);
            } catch (RuntimeException e) {
                log.warn("Cache key generation failed, computing without cache: {}", e.getMessage());
                return Mono.defer(compute).map(value -> new CacheLookup<>(value, false, null));
            }
            String shortKey = CacheKeyGenerator.shortForm(key);

            Optional<T> cached = read(key, type);
            if (cached.isPresent()) {
                recordLookup(true);
                log.debug("Cache hit for {} ({})", shortKey, params.getTag());
                return Mono.just(new CacheLookup<>(cached.get(), true, key));
            }

            return restore(key, type)
                    .map(value -> {
                        recordLookup(true);
                        log.debug("Cache hit from record store for {} ({})", shortKey, params.getTag());
                        return new CacheLookup<>(value, true, key);
                    })
                    .switchIfEmpty(Mono.defer(() -> {
                        recordLookup(false);
                        log.debug("Cache miss for {} ({})", shortKey, params.getTag());
                        return Mono.defer(compute)
                                .doOnNext(value -> set(key, params.getTag(), value))
                                .map(value -> new CacheLookup<>(value, false, key));
                    }));
        });
    }

    public boolean delete(String key) {
        boolean removed;
        synchronized (this) {
            removed = entries.remove(key) != null;
        }
        if (removed) {
            store.remove(NAMESPACE, key);
            log.debug("Cache entry deleted: {}", CacheKeyGenerator.shortForm(key));
        }
        return removed;
    }

    public int clear() {
        List<String> keys;
        synchronized (this) {
            keys = new ArrayList<>(entries.keySet());
            entries.clear();
            hits = 0;
            misses = 0;
        }
        keys.forEach(key -> store.remove(NAMESPACE, key));
        log.info("Cache cleared: {} entries", keys.size());
        return keys.size();
    }

    public int clearByTag(String tag) {
        List<String> removed = new ArrayList<>();
        synchronized (this) {
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheEntry> entry = it.next();
                if (tag != null && tag.equals(entry.getValue().getTag())) {
                    removed.add(entry.getKey());
                    it.remove();
                }
            }
        }
        removed.forEach(key -> store.remove(NAMESPACE, key));
        log.info("Cache cleared by tag {}: {} entries", tag, removed.size());
        return removed.size();
    }

    /**
     * Drops every expired entry. Runs periodically and may be called directly.
     */
    public int purgeExpired() {
        List<String> expired = new ArrayList<>();
        synchronized (this) {
            Instant now = clock.instant();
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheEntry> entry = it.next();
                if (entry.getValue().isExpired(now)) {
                    expired.add(entry.getKey());
                    it.remove();
                }
            }
        }
        expired.forEach(key -> store.remove(NAMESPACE, key));
        if (!expired.isEmpty()) {
            log.info("Deleted {} expired cache entries", expired.size());
        }
        return expired.size();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats stats() {
        Map<String, Integer> byTag = new TreeMap<>();
        long totalEntryHits = 0;
        Instant oldest = null;
        Instant newest = null;
        for (CacheEntry entry : entries.values()) {
            byTag.merge(entry.getTag() == null ? "untagged" : entry.getTag(), 1, Integer::sum);
            totalEntryHits += entry.getHitCount();
            if (oldest == null || entry.getCreatedAt().isBefore(oldest)) oldest = entry.getCreatedAt();
            if (newest == null || entry.getCreatedAt().isAfter(newest)) newest = entry.getCreatedAt();
        }
        long lookups = hits + misses;
        return CacheStats.builder()
                .hits(hits)
                .misses(misses)
                .hitRate(lookups > 0 ? (double) hits / lookups : 0.0)
                .totalEntries(entries.size())
                .maxSize(settings.getMaxSize())
                .evictions(evictions)
                .totalEntryHits(totalEntryHits)
                .byTag(byTag)
                .oldestEntry(oldest)
                .newestEntry(newest)
                .build();
    }

    /**
     * Snapshot of the raw entry, without counting as an access.
     */
    public synchronized Optional<CacheEntry> peek(String key) {
        // LinkedHashMap#get would reorder an access-ordered map
        for (Map.Entry<String, CacheEntry> entry : entries.entrySet()) {
            if (entry.getKey().equals(key)) {
                return Optional.of(entry.getValue().toBuilder().build());
            }
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        if (cleanupTask != null) {
            cleanupTask.dispose();
        }
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        String json = readJson(key);
        if (json == null) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (Exception e) {
            log.warn("Failed to parse cached result for {}, dropping entry", CacheKeyGenerator.shortForm(key));
            delete(key);
            return Optional.empty();
        }
    }

    private String readJson(String key) {
        CacheEntry touched = null;
        String json;
        synchronized (this) {
            CacheEntry entry = entries.get(key);
            if (entry == null) return null;
            Instant now = clock.instant();
            if (entry.isExpired(now)) {
                entries.remove(key);
                store.remove(NAMESPACE, key);
                return null;
            }
            if (Duration.between(entry.getLastAccessedAt(), now).compareTo(settings.getTouchInterval()) >= 0) {
                entry.setHitCount(entry.getHitCount() + 1);
                entry.setLastAccessedAt(now);
                touched = entry.toBuilder().build();
            }
            json = entry.getValue();
        }
        if (touched != null) {
            persist(touched);
        }
        return json;
    }

    private <T> Mono<T> restore(String key, Class<T> type) {
        return store.lookup(NAMESPACE, key)
                .flatMap(json -> {
                    try {
                        CacheEntry entry = objectMapper.readValue(json, CacheEntry.class);
                        if (entry.isExpired(clock.instant())) {
                            store.remove(NAMESPACE, key);
                            return Mono.empty();
                        }
                        T value = objectMapper.readValue(entry.getValue(), type);
                        synchronized (this) {
                            evictIfNeeded();
                            entries.put(key, entry);
                        }
                        return Mono.just(value);
                    } catch (Exception e) {
                        log.warn("Ignoring unreadable stored cache record {}", CacheKeyGenerator.shortForm(key));
                        return Mono.empty();
                    }
                });
    }

    private synchronized CacheEntry put(String key, String tag, String json, Duration ttl) {
        Instant now = clock.instant();
        CacheEntry existing = entries.get(key);
        if (existing != null) {
            existing.setValue(json);
            existing.setTag(tag);
            existing.setLastAccessedAt(now);
            existing.setExpiresAt(now.plus(ttl));
            log.debug("Cache updated: {}", CacheKeyGenerator.shortForm(key));
            return existing.toBuilder().build();
        }
        evictIfNeeded();
        CacheEntry entry = CacheEntry.builder()
                .key(key)
                .tag(tag)
                .value(json)
                .hitCount(0)
                .createdAt(now)
                .lastAccessedAt(now)
                .expiresAt(now.plus(ttl))
                .build();
        entries.put(key, entry);
        log.debug("Cache entry created: {} ({})", CacheKeyGenerator.shortForm(key), tag);
        return entry.toBuilder().build();
    }

    // caller holds the monitor
    private void evictIfNeeded() {
        if (entries.size() < settings.getMaxSize()) return;

        Instant now = clock.instant();
        entries.values().removeIf(entry -> entry.isExpired(now));
        if (entries.size() < settings.getMaxSize()) return;

        int toEvict = Math.max(1, settings.getMaxSize() / 10);
        List<String> victims = new ArrayList<>(toEvict);
        Iterator<String> it = entries.keySet().iterator();
        while (it.hasNext() && victims.size() < toEvict) {
            victims.add(it.next());
            it.remove();
        }
        evictions += victims.size();
        victims.forEach(key -> store.remove(NAMESPACE, key));
        log.info("LRU cache eviction performed: {} entries", victims.size());
    }

    private synchronized void recordLookup(boolean hit) {
        if (hit) hits++;
        else misses++;
    }

    private void persist(CacheEntry entry) {
        try {
            store.write(NAMESPACE, entry.getKey(), objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize cache record {}", CacheKeyGenerator.shortForm(entry.getKey()));
        }
    }

    private Duration effectiveTtl(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return settings.getTtl();
        }
        return ttl;
    }

    private Disposable startCleanup(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return null;
        }
        Scheduler scheduler = Schedulers.newSingle("result-cache-cleanup", true);
        long millis = interval.toMillis();
        scheduler.schedulePeriodically(() -> {
            try {
                purgeExpired();
            } catch (RuntimeException e) {
                log.warn("Cache cleanup failed: {}", e.getMessage());
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        // disposing the scheduler cancels the periodic task with it
        return scheduler;
    }
}
