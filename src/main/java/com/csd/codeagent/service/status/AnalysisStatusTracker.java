package com.csd.codeagent.service.status;

import com.csd.codeagent.config.AgentProperties;
import com.csd.codeagent.model.AggregatedResult;
import com.csd.codeagent.model.AnalysisStatus;
import com.csd.codeagent.model.ErrorInfo;
import com.csd.codeagent.model.StatusEntry;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lifecycle registry for analyses: pending, running, then completed or failed.
 *
 * <p>Every update goes through {@link ConcurrentHashMap#compute}, so concurrent writers
 * to one id are serialized and readers only ever see whole entries. Terminal entries
 * live for the configured TTL and are then removed by {@link #sweep()}.
 */
@Slf4j
public class AnalysisStatusTracker implements AutoCloseable {

    public static final String NAMESPACE = "status";

    private final Map<String, StatusEntry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;
    private final BestEffortStore store;
    private final ObjectMapper objectMapper;
    private final Disposable sweeper;

    public AnalysisStatusTracker(AgentProperties.Status settings, Clock clock,
                                 BestEffortStore store, ObjectMapper objectMapper) {
        this.ttl = settings.getTtl() == null || settings.getTtl().isNegative() || settings.getTtl().isZero()
                ? Duration.ofHours(1)
                : settings.getTtl();
        this.clock = clock;
        this.store = store;
        this.objectMapper = objectMapper;
        this.sweeper = startSweeper(settings.getSweepInterval());
    }

    /**
     * Registers a new analysis as pending. An id that is already tracked is left alone.
     */
    public StatusEntry create(String id, String tag) {
        StatusEntry created = entries.computeIfAbsent(id, key -> {
            StatusEntry entry = StatusEntry.builder()
                    .id(key)
                    .tag(tag)
                    .status(AnalysisStatus.PENDING)
                    .startTime(clock.instant())
                    .build();
            persist(entry);
            return entry;
        });
        log.debug("Analysis {} registered ({})", id, tag);
        return copy(created);
    }

    /**
     * Moves an entry forward. Unknown ids, backward moves and anything after a terminal
     * state are refused with a warning.
     */
    public boolean updateStatus(String id, AnalysisStatus next) {
        return transition(id, next, null, null);
    }

    /**
     * Completes the analysis with its result. Only the first terminal write wins.
     */
    public boolean setResult(String id, AggregatedResult result) {
        return transition(id, AnalysisStatus.COMPLETED, result, null);
    }

    /**
     * Fails the analysis with a classified error. Only the first terminal write wins.
     */
    public boolean setError(String id, ErrorInfo error) {
        return transition(id, AnalysisStatus.FAILED, null, error);
    }

    public Optional<StatusEntry> get(String id) {
        StatusEntry entry = entries.get(id);
        if (entry == null || isExpired(entry, clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(copy(entry));
    }

    /**
     * In-memory entry first, then whatever the record store still holds.
     */
    public Mono<StatusEntry> find(String id) {
        Optional<StatusEntry> local = get(id);
        if (local.isPresent()) {
            return Mono.just(local.get());
        }
        return store.lookup(NAMESPACE, id)
                .flatMap(json -> {
                    try {
                        StatusEntry stored = objectMapper.readValue(json, StatusEntry.class);
                        return isExpired(stored, clock.instant()) ? Mono.<StatusEntry>empty() : Mono.just(stored);
                    } catch (JsonProcessingException e) {
                        log.warn("Ignoring unreadable status record for {}: {}", id, e.getOriginalMessage());
                        return Mono.empty();
                    }
                });
    }

    public boolean delete(String id) {
        boolean removed = entries.remove(id) != null;
        store.remove(NAMESPACE, id);
        return removed;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Removes terminal entries whose TTL has run out. Non-terminal entries are kept
     * regardless of age.
     */
    public int sweep() {
        Instant now = clock.instant();
        List<String> removed = new ArrayList<>();
        for (String id : new ArrayList<>(entries.keySet())) {
            StatusEntry gone = entries.computeIfPresent(id, (key, entry) -> isExpired(entry, now) ? null : entry);
            if (gone == null) {
                removed.add(id);
            }
        }
        removed.forEach(id -> store.remove(NAMESPACE, id));
        if (!removed.isEmpty()) {
            log.info("Swept {} expired analysis status entries", removed.size());
        }
        return removed.size();
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.dispose();
        }
    }

    private boolean transition(String id, AnalysisStatus next, AggregatedResult result, ErrorInfo error) {
        AtomicBoolean applied = new AtomicBoolean(false);
        StatusEntry updated = entries.computeIfPresent(id, (key, entry) -> {
            if (!entry.getStatus().canMoveTo(next)) {
                return entry;
            }
            applied.set(true);
            StatusEntry.StatusEntryBuilder builder = entry.toBuilder().status(next);
            if (next.isTerminal()) {
                Instant now = clock.instant();
                builder.endTime(now).expiresAt(now.plus(ttl));
                if (result != null) builder.result(result);
                if (error != null) builder.error(error);
            }
            StatusEntry moved = builder.build();
            // queued while the key is locked, so the store sees snapshots in transition order
            persist(moved);
            return moved;
        });
        if (updated == null) {
            log.warn("Status update for unknown analysis {} ignored", id);
            return false;
        }
        if (!applied.get()) {
            log.warn("Illegal status transition for {}: {} -> {}", id, updated.getStatus().value(), next.value());
            return false;
        }
        log.debug("Analysis {} is now {}", id, next.value());
        return true;
    }

    private static boolean isExpired(StatusEntry entry, Instant now) {
        return entry.getExpiresAt() != null && !now.isBefore(entry.getExpiresAt());
    }

    private static StatusEntry copy(StatusEntry entry) {
        return entry.toBuilder().build();
    }

    private void persist(StatusEntry entry) {
        try {
            store.write(NAMESPACE, entry.getId(), objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize status entry {}: {}", entry.getId(), e.getOriginalMessage());
        }
    }

    private Disposable startSweeper(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return null;
        }
        Scheduler scheduler = Schedulers.newSingle("analysis-status-sweeper", true);
        long millis = interval.toMillis();
        scheduler.schedulePeriodically(() -> {
            try {
                sweep();
            } catch (RuntimeException e) {
                log.warn("Status sweep failed: {}", e.getMessage());
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        return scheduler;
    }
}
