package com.csd.codeagent.service.store;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Wraps a {@link RecordStore} so that writes are fire-and-forget and lookups time out
 * into "not found". A slow or broken store never fails or delays a request.
 *
 * <p>Writes and deletes for one record run one at a time in submission order, so the
 * last submitted snapshot is the one left in the store. Different records do not wait
 * on each other.
 */
@Slf4j
public class BestEffortStore {

    private static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(2);

    private final RecordStore delegate;
    private final Map<String, Deque<Supplier<Mono<Void>>>> lanes = new HashMap<>();

    public BestEffortStore(RecordStore delegate) {
        this.delegate = delegate;
    }

    public void write(String namespace, String key, String json) {
        enqueue(namespace, key, () -> delegate.upsert(namespace, key, json)
                .onErrorResume(e -> {
                    log.warn("Record store write failed for {}/{}: {}", namespace, shortKey(key), e.getMessage());
                    return Mono.empty();
                }));
    }

    public void remove(String namespace, String key) {
        enqueue(namespace, key, () -> delegate.delete(namespace, key)
                .onErrorResume(e -> {
                    log.warn("Record store delete failed for {}/{}: {}", namespace, shortKey(key), e.getMessage());
                    return Mono.empty();
                }));
    }

    public Mono<String> lookup(String namespace, String key) {
        return Mono.defer(() -> delegate.find(namespace, key))
                .timeout(LOOKUP_TIMEOUT)
                .onErrorResume(e -> {
                    log.warn("Record store lookup failed for {}/{}: {}", namespace, shortKey(key), e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Whether no write or delete is queued or running.
     */
    public boolean isIdle() {
        synchronized (lanes) {
            return lanes.isEmpty();
        }
    }

    private void enqueue(String namespace, String key, Supplier<Mono<Void>> operation) {
        String lane = namespace + "/" + key;
        synchronized (lanes) {
            Deque<Supplier<Mono<Void>>> pending = lanes.get(lane);
            if (pending != null) {
                // the running operation picks this one up when it finishes
                pending.addLast(operation);
                return;
            }
            lanes.put(lane, new ArrayDeque<>());
        }
        run(lane, operation);
    }

    private void run(String lane, Supplier<Mono<Void>> operation) {
        Mono.defer(operation)
                .subscribeOn(Schedulers.boundedElastic())
                .doFinally(signal -> runNext(lane))
                .subscribe(null, e -> log.warn("Record store operation failed for {}: {}", lane, e.getMessage()));
    }

    private void runNext(String lane) {
        Supplier<Mono<Void>> next;
        synchronized (lanes) {
            Deque<Supplier<Mono<Void>>> pending = lanes.get(lane);
            next = pending == null ? null : pending.pollFirst();
            if (next == null) {
                lanes.remove(lane);
                return;
            }
        }
        run(lane, next);
    }

    private static String shortKey(String key) {
        return key.length() > 16 ? key.substring(0, 16) : key;
    }
}
