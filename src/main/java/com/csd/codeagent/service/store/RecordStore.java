package com.csd.codeagent.service.store;

import reactor.core.publisher.Mono;

/**
 * Optional key/record persistence behind the cache and the status tracker.
 * Records are opaque JSON strings grouped by namespace.
 */
public interface RecordStore {

    Mono<Void> upsert(String namespace, String key, String json);

    /**
     * Emits the stored record, or completes empty when there is none.
     */
    Mono<String> find(String namespace, String key);

    Mono<Void> delete(String namespace, String key);
}
