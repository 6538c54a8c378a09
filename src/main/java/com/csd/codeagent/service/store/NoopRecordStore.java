package com.csd.codeagent.service.store;

import reactor.core.publisher.Mono;

/**
 * Used when {@code agent.storage.type=none}: nothing is kept beyond process memory.
 */
public class NoopRecordStore implements RecordStore {

    @Override
    public Mono<Void> upsert(String namespace, String key, String json) {
        return Mono.empty();
    }

    @Override
    public Mono<String> find(String namespace, String key) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> delete(String namespace, String key) {
        return Mono.empty();
    }
}
