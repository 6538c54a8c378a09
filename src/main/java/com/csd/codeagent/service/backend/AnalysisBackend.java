package com.csd.codeagent.service.backend;

import com.csd.codeagent.model.AnalysisResult;
import reactor.core.publisher.Mono;

/**
 * An external analysis capability. Implementations signal failures through the returned
 * {@link Mono}; the caller treats them as recoverable per-backend failures.
 */
public interface AnalysisBackend {

    String id();

    /**
     * Model or engine name. Part of the cache fingerprint, so changing it invalidates
     * earlier results.
     */
    String model();

    Mono<AnalysisResult> analyze(BackendRequest request);
}
