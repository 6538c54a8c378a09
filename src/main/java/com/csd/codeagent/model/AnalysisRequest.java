package com.csd.codeagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Inbound analyze request. Never persisted; only its fingerprint reaches the cache.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {
    private String prompt;
    private List<String> backends; // null or empty means every enabled backend
    private AnalysisContext context;
    private AnalysisOptions options;
}
