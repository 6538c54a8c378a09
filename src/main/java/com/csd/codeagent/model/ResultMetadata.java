package com.csd.codeagent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResultMetadata {
    private boolean fromCache;
    private String cacheKey;     // short form, 16 hex chars
    private Instant timestamp;
    private long durationMs;
    private String templateUsed;
    private AnalysisContext resolvedContext;
}
