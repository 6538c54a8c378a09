package com.csd.codeagent.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class SecretScanReport {
    private String scanId;
    private Instant timestamp;
    private FindingSummary summary;
    private Map<String, Integer> byCategory;
    private List<SecretFinding> findings;
    private int patternsUsed;
    private long durationMs;
    private String fileName;
    private String text;
}
