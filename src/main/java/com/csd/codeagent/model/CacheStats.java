package com.csd.codeagent.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
public class CacheStats {
    private long hits;
    private long misses;
    private double hitRate;
    private int totalEntries;
    private int maxSize;
    private long evictions;
    private long totalEntryHits;
    private Map<String, Integer> byTag;
    private Instant oldestEntry;
    private Instant newestEntry;
}
