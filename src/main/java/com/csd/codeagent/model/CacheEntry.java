package com.csd.codeagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {
    private String key;
    private String tag;
    private String value;        // serialized JSON
    private long hitCount;
    private Instant createdAt;
    private Instant lastAccessedAt;
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
