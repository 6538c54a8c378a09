package com.csd.codeagent.service.cache;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CacheLookup<T> {
    private final T value;
    private final boolean fromCache;
    private final String key; // null when caching is disabled
}
