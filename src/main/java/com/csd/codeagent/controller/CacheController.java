package com.csd.codeagent.controller;

import com.csd.codeagent.model.CacheStats;
import com.csd.codeagent.service.cache.ResultCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/cache")
public class CacheController {

    private final ResultCache cache;

    public CacheController(ResultCache cache) {
        this.cache = cache;
    }

    @GetMapping("/stats")
    public CacheStats stats() {
        return cache.stats();
    }

    @DeleteMapping
    public Map<String, Object> clear(@RequestParam(required = false) String tag) {
        int removed = tag == null || tag.isBlank() ? cache.clear() : cache.clearByTag(tag);
        log.info("Cache cleared{}: {} entries removed", tag == null ? "" : " for tag " + tag, removed);
        return Map.of("success", true, "removed", removed);
    }

    @DeleteMapping("/{key}")
    public Map<String, Object> delete(@PathVariable String key) {
        boolean removed = cache.delete(key);
        return Map.of("success", removed);
    }
}
