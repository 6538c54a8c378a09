package com.csd.codeagent.service.cache;

import com.csd.codeagent.exception.CacheException;
import com.csd.codeagent.model.AnalysisContext;
import com.csd.codeagent.model.AnalysisOptions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * SHA-256 over a canonical JSON rendering of the request. Casing, focus order and
 * backend order do not change the key.
 */
public class CacheKeyGenerator {

    private final ObjectMapper canonicalMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public String generate(CacheKeyParams params) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("prompt", params.getPrompt());
        normalized.put("tag", params.getTag());
        normalized.put("backends", sortedLower(params.getBackends()));
        normalized.put("context", normalizeContext(params.getContext()));
        normalized.put("options", normalizeOptions(params.getOptions()));
        normalized.put("service", params.getService() == null ? null : new TreeMap<>(params.getService()));
        try {
            return sha256(canonicalMapper.writeValueAsString(normalized));
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to serialize cache key parameters", e);
        }
    }

    public String generateShort(CacheKeyParams params) {
        return shortForm(generate(params));
    }

    public static String shortForm(String key) {
        return key.length() > 16 ? key.substring(0, 16) : key;
    }

    private Map<String, Object> normalizeContext(AnalysisContext context) {
        if (context == null) return null;
        Map<String, Object> map = new TreeMap<>();
        map.put("language", lower(context.getLanguage()));
        map.put("framework", lower(context.getFramework()));
        map.put("platform", lower(context.getPlatform()));
        map.put("projectType", lower(context.getProjectType()));
        map.put("threatModel", lower(context.getThreatModel()));
        map.put("scope", lower(context.getScope()));
        map.put("focus", sortedLower(context.getFocus()));
        map.put("fileName", context.getFileName());
        return map;
    }

    private Map<String, Object> normalizeOptions(AnalysisOptions options) {
        if (options == null) return null;
        Map<String, Object> map = new TreeMap<>();
        map.put("severity", lower(options.getSeverity()));
        map.put("template", lower(options.getTemplate()));
        map.put("preset", lower(options.getPreset()));
        map.put("autoDetect", options.getAutoDetect());
        map.put("warnOnMissingContext", options.getWarnOnMissingContext());
        map.put("includeIndividualAnalyses", options.getIncludeIndividualAnalyses());
        return map;
    }

    private static List<String> sortedLower(List<String> values) {
        if (values == null) return null;
        TreeSet<String> sorted = new TreeSet<>();
        for (String value : values) {
            if (value != null) sorted.add(value.trim().toLowerCase(Locale.ROOT));
        }
        return new ArrayList<>(sorted);
    }

    private static String lower(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
