package com.csd.codeagent.config;

import com.csd.codeagent.model.AnalysisContext;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code agent.*} in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    private String version = "0.1.0";
    private Analysis analysis = new Analysis();
    private Cache cache = new Cache();
    private Status status = new Status();
    private SecretScanning secretScanning = new SecretScanning();
    private ContextSettings context = new ContextSettings();
    private Storage storage = new Storage();
    private Map<String, Backend> backends = new LinkedHashMap<>();

    @Data
    public static class Analysis {
        private int maxPromptLength = 50_000;
        private long minTimeoutMs = 1_000;
        private long maxTimeoutMs = 600_000;
        private int maxFindings = 200;
        private int maxOutputChars = 200_000;
        private double similarityThreshold = 0.8;
        private String defaultSeverity = "all";
        private String defaultTemplate = "default";
        private List<String> warningSuppressions = new ArrayList<>();
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        private int maxSize = 1000;
        private Duration touchInterval = Duration.ofSeconds(30);
        private Duration cleanupInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Status {
        private Duration ttl = Duration.ofHours(1);
        private Duration sweepInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class SecretScanning {
        private boolean enabled = true;
        private int maxScanLength = 200_000;
        private int maxLineLength = 10_000;
        private int maxCodeLength = 100_000;
        private PatternGroups patterns = new PatternGroups();
        private List<String> excludePatterns = new ArrayList<>(List.of(
                ".*\\.test\\.(ts|js|tsx|jsx)$",
                ".*\\.spec\\.(ts|js|tsx|jsx)$",
                ".*__tests__.*",
                ".*\\.mock\\.(ts|js)$",
                ".*Test\\.java$"));
        private List<CustomPattern> customPatterns = new ArrayList<>();
    }

    @Data
    public static class PatternGroups {
        private boolean aws = true;
        private boolean gcp = true;
        private boolean azure = true;
        private boolean github = true;
        private boolean generic = true;
        private boolean database = true;
        private boolean privateKeys = true;
    }

    @Data
    public static class CustomPattern {
        private String name;
        private String regex;
        private String severity = "high";
        private String category = "other";
        private String description;
        private String recommendation;
    }

    @Data
    public static class ContextSettings {
        private AnalysisContext defaults = new AnalysisContext();
        private Map<String, AnalysisContext> presets = new LinkedHashMap<>();
        private String activePreset;
        private boolean autoDetect = true;
    }

    @Data
    public static class Storage {
        private String type = "none"; // none | file
        private String directory = "workdir/store";
    }

    @Data
    public static class Backend {
        private boolean enabled = true;
        private String baseUrl;
        private String path = "/chat/completions";
        private String apiKey;
        private String model;
        private int maxConcurrent = 1;
        private Duration interval;     // optional rate window
        private int intervalCap;       // starts allowed per window, 0 = unlimited
        private Duration timeout = Duration.ofMinutes(5);
        private int retryAttempts = 2;
        private Duration retryDelay = Duration.ofSeconds(1);
        private double temperature = 0.2;
        private int maxTokens = 4000;
    }
}
