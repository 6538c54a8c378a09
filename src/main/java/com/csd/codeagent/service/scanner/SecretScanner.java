package com.csd.codeagent.service.scanner;

import com.csd.codeagent.config.AgentProperties;
import com.csd.codeagent.model.Finding;
import com.csd.codeagent.model.SecretCategory;
import com.csd.codeagent.model.SecretFinding;
import com.csd.codeagent.model.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Line-oriented regex scan for hardcoded credentials. Runs locally, never calls a
 * backend, and never keeps the raw secret: every reported match is masked.
 */
@Slf4j
public class SecretScanner {

    private static final List<String> PLACEHOLDERS = List.of(
            "your_", "example", "placeholder", "xxx", "yyy", "zzz", "test", "dummy", "sample",
            "changeme", "replace", "<your", "{your", "${", "process.env", "env.", "config.", "settings.");

    private static final List<String> SENSITIVE_CONTEXT = List.of("heroku", "api", "key", "token", "secret", "auth");

    private static final int MIN_GENERIC_MATCH = 16;

    private final AgentProperties.SecretScanning config;
    private final List<SecretPattern> patterns;
    private final List<Pattern> excludes;

    public SecretScanner(AgentProperties.SecretScanning config) {
        this.config = config;
        this.patterns = initializePatterns(config);
        this.excludes = initializeExcludes(config.getExcludePatterns());
        log.debug("Secret scanner initialized with {} patterns", patterns.size());
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    public int patternCount() {
        return patterns.size();
    }

    public Set<SecretCategory> categories() {
        Set<SecretCategory> categories = new LinkedHashSet<>();
        patterns.forEach(p -> categories.add(p.getCategory()));
        return categories;
    }

    /**
     * Scans {@code code} and returns one finding per surviving match, grouped by pattern
     * and ordered by line within a pattern. Excluded files and a disabled scanner give an
     * empty list.
     */
    public List<SecretFinding> scan(String code, String fileName) {
        if (!config.isEnabled() || code == null || code.isEmpty()) {
            return List.of();
        }
        if (fileName != null && isExcluded(fileName)) {
            log.debug("File {} excluded from secret scanning", fileName);
            return List.of();
        }

        String scanCode = code;
        if (scanCode.length() > config.getMaxScanLength()) {
            scanCode = scanCode.substring(0, config.getMaxScanLength());
            log.debug("Secret scan input truncated from {} to {} chars", code.length(), config.getMaxScanLength());
        }
        String[] lines = scanCode.split("\n", -1);

        List<SecretFinding> findings = new ArrayList<>();
        for (SecretPattern pattern : patterns) {
            try {
                scanWith(pattern, lines, findings);
            } catch (RuntimeException | StackOverflowError e) {
                log.warn("Error scanning with pattern {}, skipping: {}", pattern.getName(), e.toString());
            }
        }

        log.info("Secret scanning completed: {} findings{}", findings.size(),
                fileName != null ? " in " + fileName : "");
        return findings;
    }

    /**
     * Converts secret hits into regular analysis findings so they can be merged with
     * backend output.
     */
    public List<Finding> toFindings(List<SecretFinding> secretFindings) {
        List<Finding> findings = new ArrayList<>();
        if (secretFindings == null) {
            return findings;
        }
        for (SecretFinding secret : secretFindings) {
            if (secret == null || secret.getSecretType() == null || secret.getSeverity() == null) {
                log.warn("Secret finding missing required fields, skipping");
                continue;
            }
            String description = (secret.getDescription() != null ? secret.getDescription() : "Secret detected")
                    + "\n\nDetected value: `" + (secret.getMatch() != null ? secret.getMatch() : "***")
                    + "` at column " + Math.max(1, secret.getColumn());
            findings.add(Finding.builder()
                    .title("Hardcoded " + secret.getSecretType())
                    .category("security")
                    .severity(secret.getSeverity())
                    .line(secret.getLine())
                    .description(description)
                    .suggestion(secret.getRecommendation() != null
                            ? secret.getRecommendation()
                            : "Remove hardcoded secret and use environment variables")
                    .build());
        }
        return findings;
    }

    static String mask(String secret) {
        int length = secret.length();
        if (length <= 4) {
            return "***";
        }
        if (length <= 12) {
            return secret.substring(0, 1) + "***[" + length + " chars]";
        }
        return secret.substring(0, 2) + "***[" + length + " chars]";
    }

    private void scanWith(SecretPattern pattern, String[] lines, List<SecretFinding> findings) {
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isEmpty()) continue;
            if (line.length() > config.getMaxLineLength()) {
                line = line.substring(0, config.getMaxLineLength());
            }
            Matcher matcher = pattern.getPattern().matcher(line);
            while (matcher.find()) {
                String match = matcher.group();
                if (match.isEmpty() || isFalsePositive(match, line, pattern)) {
                    continue;
                }
                findings.add(SecretFinding.builder()
                        .secretType(pattern.getName())
                        .category(pattern.getCategory())
                        .severity(pattern.getSeverity())
                        .line(i + 1)
                        .column(matcher.start() + 1)
                        .match(mask(match))
                        .description(pattern.getDescription())
                        .recommendation(pattern.getRecommendation())
                        .build());
            }
        }
    }

    private boolean isFalsePositive(String match, String line, SecretPattern pattern) {
        String lowerLine = line.toLowerCase(Locale.ROOT);
        String lowerMatch = match.toLowerCase(Locale.ROOT);

        for (String placeholder : PLACEHOLDERS) {
            if (lowerLine.contains(placeholder) || lowerMatch.contains(placeholder)) {
                return true;
            }
        }
        if (lowerLine.contains("env[")) {
            return true;
        }
        if (pattern.isGeneric() && match.length() < MIN_GENERIC_MATCH) {
            return true;
        }
        if ("Heroku API Key".equals(pattern.getName())) {
            return SENSITIVE_CONTEXT.stream().noneMatch(lowerLine::contains);
        }
        return false;
    }

    private boolean isExcluded(String fileName) {
        for (Pattern exclude : excludes) {
            if (exclude.matcher(fileName).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<SecretPattern> initializePatterns(AgentProperties.SecretScanning config) {
        AgentProperties.PatternGroups groups = config.getPatterns() != null
                ? config.getPatterns()
                : new AgentProperties.PatternGroups();
        List<SecretPattern> active = new ArrayList<>();
        for (SecretPattern pattern : SecretPatterns.defaults()) {
            if (isGroupEnabled(pattern.getGroup(), groups)) {
                active.add(pattern);
            }
        }
        if (config.getCustomPatterns() != null) {
            for (AgentProperties.CustomPattern custom : config.getCustomPatterns()) {
                SecretPattern compiled = compileCustom(custom);
                if (compiled != null) {
                    active.add(compiled);
                }
            }
        }
        return active;
    }

    private static boolean isGroupEnabled(SecretPattern.Group group, AgentProperties.PatternGroups groups) {
        return switch (group) {
            case AWS -> groups.isAws();
            case GCP -> groups.isGcp();
            case AZURE -> groups.isAzure();
            case GITHUB -> groups.isGithub();
            case GENERIC -> groups.isGeneric();
            case DATABASE -> groups.isDatabase();
            case PRIVATE_KEYS -> groups.isPrivateKeys();
            case ALWAYS -> true;
        };
    }

    private static SecretPattern compileCustom(AgentProperties.CustomPattern custom) {
        if (custom.getName() == null || custom.getRegex() == null) {
            log.warn("Custom secret pattern without name or regex, skipping");
            return null;
        }
        try {
            return SecretPattern.builder()
                    .name(custom.getName())
                    .pattern(Pattern.compile(custom.getRegex()))
                    .severity(Severity.fromValue(custom.getSeverity()))
                    .category(parseCategory(custom.getCategory()))
                    .group(SecretPattern.Group.ALWAYS)
                    .description(custom.getDescription() != null ? custom.getDescription() : custom.getName() + " detected")
                    .recommendation(custom.getRecommendation() != null
                            ? custom.getRecommendation()
                            : "Remove hardcoded secret and use environment variables")
                    .build();
        } catch (PatternSyntaxException e) {
            log.warn("Invalid custom secret pattern {}, skipping: {}", custom.getName(), e.getDescription());
            return null;
        }
    }

    private static SecretCategory parseCategory(String value) {
        if (value == null) return SecretCategory.OTHER;
        try {
            return SecretCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown secret category {}, using other", value);
            return SecretCategory.OTHER;
        }
    }

    private static List<Pattern> initializeExcludes(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        if (patterns == null) return compiled;
        for (String pattern : patterns) {
            try {
                compiled.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                log.warn("Invalid exclude pattern {}, skipping", pattern);
            }
        }
        return compiled;
    }
}
