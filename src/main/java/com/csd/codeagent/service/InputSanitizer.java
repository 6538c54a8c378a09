package com.csd.codeagent.service;

import com.csd.codeagent.config.AgentProperties;
import com.csd.codeagent.exception.ValidationException;
import com.csd.codeagent.model.AnalysisContext;
import com.csd.codeagent.model.AnalysisOptions;
import com.csd.codeagent.model.AnalysisRequest;
import com.csd.codeagent.service.backend.PromptBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates an analyze request and normalizes it before any work is queued. Every
 * correction is logged and reported back; input that cannot be corrected is rejected.
 */
@Slf4j
public class InputSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Set<String> SEVERITY_FILTERS = Set.of("all", "high", "medium");

    private final AgentProperties.Analysis settings;
    private final PromptBuilder promptBuilder;

    public InputSanitizer(AgentProperties.Analysis settings, PromptBuilder promptBuilder) {
        this.settings = settings;
        this.promptBuilder = promptBuilder;
    }

    /**
     * @param enabledBackends ids of the enabled backends, in configuration order
     */
    public SanitizedRequest sanitize(AnalysisRequest request, List<String> enabledBackends) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        List<String> corrections = new ArrayList<>();

        String prompt = cleanPrompt(request.getPrompt(), corrections);
        List<String> backends = selectBackends(request.getBackends(), enabledBackends);
        AnalysisContext context = normalizeContext(request.getContext(), corrections);
        AnalysisOptions options = normalizeOptions(request.getOptions(), corrections);

        if (!corrections.isEmpty()) {
            log.warn("Input sanitization performed: {}", corrections);
        }
        return SanitizedRequest.builder()
                .prompt(prompt)
                .backends(backends)
                .context(context)
                .options(options)
                .corrections(corrections)
                .build();
    }

    private String cleanPrompt(String prompt, List<String> corrections) {
        if (prompt == null || prompt.isBlank()) {
            throw new ValidationException("Prompt cannot be empty");
        }
        String cleaned = prompt;
        String trimmed = cleaned.trim();
        if (!trimmed.equals(cleaned)) {
            cleaned = trimmed;
            corrections.add("Removed leading/trailing whitespace from prompt");
        }
        String withoutControls = CONTROL_CHARS.matcher(cleaned).replaceAll("");
        if (!withoutControls.equals(cleaned)) {
            cleaned = withoutControls;
            corrections.add("Removed control characters from prompt");
        }
        if (cleaned.isBlank()) {
            throw new ValidationException("Prompt cannot be empty");
        }
        if (cleaned.length() > settings.getMaxPromptLength()) {
            throw new ValidationException(String.format("Prompt exceeds maximum length of %,d characters (got %,d)",
                    settings.getMaxPromptLength(), cleaned.length()));
        }
        return cleaned;
    }

    private List<String> selectBackends(List<String> requested, List<String> enabled) {
        if (enabled == null || enabled.isEmpty()) {
            throw new ValidationException("No analysis backends are enabled");
        }
        if (requested == null || requested.isEmpty()) {
            return List.copyOf(enabled);
        }
        Set<String> selected = new LinkedHashSet<>();
        for (String id : requested) {
            String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
            if (!enabled.contains(normalized)) {
                throw new ValidationException("Unknown or disabled backend: " + id + " (available: " + enabled + ")");
            }
            selected.add(normalized);
        }
        return List.copyOf(selected);
    }

    private AnalysisContext normalizeContext(AnalysisContext context, List<String> corrections) {
        if (context == null) return null;
        List<String> focus = null;
        if (context.getFocus() != null) {
            Set<String> unique = new LinkedHashSet<>();
            for (String item : context.getFocus()) {
                if (item != null && !item.isBlank()) unique.add(item.trim().toLowerCase(Locale.ROOT));
            }
            if (unique.size() != context.getFocus().size()) {
                corrections.add("Removed duplicate or empty focus entries");
            }
            focus = new ArrayList<>(unique);
        }
        return AnalysisContext.builder()
                .language(lower(context.getLanguage()))
                .framework(lower(context.getFramework()))
                .platform(lower(context.getPlatform()))
                .projectType(lower(context.getProjectType()))
                .threatModel(lower(context.getThreatModel()))
                .scope(lower(context.getScope()))
                .focus(focus)
                .fileName(blankToNull(context.getFileName()))
                .preset(blankToNull(context.getPreset()))
                .build();
    }

    private AnalysisOptions normalizeOptions(AnalysisOptions options, List<String> corrections) {
        AnalysisOptions source = options != null ? options : new AnalysisOptions();

        String severity = lower(source.getSeverity());
        if (severity == null) {
            severity = settings.getDefaultSeverity();
        } else if (!SEVERITY_FILTERS.contains(severity)) {
            corrections.add("Unknown severity filter '" + source.getSeverity() + "', using " + settings.getDefaultSeverity());
            severity = settings.getDefaultSeverity();
        }

        String template = lower(source.getTemplate());
        if (template == null) {
            template = settings.getDefaultTemplate();
        } else if (!promptBuilder.isKnown(template)) {
            corrections.add("Unknown template '" + source.getTemplate() + "', using " + settings.getDefaultTemplate());
            template = settings.getDefaultTemplate();
        }

        Long timeout = source.getTimeout();
        if (timeout != null) {
            long clamped = Math.max(settings.getMinTimeoutMs(), Math.min(settings.getMaxTimeoutMs(), timeout));
            if (clamped != timeout) {
                corrections.add("Clamped timeout " + timeout + "ms to " + clamped + "ms");
                timeout = clamped;
            }
        }

        return AnalysisOptions.builder()
                .severity(severity)
                .template(template)
                .preset(blankToNull(source.getPreset()))
                .autoDetect(source.autoDetectEnabled())
                .warnOnMissingContext(source.warnOnMissing())
                .timeout(timeout)
                .parallelExecution(source.parallel())
                .includeIndividualAnalyses(source.individualAnalyses())
                .build();
    }

    private static String lower(String value) {
        String trimmed = blankToNull(value);
        return trimmed == null ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
