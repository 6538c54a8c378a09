package com.csd.codeagent.service;

import com.csd.codeagent.model.AnalysisContext;
import com.csd.codeagent.model.ContextWarning;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hints about context the caller left out. Codes are stable so they can be suppressed
 * in configuration.
 */
public class ContextWarnings {

    public static final String MISSING_SCOPE = "WARN_MISSING_SCOPE";
    public static final String MISSING_THREAT_MODEL = "WARN_MISSING_THREAT_MODEL";
    public static final String MISSING_PLATFORM = "WARN_MISSING_PLATFORM";
    public static final String MISSING_LANGUAGE = "WARN_MISSING_LANGUAGE";
    public static final String PARTIAL_CODE = "WARN_PARTIAL_CODE";

    private final Set<String> suppressions;

    public ContextWarnings(List<String> suppressions) {
        this.suppressions = suppressions == null ? Set.of() : new HashSet<>(suppressions);
    }

    public List<ContextWarning> check(AnalysisContext context) {
        List<ContextWarning> warnings = new ArrayList<>();
        if (context.getScope() == null) {
            add(warnings, MISSING_SCOPE, "scope", "Code scope not specified. Treating as partial code.");
        }
        if (context.getThreatModel() == null) {
            add(warnings, MISSING_THREAT_MODEL, "threatModel",
                    "Threat model not specified. Using conservative severity assessment.");
        }
        if (context.getPlatform() == null) {
            add(warnings, MISSING_PLATFORM, "platform",
                    "Platform not specified. Analyzing for cross-platform compatibility.");
        }
        if (context.getLanguage() == null) {
            add(warnings, MISSING_LANGUAGE, "language",
                    "Programming language not specified. Auto-detection may be less accurate.");
        }
        if ("partial".equals(context.getScope())) {
            add(warnings, PARTIAL_CODE, "scope", "Analyzing partial code. Some findings may be false positives.");
        }
        return warnings;
    }

    private void add(List<ContextWarning> warnings, String code, String field, String message) {
        if (suppressions.contains(code) || suppressions.contains(code.substring("WARN_".length()))) {
            return;
        }
        warnings.add(new ContextWarning(code, field, message));
    }
}
