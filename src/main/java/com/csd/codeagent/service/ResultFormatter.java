package com.csd.codeagent.service;

import com.csd.codeagent.model.AggregatedResult;
import com.csd.codeagent.model.ContextWarning;
import com.csd.codeagent.model.Finding;
import com.csd.codeagent.model.FindingSummary;
import com.csd.codeagent.model.SecretFinding;
import com.csd.codeagent.model.SecretScanReport;
import com.csd.codeagent.model.Severity;
import com.csd.codeagent.model.StatusEntry;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders results as markdown for display.
 */
public class ResultFormatter {

    private final int maxFindings;
    private final int maxOutputChars;

    public ResultFormatter(int maxFindings, int maxOutputChars) {
        this.maxFindings = maxFindings;
        this.maxOutputChars = maxOutputChars;
    }

    /**
     * Format a merged analysis. The output is never empty: the assessment section and the
     * footer are always present.
     */
    public String formatAnalysis(String analysisId, AggregatedResult result, List<ContextWarning> warnings) {
        StringBuilder sb = new StringBuilder();

        sb.append("## Overall Assessment\n\n");
        String assessment = result.getOverallAssessment();
        sb.append(assessment == null || assessment.isBlank() ? "No assessment was provided." : assessment).append("\n\n");

        FindingSummary summary = result.getSummary();
        if (summary != null && summary.getTotalFindings() > 0) {
            sb.append("## Summary\n\n");
            appendSeverityCounts(sb, "Total Issues", summary);
            if (summary.getConsensus() != null) {
                sb.append(String.format("- **Consensus:** %d%%\n", summary.getConsensus()));
            }
            sb.append("\n");
        }

        List<Finding> findings = result.getFindings();
        if (findings != null && !findings.isEmpty()) {
            sb.append("## Findings\n\n");
            int limit = maxFindings > 0 ? Math.min(maxFindings, findings.size()) : findings.size();
            for (int i = 0; i < limit; i++) {
                appendFinding(sb, i + 1, findings.get(i));
            }
            if (findings.size() > limit) {
                sb.append(String.format("*Showing %d of %d findings.*\n\n", limit, findings.size()));
            }
        }

        List<String> recommendations = result.getRecommendations();
        if (recommendations != null && !recommendations.isEmpty()) {
            sb.append("## Recommendations\n\n");
            for (String recommendation : recommendations) {
                sb.append("- ").append(recommendation).append("\n");
            }
            sb.append("\n");
        }

        if (warnings != null && !warnings.isEmpty()) {
            sb.append("## Context Warnings\n\n");
            for (ContextWarning warning : warnings) {
                sb.append(String.format("- `%s` %s\n", warning.getCode(), warning.getMessage()));
            }
            sb.append("\n");
        }

        sb.append("---\n");
        String sources = result.getBackends() == null ? "" : String.join(", ", result.getBackends());
        sb.append(String.format("*Analysis ID: %s | Sources: %s", analysisId, sources));
        if (result.getMetadata() != null && result.getMetadata().isFromCache()) {
            sb.append(" | cached");
        }
        sb.append("*\n");

        return truncate(sb.toString());
    }

    public String formatSecretScan(SecretScanReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Secret Scan Results\n\n");

        FindingSummary summary = report.getSummary();
        if (summary == null || summary.getTotalFindings() == 0) {
            sb.append("No secrets detected in the code.\n\n");
        } else {
            sb.append("## Summary\n\n");
            appendSeverityCounts(sb, "Total Secrets Found", summary);
            sb.append("\n");

            Map<String, Integer> byCategory = report.getByCategory();
            if (byCategory != null && !byCategory.isEmpty()) {
                sb.append("### By Category\n\n");
                byCategory.forEach((category, count) ->
                        sb.append(String.format("- **%s:** %d\n", category.replace('_', ' '), count)));
                sb.append("\n");
            }

            sb.append("## Findings\n\n");
            int index = 1;
            for (SecretFinding finding : report.getFindings()) {
                sb.append(String.format("### %d. %s Hardcoded %s\n", index++, emoji(finding.getSeverity()), finding.getSecretType()));
                sb.append(String.format("**Severity:** %s | **Line:** %d | **Column:** %d\n\n",
                        label(finding.getSeverity()), finding.getLine(), finding.getColumn()));
                sb.append(finding.getDescription()).append(" (`").append(finding.getMatch()).append("`)\n\n");
                sb.append("**Recommendation:** ").append(finding.getRecommendation()).append("\n\n");
            }
        }

        sb.append("---\n");
        sb.append(String.format("*Scan ID: %s | Patterns: %d | Duration: %dms*\n",
                report.getScanId(), report.getPatternsUsed(), report.getDurationMs()));
        return truncate(sb.toString());
    }

    public String formatStatus(StatusEntry entry) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("**Analysis %s** (%s): %s\n", entry.getId(), entry.getTag(), entry.getStatus().value()));
        if (entry.getError() != null) {
            sb.append(String.format("- Error: %s: %s\n", entry.getError().getCode(), entry.getError().getMessage()));
        }
        if (entry.getResult() != null && entry.getResult().getSummary() != null) {
            sb.append(String.format("- Findings: %d\n", entry.getResult().getSummary().getTotalFindings()));
        }
        return sb.toString();
    }

    private void appendFinding(StringBuilder sb, int index, Finding finding) {
        sb.append(String.format("### %d. %s %s\n", index, emoji(finding.getSeverity()), finding.getTitle()));
        sb.append(String.format("**Severity:** %s | **Type:** %s", label(finding.getSeverity()), finding.getCategory()));
        if (finding.getConfidence() != null) {
            sb.append(" | **Confidence:** ").append(finding.getConfidence().value());
        }
        sb.append("\n");
        if (finding.getLine() != null) {
            sb.append("**Line:** ").append(finding.getLine()).append("\n");
        }
        if (finding.getSources() != null && !finding.getSources().isEmpty()) {
            sb.append("**Reported by:** ").append(String.join(", ", finding.getSources())).append("\n");
        }
        sb.append("\n**Description:**\n").append(finding.getDescription()).append("\n\n");
        if (finding.getSuggestion() != null && !finding.getSuggestion().isBlank()) {
            sb.append("**Suggestion:**\n").append(finding.getSuggestion()).append("\n\n");
        }
    }

    private void appendSeverityCounts(StringBuilder sb, String totalLabel, FindingSummary summary) {
        sb.append(String.format("- **%s:** %d\n", totalLabel, summary.getTotalFindings()));
        for (Severity severity : Severity.values()) {
            int count = summary.count(severity);
            if (count > 0) {
                String name = severity.value();
                sb.append(String.format("- **%s:** %d\n", Character.toUpperCase(name.charAt(0)) + name.substring(1), count));
            }
        }
    }

    private String truncate(String output) {
        if (maxOutputChars > 0 && output.length() > maxOutputChars) {
            return output.substring(0, maxOutputChars) + "\n\n...[truncated]";
        }
        return output;
    }

    private static String label(Severity severity) {
        return severity == null ? "UNKNOWN" : severity.name().toUpperCase(Locale.ROOT);
    }

    private static String emoji(Severity severity) {
        if (severity == null) return "⚪";
        return switch (severity) {
            case CRITICAL -> "🔴";
            case HIGH -> "🟠";
            case MEDIUM -> "🟡";
            case LOW -> "🔵";
        };
    }
}
