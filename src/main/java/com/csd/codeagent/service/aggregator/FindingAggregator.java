package com.csd.codeagent.service.aggregator;

import com.csd.codeagent.model.AggregatedResult;
import com.csd.codeagent.model.AnalysisResult;
import com.csd.codeagent.model.Confidence;
import com.csd.codeagent.model.Finding;
import com.csd.codeagent.model.FindingSummary;
import com.csd.codeagent.model.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges per-backend results into one consensus result.
 *
 * <p>Two findings describe the same issue when their categories match after
 * normalization, they point at the same line (or both at none), and their titles reach
 * the similarity threshold. A finding joins the earliest group it matches; input order
 * is result order, then finding order. The merge does no I/O and assigns no ids or
 * timestamps, so equal input always gives equal output.
 *
 * <p>Only backend ids become finding sources, backends and individual analyses.
 * Findings from auxiliary sources are merged like any other but corroborate nothing.
 */
@Slf4j
public class FindingAggregator {

    public static final double DEFAULT_THRESHOLD = 0.8;

    private final double similarityThreshold;

    public FindingAggregator() {
        this(DEFAULT_THRESHOLD);
    }

    public FindingAggregator(double similarityThreshold) {
        if (similarityThreshold <= 0 || similarityThreshold > 1) {
            throw new IllegalArgumentException("Similarity threshold must be in (0, 1]: " + similarityThreshold);
        }
        this.similarityThreshold = similarityThreshold;
    }

    public AggregatedResult merge(List<AnalysisResult> results, MergeOptions options) {
        MergeOptions opts = options != null ? options : MergeOptions.defaults();

        List<Group> groups = new ArrayList<>();
        for (AnalysisResult result : results) {
            if (result.getFindings() == null) continue;
            String source = opts.isBackend(result.getBackendId()) ? result.getBackendId() : null;
            for (Finding finding : result.getFindings()) {
                place(groups, finding, source);
            }
        }

        List<Finding> merged = new ArrayList<>();
        for (Group group : groups) {
            Finding finding = group.toFinding();
            if (opts.accepts(finding.getSeverity())) {
                merged.add(finding);
            }
        }
        // List.sort is stable, so equal severities keep first-seen order
        merged.sort(Comparator.comparingInt(f -> f.getSeverity().ordinal()));

        FindingSummary summary = FindingSummary.of(merged);
        summary.setConsensus(consensus(merged));

        List<AnalysisResult> backendResults = new ArrayList<>();
        List<String> backends = new ArrayList<>();
        for (AnalysisResult result : results) {
            if (!opts.isBackend(result.getBackendId())) continue;
            backendResults.add(result);
            if (!backends.contains(result.getBackendId())) backends.add(result.getBackendId());
        }

        AggregatedResult.AggregatedResultBuilder builder = AggregatedResult.builder()
                .backends(backends)
                .success(true)
                .findings(merged)
                .summary(summary)
                .overallAssessment(assess(backendResults, merged, summary))
                .recommendations(mergeRecommendations(results));

        if (opts.isIncludeIndividualAnalyses()) {
            Map<String, AnalysisResult> individual = new LinkedHashMap<>();
            for (AnalysisResult result : backendResults) {
                individual.putIfAbsent(result.getBackendId(), result);
            }
            builder.individualAnalyses(individual);
        }

        log.debug("Merged {} results into {} findings (consensus {}%)", results.size(), merged.size(), summary.getConsensus());
        return builder.build();
    }

    /**
     * Whether two findings collapse into one.
     */
    public boolean sameIssue(Finding a, Finding b) {
        if (!TitleSimilarity.normalize(a.getCategory()).equals(TitleSimilarity.normalize(b.getCategory()))) {
            return false;
        }
        if (!Objects.equals(a.getLine(), b.getLine())) {
            return false;
        }
        return TitleSimilarity.jaccard(a.getTitle(), b.getTitle()) >= similarityThreshold;
    }

    static int consensus(List<Finding> findings) {
        if (findings.isEmpty()) return 100;
        long corroborated = findings.stream().filter(f -> f.getSources().size() > 1).count();
        return (int) Math.round(100.0 * corroborated / findings.size());
    }

    static Confidence confidenceFor(int sourceCount, Severity severity) {
        if (sourceCount > 1) return Confidence.HIGH;
        return severity == Severity.CRITICAL || severity == Severity.HIGH ? Confidence.MEDIUM : Confidence.LOW;
    }

    private void place(List<Group> groups, Finding finding, String source) {
        for (Group group : groups) {
            if (sameIssue(group.first, finding)) {
                group.add(finding, source);
                return;
            }
        }
        groups.add(new Group(finding, source));
    }

    private String assess(List<AnalysisResult> results, List<Finding> findings, FindingSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Combined review from %d source(s): ", results.size()));
        if (summary.getCritical() > 0) {
            sb.append(String.format("Found %d critical issue%s that require immediate attention. ",
                    summary.getCritical(), summary.getCritical() > 1 ? "s" : ""));
        }
        if (summary.getHigh() > 0) {
            sb.append(String.format("Found %d high-severity issue%s that should be addressed. ",
                    summary.getHigh(), summary.getHigh() > 1 ? "s" : ""));
        }
        if (summary.getCritical() == 0 && summary.getHigh() == 0) {
            sb.append(findings.isEmpty()
                    ? "No issues were identified. "
                    : "Code quality is good with only minor issues identified. ");
        }
        if (results.size() == 1) {
            sb.append("Single-source result, findings are not corroborated.");
        } else if (summary.getConsensus() > 50) {
            sb.append("Sources show strong agreement on most findings.");
        }

        for (AnalysisResult result : results) {
            String assessment = result.getOverallAssessment();
            if (assessment != null && !assessment.isBlank()) {
                sb.append("\n\n**").append(result.getBackendId()).append(":** ").append(assessment.trim());
            }
        }
        return sb.toString().trim();
    }

    private List<String> mergeRecommendations(List<AnalysisResult> results) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (AnalysisResult result : results) {
            if (result.getRecommendations() == null) continue;
            for (String recommendation : result.getRecommendations()) {
                if (recommendation == null || recommendation.isBlank()) continue;
                unique.putIfAbsent(TitleSimilarity.normalize(recommendation), recommendation.trim());
            }
        }
        return new ArrayList<>(unique.values());
    }

    private static final class Group {
        private final Finding first;
        private final Set<String> sources = new LinkedHashSet<>();
        private Severity severity;

        Group(Finding first, String source) {
            this.first = first;
            this.severity = first.getSeverity();
            if (source != null) this.sources.add(source);
        }

        void add(Finding finding, String source) {
            severity = Severity.mostSevere(severity, finding.getSeverity());
            if (source != null) sources.add(source);
        }

        Finding toFinding() {
            Severity resolved = severity != null ? severity : Severity.LOW;
            return first.toBuilder()
                    .severity(resolved)
                    .sources(new ArrayList<>(sources))
                    .confidence(confidenceFor(sources.size(), resolved))
                    .build();
        }
    }
}
