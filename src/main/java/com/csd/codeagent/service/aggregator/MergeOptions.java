package com.csd.codeagent.service.aggregator;

import com.csd.codeagent.model.Severity;
import lombok.Builder;
import lombok.Data;

import java.util.Locale;
import java.util.Set;

@Data
@Builder
public class MergeOptions {

    @Builder.Default
    private String severity = "all";   // all, high, medium
    private boolean includeIndividualAnalyses;

    /**
     * Result sources that are not analysis backends, such as the local secret scanner.
     * Their findings are merged but never count as corroboration.
     */
    @Builder.Default
    private Set<String> auxiliarySources = Set.of();

    public static MergeOptions defaults() {
        return MergeOptions.builder().build();
    }

    public boolean isBackend(String source) {
        return source != null && (auxiliarySources == null || !auxiliarySources.contains(source));
    }

    /**
     * Whether a merged finding of the given severity survives the severity filter.
     */
    public boolean accepts(Severity value) {
        String filter = severity == null ? "all" : severity.toLowerCase(Locale.ROOT);
        Severity effective = value == null ? Severity.LOW : value;
        return switch (filter) {
            case "high" -> effective == Severity.CRITICAL || effective == Severity.HIGH;
            case "medium" -> effective != Severity.LOW;
            default -> true;
        };
    }
}
