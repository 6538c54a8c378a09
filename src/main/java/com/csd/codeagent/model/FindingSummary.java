package com.csd.codeagent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FindingSummary {
    private int totalFindings;
    private int critical;
    private int high;
    private int medium;
    private int low;
    private Integer consensus; // only set on aggregated results, 0..100

    public static FindingSummary of(Collection<Finding> findings) {
        FindingSummary summary = new FindingSummary();
        for (Finding finding : findings) {
            summary.increment(finding.getSeverity());
        }
        return summary;
    }

    public int count(Severity severity) {
        switch (severity == null ? Severity.LOW : severity) {
            case CRITICAL:
                return critical;
            case HIGH:
                return high;
            case MEDIUM:
                return medium;
            default:
                return low;
        }
    }

    private void increment(Severity severity) {
        totalFindings++;
        switch (severity == null ? Severity.LOW : severity) {
            case CRITICAL -> critical++;
            case HIGH -> high++;
            case MEDIUM -> medium++;
            default -> low++;
        }
    }
}
