package com.csd.codeagent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Output of a single backend call.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResult {
    private String id;
    private String backendId;
    private boolean success;
    private List<Finding> findings;
    private FindingSummary summary;
    private String overallAssessment;
    private List<String> recommendations;
    private long durationMs;
    private String rawOutput; // only when the backend answer could not be parsed
}
