package com.csd.codeagent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AggregatedResult {
    private String id;
    private List<String> backends;
    private boolean success;
    private List<Finding> findings;
    private FindingSummary summary;
    private String overallAssessment;
    private List<String> recommendations;
    private Map<String, AnalysisResult> individualAnalyses;
    private ResultMetadata metadata;
}
