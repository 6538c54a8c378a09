package com.csd.codeagent.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * What {@code analyze} hands back: rendered markdown for display and the typed result.
 */
@Data
@Builder
public class AnalysisResponse {
    private String analysisId;
    private String text;
    private AggregatedResult result;
    private List<ContextWarning> warnings;
}
