package com.csd.codeagent.service;

import com.csd.codeagent.model.AnalysisContext;
import com.csd.codeagent.model.AnalysisOptions;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * A request after normalization: every option has a concrete value except {@code timeout},
 * which stays null when the caller did not set one.
 */
@Getter
@Builder
public class SanitizedRequest {
    private final String prompt;
    private final List<String> backends;
    private final AnalysisContext context;
    private final AnalysisOptions options;
    private final List<String> corrections;
}
