package com.csd.codeagent.service.cache;

import com.csd.codeagent.model.AnalysisContext;
import com.csd.codeagent.model.AnalysisOptions;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Everything that influences an analysis result, and nothing that doesn't
 * (timeouts and execution mode are left out on purpose).
 */
@Data
@Builder
public class CacheKeyParams {
    private String prompt;
    private String tag;
    private List<String> backends;
    private AnalysisContext context;
    private AnalysisOptions options;
    private Map<String, String> service; // backend models, template, agent version
}
