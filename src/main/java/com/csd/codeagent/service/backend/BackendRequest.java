package com.csd.codeagent.service.backend;

import com.csd.codeagent.model.AnalysisContext;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class BackendRequest {
    private String analysisId;
    private String code;           // sanitized user prompt
    private String renderedPrompt; // template output actually sent
    private String template;
    private AnalysisContext context;
}
