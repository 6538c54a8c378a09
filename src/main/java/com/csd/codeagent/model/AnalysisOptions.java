package com.csd.codeagent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisOptions {
    private String severity;               // all, high, medium
    private String template;               // default, security, performance
    private String preset;
    private Boolean autoDetect;
    private Boolean warnOnMissingContext;
    private Long timeout;                  // per-backend timeout in ms
    private Boolean parallelExecution;
    private Boolean includeIndividualAnalyses;

    public boolean parallel() {
        return parallelExecution == null || parallelExecution;
    }

    public boolean individualAnalyses() {
        return includeIndividualAnalyses != null && includeIndividualAnalyses;
    }

    public boolean autoDetectEnabled() {
        return autoDetect == null || autoDetect;
    }

    public boolean warnOnMissing() {
        return warnOnMissingContext == null || warnOnMissingContext;
    }
}
