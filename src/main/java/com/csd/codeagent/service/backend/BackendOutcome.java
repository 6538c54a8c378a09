package com.csd.codeagent.service.backend;

import com.csd.codeagent.model.AnalysisResult;
import com.csd.codeagent.model.ErrorInfo;
import lombok.Getter;

/**
 * Result of one backend invocation: either a usable {@link AnalysisResult} or the
 * reason it failed. Failures never travel as exceptions past this point.
 */
@Getter
public final class BackendOutcome {

    private final String backendId;
    private final AnalysisResult result;
    private final ErrorInfo error;

    private BackendOutcome(String backendId, AnalysisResult result, ErrorInfo error) {
        this.backendId = backendId;
        this.result = result;
        this.error = error;
    }

    public static BackendOutcome ok(String backendId, AnalysisResult result) {
        return new BackendOutcome(backendId, result, null);
    }

    public static BackendOutcome err(String backendId, ErrorInfo error) {
        return new BackendOutcome(backendId, null, error);
    }

    public boolean isOk() {
        return result != null;
    }

    public String describe() {
        return isOk() ? backendId + ": ok" : backendId + ": " + error.getCode() + " " + error.getMessage();
    }
}
