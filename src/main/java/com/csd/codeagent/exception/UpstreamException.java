package com.csd.codeagent.exception;

import java.util.List;

/**
 * Every backend of a request failed.
 */
public class UpstreamException extends AgentException {

    private final List<String> backendErrors;

    public UpstreamException(String message, List<String> backendErrors) {
        super(ErrorCode.UPSTREAM_ERROR, message);
        this.backendErrors = List.copyOf(backendErrors);
    }

    public List<String> getBackendErrors() {
        return backendErrors;
    }
}
