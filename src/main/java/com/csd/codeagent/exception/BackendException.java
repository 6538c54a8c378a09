package com.csd.codeagent.exception;

import lombok.Getter;

/**
 * One backend failed. Recovered by the orchestrator as long as another backend succeeds.
 */
@Getter
public class BackendException extends AgentException {

    private final String backendId;
    private final boolean retryable;

    public BackendException(String backendId, String message, boolean retryable, Throwable cause) {
        super(ErrorCode.BACKEND_ERROR, message, cause);
        this.backendId = backendId;
        this.retryable = retryable;
    }

    public BackendException(ErrorCode code, String backendId, String message, Throwable cause) {
        super(code, message, cause);
        this.backendId = backendId;
        this.retryable = code == ErrorCode.BACKEND_TIMEOUT;
    }
}
