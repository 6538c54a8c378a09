package com.csd.codeagent.exception;

import lombok.Getter;

/**
 * Base of every failure the agent raises on purpose. The code is stable and is what
 * callers see through {@code getStatus}.
 */
@Getter
public class AgentException extends RuntimeException {

    private final ErrorCode code;

    public AgentException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AgentException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
