package com.csd.codeagent.exception;

/**
 * Bad input, rejected before any work is queued.
 */
public class ValidationException extends AgentException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
