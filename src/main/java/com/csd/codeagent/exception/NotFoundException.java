package com.csd.codeagent.exception;

public class NotFoundException extends AgentException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
