package com.csd.codeagent.exception;

public class ScanException extends AgentException {

    public ScanException(String message, Throwable cause) {
        super(ErrorCode.SCAN_ERROR, message, cause);
    }
}
