package com.csd.codeagent.exception;

public enum ErrorCode {
    VALIDATION_ERROR,
    BACKEND_ERROR,
    BACKEND_TIMEOUT,
    PARSE_ERROR,
    UPSTREAM_ERROR,
    CACHE_ERROR,
    SCAN_ERROR,
    NOT_FOUND,
    UNKNOWN_ERROR
}
