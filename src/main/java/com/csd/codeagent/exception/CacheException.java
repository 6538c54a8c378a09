package com.csd.codeagent.exception;

/**
 * Advisory only: logged by the cache and never surfaced to callers.
 */
public class CacheException extends AgentException {

    public CacheException(String message, Throwable cause) {
        super(ErrorCode.CACHE_ERROR, message, cause);
    }
}
