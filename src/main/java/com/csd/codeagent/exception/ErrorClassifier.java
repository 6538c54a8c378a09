package com.csd.codeagent.exception;

import com.csd.codeagent.model.ErrorInfo;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Turns any throwable into the stable code/message pair stored on failed status entries.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    public static ErrorInfo classify(Throwable error) {
        if (error instanceof AgentException) {
            AgentException agentException = (AgentException) error;
            return ErrorInfo.builder()
                    .code(agentException.getCode().name())
                    .message(agentException.getMessage())
                    .build();
        }
        if (error instanceof TimeoutException) {
            return info(ErrorCode.BACKEND_TIMEOUT, messageOf(error));
        }
        String message = messageOf(error);
        if (message.toLowerCase(Locale.ROOT).contains("timeout")) {
            return info(ErrorCode.BACKEND_TIMEOUT, message);
        }
        return info(ErrorCode.UNKNOWN_ERROR, message);
    }

    public static boolean isRetryable(Throwable error) {
        if (error instanceof BackendException) {
            return ((BackendException) error).isRetryable();
        }
        return error instanceof TimeoutException || error instanceof java.io.IOException;
    }

    private static ErrorInfo info(ErrorCode code, String message) {
        return ErrorInfo.builder().code(code.name()).message(message).build();
    }

    private static String messageOf(Throwable error) {
        if (error == null) return "An unknown error occurred";
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
