package com.csd.codeagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnalysisStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Transitions only move forward; nothing leaves a terminal state.
     */
    public boolean canMoveTo(AnalysisStatus next) {
        if (next == null || isTerminal()) return false;
        return next.ordinal() > ordinal();
    }
}
