package com.csd.codeagent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Finding severity. Declaration order is the ranking: CRITICAL is the most severe.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isMoreSevereThan(Severity other) {
        return other == null || ordinal() < other.ordinal();
    }

    public static Severity mostSevere(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.ordinal() <= b.ordinal() ? a : b;
    }

    /**
     * Lenient parse used for backend output. "info" and unknown values collapse to LOW.
     */
    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null) return LOW;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "critical":
                return CRITICAL;
            case "high":
                return HIGH;
            case "medium":
            case "moderate":
                return MEDIUM;
            default:
                return LOW;
        }
    }
}
