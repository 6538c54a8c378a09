package com.csd.codeagent.model;

import java.util.Locale;

public enum ExportFormat {
    CSV,
    XLSX,
    JSON;

    public static ExportFormat fromValue(String value) {
        return ExportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
