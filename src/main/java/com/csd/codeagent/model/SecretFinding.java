package com.csd.codeagent.model;

import lombok.Builder;
import lombok.Data;

/**
 * One secret hit. {@code match} is always masked; the raw value is never kept.
 */
@Data
@Builder
public class SecretFinding {
    private String secretType;
    private SecretCategory category;
    private Severity severity;
    private int line;     // 1-based
    private int column;   // 1-based
    private String match;
    private String description;
    private String recommendation;
}
