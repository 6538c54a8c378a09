package com.csd.codeagent.service.scanner;

import com.csd.codeagent.model.SecretCategory;
import com.csd.codeagent.model.Severity;
import lombok.Builder;
import lombok.Getter;

import java.util.regex.Pattern;

@Getter
@Builder
public class SecretPattern {

    /**
     * Config switch a pattern belongs to. {@code ALWAYS} patterns cannot be turned off.
     */
    public enum Group {
        AWS,
        GCP,
        AZURE,
        GITHUB,
        GENERIC,
        DATABASE,
        PRIVATE_KEYS,
        ALWAYS
    }

    private final String name;
    private final Pattern pattern;
    private final Severity severity;
    private final SecretCategory category;
    private final String description;
    private final String recommendation;
    private final Group group;

    /**
     * Keyword patterns like "password = '...'" need a long enough match to count.
     */
    public boolean isGeneric() {
        return name.startsWith("Generic");
    }
}
