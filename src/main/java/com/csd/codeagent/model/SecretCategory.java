package com.csd.codeagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SecretCategory {
    API_KEY,
    CREDENTIAL,
    TOKEN,
    PRIVATE_KEY,
    CONNECTION_STRING,
    OTHER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
