package com.csd.codeagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextWarning {
    private String code;     // WARN_MISSING_SCOPE, ...
    private String field;
    private String message;
}
