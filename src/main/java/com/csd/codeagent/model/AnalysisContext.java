package com.csd.codeagent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What the caller knows about the code under analysis. Every field is optional.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisContext {
    private String language;
    private String framework;
    private String platform;     // windows, unix, cross-platform, web, mobile
    private String projectType;  // web-app, cli-tool, library, api-service, ...
    private String threatModel;  // local-user-tool, internal-service, multi-tenant, public-api
    private String scope;        // full, partial, snippet
    private List<String> focus;  // security, performance, style, bugs
    private String fileName;
    private String preset;

    /**
     * Returns a copy where every non-null field of {@code override} replaces the value
     * of this context. The preset reference is never carried over.
     */
    public AnalysisContext overlay(AnalysisContext override) {
        if (override == null) {
            return toBuilder().preset(null).build();
        }
        return AnalysisContext.builder()
                .language(pick(override.language, language))
                .framework(pick(override.framework, framework))
                .platform(pick(override.platform, platform))
                .projectType(pick(override.projectType, projectType))
                .threatModel(pick(override.threatModel, threatModel))
                .scope(pick(override.scope, scope))
                .focus(override.focus != null && !override.focus.isEmpty() ? override.focus : focus)
                .fileName(pick(override.fileName, fileName))
                .build();
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
