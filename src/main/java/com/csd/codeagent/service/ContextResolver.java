package com.csd.codeagent.service;

import com.csd.codeagent.config.AgentProperties;
import com.csd.codeagent.model.AnalysisContext;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Layers context sources into the context a request is analyzed with. Later layers win
 * field by field and null fields never override:
 * configured defaults, active preset, auto-detected values, request preset, request fields.
 */
@Slf4j
public class ContextResolver {

    private final AgentProperties.ContextSettings settings;

    public ContextResolver(AgentProperties.ContextSettings settings) {
        this.settings = settings;
    }

    public AnalysisContext resolve(AnalysisContext request, String requestPreset, AnalysisContext detected) {
        AnalysisContext result = settings.getDefaults() != null
                ? settings.getDefaults().overlay(null)
                : new AnalysisContext();

        result = applyPreset(result, settings.getActivePreset());
        if (detected != null) {
            result = result.overlay(detected);
        }
        result = applyPreset(result, requestPreset);
        if (request != null) {
            result = result.overlay(request);
        }
        return result;
    }

    public boolean hasPreset(String name) {
        return name != null && presets().containsKey(name);
    }

    private AnalysisContext applyPreset(AnalysisContext base, String name) {
        if (name == null || name.isBlank()) return base;
        AnalysisContext preset = presets().get(name);
        if (preset == null) {
            log.warn("Unknown context preset {}, ignoring", name);
            return base;
        }
        return base.overlay(preset);
    }

    private Map<String, AnalysisContext> presets() {
        return settings.getPresets() != null ? settings.getPresets() : Map.of();
    }
}
