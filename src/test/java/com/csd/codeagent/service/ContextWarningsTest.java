package com.csd.codeagent.service;

import com.csd.codeagent.model.AnalysisContext;
import com.csd.codeagent.model.ContextWarning;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ContextWarningsTest {

    private static List<String> codes(List<ContextWarning> warnings) {
        return warnings.stream().map(ContextWarning::getCode).toList();
    }

    @Test
    void emptyContextWarnsAboutEverythingMissing() {
        List<ContextWarning> warnings = new ContextWarnings(List.of()).check(new AnalysisContext());
        assertEquals(List.of(ContextWarnings.MISSING_SCOPE, ContextWarnings.MISSING_THREAT_MODEL,
                ContextWarnings.MISSING_PLATFORM, ContextWarnings.MISSING_LANGUAGE), codes(warnings));
    }

    @Test
    void partialScopeIsFlagged() {
        AnalysisContext context = AnalysisContext.builder()
                .scope("partial").threatModel("public-api").platform("web").language("typescript").build();
        assertEquals(List.of(ContextWarnings.PARTIAL_CODE), codes(new ContextWarnings(null).check(context)));
    }

    @Test
    void suppressionsMatchWithOrWithoutPrefix() {
        ContextWarnings warnings = new ContextWarnings(List.of("WARN_MISSING_PLATFORM", "MISSING_THREAT_MODEL"));
        List<String> codes = codes(warnings.check(new AnalysisContext()));
        assertEquals(List.of(ContextWarnings.MISSING_SCOPE, ContextWarnings.MISSING_LANGUAGE), codes);
    }
}
