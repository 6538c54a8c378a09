package com.csd.codeagent.service;

import com.csd.codeagent.config.AgentProperties;
import com.csd.codeagent.exception.ValidationException;
import com.csd.codeagent.model.AnalysisContext;
import com.csd.codeagent.model.AnalysisOptions;
import com.csd.codeagent.model.AnalysisRequest;
import com.csd.codeagent.service.backend.PromptBuilder;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InputSanitizerTest {

    private static final List<String> ENABLED = List.of("codex", "gemini");

    private final AgentProperties.Analysis settings = new AgentProperties.Analysis();
    private final InputSanitizer sanitizer = new InputSanitizer(settings, new PromptBuilder());

    private static AnalysisRequest request(String prompt) {
        return AnalysisRequest.builder().prompt(prompt).build();
    }

    @Test
    void fillsDefaults() {
        SanitizedRequest sanitized = sanitizer.sanitize(request("int x = 1;"), ENABLED);

        assertEquals("int x = 1;", sanitized.getPrompt());
        assertEquals(ENABLED, sanitized.getBackends());
        assertNull(sanitized.getContext());
        assertEquals("all", sanitized.getOptions().getSeverity());
        assertEquals("default", sanitized.getOptions().getTemplate());
        assertTrue(sanitized.getOptions().parallel());
        assertTrue(sanitized.getCorrections().isEmpty());
    }

    @Test
    void rejectsEmptyAndOversizedPrompts() {
        assertThrows(ValidationException.class, () -> sanitizer.sanitize(request(null), ENABLED));
        assertThrows(ValidationException.class, () -> sanitizer.sanitize(request("   \n"), ENABLED));
        assertThrows(ValidationException.class, () -> sanitizer.sanitize(request("\u0000\u0001"), ENABLED));
        assertThrows(ValidationException.class,
                () -> sanitizer.sanitize(request("x".repeat(settings.getMaxPromptLength() + 1)), ENABLED));
        assertThrows(ValidationException.class, () -> sanitizer.sanitize(null, ENABLED));
    }

    @Test
    void stripsWhitespaceAndControlCharacters() {
        SanitizedRequest sanitized = sanitizer.sanitize(request("  int\u0007 x = 1;\n"), ENABLED);
        assertEquals("int x = 1;", sanitized.getPrompt());
        assertEquals(2, sanitized.getCorrections().size());
    }

    @Test
    void rejectsUnknownBackendsAndNormalizesKnownOnes() {
        AnalysisRequest unknown = request("x").toBuilder().backends(List.of("claude")).build();
        assertThrows(ValidationException.class, () -> sanitizer.sanitize(unknown, ENABLED));
        assertThrows(ValidationException.class, () -> sanitizer.sanitize(request("x"), List.of()));

        AnalysisRequest mixed = request("x").toBuilder().backends(List.of("Gemini", "gemini ")).build();
        assertEquals(List.of("gemini"), sanitizer.sanitize(mixed, ENABLED).getBackends());
    }

    @Test
    void correctsInvalidOptions() {
        AnalysisRequest request = request("x").toBuilder()
                .options(AnalysisOptions.builder().severity("extreme").template("Fancy").timeout(10L).build())
                .build();

        SanitizedRequest sanitized = sanitizer.sanitize(request, ENABLED);

        assertEquals("all", sanitized.getOptions().getSeverity());
        assertEquals("default", sanitized.getOptions().getTemplate());
        assertEquals(settings.getMinTimeoutMs(), sanitized.getOptions().getTimeout());
        assertEquals(3, sanitized.getCorrections().size());
    }

    @Test
    void keepsValidOptions() {
        AnalysisRequest request = request("x").toBuilder()
                .options(AnalysisOptions.builder().severity("HIGH").template("security").timeout(30_000L)
                        .parallelExecution(false).build())
                .build();

        AnalysisOptions options = sanitizer.sanitize(request, ENABLED).getOptions();
        assertEquals("high", options.getSeverity());
        assertEquals("security", options.getTemplate());
        assertEquals(30_000L, options.getTimeout());
        assertFalse(options.parallel());
    }

    @Test
    void normalizesContext() {
        AnalysisRequest request = request("x").toBuilder()
                .context(AnalysisContext.builder()
                        .language(" TypeScript ")
                        .focus(Arrays.asList("Security", "security", "", "bugs"))
                        .fileName("  ")
                        .build())
                .build();

        AnalysisContext context = sanitizer.sanitize(request, ENABLED).getContext();
        assertEquals("typescript", context.getLanguage());
        assertEquals(List.of("security", "bugs"), context.getFocus());
        assertNull(context.getFileName());
    }
}
