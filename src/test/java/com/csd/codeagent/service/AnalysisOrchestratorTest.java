package com.csd.codeagent.service;

import com.csd.codeagent.config.AgentProperties;
import com.csd.codeagent.exception.BackendException;
import com.csd.codeagent.exception.ErrorCode;
import com.csd.codeagent.exception.NotFoundException;
import com.csd.codeagent.exception.UpstreamException;
import com.csd.codeagent.exception.ValidationException;
import com.csd.codeagent.model.AggregatedResult;
import com.csd.codeagent.model.AnalysisOptions;
import com.csd.codeagent.model.AnalysisRequest;
import com.csd.codeagent.model.AnalysisResponse;
import com.csd.codeagent.model.AnalysisResult;
import com.csd.codeagent.model.AnalysisStatus;
import com.csd.codeagent.model.Confidence;
import com.csd.codeagent.model.Finding;
import com.csd.codeagent.model.Severity;
import com.csd.codeagent.model.StatusEntry;
import com.csd.codeagent.service.aggregator.FindingAggregator;
import com.csd.codeagent.service.backend.AnalysisBackend;
import com.csd.codeagent.service.backend.BackendQueue;
import com.csd.codeagent.service.backend.BackendQueueRegistry;
import com.csd.codeagent.service.backend.PromptBuilder;
import com.csd.codeagent.service.cache.CacheKeyGenerator;
import com.csd.codeagent.service.cache.ResultCache;
import com.csd.codeagent.service.scanner.SecretScanner;
import com.csd.codeagent.service.status.AnalysisStatusTracker;
import com.csd.codeagent.support.MutableClock;
import com.csd.codeagent.support.StubBackend;
import com.csd.codeagent.support.TestObjects;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.csd.codeagent.support.TestObjects.finding;
import static org.junit.jupiter.api.Assertions.*;

public class AnalysisOrchestratorTest {

    private static final Duration WAIT = Duration.ofSeconds(10);
    private static final String CODE = "function add(a, b) {\n  return a + b;\n}";

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private final ObjectMapper objectMapper = TestObjects.objectMapper();

    private AgentProperties properties;
    private ResultCache cache;
    private AnalysisStatusTracker tracker;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getCache().setCleanupInterval(Duration.ZERO);
        properties.getStatus().setSweepInterval(Duration.ZERO);
        properties.getAnalysis().setMinTimeoutMs(10);
        cache = new ResultCache(properties.getCache(), objectMapper, clock, TestObjects.noopStore(), new CacheKeyGenerator());
        tracker = new AnalysisStatusTracker(properties.getStatus(), clock, TestObjects.noopStore(), objectMapper);
    }

    @AfterEach
    void tearDown() {
        cache.close();
        tracker.close();
    }

    private AnalysisOrchestrator orchestrator(AnalysisBackend... backends) {
        BackendQueueRegistry queues = new BackendQueueRegistry();
        for (AnalysisBackend backend : backends) {
            queues.register(new BackendQueue(backend.id(), 1, null, 0, Schedulers.immediate()));
        }
        PromptBuilder promptBuilder = new PromptBuilder();
        return new AnalysisOrchestrator(
                properties,
                List.of(backends),
                queues,
                new InputSanitizer(properties.getAnalysis(), promptBuilder),
                new ContextResolver(properties.getContext()),
                new ContextAutoDetector(),
                new ContextWarnings(List.of()),
                promptBuilder,
                new SecretScanner(properties.getSecretScanning()),
                cache,
                tracker,
                new FindingAggregator(),
                new ResultFormatter(200, 200_000),
                clock);
    }

    private static AnalysisRequest request(String prompt) {
        return AnalysisRequest.builder().prompt(prompt).build();
    }

    private static Finding injection() {
        return finding("SQL injection in query builder", "security", Severity.HIGH, 2);
    }

    @Test
    void bothBackendsAgreeOnSharedFinding() {
        StubBackend codex = StubBackend.returning("codex", injection());
        StubBackend gemini = StubBackend.returning("gemini", injection(),
                finding("Missing semicolon", "style", Severity.LOW, 1));

        AnalysisResponse response = orchestrator(codex, gemini).execute(request(CODE)).block(WAIT);

        assertTrue(response.getAnalysisId().startsWith("combined-"));
        AggregatedResult result = response.getResult();
        assertEquals(response.getAnalysisId(), result.getId());
        assertEquals(2, result.getFindings().size());
        assertEquals(List.of("codex", "gemini"), result.getFindings().get(0).getSources());
        assertEquals(50, result.getSummary().getConsensus());
        assertFalse(result.getMetadata().isFromCache());
        assertEquals(16, result.getMetadata().getCacheKey().length());
        assertEquals("default", result.getMetadata().getTemplateUsed());
        assertNotNull(result.getMetadata().getResolvedContext());
        assertTrue(response.getText().contains(response.getAnalysisId()));

        StatusEntry status = tracker.get(response.getAnalysisId()).orElseThrow();
        assertEquals(AnalysisStatus.COMPLETED, status.getStatus());
        assertEquals("combined", status.getTag());
        assertNotNull(status.getResult());
    }

    @Test
    void identicalRequestIsServedFromCacheWithoutBackendCalls() {
        StubBackend codex = StubBackend.returning("codex", injection());
        StubBackend gemini = StubBackend.returning("gemini", injection());
        AnalysisOrchestrator orchestrator = orchestrator(codex, gemini);

        AnalysisResponse first = orchestrator.execute(request(CODE)).block(WAIT);
        AnalysisResponse second = orchestrator.execute(request(CODE)).block(WAIT);

        assertEquals(1, codex.calls());
        assertEquals(1, gemini.calls());
        assertTrue(second.getResult().getMetadata().isFromCache());
        assertEquals(first.getResult().getFindings(), second.getResult().getFindings());
        assertEquals(first.getResult().getMetadata().getCacheKey(), second.getResult().getMetadata().getCacheKey());
        assertNotEquals(first.getAnalysisId(), second.getAnalysisId());
        assertTrue(second.getText().contains("cached"));
        assertEquals(AnalysisStatus.COMPLETED, tracker.get(second.getAnalysisId()).orElseThrow().getStatus());
    }

    @Test
    void oneFailingBackendStillProducesResult() {
        StubBackend codex = StubBackend.returning("codex", injection());
        StubBackend gemini = StubBackend.failing("gemini",
                new BackendException("gemini", "gemini returned HTTP 503", true, null));

        AnalysisResponse response = orchestrator(codex, gemini).execute(request(CODE)).block(WAIT);

        assertEquals(List.of("codex"), response.getResult().getBackends());
        assertEquals(1, response.getResult().getFindings().size());
        assertEquals(0, response.getResult().getSummary().getConsensus());
    }

    @Test
    void allBackendsFailingFailsTheAnalysis() {
        StubBackend codex = StubBackend.failing("codex", new IllegalStateException("connection reset"));
        StubBackend gemini = StubBackend.failing("gemini",
                new BackendException("gemini", "gemini returned HTTP 500", true, null));
        AnalysisOrchestrator orchestrator = orchestrator(codex, gemini);

        UpstreamException error = assertThrows(UpstreamException.class,
                () -> orchestrator.execute(request(CODE)).block(WAIT));
        assertEquals(2, error.getBackendErrors().size());

        String analysisId = codex.requests().get(0).getAnalysisId();
        StatusEntry status = orchestrator.getStatus(analysisId).block(WAIT);
        assertEquals(AnalysisStatus.FAILED, status.getStatus());
        assertEquals(ErrorCode.UPSTREAM_ERROR.name(), status.getError().getCode());
        assertEquals(0, cache.size());
    }

    @Test
    void unparseableAnswerCountsAsFailure() {
        StubBackend codex = new StubBackend("codex", request -> Mono.just(AnalysisResult.builder()
                .backendId("codex")
                .success(false)
                .findings(List.of())
                .rawOutput("not json")
                .build()));

        UpstreamException error = assertThrows(UpstreamException.class,
                () -> orchestrator(codex).execute(request(CODE)).block(WAIT));
        assertTrue(error.getBackendErrors().get(0).contains(ErrorCode.PARSE_ERROR.name()));
    }

    @Test
    void slowBackendTimesOutWithoutBlockingTheOther() {
        StubBackend codex = StubBackend.returning("codex", injection());
        StubBackend gemini = new StubBackend("gemini", request -> Mono.never());
        AnalysisRequest request = request(CODE).toBuilder()
                .options(AnalysisOptions.builder().timeout(100L).build())
                .build();

        AnalysisResponse response = orchestrator(codex, gemini).execute(request).block(WAIT);

        assertEquals(List.of("codex"), response.getResult().getBackends());
    }

    @Test
    void sequentialModeWaitsForEachBackend() {
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        StubBackend codex = new StubBackend("codex", request -> {
            events.add("codex-start");
            return Mono.delay(Duration.ofMillis(50))
                    .then(Mono.fromSupplier(() -> {
                        events.add("codex-end");
                        return AnalysisResult.builder().backendId("codex").success(true).findings(List.of()).build();
                    }));
        });
        StubBackend gemini = new StubBackend("gemini", request -> {
            events.add("gemini-start");
            return Mono.just(AnalysisResult.builder().backendId("gemini").success(true).findings(List.of()).build());
        });
        AnalysisRequest request = request(CODE).toBuilder()
                .options(AnalysisOptions.builder().parallelExecution(false).build())
                .build();

        AnalysisResponse response = orchestrator(codex, gemini).execute(request).block(WAIT);

        assertEquals(List.of("codex-start", "codex-end", "gemini-start"), events);
        assertEquals(List.of("codex", "gemini"), response.getResult().getBackends());
    }

    @Test
    void invalidRequestIsRejectedBeforeAnyWork() {
        StubBackend codex = StubBackend.returning("codex");
        AnalysisOrchestrator orchestrator = orchestrator(codex);

        assertThrows(ValidationException.class, () -> orchestrator.execute(request("   ")).block(WAIT));
        AnalysisRequest unknownBackend = request(CODE).toBuilder().backends(List.of("claude")).build();
        assertThrows(ValidationException.class, () -> orchestrator.execute(unknownBackend).block(WAIT));

        assertEquals(0, codex.calls());
        assertEquals(0, tracker.size());
    }

    @Test
    void selectedBackendOnlyIsCalled() {
        StubBackend codex = StubBackend.returning("codex");
        StubBackend gemini = StubBackend.returning("gemini");
        AnalysisRequest request = request(CODE).toBuilder().backends(List.of("gemini")).build();

        AnalysisResponse response = orchestrator(codex, gemini).execute(request).block(WAIT);

        assertTrue(response.getAnalysisId().startsWith("gemini-"));
        assertEquals(0, codex.calls());
        assertEquals(1, gemini.calls());
        assertEquals(100, response.getResult().getSummary().getConsensus());
    }

    @Test
    void hardcodedSecretsAreFoldedIntoFindings() {
        StubBackend codex = StubBackend.returning("codex");
        String code = "const key = \"ghp_" + "c".repeat(36) + "\";";

        AggregatedResult result = orchestrator(codex).execute(request(code)).block(WAIT).getResult();

        assertEquals(List.of("codex"), result.getBackends());
        Finding secret = result.getFindings().stream()
                .filter(f -> f.getTitle().equals("Hardcoded GitHub Personal Access Token"))
                .findFirst()
                .orElseThrow();
        assertEquals(Severity.CRITICAL, secret.getSeverity());
        assertTrue(secret.getSources().isEmpty());
        assertEquals(Confidence.MEDIUM, secret.getConfidence());
    }

    @Test
    void secretScannerDoesNotCorroborateSingleBackend() {
        StubBackend codex = StubBackend.returning("codex",
                finding("Hardcoded GitHub Personal Access Token", "security", Severity.HIGH, 1));
        String code = "const key = \"ghp_" + "a".repeat(36) + "\";";

        AggregatedResult result = orchestrator(codex).execute(request(code)).block(WAIT).getResult();

        assertEquals(List.of("codex"), result.getBackends());
        assertEquals(1, result.getFindings().size());
        Finding token = result.getFindings().get(0);
        assertEquals(List.of("codex"), token.getSources());
        assertEquals(Severity.CRITICAL, token.getSeverity());
        assertEquals(Confidence.MEDIUM, token.getConfidence());
        assertEquals(0, result.getSummary().getConsensus());
        assertTrue(result.getOverallAssessment().startsWith("Combined review from 1 source(s)"));
        assertTrue(result.getOverallAssessment().contains("Single-source"));
        assertFalse(result.getOverallAssessment().contains("strong agreement"));
    }

    @Test
    void missingContextProducesWarnings() {
        AnalysisResponse response = orchestrator(StubBackend.returning("codex")).execute(request(CODE)).block(WAIT);
        assertTrue(response.getWarnings().stream().anyMatch(w -> w.getCode().equals(ContextWarnings.MISSING_THREAT_MODEL)));

        AnalysisRequest quiet = request(CODE + "\n").toBuilder()
                .options(AnalysisOptions.builder().warnOnMissingContext(false).build())
                .build();
        assertTrue(orchestrator(StubBackend.returning("codex")).execute(quiet).block(WAIT).getWarnings().isEmpty());
    }

    @Test
    void statusAndResultLookups() {
        AnalysisOrchestrator orchestrator = orchestrator(StubBackend.returning("codex", injection()));
        AnalysisResponse response = orchestrator.execute(request(CODE)).block(WAIT);

        assertEquals(1, orchestrator.getResult(response.getAnalysisId()).block(WAIT).getFindings().size());
        assertThrows(NotFoundException.class, () -> orchestrator.getStatus("codex-unknown").block(WAIT));
        assertThrows(ValidationException.class, () -> orchestrator.getStatus(" ").block(WAIT));
    }
}
