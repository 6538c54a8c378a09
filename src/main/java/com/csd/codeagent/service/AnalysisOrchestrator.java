package com.csd.codeagent.service;

import com.csd.codeagent.config.AgentProperties;
import com.csd.codeagent.exception.BackendException;
import com.csd.codeagent.exception.ErrorClassifier;
import com.csd.codeagent.exception.ErrorCode;
import com.csd.codeagent.exception.NotFoundException;
import com.csd.codeagent.exception.UpstreamException;
import com.csd.codeagent.exception.ValidationException;
import com.csd.codeagent.model.AggregatedResult;
import com.csd.codeagent.model.AnalysisContext;
import com.csd.codeagent.model.AnalysisRequest;
import com.csd.codeagent.model.AnalysisResponse;
import com.csd.codeagent.model.AnalysisResult;
import com.csd.codeagent.model.AnalysisStatus;
import com.csd.codeagent.model.ContextWarning;
import com.csd.codeagent.model.ErrorInfo;
import com.csd.codeagent.model.Finding;
import com.csd.codeagent.model.FindingSummary;
import com.csd.codeagent.model.ResultMetadata;
import com.csd.codeagent.model.SecretFinding;
import com.csd.codeagent.model.StatusEntry;
import com.csd.codeagent.service.aggregator.FindingAggregator;
import com.csd.codeagent.service.aggregator.MergeOptions;
import com.csd.codeagent.service.backend.AnalysisBackend;
import com.csd.codeagent.service.backend.BackendOutcome;
import com.csd.codeagent.service.backend.BackendQueueRegistry;
import com.csd.codeagent.service.backend.BackendRequest;
import com.csd.codeagent.service.backend.PromptBuilder;
import com.csd.codeagent.service.cache.CacheKeyGenerator;
import com.csd.codeagent.service.cache.CacheKeyParams;
import com.csd.codeagent.service.cache.CacheLookup;
import com.csd.codeagent.service.cache.ResultCache;
import com.csd.codeagent.service.scanner.SecretScanner;
import com.csd.codeagent.service.status.AnalysisStatusTracker;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Answers analyze requests: validate, resolve context, consult the cache, fan out to the
 * backend queues, merge, record status and render.
 *
 * <p>A request only fails upstream when every selected backend failed. Whatever happens
 * after admission is recorded in the status tracker under the returned analysis id.
 */
@Slf4j
public class AnalysisOrchestrator {

    public static final String COMBINED_TAG = "combined";
    public static final String SECRET_SCANNER_SOURCE = "secret-scanner";

    private static final Duration FALLBACK_TIMEOUT = Duration.ofMinutes(5);

    private final AgentProperties properties;
    private final Map<String, AnalysisBackend> backends;
    private final BackendQueueRegistry queues;
    private final InputSanitizer sanitizer;
    private final ContextResolver contextResolver;
    private final ContextAutoDetector autoDetector;
    private final ContextWarnings contextWarnings;
    private final PromptBuilder promptBuilder;
    private final SecretScanner secretScanner;
    private final ResultCache cache;
    private final AnalysisStatusTracker statusTracker;
    private final FindingAggregator aggregator;
    private final ResultFormatter formatter;
    private final Clock clock;

    public AnalysisOrchestrator(AgentProperties properties,
                                List<AnalysisBackend> backends,
                                BackendQueueRegistry queues,
                                InputSanitizer sanitizer,
                                ContextResolver contextResolver,
                                ContextAutoDetector autoDetector,
                                ContextWarnings contextWarnings,
                                PromptBuilder promptBuilder,
                                SecretScanner secretScanner,
                                ResultCache cache,
                                AnalysisStatusTracker statusTracker,
                                FindingAggregator aggregator,
                                ResultFormatter formatter,
                                Clock clock) {
        this.properties = properties;
        this.backends = new LinkedHashMap<>();
        for (AnalysisBackend backend : backends) {
            this.backends.put(backend.id(), backend);
        }
        this.queues = queues;
        this.sanitizer = sanitizer;
        this.contextResolver = contextResolver;
        this.autoDetector = autoDetector;
        this.contextWarnings = contextWarnings;
        this.promptBuilder = promptBuilder;
        this.secretScanner = secretScanner;
        this.cache = cache;
        this.statusTracker = statusTracker;
        this.aggregator = aggregator;
        this.formatter = formatter;
        this.clock = clock;
    }

    public List<String> enabledBackends() {
        return new ArrayList<>(backends.keySet());
    }

    public Mono<AnalysisResponse> execute(AnalysisRequest request) {
        return Mono.defer(() -> {
            SanitizedRequest input = sanitizer.sanitize(request, enabledBackends());
            AnalysisContext context = resolveContext(input);
            List<ContextWarning> warnings = input.getOptions().warnOnMissing()
                    ? contextWarnings.check(context)
                    : List.of();

            String tag = input.getBackends().size() > 1 ? COMBINED_TAG : input.getBackends().get(0);
            String analysisId = tag + "-" + UUID.randomUUID();
            Instant started = clock.instant();

            statusTracker.create(analysisId, tag);
            statusTracker.updateStatus(analysisId, AnalysisStatus.RUNNING);
            log.info("Analysis {} admitted for backends {}", analysisId, input.getBackends());

            CacheKeyParams keyParams = cacheKeyParams(tag, input, context);
            return cache.getOrSet(keyParams, AggregatedResult.class, () -> runBackends(analysisId, input, context))
                    .map(lookup -> respond(analysisId, started, lookup, input, context, warnings))
                    .doOnNext(response -> statusTracker.setResult(analysisId, response.getResult()))
                    .doOnError(e -> {
                        ErrorInfo error = ErrorClassifier.classify(e);
                        statusTracker.setError(analysisId, error);
                        log.warn("Analysis {} failed: {} {}", analysisId, error.getCode(), error.getMessage());
                    })
                    .doOnCancel(() -> statusTracker.setError(analysisId, ErrorInfo.builder()
                            .code(ErrorCode.UNKNOWN_ERROR.name())
                            .message("Analysis cancelled by caller")
                            .build()));
        });
    }

    /**
     * Status of an analysis, falling back to the record store for entries that are no
     * longer held in memory.
     */
    public Mono<StatusEntry> getStatus(String analysisId) {
        if (analysisId == null || analysisId.isBlank()) {
            return Mono.error(new ValidationException("Analysis ID cannot be empty"));
        }
        return statusTracker.find(analysisId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Analysis not found: " + analysisId)));
    }

    /**
     * Result of a completed analysis.
     */
    public Mono<AggregatedResult> getResult(String analysisId) {
        return getStatus(analysisId).flatMap(entry -> {
            if (entry.getStatus() != AnalysisStatus.COMPLETED || entry.getResult() == null) {
                return Mono.error(new ValidationException(
                        "Analysis " + analysisId + " is " + entry.getStatus().value() + ", no result available"));
            }
            return Mono.just(entry.getResult());
        });
    }

    private AnalysisContext resolveContext(SanitizedRequest input) {
        AnalysisContext requestContext = input.getContext();
        String fileName = requestContext != null ? requestContext.getFileName() : null;
        AnalysisContext detected = properties.getContext().isAutoDetect() && input.getOptions().autoDetectEnabled()
                ? autoDetector.detect(input.getPrompt(), fileName)
                : null;
        String requestPreset = input.getOptions().getPreset() != null
                ? input.getOptions().getPreset()
                : requestContext != null ? requestContext.getPreset() : null;
        return contextResolver.resolve(requestContext, requestPreset, detected);
    }

    private CacheKeyParams cacheKeyParams(String tag, SanitizedRequest input, AnalysisContext context) {
        Map<String, String> service = new LinkedHashMap<>();
        service.put("version", properties.getVersion());
        service.put("template", input.getOptions().getTemplate());
        service.put("secretScanning", String.valueOf(secretScanner.isEnabled()));
        for (String id : input.getBackends()) {
            service.put("model." + id, backends.get(id).model());
        }
        return CacheKeyParams.builder()
                .prompt(input.getPrompt())
                .tag(tag)
                .backends(input.getBackends())
                .context(context)
                .options(input.getOptions())
                .service(service)
                .build();
    }

    private Mono<AggregatedResult> runBackends(String analysisId, SanitizedRequest input, AnalysisContext context) {
        BackendRequest backendRequest = BackendRequest.builder()
                .analysisId(analysisId)
                .code(input.getPrompt())
                .template(input.getOptions().getTemplate())
                .context(context)
                .renderedPrompt(promptBuilder.render(input.getOptions().getTemplate(), input.getPrompt(), context))
                .build();

        Flux<String> ids = Flux.fromIterable(input.getBackends());
        Flux<BackendOutcome> outcomes = input.getOptions().parallel()
                ? ids.flatMapSequential(id -> invoke(id, backendRequest, input))
                : ids.concatMap(id -> invoke(id, backendRequest, input));

        return outcomes.collectList().flatMap(list -> merge(analysisId, list, input, context));
    }

    private Mono<BackendOutcome> invoke(String backendId, BackendRequest request, SanitizedRequest input) {
        AnalysisBackend backend = backends.get(backendId);
        Duration timeout = timeoutFor(backendId, input.getOptions().getTimeout());
        return queues.forBackend(backendId)
                .submit(() -> backend.analyze(request))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new BackendException(ErrorCode.BACKEND_TIMEOUT, backendId,
                        backendId + " timed out after " + timeout.toMillis() + "ms", e))
                .flatMap(result -> {
                    if (!result.isSuccess()) {
                        return Mono.<BackendOutcome>error(new BackendException(ErrorCode.PARSE_ERROR, backendId,
                                backendId + " returned an unparseable answer", null));
                    }
                    result.setBackendId(backendId);
                    return Mono.just(BackendOutcome.ok(backendId, result));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> BackendOutcome.err(backendId, ErrorInfo.builder()
                        .code(ErrorCode.BACKEND_ERROR.name())
                        .message(backendId + " returned no result")
                        .build())))
                .onErrorResume(e -> {
                    ErrorInfo error = ErrorClassifier.classify(e);
                    log.warn("Backend {} failed for {}: {} {}", backendId, request.getAnalysisId(), error.getCode(), error.getMessage());
                    return Mono.just(BackendOutcome.err(backendId, error));
                });
    }

    private Mono<AggregatedResult> merge(String analysisId, List<BackendOutcome> outcomes,
                                         SanitizedRequest input, AnalysisContext context) {
        List<AnalysisResult> succeeded = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (BackendOutcome outcome : outcomes) {
            if (outcome.isOk()) {
                succeeded.add(outcome.getResult());
            } else {
                failures.add(outcome.describe());
            }
        }
        if (succeeded.isEmpty()) {
            return Mono.error(new UpstreamException("All backends failed: " + String.join("; ", failures), failures));
        }
        if (!failures.isEmpty()) {
            log.warn("Analysis {} continues with partial results, failed: {}", analysisId, failures);
        }

        AnalysisResult secrets = scanSecrets(input.getPrompt(), context.getFileName());
        if (secrets != null) {
            succeeded.add(secrets);
        }

        MergeOptions options = MergeOptions.builder()
                .severity(input.getOptions().getSeverity())
                .includeIndividualAnalyses(input.getOptions().individualAnalyses())
                .auxiliarySources(Set.of(SECRET_SCANNER_SOURCE))
                .build();
        return Mono.just(aggregator.merge(succeeded, options));
    }

    private AnalysisResult scanSecrets(String code, String fileName) {
        if (!secretScanner.isEnabled()) return null;
        List<SecretFinding> secrets = secretScanner.scan(code, fileName);
        if (secrets.isEmpty()) return null;
        List<Finding> findings = secretScanner.toFindings(secrets);
        log.debug("Folding {} secret findings into the analysis", findings.size());
        return AnalysisResult.builder()
                .backendId(SECRET_SCANNER_SOURCE)
                .success(true)
                .findings(findings)
                .summary(FindingSummary.of(findings))
                .recommendations(List.of("Remove hardcoded secrets and load them from environment variables or a secret manager."))
                .build();
    }

    private AnalysisResponse respond(String analysisId, Instant started, CacheLookup<AggregatedResult> lookup,
                                     SanitizedRequest input, AnalysisContext context, List<ContextWarning> warnings) {
        Instant now = clock.instant();
        AggregatedResult result = lookup.getValue().toBuilder()
                .id(analysisId)
                .metadata(ResultMetadata.builder()
                        .fromCache(lookup.isFromCache())
                        .cacheKey(lookup.getKey() != null ? CacheKeyGenerator.shortForm(lookup.getKey()) : null)
                        .timestamp(now)
                        .durationMs(Duration.between(started, now).toMillis())
                        .templateUsed(input.getOptions().getTemplate())
                        .resolvedContext(context)
                        .build())
                .build();

        if (lookup.isFromCache()) {
            log.info("Analysis {} served from cache ({})", analysisId, result.getMetadata().getCacheKey());
        } else {
            log.info("Analysis {} completed with {} findings", analysisId, result.getFindings().size());
        }
        return AnalysisResponse.builder()
                .analysisId(analysisId)
                .text(formatter.formatAnalysis(analysisId, result, warnings))
                .result(result)
                .warnings(warnings)
                .build();
    }

    private Duration timeoutFor(String backendId, Long requestTimeoutMs) {
        if (requestTimeoutMs != null) {
            return Duration.ofMillis(requestTimeoutMs);
        }
        AgentProperties.Backend settings = properties.getBackends().get(backendId);
        if (settings != null && settings.getTimeout() != null && !settings.getTimeout().isZero()) {
            return settings.getTimeout();
        }
        return FALLBACK_TIMEOUT;
    }
}
