package com.csd.codeagent.service.backend;

import com.csd.codeagent.config.AgentProperties;
import com.csd.codeagent.exception.BackendException;
import com.csd.codeagent.exception.ErrorClassifier;
import com.csd.codeagent.exception.ErrorCode;
import com.csd.codeagent.model.AnalysisResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend that talks to an OpenAI-compatible chat-completions endpoint.
 */
@Slf4j
public class HttpAnalysisBackend implements AnalysisBackend {

    private static final String SYSTEM_PROMPT =
            "You are a senior code reviewer. Answer with the requested JSON only.";

    private final String id;
    private final AgentProperties.Backend settings;
    private final WebClient client;
    private final BackendResponseParser parser;

    public HttpAnalysisBackend(String id, AgentProperties.Backend settings,
                               WebClient.Builder webClientBuilder, BackendResponseParser parser) {
        this.id = id;
        this.settings = settings;
        this.client = webClientBuilder.clone()
                .baseUrl(settings.getBaseUrl())
                .build();
        this.parser = parser;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String model() {
        return settings.getModel();
    }

    @Override
    public Mono<AnalysisResult> analyze(BackendRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", settings.getModel());
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", request.getRenderedPrompt())
        ));
        body.put("temperature", settings.getTemperature());
        body.put("max_tokens", settings.getMaxTokens());

        return client.post()
                .uri(settings.getPath())
                .headers(headers -> {
                    if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
                        headers.setBearerAuth(settings.getApiKey());
                    }
                })
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, this::toBackendException)
                .onErrorMap(WebClientRequestException.class,
                        e -> new BackendException(id, id + " request failed: " + e.getMessage(), true, e))
                .retryWhen(Retry.backoff(settings.getRetryAttempts(), settings.getRetryDelay())
                        .filter(ErrorClassifier::isRetryable)
                        .doBeforeRetry(signal -> log.warn("Retrying {} (attempt {}): {}",
                                id, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .elapsed()
                .flatMap(timed -> {
                    String content;
                    try {
                        content = parser.extractContent(timed.getT2());
                    } catch (JsonProcessingException e) {
                        return Mono.error(new BackendException(ErrorCode.PARSE_ERROR, id,
                                id + " returned a malformed response body", e));
                    }
                    AnalysisResult result = parser.parse(id, content);
                    result.setDurationMs(timed.getT1());
                    log.debug("{} answered in {}ms with {} findings", id, timed.getT1(),
                            result.getFindings() == null ? 0 : result.getFindings().size());
                    return Mono.just(result);
                });
    }

    private BackendException toBackendException(WebClientResponseException e) {
        boolean retryable = e.getStatusCode().is5xxServerError()
                || e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value();
        return new BackendException(id, id + " returned HTTP " + e.getStatusCode().value(), retryable, e);
    }
}
