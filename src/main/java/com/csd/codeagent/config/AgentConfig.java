package com.csd.codeagent.config;

import com.csd.codeagent.service.AnalysisOrchestrator;
import com.csd.codeagent.service.ContextAutoDetector;
import com.csd.codeagent.service.ContextResolver;
import com.csd.codeagent.service.ContextWarnings;
import com.csd.codeagent.service.InputSanitizer;
import com.csd.codeagent.service.ResultFormatter;
import com.csd.codeagent.service.aggregator.FindingAggregator;
import com.csd.codeagent.service.backend.AnalysisBackend;
import com.csd.codeagent.service.backend.BackendQueue;
import com.csd.codeagent.service.backend.BackendQueueRegistry;
import com.csd.codeagent.service.backend.BackendResponseParser;
import com.csd.codeagent.service.backend.HttpAnalysisBackend;
import com.csd.codeagent.service.backend.PromptBuilder;
import com.csd.codeagent.service.cache.CacheKeyGenerator;
import com.csd.codeagent.service.cache.ResultCache;
import com.csd.codeagent.service.scanner.SecretScanService;
import com.csd.codeagent.service.scanner.SecretScanner;
import com.csd.codeagent.service.status.AnalysisStatusTracker;
import com.csd.codeagent.service.store.BestEffortStore;
import com.csd.codeagent.service.store.FileRecordStore;
import com.csd.codeagent.service.store.NoopRecordStore;
import com.csd.codeagent.service.store.RecordStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the long-lived pieces of the agent that need settings or shared state.
 * Stateless helpers register themselves as services.
 */
@Slf4j
@Configuration
public class AgentConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BestEffortStore recordStore(AgentProperties properties) {
        RecordStore delegate;
        if ("file".equalsIgnoreCase(properties.getStorage().getType())) {
            log.info("Persisting cache and status records under {}", properties.getStorage().getDirectory());
            delegate = new FileRecordStore(Path.of(properties.getStorage().getDirectory()));
        } else {
            delegate = new NoopRecordStore();
        }
        return new BestEffortStore(delegate);
    }

    @Bean
    public CacheKeyGenerator cacheKeyGenerator() {
        return new CacheKeyGenerator();
    }

    @Bean(destroyMethod = "close")
    public ResultCache resultCache(AgentProperties properties, ObjectMapper objectMapper, Clock clock,
                                   BestEffortStore store, CacheKeyGenerator keyGenerator) {
        return new ResultCache(properties.getCache(), objectMapper, clock, store, keyGenerator);
    }

    @Bean(destroyMethod = "close")
    public AnalysisStatusTracker analysisStatusTracker(AgentProperties properties, Clock clock,
                                                       BestEffortStore store, ObjectMapper objectMapper) {
        return new AnalysisStatusTracker(properties.getStatus(), clock, store, objectMapper);
    }

    @Bean
    public SecretScanner secretScanner(AgentProperties properties) {
        return new SecretScanner(properties.getSecretScanning());
    }

    @Bean
    public ResultFormatter resultFormatter(AgentProperties properties) {
        return new ResultFormatter(properties.getAnalysis().getMaxFindings(), properties.getAnalysis().getMaxOutputChars());
    }

    @Bean
    public SecretScanService secretScanService(SecretScanner scanner, ResultFormatter formatter,
                                               Clock clock, AgentProperties properties) {
        return new SecretScanService(scanner, formatter, clock, properties.getSecretScanning().getMaxCodeLength());
    }

    @Bean
    public FindingAggregator findingAggregator(AgentProperties properties) {
        return new FindingAggregator(properties.getAnalysis().getSimilarityThreshold());
    }

    @Bean
    public List<AnalysisBackend> analysisBackends(AgentProperties properties, WebClient.Builder webClientBuilder,
                                                  BackendResponseParser parser) {
        List<AnalysisBackend> backends = new ArrayList<>();
        for (Map.Entry<String, AgentProperties.Backend> entry : properties.getBackends().entrySet()) {
            AgentProperties.Backend settings = entry.getValue();
            if (!settings.isEnabled()) {
                log.info("Backend {} is disabled", entry.getKey());
                continue;
            }
            if (settings.getBaseUrl() == null || settings.getBaseUrl().isBlank()) {
                log.warn("Backend {} has no base-url configured, skipping", entry.getKey());
                continue;
            }
            backends.add(new HttpAnalysisBackend(entry.getKey(), settings, webClientBuilder, parser));
            log.info("Backend {} enabled (model {}, max concurrent {})",
                    entry.getKey(), settings.getModel(), settings.getMaxConcurrent());
        }
        return backends;
    }

    @Bean
    public BackendQueueRegistry backendQueueRegistry(AgentProperties properties, List<AnalysisBackend> analysisBackends) {
        BackendQueueRegistry registry = new BackendQueueRegistry();
        for (AnalysisBackend backend : analysisBackends) {
            AgentProperties.Backend settings = properties.getBackends().get(backend.id());
            registry.register(new BackendQueue(backend.id(), Math.max(1, settings.getMaxConcurrent()),
                    settings.getInterval(), settings.getIntervalCap(), Schedulers.parallel()));
        }
        return registry;
    }

    @Bean
    public ContextResolver contextResolver(AgentProperties properties) {
        return new ContextResolver(properties.getContext());
    }

    @Bean
    public ContextWarnings contextWarnings(AgentProperties properties) {
        return new ContextWarnings(properties.getAnalysis().getWarningSuppressions());
    }

    @Bean
    public InputSanitizer inputSanitizer(AgentProperties properties, PromptBuilder promptBuilder) {
        return new InputSanitizer(properties.getAnalysis(), promptBuilder);
    }

    @Bean
    public AnalysisOrchestrator analysisOrchestrator(AgentProperties properties,
                                                     List<AnalysisBackend> analysisBackends,
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
        return new AnalysisOrchestrator(properties, analysisBackends, queues, sanitizer, contextResolver,
                autoDetector, contextWarnings, promptBuilder, secretScanner, cache, statusTracker,
                aggregator, formatter, clock);
    }
}
