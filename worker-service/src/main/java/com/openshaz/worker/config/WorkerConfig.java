package com.openshaz.worker.config;

import com.openshaz.common.message.JobMessageCodec;
import com.openshaz.common.messaging.MessageBroker;
import com.openshaz.common.service.ObjectStorageService;
import com.openshaz.common.util.StartupRetry;
import com.openshaz.worker.dispatch.TaskHandler;
import com.openshaz.worker.dispatch.WorkerDispatcher;
import com.openshaz.worker.extraction.FeatureExtractor;
import com.openshaz.worker.extraction.RemoteFeatureExtractor;
import com.openshaz.worker.retry.ExponentialBackoffRetryPolicy;
import com.openshaz.worker.retry.RetryGovernor;
import com.openshaz.worker.retry.RetryPolicy;
import com.openshaz.worker.service.FeatureVectorStore;
import com.openshaz.worker.similarity.FeatureCache;
import com.openshaz.worker.similarity.SimilarityEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Wires the worker core: retry handling, feature extraction, the feature cache and the
 * dispatcher that ties them to the broker.
 */
@Slf4j
@Configuration
public class WorkerConfig {

    // ═══════════════════════════════════════════════════════
    // Retry
    // ═══════════════════════════════════════════════════════

    @Value("${openshaz.retry.max-retries:3}")
    private int maxRetries;

    // 0 disables the delay queue and republishes immediately
    @Value("${openshaz.retry.base-delay:2s}")
    private Duration retryBaseDelay;

    @Value("${openshaz.retry.max-delay:60s}")
    private Duration retryMaxDelay;

    @Value("${openshaz.retry.discard-terminal-errors:true}")
    private boolean discardTerminalErrors;

    // ═══════════════════════════════════════════════════════
    // Similarity and extraction
    // ═══════════════════════════════════════════════════════

    @Value("${openshaz.similarity.normalize:true}")
    private boolean normalize;

    @Value("${openshaz.extractor.base-url:http://localhost:8500}")
    private String extractorBaseUrl;

    @Value("${openshaz.features.dimensions:0}")
    private int featureDimensions;

    @Value("${openshaz.extractor.timeout:60s}")
    private Duration extractorTimeout;

    // ═══════════════════════════════════════════════════════
    // Start-up
    // ═══════════════════════════════════════════════════════

    @Value("${openshaz.storage.connect-attempts:3}")
    private int storageConnectAttempts;

    @Value("${openshaz.storage.connect-backoff:5s}")
    private Duration storageConnectBackoff;

    @Bean
    public RetryPolicy retryPolicy() {
        if (retryBaseDelay.isZero()) {
            log.info("Retry delay disabled, failed jobs are republished immediately");
            return RetryPolicy.IMMEDIATE;
        }
        log.info("Retry backoff: base {} max {}", retryBaseDelay, retryMaxDelay);
        return new ExponentialBackoffRetryPolicy(retryBaseDelay, retryMaxDelay);
    }

    @Bean
    public RetryGovernor retryGovernor(RetryPolicy retryPolicy, JobMessageCodec jobMessageCodec) {
        return new RetryGovernor(maxRetries, retryPolicy, discardTerminalErrors, jobMessageCodec);
    }

    /**
     * Feature extraction service client. Consumers @Autowired FeatureExtractor get this one.
     */
    @Bean
    public FeatureExtractor featureExtractor(WebClient.Builder webClientBuilder) {
        log.info("Feature extractor at {} (dimensions: {})", extractorBaseUrl,
                featureDimensions > 0 ? featureDimensions : "unchecked");
        return new RemoteFeatureExtractor(webClientBuilder, extractorBaseUrl, featureDimensions, extractorTimeout);
    }

    @Bean
    public FeatureCache featureCache(FeatureVectorStore featureVectorStore) {
        return new FeatureCache(featureVectorStore, normalize);
    }

    @Bean
    public SimilarityEvaluator similarityEvaluator() {
        return new SimilarityEvaluator(normalize);
    }

    @Bean
    public StoragePreflight storagePreflight(ObjectStorageService storageService) {
        return new StoragePreflight(storageService, new StartupRetry(storageConnectAttempts, storageConnectBackoff));
    }

    @Bean
    public WorkerDispatcher workerDispatcher(MessageBroker messageBroker, RetryGovernor retryGovernor,
            JobMessageCodec jobMessageCodec, List<TaskHandler> taskHandlers, FeatureCache featureCache,
            StoragePreflight storagePreflight) {
        return new WorkerDispatcher(messageBroker, retryGovernor, jobMessageCodec, taskHandlers,
                featureCache, storagePreflight);
    }
}
