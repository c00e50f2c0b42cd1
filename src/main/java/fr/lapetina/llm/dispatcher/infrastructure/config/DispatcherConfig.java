package fr.lapetina.llm.dispatcher.infrastructure.config;

import fr.lapetina.llm.dispatcher.domain.strategy.StrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Root configuration object for the dispatcher.
 * Designed to be populated from YAML.
 */
public class DispatcherConfig {

    private static final Logger log = LoggerFactory.getLogger(DispatcherConfig.class);

    private List<ProviderConfig> providers = new ArrayList<>();
    private String defaultProvider = "gemini";
    private RotationConfig rotation = new RotationConfig();
    private DispatchConfig dispatch = new DispatchConfig();
    private BatchConfig batch = new BatchConfig();
    private PipelineConfig pipeline = new PipelineConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public String getDefaultProvider() { return defaultProvider; }
    public void setDefaultProvider(String defaultProvider) { this.defaultProvider = defaultProvider; }

    public RotationConfig getRotation() { return rotation; }
    public void setRotation(RotationConfig rotation) { this.rotation = rotation; }

    public DispatchConfig getDispatch() { return dispatch; }
    public void setDispatch(DispatchConfig dispatch) { this.dispatch = dispatch; }

    public BatchConfig getBatch() { return batch; }
    public void setBatch(BatchConfig batch) { this.batch = batch; }

    public PipelineConfig getPipeline() { return pipeline; }
    public void setPipeline(PipelineConfig pipeline) { this.pipeline = pipeline; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public Optional<ProviderConfig> findProvider(String id) {
        return providers.stream()
                .filter(p -> p.getId() != null && p.getId().equals(id))
                .findFirst();
    }

    /**
     * Checks limits and strategy names. A retry timeout longer than the call timeout is
     * clamped to the call timeout.
     *
     * @throws ConfigLoader.ConfigurationException on the first invalid setting
     */
    public DispatcherConfig validate() {
        if (!StrategyFactory.isRegistered(rotation.getStrategy())) {
            throw new ConfigLoader.ConfigurationException("Unknown rotation strategy: " + rotation.getStrategy());
        }
        requireAtLeast(rotation.getFailureThreshold(), 0, "rotation.failureThreshold");
        requireAtLeast(rotation.getCooldownMs(), 0, "rotation.cooldownMs");
        requireAtLeast(rotation.getAuthErrorCooldownMs(), 0, "rotation.authErrorCooldownMs");
        requireAtLeast(rotation.getRateLimitCooldownMs(), 0, "rotation.rateLimitCooldownMs");
        requireAtLeast(rotation.getTimeoutCooldownMs(), 0, "rotation.timeoutCooldownMs");

        requireAtLeast(dispatch.getMaxParallelApiKeys(), 1, "dispatch.maxParallelApiKeys");
        requireAtLeast(dispatch.getApiCallTimeoutMs(), 1, "dispatch.apiCallTimeoutMs");
        requireAtLeast(dispatch.getApiRetryTimeoutMs(), 1, "dispatch.apiRetryTimeoutMs");
        requireAtLeast(dispatch.getMaxRetries(), 0, "dispatch.maxRetries");

        requireAtLeast(batch.getMaxBatchSize(), 1, "batch.maxBatchSize");
        requireAtLeast(batch.getBatchTimeoutMs(), 1, "batch.batchTimeoutMs");
        requireAtLeast(batch.getDefaultConcurrencyLimit(), 1, "batch.defaultConcurrencyLimit");

        requireAtLeast(pipeline.getWorkerThreads(), 1, "pipeline.workerThreads");
        if (Integer.bitCount(pipeline.getRingBufferSize()) != 1) {
            throw new ConfigLoader.ConfigurationException(
                    "pipeline.ringBufferSize must be a power of 2, got " + pipeline.getRingBufferSize());
        }
        requireAtLeast(timeouts.getConnectTimeoutMs(), 1, "timeouts.connectTimeoutMs");

        for (ProviderConfig provider : providers) {
            if (provider.getId() == null || provider.getId().isBlank()) {
                throw new ConfigLoader.ConfigurationException("Provider id is required");
            }
            if (provider.isEnabled() && (provider.getEndpoint() == null || provider.getEndpoint().isBlank())) {
                throw new ConfigLoader.ConfigurationException("Provider " + provider.getId() + " has no endpoint");
            }
        }

        if (dispatch.getApiRetryTimeoutMs() > dispatch.getApiCallTimeoutMs()) {
            log.warn("Retry timeout {}ms exceeds call timeout {}ms, clamping to call timeout",
                    dispatch.getApiRetryTimeoutMs(), dispatch.getApiCallTimeoutMs());
            dispatch.setApiRetryTimeoutMs(dispatch.getApiCallTimeoutMs());
        }
        return this;
    }

    private static void requireAtLeast(long value, long min, String name) {
        if (value < min) {
            throw new ConfigLoader.ConfigurationException(name + " must be >= " + min + ", got " + value);
        }
    }

    /**
     * One provider endpoint and its API keys.
     */
    public static class ProviderConfig {
        private String id;
        private String endpoint;
        private String authHeader = "Authorization";
        private String authScheme = "Bearer ";
        private List<String> apiKeys = new ArrayList<>();
        private String apiKey;
        private boolean enabled = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getAuthHeader() { return authHeader; }
        public void setAuthHeader(String authHeader) { this.authHeader = authHeader; }

        public String getAuthScheme() { return authScheme; }
        public void setAuthScheme(String authScheme) { this.authScheme = authScheme; }

        public List<String> getApiKeys() { return apiKeys; }
        public void setApiKeys(List<String> apiKeys) { this.apiKeys = apiKeys; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        /**
         * Keys from {@code apiKeys}, or the single {@code apiKey} when the list is empty.
         * Blank entries are dropped and duplicates removed, keeping order.
         */
        public List<String> resolveApiKeys() {
            List<String> resolved = new ArrayList<>();
            List<String> source = apiKeys != null && !apiKeys.isEmpty()
                    ? apiKeys
                    : (apiKey != null ? List.of(apiKey) : List.of());
            for (String key : source) {
                if (key == null) {
                    continue;
                }
                String trimmed = key.trim();
                if (!trimmed.isEmpty() && !resolved.contains(trimmed)) {
                    resolved.add(trimmed);
                }
            }
            return resolved;
        }
    }

    /**
     * Credential rotation and quarantine configuration.
     */
    public static class RotationConfig {
        private String strategy = StrategyFactory.DEFAULT_STRATEGY;
        private int failureThreshold = 2;
        private long cooldownMs = 30000;
        private long authErrorCooldownMs = 600000;
        private long rateLimitCooldownMs = 300000;
        private long timeoutCooldownMs = 120000;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }

        public long getAuthErrorCooldownMs() { return authErrorCooldownMs; }
        public void setAuthErrorCooldownMs(long authErrorCooldownMs) { this.authErrorCooldownMs = authErrorCooldownMs; }

        public long getRateLimitCooldownMs() { return rateLimitCooldownMs; }
        public void setRateLimitCooldownMs(long rateLimitCooldownMs) { this.rateLimitCooldownMs = rateLimitCooldownMs; }

        public long getTimeoutCooldownMs() { return timeoutCooldownMs; }
        public void setTimeoutCooldownMs(long timeoutCooldownMs) { this.timeoutCooldownMs = timeoutCooldownMs; }
    }

    /**
     * Single-call dispatch configuration.
     */
    public static class DispatchConfig {
        private int maxParallelApiKeys = 5;
        private long apiCallTimeoutMs = 60000;
        private long apiRetryTimeoutMs = 30000;
        private int maxRetries = 2;
        private boolean enableFastFailover = true;

        public int getMaxParallelApiKeys() { return maxParallelApiKeys; }
        public void setMaxParallelApiKeys(int maxParallelApiKeys) { this.maxParallelApiKeys = maxParallelApiKeys; }

        public long getApiCallTimeoutMs() { return apiCallTimeoutMs; }
        public void setApiCallTimeoutMs(long apiCallTimeoutMs) { this.apiCallTimeoutMs = apiCallTimeoutMs; }

        public long getApiRetryTimeoutMs() { return apiRetryTimeoutMs; }
        public void setApiRetryTimeoutMs(long apiRetryTimeoutMs) { this.apiRetryTimeoutMs = apiRetryTimeoutMs; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public boolean isEnableFastFailover() { return enableFastFailover; }
        public void setEnableFastFailover(boolean enableFastFailover) { this.enableFastFailover = enableFastFailover; }
    }

    /**
     * Batch execution configuration.
     */
    public static class BatchConfig {
        private int maxBatchSize = 10;
        private long batchTimeoutMs = 30000;
        private int defaultConcurrencyLimit = 5;

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }

        public long getBatchTimeoutMs() { return batchTimeoutMs; }
        public void setBatchTimeoutMs(long batchTimeoutMs) { this.batchTimeoutMs = batchTimeoutMs; }

        public int getDefaultConcurrencyLimit() { return defaultConcurrencyLimit; }
        public void setDefaultConcurrencyLimit(int defaultConcurrencyLimit) { this.defaultConcurrencyLimit = defaultConcurrencyLimit; }
    }

    /**
     * LMAX Disruptor submission pipeline configuration.
     */
    public static class PipelineConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int workerThreads = 8;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 10000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "llm_dispatcher";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
