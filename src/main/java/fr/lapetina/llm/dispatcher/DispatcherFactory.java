package fr.lapetina.llm.dispatcher;

import fr.lapetina.llm.dispatcher.dispatch.DispatchObserver;
import fr.lapetina.llm.dispatcher.dispatch.DispatchService;
import fr.lapetina.llm.dispatcher.dispatch.DispatchSettings;
import fr.lapetina.llm.dispatcher.disruptor.DispatchPipeline;
import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.domain.strategy.RotationStrategy;
import fr.lapetina.llm.dispatcher.domain.strategy.StrategyFactory;
import fr.lapetina.llm.dispatcher.infrastructure.config.ConfigLoader;
import fr.lapetina.llm.dispatcher.infrastructure.config.DispatcherConfig;
import fr.lapetina.llm.dispatcher.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.dispatcher.pool.CredentialPool;
import fr.lapetina.llm.dispatcher.pool.CredentialPools;
import fr.lapetina.llm.dispatcher.pool.QuarantinePolicy;
import fr.lapetina.llm.dispatcher.provider.HttpProviderCall;
import fr.lapetina.llm.dispatcher.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates a fully wired dispatcher from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (DispatcherFactory factory = DispatcherFactory.create("dispatcher.yaml").start()) {
 *     CallResult result = factory.getDispatchService().dispatchOne(request);
 * }
 * }</pre>
 */
public class DispatcherFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatcherFactory.class);

    private final ConfigLoader configLoader;
    private final DispatcherConfig config;
    private final Clock clock;
    private final CredentialPools pools;
    private final ProviderRegistry providers;
    private final MetricsRegistry metricsRegistry;
    private final DispatchService dispatchService;
    private final DispatchPipeline pipeline;

    protected DispatcherFactory(ConfigLoader configLoader, ProviderRegistry providersOverride, Clock clock) {
        this.configLoader = configLoader;
        this.config = configLoader.load();
        this.clock = clock;

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.pools = new CredentialPools();
        loadPools();

        // Allow override for testing
        this.providers = providersOverride != null ? providersOverride : createProviders();

        DispatchObserver observer = config.getMetrics().isEnabled() ? metricsRegistry : DispatchObserver.NOOP;
        this.dispatchService = new DispatchService(pools, providers, settingsFrom(config), clock, observer);

        this.pipeline = DispatchPipeline.builder()
                .fromConfig(config)
                .dispatchService(dispatchService)
                .metricsRegistry(metricsRegistry)
                .build();

        configLoader.addListener(this::onConfigChanged);

        log.info("DispatcherFactory initialized: providers={}, defaultProvider={}",
                pools.providerIds(), config.getDefaultProvider());
    }

    /**
     * Creates a factory from the specified configuration file, with environment overrides applied.
     */
    public static DispatcherFactory create(String configPath) {
        return new DispatcherFactory(new ConfigLoader(configPath), null, Clock.systemUTC());
    }

    /**
     * Creates a factory with an explicit environment and provider registry.
     * A null registry builds HTTP providers from the configuration.
     */
    public static DispatcherFactory create(
            String configPath,
            Map<String, String> environment,
            ProviderRegistry providers,
            Clock clock
    ) {
        return new DispatcherFactory(new ConfigLoader(configPath, environment), providers, clock);
    }

    /**
     * Starts the submission pipeline and the configuration watcher.
     */
    public DispatcherFactory start() {
        pipeline.start();
        configLoader.startWatching();
        log.info("Dispatcher started");
        return this;
    }

    /**
     * Converts the loaded configuration into dispatch settings.
     */
    public static DispatchSettings settingsFrom(DispatcherConfig config) {
        DispatcherConfig.DispatchConfig dispatch = config.getDispatch();
        DispatcherConfig.BatchConfig batch = config.getBatch();
        return DispatchSettings.builder()
                .maxParallelApiKeys(dispatch.getMaxParallelApiKeys())
                .callTimeout(Duration.ofMillis(dispatch.getApiCallTimeoutMs()))
                .retryTimeout(Duration.ofMillis(dispatch.getApiRetryTimeoutMs()))
                .maxRetries(dispatch.getMaxRetries())
                .enableFastFailover(dispatch.isEnableFastFailover())
                .maxBatchSize(batch.getMaxBatchSize())
                .batchTimeout(Duration.ofMillis(batch.getBatchTimeoutMs()))
                .defaultConcurrencyLimit(batch.getDefaultConcurrencyLimit())
                .build();
    }

    static QuarantinePolicy policyFrom(DispatcherConfig config) {
        DispatcherConfig.RotationConfig rotation = config.getRotation();
        return new QuarantinePolicy(
                rotation.getFailureThreshold(),
                Duration.ofMillis(rotation.getCooldownMs()),
                Duration.ofMillis(rotation.getAuthErrorCooldownMs()),
                Map.of(ErrorType.RATE_LIMITED, Duration.ofMillis(rotation.getRateLimitCooldownMs()),
                        ErrorType.TIMEOUT, Duration.ofMillis(rotation.getTimeoutCooldownMs()))
        );
    }

    private void loadPools() {
        QuarantinePolicy policy = policyFrom(config);
        for (DispatcherConfig.ProviderConfig provider : config.getProviders()) {
            if (!provider.isEnabled()) {
                log.info("Provider disabled, skipping: provider={}", provider.getId());
                continue;
            }
            List<String> keys = provider.resolveApiKeys();
            if (keys.isEmpty()) {
                log.warn("Provider has no API keys, every call will fail with POOL_EXHAUSTED: provider={}",
                        provider.getId());
            }
            CredentialPool pool = CredentialPool.of(provider.getId(), keys, rotationStrategy(), policy, clock);
            pools.register(pool);
            metricsRegistry.registerPool(pool, clock);
        }
    }

    private ProviderRegistry createProviders() {
        ProviderRegistry registry = new ProviderRegistry();
        Duration connectTimeout = Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs());
        for (DispatcherConfig.ProviderConfig provider : config.getProviders()) {
            if (!provider.isEnabled()) {
                continue;
            }
            registry.register(HttpProviderCall.builder()
                    .providerId(provider.getId())
                    .endpoint(provider.getEndpoint())
                    .authHeader(provider.getAuthHeader())
                    .authScheme(provider.getAuthScheme())
                    .connectTimeout(connectTimeout)
                    .build());
        }
        return registry;
    }

    private RotationStrategy rotationStrategy() {
        return StrategyFactory.createOrDefault(config.getRotation().getStrategy());
    }

    private void onConfigChanged(DispatcherConfig oldConfig, DispatcherConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");

        String oldStrategy = oldConfig.getRotation().getStrategy();
        String newStrategy = newConfig.getRotation().getStrategy();
        if (!oldStrategy.equals(newStrategy)) {
            pools.applyStrategy(() -> StrategyFactory.createOrDefault(newStrategy));
            log.info("Rotation strategy updated: {} -> {}", oldStrategy, newStrategy);
        }

        if (!settingsFrom(oldConfig).equals(settingsFrom(newConfig))
                || !policyFrom(oldConfig).equals(policyFrom(newConfig))
                || !providerKeys(oldConfig).equals(providerKeys(newConfig))) {
            log.warn("Dispatch, quarantine or provider settings changed; they take effect after restart");
        }
    }

    private static Map<String, List<String>> providerKeys(DispatcherConfig config) {
        Map<String, List<String>> keys = new LinkedHashMap<>();
        for (DispatcherConfig.ProviderConfig provider : config.getProviders()) {
            keys.put(provider.getId() + "@" + provider.getEndpoint() + "#" + provider.isEnabled(),
                    provider.resolveApiKeys());
        }
        return keys;
    }

    public DispatchService getDispatchService() {
        return dispatchService;
    }

    public DispatchPipeline getPipeline() {
        return pipeline;
    }

    public CredentialPools getPools() {
        return pools;
    }

    public ProviderRegistry getProviders() {
        return providers;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public DispatcherConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    @Override
    public void close() {
        log.info("Shutting down DispatcherFactory...");

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("DispatcherFactory shut down");
    }
}
