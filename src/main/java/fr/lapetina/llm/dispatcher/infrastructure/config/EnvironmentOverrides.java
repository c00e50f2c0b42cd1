package fr.lapetina.llm.dispatcher.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Applies environment variables on top of a loaded configuration.
 *
 * <ul>
 *   <li>{@code API_KEY_ROTATION_STRATEGY}: {@code round_robin | random | failover}</li>
 *   <li>{@code MAX_PARALLEL_API_KEYS}, {@code MAX_BATCH_SIZE}: integers</li>
 *   <li>{@code API_CALL_TIMEOUT}, {@code API_RETRY_TIMEOUT}, {@code BATCH_TIMEOUT}: seconds</li>
 *   <li>{@code ENABLE_FAST_FAILOVER}: {@code true/1/yes/on} or {@code false/0/no/off}</li>
 *   <li>{@code DEFAULT_LLM_PROVIDER}</li>
 *   <li>{@code <PROVIDER>_API_KEYS} (comma separated) or {@code <PROVIDER>_API_KEY} for each
 *       configured provider, e.g. {@code GEMINI_API_KEYS}</li>
 * </ul>
 */
public final class EnvironmentOverrides {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentOverrides.class);

    public static final String ROTATION_STRATEGY = "API_KEY_ROTATION_STRATEGY";
    public static final String MAX_PARALLEL_API_KEYS = "MAX_PARALLEL_API_KEYS";
    public static final String API_CALL_TIMEOUT = "API_CALL_TIMEOUT";
    public static final String API_RETRY_TIMEOUT = "API_RETRY_TIMEOUT";
    public static final String ENABLE_FAST_FAILOVER = "ENABLE_FAST_FAILOVER";
    public static final String MAX_BATCH_SIZE = "MAX_BATCH_SIZE";
    public static final String BATCH_TIMEOUT = "BATCH_TIMEOUT";
    public static final String DEFAULT_LLM_PROVIDER = "DEFAULT_LLM_PROVIDER";

    private EnvironmentOverrides() {
        // Utility class
    }

    /**
     * Applies overrides from the process environment.
     */
    public static DispatcherConfig applySystem(DispatcherConfig config) {
        return apply(config, System.getenv());
    }

    /**
     * Applies overrides from {@code env} to {@code config} in place.
     *
     * @throws ConfigLoader.ConfigurationException for a value that cannot be parsed
     */
    public static DispatcherConfig apply(DispatcherConfig config, Map<String, String> env) {
        String strategy = value(env, ROTATION_STRATEGY);
        if (strategy != null) {
            config.getRotation().setStrategy(strategy.toLowerCase(Locale.ROOT));
            log.info("Override applied: {}={}", ROTATION_STRATEGY, strategy);
        }

        String maxParallel = value(env, MAX_PARALLEL_API_KEYS);
        if (maxParallel != null) {
            config.getDispatch().setMaxParallelApiKeys(parseInt(MAX_PARALLEL_API_KEYS, maxParallel));
            log.info("Override applied: {}={}", MAX_PARALLEL_API_KEYS, maxParallel);
        }

        String callTimeout = value(env, API_CALL_TIMEOUT);
        if (callTimeout != null) {
            config.getDispatch().setApiCallTimeoutMs(parseInt(API_CALL_TIMEOUT, callTimeout) * 1000L);
            log.info("Override applied: {}={}s", API_CALL_TIMEOUT, callTimeout);
        }

        String retryTimeout = value(env, API_RETRY_TIMEOUT);
        if (retryTimeout != null) {
            config.getDispatch().setApiRetryTimeoutMs(parseInt(API_RETRY_TIMEOUT, retryTimeout) * 1000L);
            log.info("Override applied: {}={}s", API_RETRY_TIMEOUT, retryTimeout);
        }

        String fastFailover = value(env, ENABLE_FAST_FAILOVER);
        if (fastFailover != null) {
            config.getDispatch().setEnableFastFailover(parseBoolean(ENABLE_FAST_FAILOVER, fastFailover));
            log.info("Override applied: {}={}", ENABLE_FAST_FAILOVER, fastFailover);
        }

        String maxBatchSize = value(env, MAX_BATCH_SIZE);
        if (maxBatchSize != null) {
            config.getBatch().setMaxBatchSize(parseInt(MAX_BATCH_SIZE, maxBatchSize));
            log.info("Override applied: {}={}", MAX_BATCH_SIZE, maxBatchSize);
        }

        String batchTimeout = value(env, BATCH_TIMEOUT);
        if (batchTimeout != null) {
            config.getBatch().setBatchTimeoutMs(parseInt(BATCH_TIMEOUT, batchTimeout) * 1000L);
            log.info("Override applied: {}={}s", BATCH_TIMEOUT, batchTimeout);
        }

        String defaultProvider = value(env, DEFAULT_LLM_PROVIDER);
        if (defaultProvider != null) {
            config.setDefaultProvider(defaultProvider.toLowerCase(Locale.ROOT));
            log.info("Override applied: {}={}", DEFAULT_LLM_PROVIDER, defaultProvider);
        }

        for (DispatcherConfig.ProviderConfig provider : config.getProviders()) {
            applyProviderKeys(provider, env);
        }
        return config;
    }

    private static void applyProviderKeys(DispatcherConfig.ProviderConfig provider, Map<String, String> env) {
        if (provider.getId() == null) {
            return;
        }
        String prefix = provider.getId().toUpperCase(Locale.ROOT).replace('-', '_');

        String keys = value(env, prefix + "_API_KEYS");
        if (keys != null) {
            List<String> parsed = Arrays.stream(keys.split(","))
                    .map(String::trim)
                    .filter(k -> !k.isEmpty())
                    .toList();
            provider.setApiKeys(parsed);
            log.info("Override applied: {}_API_KEYS ({} keys)", prefix, parsed.size());
            return;
        }

        String single = value(env, prefix + "_API_KEY");
        if (single != null) {
            provider.setApiKeys(List.of(single.trim()));
            log.info("Override applied: {}_API_KEY (1 key)", prefix);
        }
    }

    private static String value(Map<String, String> env, String name) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim();
    }

    static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoader.ConfigurationException(name + " must be an integer, got '" + raw + "'", e);
        }
    }

    static boolean parseBoolean(String name, String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new ConfigLoader.ConfigurationException(
                    name + " must be a boolean (true/false, 1/0, yes/no, on/off), got '" + raw + "'");
        };
    }
}
