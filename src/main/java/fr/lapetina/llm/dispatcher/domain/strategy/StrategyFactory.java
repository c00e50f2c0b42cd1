package fr.lapetina.llm.dispatcher.domain.strategy;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for creating rotation strategies by configuration name.
 *
 * Names are case-insensitive and accept either '_' or '-' as separator,
 * so {@code round_robin}, {@code ROUND_ROBIN} and {@code round-robin} are equivalent.
 */
public final class StrategyFactory {

    public static final String DEFAULT_STRATEGY = "round_robin";

    private static final Map<String, Supplier<RotationStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("round_robin", RoundRobinStrategy::new);
        register("random", RandomStrategy::new);
        register("failover", FailoverStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<RotationStrategy> supplier) {
        REGISTRY.put(normalize(name), supplier);
    }

    /**
     * Creates a strategy by name.
     *
     * @param name Strategy name from configuration
     * @return Strategy instance, or empty if not found
     */
    public static Optional<RotationStrategy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<RotationStrategy> supplier = REGISTRY.get(normalize(name));
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Creates a strategy by name, falling back to round-robin.
     */
    public static RotationStrategy createOrDefault(String name) {
        return create(name).orElseGet(RoundRobinStrategy::new);
    }

    public static boolean isRegistered(String name) {
        return name != null && REGISTRY.containsKey(normalize(name));
    }

    /**
     * Returns all registered strategy names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
