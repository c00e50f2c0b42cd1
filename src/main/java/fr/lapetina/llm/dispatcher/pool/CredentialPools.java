package fr.lapetina.llm.dispatcher.pool;

import fr.lapetina.llm.dispatcher.domain.strategy.RotationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of credential pools keyed by provider id.
 *
 * Pools are registered once at startup and live for the whole process.
 */
public final class CredentialPools {

    private static final Logger log = LoggerFactory.getLogger(CredentialPools.class);

    private final Map<String, CredentialPool> pools = new ConcurrentHashMap<>();

    /**
     * Registers a pool. A provider can only own one pool.
     */
    public void register(CredentialPool pool) {
        CredentialPool previous = pools.putIfAbsent(pool.getProviderId(), pool);
        if (previous != null) {
            throw new IllegalStateException("Pool already registered for provider: " + pool.getProviderId());
        }
        log.info("Pool registered: {}", pool);
    }

    public Optional<CredentialPool> get(String providerId) {
        if (providerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(pools.get(providerId));
    }

    /**
     * Gets the pool for a provider.
     *
     * @throws IllegalArgumentException if no pool is registered for the provider
     */
    public CredentialPool require(String providerId) {
        return get(providerId).orElseThrow(() ->
                new IllegalArgumentException("No credential pool for provider: " + providerId));
    }

    public boolean contains(String providerId) {
        return providerId != null && pools.containsKey(providerId);
    }

    public Set<String> providerIds() {
        return Set.copyOf(pools.keySet());
    }

    public List<CredentialPool> all() {
        return new ArrayList<>(pools.values());
    }

    /**
     * Applies a rotation strategy to every pool. Each pool gets its own instance.
     */
    public void applyStrategy(Supplier<RotationStrategy> strategySupplier) {
        for (CredentialPool pool : pools.values()) {
            pool.setStrategy(strategySupplier.get());
        }
    }

    public int size() {
        return pools.size();
    }
}
