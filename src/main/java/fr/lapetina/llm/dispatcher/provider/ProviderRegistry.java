package fr.lapetina.llm.dispatcher.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit registry of provider variants keyed by provider id.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderCall> providers = new ConcurrentHashMap<>();

    /**
     * Registers a provider variant, replacing any previous one for the same id.
     */
    public void register(ProviderCall provider) {
        ProviderCall previous = providers.put(provider.providerId(), provider);
        if (previous == null) {
            log.info("Provider registered: providerId={}, type={}",
                    provider.providerId(), provider.getClass().getSimpleName());
        } else {
            log.info("Provider replaced: providerId={}, type={}",
                    provider.providerId(), provider.getClass().getSimpleName());
        }
    }

    public Optional<ProviderCall> get(String providerId) {
        if (providerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(providerId));
    }

    /**
     * Gets the variant for a provider.
     *
     * @throws IllegalArgumentException for an unknown provider id
     */
    public ProviderCall require(String providerId) {
        return get(providerId).orElseThrow(() ->
                new IllegalArgumentException("Unknown provider: " + providerId));
    }

    public boolean contains(String providerId) {
        return providerId != null && providers.containsKey(providerId);
    }

    public Set<String> providerIds() {
        return Set.copyOf(providers.keySet());
    }
}
