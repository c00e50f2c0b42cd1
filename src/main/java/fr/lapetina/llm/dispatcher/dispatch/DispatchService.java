package fr.lapetina.llm.dispatcher.dispatch;

import fr.lapetina.llm.dispatcher.domain.model.BatchJob;
import fr.lapetina.llm.dispatcher.domain.model.BatchResult;
import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import fr.lapetina.llm.dispatcher.domain.model.CallResult;
import fr.lapetina.llm.dispatcher.pool.CredentialPool;
import fr.lapetina.llm.dispatcher.pool.CredentialPools;
import fr.lapetina.llm.dispatcher.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for calling code: one request or a whole batch.
 *
 * A request goes through the {@link FailoverRacer} when fast failover is enabled and its
 * provider pool holds more than one credential, and through the
 * {@link SingleCallDispatcher} otherwise.
 */
public final class DispatchService implements CallDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    private final CredentialPools pools;
    private final ProviderRegistry providers;
    private final DispatchSettings settings;
    private final Clock clock;
    private final SingleCallDispatcher sequential;
    private final FailoverRacer racer;
    private final BatchCoordinator coordinator;

    public DispatchService(
            CredentialPools pools,
            ProviderRegistry providers,
            DispatchSettings settings,
            Clock clock,
            DispatchObserver observer
    ) {
        this.pools = Objects.requireNonNull(pools, "Pools are required");
        this.providers = Objects.requireNonNull(providers, "Providers are required");
        this.settings = Objects.requireNonNull(settings, "Settings are required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.sequential = new SingleCallDispatcher(pools, providers, settings, clock, observer);
        this.racer = new FailoverRacer(pools, providers, settings, clock, observer);
        this.coordinator = new BatchCoordinator(this::dispatcherFor, this::isKnownProvider, settings, clock, observer);

        log.info("DispatchService created: providers={}, fastFailover={}, maxParallelApiKeys={}, maxBatchSize={}",
                pools.providerIds(), settings.enableFastFailover(),
                settings.maxParallelApiKeys(), settings.maxBatchSize());
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public CallResult dispatch(CallRequest request) {
        return dispatchOne(request);
    }

    /**
     * Dispatches one request to completion.
     *
     * @throws IllegalArgumentException if the request targets an unknown provider
     */
    public CallResult dispatchOne(CallRequest request) {
        Objects.requireNonNull(request, "Request is required");
        if (!isKnownProvider(request.providerId())) {
            throw new IllegalArgumentException("Unknown provider: " + request.providerId());
        }
        return dispatcherFor(request).dispatch(request);
    }

    /**
     * Runs requests as one batch with the default concurrency limit.
     *
     * @throws BatchValidationException if the batch is rejected up front
     */
    public BatchResult dispatchBatch(List<CallRequest> requests) {
        return dispatchBatch(new BatchJob(requests, settings.defaultConcurrencyLimit()));
    }

    /**
     * @throws BatchValidationException if the batch is rejected up front
     */
    public BatchResult dispatchBatch(BatchJob job) {
        return coordinator.run(job);
    }

    /**
     * Picks the racer or the sequential dispatcher for a request.
     */
    CallDispatcher dispatcherFor(CallRequest request) {
        CredentialPool pool = pools.require(request.providerId());
        if (settings.enableFastFailover() && pool.size() > 1) {
            return racer;
        }
        return sequential;
    }

    public boolean isKnownProvider(String providerId) {
        return pools.contains(providerId) && providers.contains(providerId);
    }

    public DispatchSettings getSettings() {
        return settings;
    }

    public CredentialPools getPools() {
        return pools;
    }
}
