package fr.lapetina.llm.dispatcher.infrastructure.metrics;

import fr.lapetina.llm.dispatcher.dispatch.DispatchObserver;
import fr.lapetina.llm.dispatcher.domain.event.EventState;
import fr.lapetina.llm.dispatcher.domain.model.BatchResult;
import fr.lapetina.llm.dispatcher.domain.model.CallAttempt;
import fr.lapetina.llm.dispatcher.domain.model.CallResult;
import fr.lapetina.llm.dispatcher.domain.model.Credential;
import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.pool.CredentialPool;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Attempt counters and latency per provider and credential
 * - Error counters by type
 * - Terminal result counters by state
 * - Batch duration
 * - Credential health gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements DispatchObserver, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "llm_dispatcher";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> attemptTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> resultCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> eventCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();

    private final Timer batchTimer;
    private final Counter batchTimeoutCounter;
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.batchTimer = Timer.builder(prefix + "_batch_duration")
                .description("Wall-clock duration of batch runs")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        this.batchTimeoutCounter = Counter.builder(prefix + "_batch_timeouts_total")
                .description("Batches cut off by the batch timeout")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the ring buffer")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    @Override
    public void onAttempt(String providerId, CallAttempt attempt) {
        String outcome = attempt.outcome().name();
        String key = providerId + ":" + attempt.credentialId() + ":" + outcome;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Provider call attempts")
                        .tag("provider", providerId)
                        .tag("credential", attempt.credentialId())
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        attemptTimers.computeIfAbsent(providerId + ":" + attempt.credentialId(), k ->
                Timer.builder(prefix + "_attempt_latency")
                        .description("Provider call attempt latency")
                        .tag("provider", providerId)
                        .tag("credential", attempt.credentialId())
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(attempt.latency());

        if (attempt.errorType() != null) {
            incrementErrorCount(providerId, attempt.errorType());
        }
    }

    @Override
    public void onResult(CallResult result) {
        String providerId = result.providerId() != null ? result.providerId() : "unknown";
        String state = result.state().name();
        resultCounters.computeIfAbsent(providerId + ":" + state, k ->
                Counter.builder(prefix + "_results_total")
                        .description("Terminal request results")
                        .tag("provider", providerId)
                        .tag("state", state)
                        .register(registry)
        ).increment();
    }

    @Override
    public void onBatch(BatchResult result) {
        batchTimer.record(result.elapsed());
        if (result.timedOut()) {
            batchTimeoutCounter.increment();
        }
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String providerId, ErrorType errorType) {
        String key = providerId + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Attempt errors by type")
                        .tag("provider", providerId)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts pipeline events by the state they left the ring buffer in.
     */
    public void incrementEventCount(String providerId, EventState state) {
        String key = providerId + ":" + state.name();
        eventCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_pipeline_events_total")
                        .description("Submitted requests by pipeline outcome")
                        .tag("provider", providerId)
                        .tag("state", state.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records stage-specific latency (validation, handoff).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Registers health gauges for a pool: healthy credential count and, per credential,
     * 1 while quarantined and 0 otherwise.
     */
    public void registerPool(CredentialPool pool, Clock clock) {
        Gauge.builder(prefix + "_healthy_credentials", pool, CredentialPool::healthyCount)
                .description("Credentials currently eligible for selection")
                .tag("provider", pool.getProviderId())
                .register(registry);

        for (Credential credential : pool.getCredentials()) {
            Gauge.builder(prefix + "_credential_quarantined", credential,
                            c -> c.isQuarantinedAt(clock.instant()) ? 1 : 0)
                    .description("Whether the credential is quarantined (1) or not (0)")
                    .tag("provider", pool.getProviderId())
                    .tag("credential", credential.getId())
                    .register(registry);
        }
    }

    /**
     * Updates the ring buffer remaining capacity.
     */
    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
