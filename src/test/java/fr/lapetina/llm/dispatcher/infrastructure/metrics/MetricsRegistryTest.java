package fr.lapetina.llm.dispatcher.infrastructure.metrics;

import fr.lapetina.llm.dispatcher.domain.event.EventState;
import fr.lapetina.llm.dispatcher.domain.model.BatchResult;
import fr.lapetina.llm.dispatcher.domain.model.CallAttempt;
import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import fr.lapetina.llm.dispatcher.domain.model.CallResult;
import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.domain.strategy.RoundRobinStrategy;
import fr.lapetina.llm.dispatcher.pool.CredentialPool;
import fr.lapetina.llm.dispatcher.pool.QuarantinePolicy;
import fr.lapetina.llm.dispatcher.support.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;
    private MeterRegistry registry;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("test");
        registry = metrics.getRegistry();
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count attempts and errors per provider and credential")
    void shouldCountAttempts() {
        metrics.onAttempt("gemini", CallAttempt.failure(1, "gemini-0", Instant.EPOCH,
                ErrorType.RATE_LIMITED, "quota", Duration.ofMillis(20)));
        metrics.onAttempt("gemini", CallAttempt.success(2, "gemini-1", Instant.EPOCH, Duration.ofMillis(30)));

        assertThat(registry.get("test_attempts_total")
                .tags("provider", "gemini", "credential", "gemini-0", "outcome", "ERROR").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("test_attempts_total")
                .tags("credential", "gemini-1", "outcome", "SUCCESS").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("test_errors_total").tags("type", "RATE_LIMITED").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("test_attempt_latency").tag("credential", "gemini-1").timer().count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("should count terminal results and batch timeouts")
    void shouldCountResults() {
        CallRequest request = CallRequest.of("gemini", Map.of());
        CallResult failed = CallResult.poolExhausted(request, List.of(), Instant.EPOCH);

        metrics.onResult(failed);
        metrics.onResult(failed);
        metrics.onBatch(new BatchResult(List.of(failed), Duration.ofMillis(100), true));

        assertThat(registry.get("test_results_total").tag("state", "FAILED_POOL_EXHAUSTED").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("test_batch_timeouts_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_batch_duration").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("should expose pool health gauges that follow quarantine")
    void shouldTrackPoolHealth() {
        MutableClock clock = new MutableClock();
        CredentialPool pool = CredentialPool.of("gemini", List.of("gauge-key-0001", "gauge-key-0002"),
                new RoundRobinStrategy(), QuarantinePolicy.defaults(), clock);
        metrics.registerPool(pool, clock);

        pool.reportFailure(pool.getCredentials().get(0), ErrorType.AUTH_ERROR);

        assertThat(registry.get("test_healthy_credentials").tag("provider", "gemini").gauge().value())
                .isEqualTo(1.0);
        assertThat(registry.get("test_credential_quarantined").tag("credential", "gemini-0").gauge().value())
                .isEqualTo(1.0);
        assertThat(registry.get("test_credential_quarantined").tag("credential", "gemini-1").gauge().value())
                .isZero();
    }

    @Test
    @DisplayName("should render pipeline meters in the Prometheus scrape")
    void shouldScrape() {
        metrics.incrementEventCount("gemini", EventState.VALIDATION_FAILED);
        metrics.recordStageLatency("validation", Duration.ofMillis(1));
        metrics.setRingBufferRemaining(42);

        String scrape = metrics.scrape();

        assertThat(scrape).contains("test_pipeline_events_total");
        assertThat(scrape).contains("test_ringbuffer_remaining 42.0");
        assertThat(scrape).contains("stage=\"validation\"");
    }
}
