package fr.lapetina.llm.dispatcher.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llm.dispatcher.domain.event.CallRequestEvent;
import fr.lapetina.llm.dispatcher.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Third stage handler: records pipeline metrics and sets MDC context.
 *
 * Records:
 * - Submitted requests by provider and pipeline outcome
 * - Validation and hand-off latency
 * - Rejections
 *
 * Request outcomes are recorded by the dispatchers, not here: the worker may still be
 * running when the event reaches this stage.
 */
public final class MetricsHandler implements EventHandler<CallRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(CallRequestEvent event, long sequence, boolean endOfBatch) {
        setupMDC(event);

        try {
            recordMetrics(event);
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(CallRequestEvent event) {
        if (event.getRequest() != null) {
            MDC.put("requestId", event.getRequest().requestId());
            MDC.put("providerId", event.getRequest().providerId());
        }
        MDC.put("eventState", event.getState() != null ? event.getState().name() : "UNKNOWN");
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("providerId");
        MDC.remove("eventState");
    }

    private void recordMetrics(CallRequestEvent event) {
        if (event.getState() == null) {
            return;
        }
        String providerId = event.getRequest() != null ? event.getRequest().providerId() : "unknown";

        metricsRegistry.incrementEventCount(providerId, event.getState());

        if (event.getValidatedAt() != null && event.getAcceptedAt() != null) {
            metricsRegistry.recordStageLatency("validation",
                    Duration.between(event.getAcceptedAt(), event.getValidatedAt()));
        }
        if (event.getDispatchedAt() != null && event.getValidatedAt() != null) {
            metricsRegistry.recordStageLatency("handoff",
                    Duration.between(event.getValidatedAt(), event.getDispatchedAt()));
        }

        if (event.getErrorType() != null) {
            metricsRegistry.incrementErrorCount(providerId, event.getErrorType());
            log.warn("Pipeline error recorded: provider={}, errorType={}, message={}",
                    providerId, event.getErrorType(), event.getErrorMessage());
        }
    }
}
