package fr.lapetina.llm.dispatcher.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llm.dispatcher.domain.event.CallRequestEvent;
import fr.lapetina.llm.dispatcher.domain.event.EventState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Final stage handler: logs the pipeline summary and clears the event for reuse.
 */
public final class CompletionHandler implements EventHandler<CallRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(CallRequestEvent event, long sequence, boolean endOfBatch) {
        try {
            logSummary(event);
        } finally {
            // Clear event for reuse
            event.clear();
        }
    }

    private void logSummary(CallRequestEvent event) {
        if (event.getRequest() == null) {
            return;
        }

        String requestId = event.getRequest().requestId();
        String providerId = event.getRequest().providerId();
        long pipelineMs = event.getAcceptedAt() != null
                ? Duration.between(event.getAcceptedAt(), Instant.now()).toMillis()
                : 0;

        if (event.getState() == EventState.DISPATCHED) {
            log.debug("Request left pipeline: requestId={}, providerId={}, pipelineMs={}",
                    requestId, providerId, pipelineMs);
        } else {
            log.warn("Request dropped by pipeline: requestId={}, providerId={}, state={}, errorType={}, errorMessage={}",
                    requestId, providerId, event.getState(), event.getErrorType(), event.getErrorMessage());
        }
    }
}
