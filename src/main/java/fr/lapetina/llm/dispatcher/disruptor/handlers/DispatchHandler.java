package fr.lapetina.llm.dispatcher.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llm.dispatcher.dispatch.CallDispatcher;
import fr.lapetina.llm.dispatcher.disruptor.exception.BackpressureException;
import fr.lapetina.llm.dispatcher.domain.event.CallRequestEvent;
import fr.lapetina.llm.dispatcher.domain.event.EventState;
import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import fr.lapetina.llm.dispatcher.domain.model.CallResult;
import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.domain.model.RequestState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Second stage handler: hands validated requests to the dispatch workers.
 *
 * Dispatching blocks on provider calls, so it never runs on the ring buffer thread.
 * The worker only receives the request and the caller's future; the event itself is
 * cleared by the completion stage and reused.
 */
public final class DispatchHandler implements EventHandler<CallRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final CallDispatcher dispatcher;
    private final Executor workers;
    private final Clock clock;

    public DispatchHandler(CallDispatcher dispatcher, Executor workers, Clock clock) {
        this.dispatcher = dispatcher;
        this.workers = workers;
        this.clock = clock;
    }

    @Override
    public void onEvent(CallRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            completeWithValidationError(event);
            return;
        }

        if (event.getState() != EventState.VALIDATED) {
            event.markValidationFailed("Invalid state for dispatch: " + event.getState());
            completeWithValidationError(event);
            return;
        }

        CallRequest request = event.getRequest();
        CompletableFuture<CallResult> future = event.getResultFuture();

        try {
            workers.execute(() -> run(request, future));
            event.markDispatched();
            log.debug("Request handed to worker: requestId={}, providerId={}, sequence={}",
                    request.requestId(), request.providerId(), sequence);
        } catch (RejectedExecutionException e) {
            event.markRejected("Dispatch workers saturated");
            log.warn("Request rejected, workers saturated: requestId={}, providerId={}",
                    request.requestId(), request.providerId());
            future.completeExceptionally(new BackpressureException(
                    BackpressureException.BackpressureReason.WORKERS_SATURATED,
                    "requestId=" + request.requestId()));
        }
    }

    private void run(CallRequest request, CompletableFuture<CallResult> future) {
        try {
            future.complete(dispatcher.dispatch(request));
        } catch (RuntimeException e) {
            log.error("Dispatch failed unexpectedly: requestId={}, providerId={}",
                    request.requestId(), request.providerId(), e);
            future.complete(CallResult.failure(request, RequestState.FAILED_NONRETRYABLE,
                    ErrorType.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    List.of(), clock.instant()));
        }
    }

    private void completeWithValidationError(CallRequestEvent event) {
        CompletableFuture<CallResult> future = event.getResultFuture();
        if (future == null || future.isDone() || event.getState() != EventState.VALIDATION_FAILED) {
            return;
        }
        CallRequest request = event.getRequest();
        if (request == null) {
            future.completeExceptionally(new IllegalArgumentException(event.getErrorMessage()));
            return;
        }
        future.complete(CallResult.failure(request, RequestState.FAILED_NONRETRYABLE,
                ErrorType.VALIDATION_ERROR, event.getErrorMessage(), List.of(), clock.instant()));
    }
}
