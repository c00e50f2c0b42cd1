package fr.lapetina.llm.dispatcher.domain.event;

import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import fr.lapetina.llm.dispatcher.domain.model.CallResult;
import fr.lapetina.llm.dispatcher.domain.model.ErrorType;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * Mutable holder reused across the ring buffer. Each handler stage updates it as the
 * request moves through the pipeline. Never accessed outside the pipeline handlers:
 * dispatch workers receive the request and the future, not the event.
 */
public final class CallRequestEvent {

    private CallRequest request;
    private CompletableFuture<CallResult> resultFuture;

    private EventState state;
    private ErrorType errorType;
    private String errorMessage;

    private Instant acceptedAt;
    private Instant validatedAt;
    private Instant dispatchedAt;

    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.request = null;
        this.resultFuture = null;
        this.state = null;
        this.errorType = null;
        this.errorMessage = null;
        this.acceptedAt = null;
        this.validatedAt = null;
        this.dispatchedAt = null;
        this.sequence = -1;
    }

    /**
     * Initializes the event with a new request.
     */
    public void initialize(CallRequest request, CompletableFuture<CallResult> resultFuture) {
        clear();
        this.request = request;
        this.resultFuture = resultFuture;
        this.state = EventState.CREATED;
        this.acceptedAt = Instant.now();
    }

    public CallRequest getRequest() {
        return request;
    }

    public CompletableFuture<CallResult> getResultFuture() {
        return resultFuture;
    }

    public EventState getState() {
        return state;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markValidated() {
        this.state = EventState.VALIDATED;
        this.validatedAt = Instant.now();
    }

    public void markValidationFailed(String message) {
        this.state = EventState.VALIDATION_FAILED;
        this.errorType = ErrorType.VALIDATION_ERROR;
        this.errorMessage = message;
    }

    public void markDispatched() {
        this.state = EventState.DISPATCHED;
        this.dispatchedAt = Instant.now();
    }

    public void markRejected(String message) {
        this.state = EventState.REJECTED;
        this.errorType = ErrorType.INTERNAL_ERROR;
        this.errorMessage = message;
    }

    /**
     * Whether the dispatch stage must not hand this event to a worker.
     */
    public boolean shouldSkip() {
        return state == EventState.VALIDATION_FAILED || state == EventState.REJECTED;
    }

    @Override
    public String toString() {
        return "CallRequestEvent{" +
                "requestId=" + (request != null ? request.requestId() : "null") +
                ", providerId=" + (request != null ? request.providerId() : "null") +
                ", state=" + state +
                ", seq=" + sequence +
                '}';
    }
}
