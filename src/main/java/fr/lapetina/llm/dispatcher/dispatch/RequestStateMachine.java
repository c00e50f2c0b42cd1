package fr.lapetina.llm.dispatcher.dispatch;

import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.domain.model.RequestState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded state machine for one request.
 *
 * Owns the retry budget and the classification of failures, so the dispatch loop only
 * asks what to do next. Not thread-safe: one instance per request, driven by one worker.
 *
 * <pre>
 * PENDING -> DISPATCHED -> SUCCEEDED
 *                       -> RETRYING -> DISPATCHED
 *                       -> FAILED_EXHAUSTED | FAILED_NONRETRYABLE
 * PENDING | RETRYING   -> FAILED_POOL_EXHAUSTED
 * </pre>
 */
public final class RequestStateMachine {

    private final String requestId;
    private final int maxRetries;
    private final int maxAuthRotations;
    private final List<RequestState> history = new ArrayList<>();

    private RequestState state = RequestState.PENDING;
    private int retriesUsed;
    private int authRotations;

    /**
     * @param requestId        request this machine tracks
     * @param maxRetries       retries allowed after the first attempt
     * @param maxAuthRotations auth failures that may rotate to another key without charging
     *                         the retry budget (usually the pool size)
     */
    public RequestStateMachine(String requestId, int maxRetries, int maxAuthRotations) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.requestId = Objects.requireNonNull(requestId, "Request ID is required");
        this.maxRetries = maxRetries;
        this.maxAuthRotations = Math.max(0, maxAuthRotations);
        history.add(state);
    }

    /**
     * Moves to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public void transition(RequestState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Invalid transition for request " + requestId
                    + ": " + state + " -> " + next);
        }
        state = next;
        history.add(next);
    }

    public void dispatched() {
        transition(RequestState.DISPATCHED);
    }

    public void succeeded() {
        transition(RequestState.SUCCEEDED);
    }

    public void poolExhausted() {
        transition(RequestState.FAILED_POOL_EXHAUSTED);
    }

    /**
     * Applies a failed attempt and returns the resulting state.
     *
     * <ul>
     *   <li>{@code AUTH_ERROR}: RETRYING without charging the budget, while rotations remain</li>
     *   <li>other non-retryable kinds: FAILED_NONRETRYABLE</li>
     *   <li>retryable kinds: RETRYING while the budget lasts, then FAILED_EXHAUSTED</li>
     * </ul>
     */
    public RequestState onFailure(ErrorType errorType) {
        Objects.requireNonNull(errorType, "Error type is required");
        if (state != RequestState.DISPATCHED) {
            throw new IllegalStateException("Failure reported for request " + requestId
                    + " while " + state);
        }

        if (errorType == ErrorType.AUTH_ERROR && authRotations < maxAuthRotations) {
            authRotations++;
            transition(RequestState.RETRYING);
        } else if (!errorType.isRetryable()) {
            transition(RequestState.FAILED_NONRETRYABLE);
        } else if (retriesUsed < maxRetries) {
            retriesUsed++;
            transition(RequestState.RETRYING);
        } else {
            transition(RequestState.FAILED_EXHAUSTED);
        }
        return state;
    }

    /**
     * Ends the request as exhausted from any non-terminal state. Used when the request is
     * abandoned (batch deadline, interruption).
     */
    public void abandon() {
        if (!state.isTerminal()) {
            transition(RequestState.FAILED_EXHAUSTED);
        }
    }

    public RequestState getState() {
        return state;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public int getRetriesUsed() {
        return retriesUsed;
    }

    public int getRetriesLeft() {
        return maxRetries - retriesUsed;
    }

    public int getAuthRotations() {
        return authRotations;
    }

    public List<RequestState> getHistory() {
        return List.copyOf(history);
    }

    @Override
    public String toString() {
        return "RequestStateMachine{" +
                "requestId='" + requestId + '\'' +
                ", state=" + state +
                ", retries=" + retriesUsed + "/" + maxRetries +
                '}';
    }
}
