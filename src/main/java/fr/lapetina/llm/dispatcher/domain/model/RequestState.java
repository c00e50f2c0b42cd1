package fr.lapetina.llm.dispatcher.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single call request.
 *
 * <pre>
 * PENDING -> DISPATCHED -> SUCCEEDED
 *                       -> RETRYING -> DISPATCHED
 *                       -> FAILED_EXHAUSTED | FAILED_NONRETRYABLE
 * PENDING | RETRYING   -> FAILED_POOL_EXHAUSTED
 * </pre>
 *
 * PENDING is the only initial state. A batch timeout may end any non-terminal state
 * in FAILED_EXHAUSTED.
 */
public enum RequestState {
    PENDING,
    DISPATCHED,
    RETRYING,
    SUCCEEDED,
    FAILED_EXHAUSTED,
    FAILED_NONRETRYABLE,
    FAILED_POOL_EXHAUSTED;

    public boolean isTerminal() {
        return switch (this) {
            case SUCCEEDED, FAILED_EXHAUSTED, FAILED_NONRETRYABLE, FAILED_POOL_EXHAUSTED -> true;
            default -> false;
        };
    }

    public boolean isFailure() {
        return isTerminal() && this != SUCCEEDED;
    }

    /**
     * States reachable from this one in a single step.
     */
    public Set<RequestState> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(DISPATCHED, FAILED_POOL_EXHAUSTED, FAILED_EXHAUSTED);
            case DISPATCHED -> EnumSet.of(SUCCEEDED, RETRYING, FAILED_EXHAUSTED, FAILED_NONRETRYABLE);
            case RETRYING -> EnumSet.of(DISPATCHED, FAILED_POOL_EXHAUSTED, FAILED_EXHAUSTED);
            default -> EnumSet.noneOf(RequestState.class);
        };
    }

    public boolean canTransitionTo(RequestState next) {
        return successors().contains(next);
    }
}
