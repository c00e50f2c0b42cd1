package fr.lapetina.llm.dispatcher.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Terminal outcome of a {@link CallRequest}: a provider response or a structured failure,
 * always with the full attempt history. Immutable and thread-safe.
 */
public record CallResult(
        String requestId,
        String providerId,
        RequestState state,
        ProviderResponse response,
        ErrorType errorType,
        String errorMessage,
        List<CallAttempt> attempts,
        Instant completedAt
) {
    public CallResult {
        Objects.requireNonNull(requestId, "Request ID is required");
        Objects.requireNonNull(state, "State is required");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Result state must be terminal: " + state);
        }
        if (state == RequestState.SUCCEEDED && response == null) {
            throw new IllegalArgumentException("Successful result requires a response");
        }
        if (state != RequestState.SUCCEEDED && errorType == null) {
            throw new IllegalArgumentException("Failed result requires an error type");
        }
        attempts = attempts != null ? List.copyOf(attempts) : List.of();
        Objects.requireNonNull(completedAt, "Completion time is required");
    }

    public boolean isSuccess() {
        return state == RequestState.SUCCEEDED;
    }

    public boolean isError() {
        return state != RequestState.SUCCEEDED;
    }

    public int attemptCount() {
        return attempts.size();
    }

    public static CallResult success(
            CallRequest request,
            ProviderResponse response,
            List<CallAttempt> attempts,
            Instant completedAt
    ) {
        return new CallResult(
                request.requestId(), request.providerId(), RequestState.SUCCEEDED,
                response, null, null, attempts, completedAt
        );
    }

    public static CallResult failure(
            CallRequest request,
            RequestState state,
            ErrorType errorType,
            String errorMessage,
            List<CallAttempt> attempts,
            Instant completedAt
    ) {
        return new CallResult(
                request.requestId(), request.providerId(), state,
                null, errorType, errorMessage, attempts, completedAt
        );
    }

    public static CallResult poolExhausted(CallRequest request, List<CallAttempt> attempts, Instant completedAt) {
        return failure(
                request, RequestState.FAILED_POOL_EXHAUSTED, ErrorType.POOL_EXHAUSTED,
                "No usable credential for provider: " + request.providerId(), attempts, completedAt
        );
    }
}
