package fr.lapetina.llm.dispatcher.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Record of one try against one credential. Never mutated after creation.
 *
 * @param attemptNumber 1-based position in the request's attempt history
 * @param credentialId  credential used for the attempt
 * @param startedAt     when the provider call was issued
 * @param outcome       success, timeout or error
 * @param errorType     classified failure, null on success
 * @param errorMessage  provider or transport message, null on success
 * @param latency       time until the attempt settled
 */
public record CallAttempt(
        int attemptNumber,
        String credentialId,
        Instant startedAt,
        AttemptOutcome outcome,
        ErrorType errorType,
        String errorMessage,
        Duration latency
) {
    public CallAttempt {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(credentialId, "Credential ID is required");
        Objects.requireNonNull(startedAt, "Start time is required");
        Objects.requireNonNull(outcome, "Outcome is required");
        if (latency == null || latency.isNegative()) {
            latency = Duration.ZERO;
        }
    }

    public static CallAttempt success(int attemptNumber, String credentialId, Instant startedAt, Duration latency) {
        return new CallAttempt(attemptNumber, credentialId, startedAt, AttemptOutcome.SUCCESS, null, null, latency);
    }

    public static CallAttempt failure(
            int attemptNumber,
            String credentialId,
            Instant startedAt,
            ErrorType errorType,
            String errorMessage,
            Duration latency
    ) {
        AttemptOutcome outcome = errorType == ErrorType.TIMEOUT ? AttemptOutcome.TIMEOUT : AttemptOutcome.ERROR;
        return new CallAttempt(attemptNumber, credentialId, startedAt, outcome, errorType, errorMessage, latency);
    }

    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS;
    }
}
