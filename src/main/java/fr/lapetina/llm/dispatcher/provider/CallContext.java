package fr.lapetina.llm.dispatcher.provider;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-attempt context handed to a provider variant.
 *
 * @param attemptNumber 1-based attempt number within the request
 * @param timeout       budget for this attempt
 * @param deadline      instant at which the dispatcher abandons the attempt
 * @param token         cooperative cancellation signal
 */
public record CallContext(int attemptNumber, Duration timeout, Instant deadline, CancellationToken token) {

    public CallContext {
        Objects.requireNonNull(timeout, "Timeout is required");
        Objects.requireNonNull(deadline, "Deadline is required");
        Objects.requireNonNull(token, "Cancellation token is required");
    }

    public static CallContext start(int attemptNumber, Duration timeout, Instant now) {
        return new CallContext(attemptNumber, timeout, now.plus(timeout), new CancellationToken());
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }
}
