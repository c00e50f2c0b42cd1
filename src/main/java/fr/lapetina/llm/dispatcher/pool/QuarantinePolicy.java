package fr.lapetina.llm.dispatcher.pool;

import fr.lapetina.llm.dispatcher.domain.model.ErrorType;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Thresholds governing when a credential is taken out of rotation and for how long.
 *
 * The threshold decides when; the error type of the failure that crosses it decides how
 * long. Error types without their own entry use {@code cooldown}.
 *
 * @param failureThreshold   a credential is quarantined once its consecutive failures exceed this value
 * @param cooldown           quarantine length for error types without a specific cooldown
 * @param authErrorCooldown  quarantine length applied at once on an authentication failure
 * @param errorCooldowns     quarantine length per error type
 */
public record QuarantinePolicy(
        int failureThreshold,
        Duration cooldown,
        Duration authErrorCooldown,
        Map<ErrorType, Duration> errorCooldowns
) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 2;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(30);
    public static final Duration DEFAULT_AUTH_ERROR_COOLDOWN = Duration.ofMinutes(10);
    public static final Duration DEFAULT_RATE_LIMIT_COOLDOWN = Duration.ofMinutes(5);
    public static final Duration DEFAULT_TIMEOUT_COOLDOWN = Duration.ofMinutes(2);

    public QuarantinePolicy {
        if (failureThreshold < 0) {
            throw new IllegalArgumentException("Failure threshold must not be negative");
        }
        Objects.requireNonNull(cooldown, "Cooldown is required");
        Objects.requireNonNull(authErrorCooldown, "Auth error cooldown is required");
        if (cooldown.isNegative() || authErrorCooldown.isNegative()) {
            throw new IllegalArgumentException("Cooldowns must not be negative");
        }
        errorCooldowns = errorCooldowns == null ? Map.of() : Map.copyOf(errorCooldowns);
        for (Map.Entry<ErrorType, Duration> entry : errorCooldowns.entrySet()) {
            if (entry.getValue().isNegative()) {
                throw new IllegalArgumentException("Cooldown for " + entry.getKey() + " must not be negative");
            }
        }
    }

    public QuarantinePolicy(int failureThreshold, Duration cooldown, Duration authErrorCooldown) {
        this(failureThreshold, cooldown, authErrorCooldown, Map.of());
    }

    public static QuarantinePolicy defaults() {
        return new QuarantinePolicy(DEFAULT_FAILURE_THRESHOLD, DEFAULT_COOLDOWN, DEFAULT_AUTH_ERROR_COOLDOWN,
                Map.of(ErrorType.RATE_LIMITED, DEFAULT_RATE_LIMIT_COOLDOWN,
                        ErrorType.TIMEOUT, DEFAULT_TIMEOUT_COOLDOWN));
    }

    /**
     * Quarantine length once a failure of {@code errorType} crosses the threshold.
     */
    public Duration cooldownFor(ErrorType errorType) {
        if (errorType == ErrorType.AUTH_ERROR) {
            return authErrorCooldown;
        }
        return errorCooldowns.getOrDefault(errorType, cooldown);
    }
}
