package fr.lapetina.llm.dispatcher.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A logical call to be dispatched against a provider's credential pool.
 * Immutable and thread-safe.
 *
 * The payload is opaque to the dispatcher and handed untouched to the provider variant.
 * Timeouts and retry count left null fall back to the configured dispatch defaults.
 */
public record CallRequest(
        String requestId,
        String providerId,
        Map<String, Object> payload,
        Duration callTimeout,
        Duration retryTimeout,
        Integer maxRetries,
        Instant createdAt
) {
    public CallRequest {
        Objects.requireNonNull(providerId, "Provider ID is required");
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (callTimeout != null && (callTimeout.isNegative() || callTimeout.isZero())) {
            throw new IllegalArgumentException("Call timeout must be positive");
        }
        if (retryTimeout != null && (retryTimeout.isNegative() || retryTimeout.isZero())) {
            throw new IllegalArgumentException("Retry timeout must be positive");
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("Max retries must not be negative");
        }
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    /**
     * Creates a request using the configured timeouts and retry budget.
     */
    public static CallRequest of(String providerId, Map<String, Object> payload) {
        return new CallRequest(null, providerId, payload, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String providerId;
        private Map<String, Object> payload;
        private Duration callTimeout;
        private Duration retryTimeout;
        private Integer maxRetries;
        private Instant createdAt;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder retryTimeout(Duration retryTimeout) {
            this.retryTimeout = retryTimeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public CallRequest build() {
            return new CallRequest(
                    requestId, providerId, payload, callTimeout, retryTimeout, maxRetries, createdAt
            );
        }
    }
}
