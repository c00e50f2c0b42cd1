package fr.lapetina.llm.dispatcher.dispatch;

import fr.lapetina.llm.dispatcher.domain.model.CallRequest;

import java.time.Duration;
import java.util.Objects;

/**
 * Resolved dispatch limits shared by the dispatcher, the racer and the batch coordinator.
 */
public record DispatchSettings(
        int maxParallelApiKeys,
        Duration callTimeout,
        Duration retryTimeout,
        int maxRetries,
        boolean enableFastFailover,
        int maxBatchSize,
        Duration batchTimeout,
        int defaultConcurrencyLimit
) {
    public static final int DEFAULT_MAX_PARALLEL_API_KEYS = 5;
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_RETRY_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final int DEFAULT_MAX_BATCH_SIZE = 10;
    public static final Duration DEFAULT_BATCH_TIMEOUT = Duration.ofSeconds(30);

    public DispatchSettings {
        if (maxParallelApiKeys < 1) {
            throw new IllegalArgumentException("maxParallelApiKeys must be >= 1");
        }
        requirePositive(callTimeout, "callTimeout");
        requirePositive(retryTimeout, "retryTimeout");
        requirePositive(batchTimeout, "batchTimeout");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be >= 1");
        }
        if (defaultConcurrencyLimit < 1) {
            throw new IllegalArgumentException("defaultConcurrencyLimit must be >= 1");
        }
    }

    public static DispatchSettings defaults() {
        return builder().build();
    }

    /**
     * Timeout for the given attempt of a request: the call timeout for the first attempt,
     * the retry timeout for the following ones. Per-request overrides win.
     */
    public Duration timeoutFor(CallRequest request, int attemptNumber) {
        if (attemptNumber <= 1) {
            return request.callTimeout() != null ? request.callTimeout() : callTimeout;
        }
        return request.retryTimeout() != null ? request.retryTimeout() : retryTimeout;
    }

    public int maxRetriesFor(CallRequest request) {
        return request.maxRetries() != null ? request.maxRetries() : maxRetries;
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " is required");
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxParallelApiKeys = DEFAULT_MAX_PARALLEL_API_KEYS;
        private Duration callTimeout = DEFAULT_CALL_TIMEOUT;
        private Duration retryTimeout = DEFAULT_RETRY_TIMEOUT;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private boolean enableFastFailover = true;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
        private Duration batchTimeout = DEFAULT_BATCH_TIMEOUT;
        private int defaultConcurrencyLimit = DEFAULT_MAX_PARALLEL_API_KEYS;

        public Builder maxParallelApiKeys(int maxParallelApiKeys) {
            this.maxParallelApiKeys = maxParallelApiKeys;
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

        public Builder enableFastFailover(boolean enableFastFailover) {
            this.enableFastFailover = enableFastFailover;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder batchTimeout(Duration batchTimeout) {
            this.batchTimeout = batchTimeout;
            return this;
        }

        public Builder defaultConcurrencyLimit(int defaultConcurrencyLimit) {
            this.defaultConcurrencyLimit = defaultConcurrencyLimit;
            return this;
        }

        public DispatchSettings build() {
            return new DispatchSettings(
                    maxParallelApiKeys,
                    callTimeout,
                    retryTimeout,
                    maxRetries,
                    enableFastFailover,
                    maxBatchSize,
                    batchTimeout,
                    defaultConcurrencyLimit
            );
        }
    }
}
