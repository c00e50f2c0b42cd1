package fr.lapetina.llm.dispatcher.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One API key bound to one provider.
 *
 * Health fields are written only by the owning {@code CredentialPool} while it holds its
 * lock; they are volatile so diagnostics can read them from any thread.
 */
public final class Credential {

    private final String id;
    private final String providerId;
    private final String apiKey;
    private final int index;

    private volatile int consecutiveFailures;
    private volatile Instant quarantinedUntil;
    private volatile Instant lastUsedAt;

    private Credential(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Credential ID is required");
        this.providerId = Objects.requireNonNull(builder.providerId, "Provider ID is required");
        this.apiKey = Objects.requireNonNull(builder.apiKey, "API key is required");
        this.index = builder.index;
    }

    public String getId() {
        return id;
    }

    public String getProviderId() {
        return providerId;
    }

    /**
     * Raw secret. Only provider variants should read this; never log it.
     */
    public String getApiKey() {
        return apiKey;
    }

    /**
     * Position of this credential in its pool.
     */
    public int getIndex() {
        return index;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public Instant getQuarantinedUntil() {
        return quarantinedUntil;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public boolean isQuarantinedAt(Instant now) {
        Instant until = quarantinedUntil;
        return until != null && until.isAfter(now);
    }

    public String maskedKey() {
        return mask(apiKey);
    }

    // Mutators below are called by CredentialPool under its lock

    public int incrementFailures() {
        consecutiveFailures = consecutiveFailures + 1;
        return consecutiveFailures;
    }

    public void resetFailures() {
        consecutiveFailures = 0;
    }

    public void quarantineUntil(Instant until) {
        this.quarantinedUntil = until;
    }

    public void clearQuarantine() {
        this.quarantinedUntil = null;
    }

    public void markUsed(Instant at) {
        this.lastUsedAt = at;
    }

    static String mask(String key) {
        if (key.length() <= 8) {
            return "****";
        }
        return key.substring(0, 4) + "..." + key.substring(key.length() - 4);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Credential that = (Credential) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Credential{" +
                "id='" + id + '\'' +
                ", key=" + maskedKey() +
                ", failures=" + consecutiveFailures +
                ", quarantinedUntil=" + quarantinedUntil +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String providerId;
        private String apiKey;
        private int index;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Credential build() {
            if (id == null && providerId != null) {
                id = providerId + "-" + index;
            }
            return new Credential(this);
        }
    }
}
