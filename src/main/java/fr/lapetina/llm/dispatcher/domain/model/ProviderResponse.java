package fr.lapetina.llm.dispatcher.domain.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Successful answer from a provider. The body is opaque to the dispatcher.
 */
public record ProviderResponse(
        String providerId,
        String credentialId,
        String body,
        int statusCode,
        Map<String, Object> metadata,
        Instant receivedAt
) {
    public ProviderResponse {
        Objects.requireNonNull(providerId, "Provider ID is required");
        Objects.requireNonNull(credentialId, "Credential ID is required");
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static ProviderResponse of(String providerId, String credentialId, String body) {
        return new ProviderResponse(providerId, credentialId, body, 200, null, null);
    }
}
