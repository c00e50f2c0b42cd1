package fr.lapetina.llm.dispatcher.domain.model;

import java.time.Instant;

/**
 * Point-in-time view of a credential's health, safe to expose outside the pool.
 */
public record CredentialStatus(
        String id,
        String providerId,
        String maskedKey,
        int consecutiveFailures,
        Instant quarantinedUntil,
        Instant lastUsedAt,
        boolean quarantined
) {
    public static CredentialStatus of(Credential credential, Instant now) {
        return new CredentialStatus(
                credential.getId(),
                credential.getProviderId(),
                credential.maskedKey(),
                credential.getConsecutiveFailures(),
                credential.getQuarantinedUntil(),
                credential.getLastUsedAt(),
                credential.isQuarantinedAt(now)
        );
    }
}
