package fr.lapetina.llm.dispatcher.domain.model;

/**
 * Error taxonomy for outbound provider calls.
 * Drives retry decisions, pool accounting and metrics.
 */
public enum ErrorType {
    /** Attempt exceeded its deadline */
    TIMEOUT(true, true),

    /** Provider rejected the call for quota or rate reasons */
    RATE_LIMITED(true, true),

    /** Connection, I/O or provider-side 5xx failure */
    TRANSPORT_ERROR(true, true),

    /** Provider rejected the request itself (malformed request semantics) */
    INVALID_RESPONSE(false, false),

    /** Credential is fundamentally broken (revoked, wrong key, no permission) */
    AUTH_ERROR(false, true),

    /** Every credential of the pool is quarantined, or the pool is empty */
    POOL_EXHAUSTED(false, false),

    /** Overall batch wall-clock budget elapsed before the request finished */
    BATCH_TIMEOUT(false, false),

    /** Request rejected before dispatch */
    VALIDATION_ERROR(false, false),

    /** Attempt abandoned by its caller */
    CANCELLED(false, false),

    /** Unexpected failure inside the dispatcher */
    INTERNAL_ERROR(false, false);

    private final boolean retryable;
    private final boolean credentialFault;

    ErrorType(boolean retryable, boolean credentialFault) {
        this.retryable = retryable;
        this.credentialFault = credentialFault;
    }

    /**
     * Whether another attempt with a different credential may succeed.
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Whether the failure is attributed to the credential and must be reported to its pool.
     */
    public boolean isCredentialFault() {
        return credentialFault;
    }
}
