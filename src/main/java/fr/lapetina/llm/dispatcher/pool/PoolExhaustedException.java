package fr.lapetina.llm.dispatcher.pool;

/**
 * Thrown when a pool has no credential to hand out: it is empty, or every credential
 * is quarantined. Raised immediately, never after waiting.
 */
public final class PoolExhaustedException extends RuntimeException {

    private final String providerId;
    private final int poolSize;

    public PoolExhaustedException(String providerId, int poolSize) {
        super("Credential pool exhausted: provider=" + providerId + ", size=" + poolSize
                + (poolSize == 0 ? " (empty)" : " (all quarantined)"));
        this.providerId = providerId;
        this.poolSize = poolSize;
    }

    public String getProviderId() {
        return providerId;
    }

    public int getPoolSize() {
        return poolSize;
    }
}
