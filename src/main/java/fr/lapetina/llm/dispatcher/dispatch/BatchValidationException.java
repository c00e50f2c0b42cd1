package fr.lapetina.llm.dispatcher.dispatch;

/**
 * Thrown when a batch is rejected before any worker is scheduled.
 */
public final class BatchValidationException extends RuntimeException {

    private final int batchSize;

    public BatchValidationException(String message, int batchSize) {
        super(message);
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
