package fr.lapetina.llm.dispatcher.disruptor.exception;

/**
 * Exception thrown when the dispatcher is under backpressure.
 *
 * This occurs when:
 * - Ring buffer is full and cannot accept new requests
 * - Every dispatch worker is busy and the hand-off queue is full
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason) {
        super("Backpressure: " + reason.getMessage());
        this.reason = reason;
    }

    public BackpressureException(BackpressureReason reason, String details) {
        super("Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("Ring buffer is full"),
        WORKERS_SATURATED("All dispatch workers are busy");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
