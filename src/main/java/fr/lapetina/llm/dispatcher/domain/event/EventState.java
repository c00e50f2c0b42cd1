package fr.lapetina.llm.dispatcher.domain.event;

/**
 * Lifecycle state of a call request event in the Disruptor pipeline.
 *
 * These states only cover the ring buffer stages. The request's own lifecycle after
 * hand-off is tracked by {@link fr.lapetina.llm.dispatcher.domain.model.RequestState}.
 */
public enum EventState {
    /** Event just claimed, awaiting validation */
    CREATED,

    /** Request validated successfully */
    VALIDATED,

    /** Validation failed, the caller's future is completed with a failure */
    VALIDATION_FAILED,

    /** Request handed to a dispatch worker */
    DISPATCHED,

    /** Worker pool saturated, the caller's future is completed exceptionally */
    REJECTED
}
