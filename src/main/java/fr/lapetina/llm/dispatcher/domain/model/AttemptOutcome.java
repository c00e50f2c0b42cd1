package fr.lapetina.llm.dispatcher.domain.model;

/**
 * Outcome of a single provider call attempt.
 */
public enum AttemptOutcome {
    SUCCESS,
    TIMEOUT,
    ERROR
}
