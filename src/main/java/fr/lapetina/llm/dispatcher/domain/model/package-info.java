/**
 * Domain model classes for the outbound call dispatcher.
 *
 * <p>Everything here except {@link fr.lapetina.llm.dispatcher.domain.model.Credential} is an
 * immutable value object handed between components and never shared for mutation.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.dispatcher.domain.model.Credential} - One API key; health state owned by its pool</li>
 *   <li>{@link fr.lapetina.llm.dispatcher.domain.model.CallRequest} - Immutable request with opaque payload</li>
 *   <li>{@link fr.lapetina.llm.dispatcher.domain.model.CallAttempt} - Record of one try against one credential</li>
 *   <li>{@link fr.lapetina.llm.dispatcher.domain.model.CallResult} - Terminal outcome plus attempt history</li>
 *   <li>{@link fr.lapetina.llm.dispatcher.domain.model.BatchJob} / {@link fr.lapetina.llm.dispatcher.domain.model.BatchResult} - Index-aligned batch input and output</li>
 *   <li>{@link fr.lapetina.llm.dispatcher.domain.model.RequestState} - Per-request state machine states</li>
 *   <li>{@link fr.lapetina.llm.dispatcher.domain.model.ErrorType} - Retryable / non-retryable error taxonomy</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Records are immutable. {@code Credential} exposes volatile health fields that are only
 * written by {@code CredentialPool} inside its critical section.
 *
 * @see fr.lapetina.llm.dispatcher.domain.model.CallRequest
 * @see fr.lapetina.llm.dispatcher.domain.model.CallResult
 */
package fr.lapetina.llm.dispatcher.domain.model;
