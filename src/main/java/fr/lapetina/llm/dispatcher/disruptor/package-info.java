/**
 * LMAX Disruptor-based pipeline for asynchronous call submission.
 *
 * <p>Callers publish {@link fr.lapetina.llm.dispatcher.domain.model.CallRequest}s into a
 * pre-allocated ring buffer and receive a future of the terminal
 * {@link fr.lapetina.llm.dispatcher.domain.model.CallResult}. Publishing is lock-free and a
 * full ring buffer is reported at once, which gives callers a clear backpressure signal.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Validation → Dispatch hand-off → Metrics → Completion
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.dispatcher.disruptor.DispatchPipeline} - Pipeline orchestrator</li>
 *   <li>{@link fr.lapetina.llm.dispatcher.disruptor.exception.BackpressureException} - Thrown when ring buffer is full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.llm.dispatcher.disruptor;
