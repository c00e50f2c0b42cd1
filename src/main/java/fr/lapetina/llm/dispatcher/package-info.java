/**
 * LLM Dispatcher - outbound call dispatcher for LLM providers with pooled API keys.
 *
 * <p>Calls are spread across a provider's API keys by a rotation strategy. Failing keys are
 * quarantined for a cooldown, failed attempts are retried on other keys, and batches run
 * with bounded concurrency and index-aligned results.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.dispatcher.DispatcherFactory} - Main entry point for creating
 *       a fully wired dispatcher from YAML configuration</li>
 *   <li>{@link fr.lapetina.llm.dispatcher.LlmDispatcherApplication} - Command-line batch runner</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (DispatcherFactory factory = DispatcherFactory.create("dispatcher.yaml").start()) {
 *     CallRequest request = CallRequest.of("gemini", Map.of("contents", "Hello!"));
 *
 *     CallResult result = factory.getDispatchService().dispatchOne(request);
 *     CompletableFuture<CallResult> async = factory.getPipeline().submit(request);
 * }
 * }</pre>
 *
 * @see fr.lapetina.llm.dispatcher.dispatch.DispatchService
 * @see fr.lapetina.llm.dispatcher.disruptor.DispatchPipeline
 */
package fr.lapetina.llm.dispatcher;
