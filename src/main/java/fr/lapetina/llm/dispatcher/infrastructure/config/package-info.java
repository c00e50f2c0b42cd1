/**
 * Configuration loading, environment overrides and hot-reload support.
 *
 * <p>YAML is parsed into {@link fr.lapetina.llm.dispatcher.infrastructure.config.DispatcherConfig},
 * then environment variables are applied on top and the result is validated.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.dispatcher.infrastructure.config.DispatcherConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.llm.dispatcher.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.llm.dispatcher.infrastructure.config.EnvironmentOverrides} - Environment variables over YAML</li>
 *   <li>{@link fr.lapetina.llm.dispatcher.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Hot-Reload</h2>
 * <p>Only the rotation strategy is swapped at runtime. Other changes are logged and take
 * effect after restart.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code providers} - Provider endpoints and their API keys</li>
 *   <li>{@code rotation} - Rotation strategy and quarantine thresholds</li>
 *   <li>{@code dispatch} - Call and retry timeouts, retry budget, fast failover</li>
 *   <li>{@code batch} - Batch size limit, batch timeout, default concurrency</li>
 *   <li>{@code pipeline} - Ring buffer and worker settings</li>
 *   <li>{@code timeouts} - Connection timeout</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.llm.dispatcher.infrastructure.config;
