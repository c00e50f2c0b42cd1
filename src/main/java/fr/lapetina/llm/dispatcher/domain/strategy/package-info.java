/**
 * Credential rotation strategies.
 *
 * <p>Strategies are stateless selectors. The rotation cursor lives in the
 * {@link fr.lapetina.llm.dispatcher.pool.CredentialPool}, which invokes a strategy inside its
 * critical section so that selecting and advancing happen as one step.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code round_robin}</td><td>Cycles through healthy credentials in order</td></tr>
 *   <tr><td>{@code random}</td><td>Uniform choice among healthy credentials</td></tr>
 *   <tr><td>{@code failover}</td><td>Lowest-index healthy credential</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * RotationStrategy strategy = StrategyFactory.create("failover").orElseThrow();
 * CredentialPool pool = new CredentialPool("gemini", credentials, strategy, policy, Clock.systemUTC());
 * }</pre>
 *
 * @see fr.lapetina.llm.dispatcher.domain.strategy.RotationStrategy
 * @see fr.lapetina.llm.dispatcher.domain.strategy.StrategyFactory
 */
package fr.lapetina.llm.dispatcher.domain.strategy;
