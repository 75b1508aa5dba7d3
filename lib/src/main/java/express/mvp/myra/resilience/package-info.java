/**
 * Resilience layer for client libraries talking to remote services.
 *
 * <p>{@link express.mvp.myra.resilience.Resilience} wires the components configured by
 * {@link express.mvp.myra.resilience.ResilienceConfig}:
 *
 * <ul>
 *   <li>{@code cache} - bounded TTL cache for idempotent reads
 *   <li>{@code error} - error kinds, the error code catalog and classification
 *   <li>{@code retry} - table-driven retry decisions with shared budgets
 *   <li>{@code handler} - logging, reporting and retry of failures
 *   <li>{@code response} - external error payloads
 *   <li>{@code validation} - parameter checks
 * </ul>
 */
package express.mvp.myra.resilience;
