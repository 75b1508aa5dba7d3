/**
 * Table-driven retry decisions with shared budgets.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.resilience.retry.RetryPolicyTable} - Which retry keys are
 *       retryable and with what allowance and delay
 *   <li>{@link express.mvp.myra.resilience.retry.RetryCoordinator} - Evaluates failures and owns
 *       the budgets
 *   <li>{@link express.mvp.myra.resilience.retry.RetryBudget} - Attempt count for one key
 *   <li>{@link express.mvp.myra.resilience.retry.BudgetScope} - Which failures share a budget
 *   <li>{@link express.mvp.myra.resilience.retry.RetryRequestedException} - Marker delivered when
 *       the caller should try again
 * </ul>
 *
 * <h2>Default Table</h2>
 *
 * <ul>
 *   <li><b>NETWORK_TIMEOUT:</b> 3 retries, 1 s apart
 *   <li><b>NETWORK_CONNECTION_FAILED:</b> 3 retries, 2 s apart
 *   <li><b>AUTH_SESSION_EXPIRED:</b> 1 immediate retry
 * </ul>
 */
package express.mvp.myra.resilience.retry;
