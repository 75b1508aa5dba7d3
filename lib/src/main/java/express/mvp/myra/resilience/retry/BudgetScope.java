package express.mvp.myra.resilience.retry;

/**
 * Decides which failures share a retry budget.
 *
 * <p>The default, {@link #GLOBAL}, keys budgets by retry key alone: every operation failing with
 * {@code NETWORK_TIMEOUT} draws from the same process-wide allowance, even unrelated call sites.
 * {@link #PER_CONTEXT} gives each failure context its own budget.
 *
 * <pre>{@code
 * RetryCoordinator coordinator =
 *     new RetryCoordinator(RetryPolicyTable.defaults(), scheduler, BudgetScope.PER_CONTEXT);
 * }</pre>
 */
@FunctionalInterface
public interface BudgetScope {

    /** One budget per retry key for the whole process. */
    BudgetScope GLOBAL = (retryKey, context) -> retryKey;

    /** One budget per retry key and failure context. */
    BudgetScope PER_CONTEXT =
            (retryKey, context) -> context == null ? retryKey : retryKey + "@" + context;

    /**
     * Returns the key under which the budget is stored.
     *
     * @param retryKey the error's retry key
     * @param context the failure context, e.g. the operation name (may be null)
     * @return the budget key
     */
    String budgetKey(String retryKey, String context);
}
