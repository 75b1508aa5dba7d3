package express.mvp.myra.resilience.retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Decides whether failures are retried and keeps the retry budgets.
 *
 * <p>Only keys present in the {@link RetryPolicyTable} are retryable. For a retryable key the
 * coordinator consumes one attempt from the key's {@link RetryBudget}; once the allowance is used
 * up the next failure resets the budget and reports exhaustion, and the failure after that starts
 * a fresh cycle with no cooldown.
 *
 * <h2>Budget Sharing</h2>
 *
 * <p>With {@link BudgetScope#GLOBAL} (the default) budgets are process-wide per retry key, so
 * concurrent operations failing with the same code consume the same allowance. Use
 * {@link BudgetScope#PER_CONTEXT} to give each failure context its own budget.
 *
 * <h2>Delays</h2>
 *
 * <p>{@link #delay(Duration)} never blocks the caller: it schedules a timer and returns a future.
 * Cancelling that future cancels the timer.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryDecision decision = coordinator.evaluate("NETWORK_TIMEOUT", "fetchThread", 3);
 * if (decision.shouldRetry()) {
 *     coordinator.delay(decision.delay()).thenRun(() -> fetchThread(id));
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. Budgets live in a concurrent map and each budget serializes its
 * own updates.
 *
 * @see RetryPolicyTable
 * @see RetryBudget
 */
public final class RetryCoordinator {

    private final RetryPolicyTable policies;
    private final ScheduledExecutorService scheduler;
    private final BudgetScope scope;
    private final Clock clock;

    /** Budgets keyed by {@link BudgetScope#budgetKey(String, String)}. */
    private final Map<String, RetryBudget> budgets = new ConcurrentHashMap<>();

    /**
     * Creates a coordinator with global budgets.
     *
     * @param policies the retryable keys
     * @param scheduler timer for retry delays
     */
    public RetryCoordinator(RetryPolicyTable policies, ScheduledExecutorService scheduler) {
        this(policies, scheduler, BudgetScope.GLOBAL);
    }

    /**
     * Creates a coordinator.
     *
     * @param policies the retryable keys
     * @param scheduler timer for retry delays
     * @param scope decides which failures share a budget
     */
    public RetryCoordinator(
            RetryPolicyTable policies, ScheduledExecutorService scheduler, BudgetScope scope) {
        this(policies, scheduler, scope, Clock.systemUTC());
    }

    /**
     * Creates a coordinator reading decision times from the given clock.
     *
     * @param policies the retryable keys
     * @param scheduler timer for retry delays
     * @param scope decides which failures share a budget
     * @param clock source of decision timestamps
     */
    public RetryCoordinator(
            RetryPolicyTable policies,
            ScheduledExecutorService scheduler,
            BudgetScope scope,
            Clock clock) {
        this.policies = Objects.requireNonNull(policies, "policies");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Checks if a key is eligible for retry at all.
     *
     * @param retryKey the error's retry key
     * @param maxRetries the caller's retry allowance
     * @return true iff the key has a policy and {@code maxRetries > 0}
     */
    public boolean shouldRetry(String retryKey, int maxRetries) {
        return policies.contains(retryKey) && maxRetries > 0;
    }

    /**
     * Evaluates a failure with global scoping.
     *
     * @param retryKey the error's retry key
     * @param maxRetries the caller's retry allowance
     * @return the decision
     */
    public RetryDecision evaluate(String retryKey, int maxRetries) {
        return evaluate(retryKey, null, maxRetries);
    }

    /**
     * Evaluates a failure and updates the matching budget.
     *
     * <p>The effective allowance is the smaller of the caller's {@code maxRetries} and the policy's
     * own. The delay comes from the policy.
     *
     * @param retryKey the error's retry key
     * @param context the failure context (used by non-global scopes, may be null)
     * @param maxRetries the caller's retry allowance
     * @return the decision
     */
    public RetryDecision evaluate(String retryKey, String context, int maxRetries) {
        if (!shouldRetry(retryKey, maxRetries)) {
            return RetryDecision.notRetryable(retryKey);
        }
        RetryPolicy policy = policies.find(retryKey).orElseThrow();
        int limit = Math.min(maxRetries, policy.maxRetries());

        RetryBudget budget =
                budgets.computeIfAbsent(
                        scope.budgetKey(retryKey, context), key -> new RetryBudget(key, policy));

        int attempt = budget.tryConsume(limit, clock.instant());
        if (attempt == 0) {
            return RetryDecision.exhausted(retryKey, limit);
        }
        return RetryDecision.retry(retryKey, attempt, limit, budget.delayFor(attempt));
    }

    /**
     * Resets the budget after the operation succeeded.
     *
     * @param retryKey the retry key of the earlier failure
     * @param context the failure context (may be null)
     */
    public void recordSuccess(String retryKey, String context) {
        RetryBudget budget = budgets.get(scope.budgetKey(retryKey, context));
        if (budget != null) {
            budget.reset();
        }
    }

    /**
     * Returns the attempts consumed in the current cycle.
     *
     * @param retryKey the retry key
     * @return the attempt count (0 if no budget exists)
     */
    public int attempts(String retryKey) {
        return attempts(retryKey, null);
    }

    /**
     * Returns the attempts consumed in the current cycle for a context.
     *
     * @param retryKey the retry key
     * @param context the failure context (may be null)
     * @return the attempt count (0 if no budget exists)
     */
    public int attempts(String retryKey, String context) {
        RetryBudget budget = budgets.get(scope.budgetKey(retryKey, context));
        return budget == null ? 0 : budget.attempts();
    }

    /**
     * Returns the budget for a key, if one was created.
     *
     * @param retryKey the retry key
     * @param context the failure context (may be null)
     * @return the budget, or empty before the first retryable failure
     */
    public Optional<RetryBudget> budget(String retryKey, String context) {
        return Optional.ofNullable(budgets.get(scope.budgetKey(retryKey, context)));
    }

    /**
     * Drops the budget for a key.
     *
     * @param retryKey the retry key
     * @param context the failure context (may be null)
     */
    public void reset(String retryKey, String context) {
        budgets.remove(scope.budgetKey(retryKey, context));
    }

    /** Drops all budgets. */
    public void resetAll() {
        budgets.clear();
    }

    /**
     * Returns the policy table.
     *
     * @return the retryable keys
     */
    public RetryPolicyTable policies() {
        return policies;
    }

    /**
     * Returns the budget scope.
     *
     * @return the scope
     */
    public BudgetScope scope() {
        return scope;
    }

    /**
     * Checks if the scheduler behind {@link #delay(Duration)} has been shut down.
     *
     * @return true if no new delays can be scheduled
     */
    public boolean isShutdown() {
        return scheduler.isShutdown();
    }

    /**
     * Completes after the given delay without blocking the caller.
     *
     * <p>Cancelling the returned future cancels the pending timer. If the scheduler no longer
     * accepts tasks the future fails with {@link RejectedExecutionException}.
     *
     * @param delay the wait
     * @return a future completing after {@code delay}
     */
    public CompletableFuture<Void> delay(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isZero() || delay.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        ScheduledFuture<?> timer;
        try {
            timer =
                    scheduler.schedule(
                            () -> future.complete(null), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
            return future;
        }
        future.whenComplete(
                (ignored, error) -> {
                    if (future.isCancelled()) {
                        timer.cancel(false);
                    }
                });
        return future;
    }

    @Override
    public String toString() {
        return "RetryCoordinator[policies=" + policies.asMap().keySet() + ", budgets=" + budgets.size() + "]";
    }
}
