package express.mvp.myra.resilience.retry;

import java.time.Duration;
import java.time.Instant;

/**
 * Attempt bookkeeping for one retry key.
 *
 * <p>A budget is created lazily by {@link RetryCoordinator} on the first retryable failure for
 * its key. Each retry decision either consumes one attempt or, once {@code maxRetries} attempts
 * have been consumed, resets the count to zero and reports exhaustion. A success also resets it.
 *
 * <pre>
 * Idle ──failure──▶ Retrying(1) ──failure──▶ ... Retrying(max) ──failure──▶ Exhausted ─▶ Idle
 *   ▲                    │
 *   └──────success───────┘
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are synchronized on the budget, so concurrent failures sharing a key consume
 * attempts one at a time.
 *
 * @see RetryCoordinator
 */
public final class RetryBudget {

    /** Key this budget is registered under. */
    private final String key;

    /** Policy supplying the allowance and delays. */
    private final RetryPolicy policy;

    /** Attempts consumed in the current cycle. */
    private int attempts;

    /** Number of times the budget ran out. */
    private long exhaustions;

    /** Time of the last retry decision. */
    private Instant lastDecisionTime;

    RetryBudget(String key, RetryPolicy policy) {
        this.key = key;
        this.policy = policy;
    }

    /**
     * Consumes one attempt if the allowance permits.
     *
     * @param limit the effective maximum retries for this decision
     * @param now the decision time
     * @return the 1-based attempt number, or 0 if the budget was exhausted and reset
     */
    synchronized int tryConsume(int limit, Instant now) {
        lastDecisionTime = now;
        if (attempts < limit) {
            attempts++;
            return attempts;
        }
        attempts = 0;
        exhaustions++;
        return 0;
    }

    /** Resets the attempt count to zero. */
    synchronized void reset() {
        attempts = 0;
    }

    /**
     * Returns the retry key.
     *
     * @return the key
     */
    public String key() {
        return key;
    }

    /**
     * Returns the policy backing this budget.
     *
     * @return the policy
     */
    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Returns the maximum retries allowed by the policy.
     *
     * @return max retries
     */
    public int maxRetries() {
        return policy.maxRetries();
    }

    /**
     * Returns the delay before the given retry.
     *
     * @param retryNumber the 1-based retry number
     * @return the delay
     */
    public Duration delayFor(int retryNumber) {
        return policy.delayFor(retryNumber);
    }

    /**
     * Returns the attempts consumed in the current cycle.
     *
     * @return attempt count
     */
    public synchronized int attempts() {
        return attempts;
    }

    /**
     * Returns how many times the budget ran out.
     *
     * @return exhaustion count
     */
    public synchronized long exhaustions() {
        return exhaustions;
    }

    /**
     * Returns the time of the last retry decision.
     *
     * @return the instant, or null if no decision was made yet
     */
    public synchronized Instant lastDecisionTime() {
        return lastDecisionTime;
    }

    @Override
    public synchronized String toString() {
        return String.format(
                "RetryBudget[key=%s, attempts=%d/%d, exhaustions=%d]",
                key, attempts, policy.maxRetries(), exhaustions);
    }
}
