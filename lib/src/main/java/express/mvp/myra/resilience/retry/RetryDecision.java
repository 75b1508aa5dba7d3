package express.mvp.myra.resilience.retry;

import java.time.Duration;

/**
 * Outcome of evaluating one failure against the retry budgets.
 *
 * @param outcome what to do with the failure
 * @param retryKey the error's retry key
 * @param attempt the 1-based retry number for {@link Outcome#RETRY}, otherwise 0
 * @param maxRetries the effective allowance used for the decision
 * @param delay the wait before retrying, {@link Duration#ZERO} unless retrying
 */
public record RetryDecision(
        Outcome outcome, String retryKey, int attempt, int maxRetries, Duration delay) {

    /** Possible outcomes. */
    public enum Outcome {
        /** Wait {@code delay}, then try again. */
        RETRY,
        /** Budget ran out and was reset; surface the original error. */
        EXHAUSTED,
        /** Key is not in the policy table or retries are disabled. */
        NOT_RETRYABLE
    }

    static RetryDecision retry(String retryKey, int attempt, int maxRetries, Duration delay) {
        return new RetryDecision(Outcome.RETRY, retryKey, attempt, maxRetries, delay);
    }

    static RetryDecision exhausted(String retryKey, int maxRetries) {
        return new RetryDecision(Outcome.EXHAUSTED, retryKey, 0, maxRetries, Duration.ZERO);
    }

    /**
     * Creates a decision for a failure that is not retried.
     *
     * @param retryKey the error's retry key
     * @return the decision
     */
    public static RetryDecision notRetryable(String retryKey) {
        return new RetryDecision(Outcome.NOT_RETRYABLE, retryKey, 0, 0, Duration.ZERO);
    }

    /**
     * Checks if the operation should be attempted again.
     *
     * @return true for {@link Outcome#RETRY}
     */
    public boolean shouldRetry() {
        return outcome == Outcome.RETRY;
    }

    /**
     * Checks if the budget ran out on this decision.
     *
     * @return true for {@link Outcome#EXHAUSTED}
     */
    public boolean isExhausted() {
        return outcome == Outcome.EXHAUSTED;
    }
}
