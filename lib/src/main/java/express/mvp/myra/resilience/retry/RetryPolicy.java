package express.mvp.myra.resilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry allowance for one retry key: how many retries, and how long to wait before each.
 *
 * <p>Delays are fixed by default. A policy only backs off when it is built with a multiplier
 * greater than 1.0, in which case the delay before retry {@code n} is
 * {@code delay * multiplier^(n-1)}, capped at {@code maxDelay}.
 *
 * <h2>Built-in Policies</h2>
 *
 * <ul>
 *   <li>{@link #noRetry()} - Never retry
 *   <li>{@link #immediate(int)} - Retry without delay
 *   <li>{@link #fixedDelay(int, Duration)} - Same delay before every retry
 *   <li>{@link #exponentialBackoff(int, Duration, Duration)} - Doubling delay with cap
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryPolicyTable table = RetryPolicyTable.defaults()
 *     .with(ErrorCode.NETWORK_RATE_LIMITED,
 *           RetryPolicy.exponentialBackoff(4, Duration.ofMillis(500), Duration.ofSeconds(8)));
 * }</pre>
 *
 * @see RetryPolicyTable
 * @see RetryCoordinator
 */
public final class RetryPolicy {

    /** Maximum number of retries after the initial failure. */
    private final int maxRetries;

    /** Delay before the first retry. */
    private final Duration delay;

    /** Delay cap. */
    private final Duration maxDelay;

    /** Backoff multiplier (1.0 = fixed delay). */
    private final double backoffMultiplier;

    private RetryPolicy(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.delay = builder.delay;
        this.maxDelay = builder.maxDelay != null ? builder.maxDelay : builder.delay;
        this.backoffMultiplier = builder.backoffMultiplier;
    }

    /**
     * Returns the maximum number of retries.
     *
     * @return max retries (0 means never retry)
     */
    public int maxRetries() {
        return maxRetries;
    }

    /**
     * Returns the delay before the first retry.
     *
     * @return the base delay
     */
    public Duration delay() {
        return delay;
    }

    /**
     * Returns the delay cap.
     *
     * @return the maximum delay
     */
    public Duration maxDelay() {
        return maxDelay;
    }

    /**
     * Returns the backoff multiplier.
     *
     * @return the multiplier (1.0 for a fixed delay)
     */
    public double backoffMultiplier() {
        return backoffMultiplier;
    }

    /**
     * Calculates the delay before a given retry.
     *
     * @param retryNumber the 1-based retry number
     * @return the delay to apply
     */
    public Duration delayFor(int retryNumber) {
        if (backoffMultiplier <= 1.0 || retryNumber <= 1) {
            return delay;
        }
        double scaled = delay.toMillis() * Math.pow(backoffMultiplier, retryNumber - 1);
        long capped = (long) Math.min(scaled, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Returns a policy that never retries.
     *
     * @return no-retry policy
     */
    public static RetryPolicy noRetry() {
        return builder().maxRetries(0).build();
    }

    /**
     * Returns a policy that retries without delay.
     *
     * @param maxRetries maximum retries
     * @return immediate retry policy
     */
    public static RetryPolicy immediate(int maxRetries) {
        return fixedDelay(maxRetries, Duration.ZERO);
    }

    /**
     * Returns a policy with the same delay before every retry.
     *
     * @param maxRetries maximum retries
     * @param delay delay before each retry
     * @return fixed delay policy
     */
    public static RetryPolicy fixedDelay(int maxRetries, Duration delay) {
        return builder().maxRetries(maxRetries).delay(delay).build();
    }

    /**
     * Returns a policy whose delay doubles on each retry.
     *
     * @param maxRetries maximum retries
     * @param initialDelay delay before the first retry
     * @param maxDelay delay cap
     * @return exponential backoff policy
     */
    public static RetryPolicy exponentialBackoff(
            int maxRetries, Duration initialDelay, Duration maxDelay) {
        return builder()
                .maxRetries(maxRetries)
                .delay(initialDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(2.0)
                .build();
    }

    /**
     * Returns a builder for custom policy configuration.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryPolicy other)) return false;
        return maxRetries == other.maxRetries
                && Double.compare(backoffMultiplier, other.backoffMultiplier) == 0
                && delay.equals(other.delay)
                && maxDelay.equals(other.maxDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, delay, maxDelay, backoffMultiplier);
    }

    @Override
    public String toString() {
        return backoffMultiplier <= 1.0
                ? String.format("RetryPolicy[maxRetries=%d, delay=%dms]", maxRetries, delay.toMillis())
                : String.format(
                        "RetryPolicy[maxRetries=%d, delay=%dms, x%.1f, max=%dms]",
                        maxRetries, delay.toMillis(), backoffMultiplier, maxDelay.toMillis());
    }

    /** Builder for {@link RetryPolicy}. */
    public static final class Builder {
        private int maxRetries = 3;
        private Duration delay = Duration.ofSeconds(1);
        private Duration maxDelay;
        private double backoffMultiplier = 1.0;

        /**
         * Sets the maximum number of retries.
         *
         * @param maxRetries max retries (must be >= 0)
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Sets the delay before the first retry.
         *
         * @param delay the delay (must not be negative)
         * @return this builder
         */
        public Builder delay(Duration delay) {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
            this.delay = delay;
            return this;
        }

        /**
         * Sets the delay cap. Defaults to the base delay.
         *
         * @param maxDelay the maximum delay
         * @return this builder
         */
        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay");
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * Sets the backoff multiplier.
         *
         * @param multiplier multiplier (1.0 = fixed delay, 2.0 = double each time)
         * @return this builder
         */
        public Builder backoffMultiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
            }
            this.backoffMultiplier = multiplier;
            return this;
        }

        /**
         * Builds the retry policy.
         *
         * @return new policy
         * @throws IllegalArgumentException if maxDelay is below delay
         */
        public RetryPolicy build() {
            if (maxDelay != null && maxDelay.compareTo(delay) < 0) {
                throw new IllegalArgumentException("maxDelay must be >= delay");
            }
            return new RetryPolicy(this);
        }
    }
}
