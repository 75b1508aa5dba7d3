package express.mvp.myra.resilience.handler;

import java.util.Objects;
import java.util.logging.Level;

/**
 * Per-call options for {@link FailureHandler}.
 *
 * <p>Defaults: no retry, at most 3 retries when retry is enabled, reporting on, logged at
 * {@link Level#SEVERE}.
 *
 * <pre>{@code
 * HandlerOptions options = HandlerOptions.builder()
 *     .retry(true)
 *     .maxRetries(2)
 *     .logLevel(Level.WARNING)
 *     .build();
 * }</pre>
 */
public final class HandlerOptions {

    private static final HandlerOptions DEFAULTS = builder().build();

    private final boolean retry;
    private final int maxRetries;
    private final boolean report;
    private final Level logLevel;

    private HandlerOptions(Builder builder) {
        this.retry = builder.retry;
        this.maxRetries = builder.maxRetries;
        this.report = builder.report;
        this.logLevel = builder.logLevel;
    }

    /**
     * Returns the default options.
     *
     * @return options with retry disabled
     */
    public static HandlerOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Returns the default options with retry enabled.
     *
     * @return retrying options
     */
    public static HandlerOptions retrying() {
        return builder().retry(true).build();
    }

    /**
     * Creates a builder initialized with the defaults.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks if retry is evaluated for handled failures.
     *
     * @return the retry flag
     */
    public boolean retry() {
        return retry;
    }

    /**
     * Returns the caller's retry allowance.
     *
     * @return maximum retries, capped by the policy table
     */
    public int maxRetries() {
        return maxRetries;
    }

    /**
     * Checks if handled failures are reported.
     *
     * @return the report flag
     */
    public boolean report() {
        return report;
    }

    /**
     * Returns the level of the "&lt;context&gt; error" log entry.
     *
     * @return the level
     */
    public Level logLevel() {
        return logLevel;
    }

    /**
     * Returns a builder initialized with these options.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder().retry(retry).maxRetries(maxRetries).report(report).logLevel(logLevel);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HandlerOptions that)) {
            return false;
        }
        return retry == that.retry
                && maxRetries == that.maxRetries
                && report == that.report
                && logLevel.equals(that.logLevel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(retry, maxRetries, report, logLevel);
    }

    @Override
    public String toString() {
        return "HandlerOptions[retry=" + retry
                + ", maxRetries=" + maxRetries
                + ", report=" + report
                + ", logLevel=" + logLevel
                + "]";
    }

    /** Builder for {@link HandlerOptions}. */
    public static final class Builder {
        private boolean retry = false;
        private int maxRetries = 3;
        private boolean report = true;
        private Level logLevel = Level.SEVERE;

        private Builder() {}

        /**
         * Enables retry evaluation. Only keys in the retry policy table are ever retried.
         *
         * @param retry whether to evaluate retries
         * @return this builder
         */
        public Builder retry(boolean retry) {
            this.retry = retry;
            return this;
        }

        /**
         * Sets the caller's retry allowance.
         *
         * @param maxRetries maximum retries, 0 disables retry
         * @return this builder
         * @throws IllegalArgumentException if negative
         */
        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be non-negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Enables or disables reporting.
         *
         * @param report false to skip the reporter
         * @return this builder
         */
        public Builder report(boolean report) {
            this.report = report;
            return this;
        }

        /**
         * Sets the level of the error log entry.
         *
         * @param logLevel the level
         * @return this builder
         */
        public Builder logLevel(Level logLevel) {
            this.logLevel = Objects.requireNonNull(logLevel, "logLevel");
            return this;
        }

        /**
         * Builds the options.
         *
         * @return the options
         */
        public HandlerOptions build() {
            return new HandlerOptions(this);
        }
    }
}
