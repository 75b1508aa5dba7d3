package express.mvp.myra.resilience;

import express.mvp.myra.resilience.cache.CacheStore;
import express.mvp.myra.resilience.handler.ErrorLog;
import express.mvp.myra.resilience.handler.ErrorReporter;
import express.mvp.myra.resilience.handler.JulErrorLog;
import express.mvp.myra.resilience.handler.LoggingErrorReporter;
import express.mvp.myra.resilience.retry.BudgetScope;
import express.mvp.myra.resilience.retry.RetryPolicyTable;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a {@link Resilience} instance.
 *
 * <p>Immutable; build with {@link #builder()}.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Resilience Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>cacheCapacity</td><td>1000</td><td>Maximum cache entries</td></tr>
 *   <tr><td>cacheTtl</td><td>5 min</td><td>Default entry lifetime</td></tr>
 *   <tr><td>retryPolicies</td><td>{@link RetryPolicyTable#defaults()}</td>
 *       <td>Retryable keys</td></tr>
 *   <tr><td>budgetScope</td><td>GLOBAL</td><td>Which failures share a budget</td></tr>
 *   <tr><td>reportingEnabled</td><td>true</td><td>Send handled errors to the reporter</td></tr>
 *   <tr><td>schedulerThreads</td><td>1</td><td>Threads for retry timers (reports run on their own thread)</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ResilienceConfig config = ResilienceConfig.builder()
 *     .cacheCapacity(500)
 *     .cacheTtl(Duration.ofMinutes(1))
 *     .retryPolicies(RetryPolicyTable.defaults()
 *         .with(ErrorCode.NETWORK_RATE_LIMITED, RetryPolicy.fixedDelay(2, Duration.ofSeconds(5))))
 *     .budgetScope(BudgetScope.PER_CONTEXT)
 *     .build();
 * }</pre>
 *
 * @see Resilience
 */
public final class ResilienceConfig {

    private final int cacheCapacity;
    private final Duration cacheTtl;
    private final RetryPolicyTable retryPolicies;
    private final BudgetScope budgetScope;
    private final boolean reportingEnabled;
    private final int schedulerThreads;
    private final Clock clock;
    private final ErrorLog errorLog;
    private final ErrorReporter reporter;

    private ResilienceConfig(Builder builder) {
        this.cacheCapacity = builder.cacheCapacity;
        this.cacheTtl = builder.cacheTtl;
        this.retryPolicies = builder.retryPolicies;
        this.budgetScope = builder.budgetScope;
        this.reportingEnabled = builder.reportingEnabled;
        this.schedulerThreads = builder.schedulerThreads;
        this.clock = builder.clock;
        this.errorLog = builder.errorLog;
        this.reporter = builder.reporter;
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
     * Returns the default configuration.
     *
     * @return defaults
     */
    public static ResilienceConfig defaults() {
        return builder().build();
    }

    /**
     * Returns the capacity of caches created by {@link Resilience#newCache()}.
     *
     * @return maximum entries
     */
    public int cacheCapacity() {
        return cacheCapacity;
    }

    /**
     * Returns the default TTL of created caches.
     *
     * @return the TTL
     */
    public Duration cacheTtl() {
        return cacheTtl;
    }

    /**
     * Returns the retry policy table.
     *
     * @return the retryable keys
     */
    public RetryPolicyTable retryPolicies() {
        return retryPolicies;
    }

    /**
     * Returns how failures share retry budgets.
     *
     * @return the scope
     */
    public BudgetScope budgetScope() {
        return budgetScope;
    }

    /**
     * Checks if the reporter is invoked at all.
     *
     * @return true if reporting is enabled
     */
    public boolean reportingEnabled() {
        return reportingEnabled;
    }

    /**
     * Returns the number of retry scheduler threads.
     *
     * @return thread count
     */
    public int schedulerThreads() {
        return schedulerThreads;
    }

    /**
     * Returns the clock for TTLs, decisions and timestamps.
     *
     * @return the clock
     */
    public Clock clock() {
        return clock;
    }

    /**
     * Returns the logging collaborator.
     *
     * @return the error log
     */
    public ErrorLog errorLog() {
        return errorLog;
    }

    /**
     * Returns the reporting collaborator.
     *
     * @return the reporter
     */
    public ErrorReporter reporter() {
        return reporter;
    }

    @Override
    public String toString() {
        return "ResilienceConfig["
                + "cacheCapacity=" + cacheCapacity
                + ", cacheTtl=" + cacheTtl
                + ", retryPolicies=" + retryPolicies
                + ", reportingEnabled=" + reportingEnabled
                + ", schedulerThreads=" + schedulerThreads
                + "]";
    }

    /** Builder for {@link ResilienceConfig}. */
    public static final class Builder {
        private int cacheCapacity = CacheStore.DEFAULT_CAPACITY;
        private Duration cacheTtl = CacheStore.DEFAULT_TTL;
        private RetryPolicyTable retryPolicies = RetryPolicyTable.defaults();
        private BudgetScope budgetScope = BudgetScope.GLOBAL;
        private boolean reportingEnabled = true;
        private int schedulerThreads = 1;
        private Clock clock = Clock.systemUTC();
        private ErrorLog errorLog;
        private ErrorReporter reporter;

        private Builder() {}

        /**
         * Sets the cache capacity.
         *
         * @param capacity maximum entries, 0 disables caching
         * @return this builder
         * @throws IllegalArgumentException if negative
         */
        public Builder cacheCapacity(int capacity) {
            if (capacity < 0) {
                throw new IllegalArgumentException("cacheCapacity must be non-negative");
            }
            this.cacheCapacity = capacity;
            return this;
        }

        /**
         * Sets the default cache TTL.
         *
         * @param ttl the TTL
         * @return this builder
         * @throws NullPointerException if ttl is null
         */
        public Builder cacheTtl(Duration ttl) {
            this.cacheTtl = Objects.requireNonNull(ttl, "ttl");
            return this;
        }

        /**
         * Sets the retry policy table.
         *
         * @param policies the retryable keys
         * @return this builder
         */
        public Builder retryPolicies(RetryPolicyTable policies) {
            this.retryPolicies = Objects.requireNonNull(policies, "policies");
            return this;
        }

        /**
         * Sets how failures share retry budgets.
         *
         * @param scope the scope
         * @return this builder
         */
        public Builder budgetScope(BudgetScope scope) {
            this.budgetScope = Objects.requireNonNull(scope, "scope");
            return this;
        }

        /**
         * Enables or disables reporting.
         *
         * @param enabled false to skip the reporter
         * @return this builder
         */
        public Builder reportingEnabled(boolean enabled) {
            this.reportingEnabled = enabled;
            return this;
        }

        /**
         * Sets the number of scheduler threads.
         *
         * @param threads thread count
         * @return this builder
         * @throws IllegalArgumentException if not positive
         */
        public Builder schedulerThreads(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("schedulerThreads must be positive");
            }
            this.schedulerThreads = threads;
            return this;
        }

        /**
         * Sets the clock.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Sets the logging collaborator.
         *
         * @param errorLog the error log
         * @return this builder
         */
        public Builder errorLog(ErrorLog errorLog) {
            this.errorLog = Objects.requireNonNull(errorLog, "errorLog");
            return this;
        }

        /**
         * Sets the reporting collaborator.
         *
         * @param reporter the reporter
         * @return this builder
         */
        public Builder reporter(ErrorReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter");
            return this;
        }

        /**
         * Builds the configuration, defaulting the collaborators to JUL-backed ones.
         *
         * @return the configuration
         */
        public ResilienceConfig build() {
            if (errorLog == null) {
                errorLog = new JulErrorLog();
            }
            if (reporter == null) {
                reporter = new LoggingErrorReporter();
            }
            return new ResilienceConfig(this);
        }
    }
}
