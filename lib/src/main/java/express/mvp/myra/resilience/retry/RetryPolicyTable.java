package express.mvp.myra.resilience.retry;

import express.mvp.myra.resilience.error.ErrorCode;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable table of retryable keys and their policies.
 *
 * <p>Only keys present in the table are ever retried. Keys are catalog symbolic names such as
 * {@code NETWORK_TIMEOUT}, or any other retry key an error may carry.
 *
 * <table border="1">
 *   <caption>Default policies</caption>
 *   <tr><th>Key</th><th>Max retries</th><th>Delay</th></tr>
 *   <tr><td>NETWORK_TIMEOUT</td><td>3</td><td>1000 ms</td></tr>
 *   <tr><td>NETWORK_CONNECTION_FAILED</td><td>3</td><td>2000 ms</td></tr>
 *   <tr><td>AUTH_SESSION_EXPIRED</td><td>1</td><td>0 ms</td></tr>
 * </table>
 */
public final class RetryPolicyTable {

    private static final RetryPolicyTable DEFAULTS =
            builder()
                    .put(ErrorCode.NETWORK_TIMEOUT, RetryPolicy.fixedDelay(3, Duration.ofMillis(1000)))
                    .put(ErrorCode.NETWORK_CONNECTION_FAILED, RetryPolicy.fixedDelay(3, Duration.ofMillis(2000)))
                    .put(ErrorCode.AUTH_SESSION_EXPIRED, RetryPolicy.fixedDelay(1, Duration.ZERO))
                    .build();

    private static final RetryPolicyTable EMPTY = builder().build();

    private final Map<String, RetryPolicy> policies;

    private RetryPolicyTable(Map<String, RetryPolicy> policies) {
        this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
    }

    /**
     * Returns the default table.
     *
     * @return the default policies
     */
    public static RetryPolicyTable defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a table with no retryable keys.
     *
     * @return the empty table
     */
    public static RetryPolicyTable none() {
        return EMPTY;
    }

    /**
     * Returns a new empty builder.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Finds the policy for a key.
     *
     * @param key the retry key
     * @return the policy, or empty if the key is not retryable
     */
    public Optional<RetryPolicy> find(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(policies.get(key));
    }

    /**
     * Checks if a key is retryable.
     *
     * @param key the retry key
     * @return true if the table has a policy for it
     */
    public boolean contains(String key) {
        return key != null && policies.containsKey(key);
    }

    /**
     * Returns a copy of this table with one entry added or replaced.
     *
     * @param code the catalog code
     * @param policy the policy
     * @return the extended table
     */
    public RetryPolicyTable with(ErrorCode code, RetryPolicy policy) {
        return with(code.name(), policy);
    }

    /**
     * Returns a copy of this table with one entry added or replaced.
     *
     * @param key the retry key
     * @param policy the policy
     * @return the extended table
     */
    public RetryPolicyTable with(String key, RetryPolicy policy) {
        return toBuilder().put(key, policy).build();
    }

    /**
     * Returns a copy of this table without the given key.
     *
     * @param key the retry key
     * @return the reduced table
     */
    public RetryPolicyTable without(String key) {
        Builder builder = toBuilder();
        builder.policies.remove(key);
        return builder.build();
    }

    /**
     * Returns a builder pre-filled with this table's entries.
     *
     * @return new builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.policies.putAll(policies);
        return builder;
    }

    /**
     * Returns all entries.
     *
     * @return read-only view of key to policy
     */
    public Map<String, RetryPolicy> asMap() {
        return policies;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof RetryPolicyTable other && policies.equals(other.policies));
    }

    @Override
    public int hashCode() {
        return policies.hashCode();
    }

    @Override
    public String toString() {
        return "RetryPolicyTable" + policies;
    }

    /** Builder for {@link RetryPolicyTable}. */
    public static final class Builder {
        private final Map<String, RetryPolicy> policies = new LinkedHashMap<>();

        /**
         * Adds or replaces the policy for a catalog code.
         *
         * @param code the catalog code
         * @param policy the policy
         * @return this builder
         */
        public Builder put(ErrorCode code, RetryPolicy policy) {
            return put(Objects.requireNonNull(code, "code").name(), policy);
        }

        /**
         * Adds or replaces the policy for a retry key.
         *
         * @param key the retry key
         * @param policy the policy
         * @return this builder
         */
        public Builder put(String key, RetryPolicy policy) {
            policies.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(policy, "policy"));
            return this;
        }

        /**
         * Builds the table.
         *
         * @return new table
         */
        public RetryPolicyTable build() {
            return new RetryPolicyTable(policies);
        }
    }
}
