package express.mvp.myra.resilience.handler;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.myra.resilience.error.StandardException;
import java.util.Objects;
import java.util.Optional;

/**
 * Value or classified failure of an operation.
 *
 * @param value the value on success (may be null)
 * @param error the failure, or null on success
 * @param <T> the value type
 */
@SuppressFBWarnings(
        value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
        justification = "Values and throwables are handed through unchanged.")
public record Result<T>(T value, StandardException error) {

    /**
     * Creates a successful result.
     *
     * @param value the value (may be null)
     * @param <T> the value type
     * @return the result
     */
    public static <T> Result<T> success(T value) {
        return new Result<>(value, null);
    }

    /**
     * Creates a failed result.
     *
     * @param error the failure
     * @param <T> the value type
     * @return the result
     */
    public static <T> Result<T> failure(StandardException error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    /**
     * Checks if the operation succeeded.
     *
     * @return true if there is no error
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Returns the failure, if any.
     *
     * @return the error, or empty on success
     */
    public Optional<StandardException> failure() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the value or throws the failure.
     *
     * @return the value
     * @throws StandardException if the operation failed
     */
    public T getOrThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }
}
