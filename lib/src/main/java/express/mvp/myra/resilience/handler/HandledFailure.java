package express.mvp.myra.resilience.handler;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.myra.resilience.error.StandardException;
import express.mvp.myra.resilience.retry.RetryDecision;
import express.mvp.myra.resilience.retry.RetryRequestedException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of {@link FailureHandler#handle}: the error to deliver and the retry decision behind it.
 *
 * <p>{@code error} is a {@link RetryRequestedException} when the caller should try again, the
 * original error when it was already a {@link StandardException}, and the original wrapped as a
 * network error otherwise.
 *
 * @param original the error passed to the handler, unwrapped from future wrappers
 * @param error the error to deliver
 * @param decision the retry decision
 */
@SuppressFBWarnings(
        value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
        justification = "Throwables are handed through unchanged.")
public record HandledFailure(Throwable original, StandardException error, RetryDecision decision) {

    public HandledFailure {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(decision, "decision");
    }

    /**
     * Checks if the caller should attempt the operation again.
     *
     * @return true if {@link #error()} is a retry marker
     */
    public boolean isRetryRequested() {
        return error instanceof RetryRequestedException;
    }

    /**
     * Returns a future failed with {@link #error()}.
     *
     * @param <T> the future's value type
     * @return a failed future
     */
    public <T> CompletableFuture<T> toFailedFuture() {
        return CompletableFuture.failedFuture(error);
    }
}
