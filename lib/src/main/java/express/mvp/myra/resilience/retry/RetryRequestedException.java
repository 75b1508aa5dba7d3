package express.mvp.myra.resilience.retry;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.myra.resilience.error.ErrorKind;
import express.mvp.myra.resilience.error.StandardException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transient marker telling the caller to attempt the failed operation again.
 *
 * <p>Delivered after the retry delay has elapsed. The failure that triggered the retry is kept
 * as the cause and under {@code details.originalError}; the retry number is under
 * {@code details.retryAttempt}.
 *
 * <pre>{@code
 * try {
 *     handler.handle(error, "sendMessage", options).join();
 * } catch (CompletionException e) {
 *     if (e.getCause() instanceof RetryRequestedException retry) {
 *         return sendMessage(request); // attempt again
 *     }
 *     throw e;
 * }
 * }</pre>
 */
public class RetryRequestedException extends StandardException {

    private static final long serialVersionUID = 1L;

    private final int attempt;

    /**
     * Creates a retry marker.
     *
     * @param originalError the failure being retried
     * @param attempt the 1-based retry number
     */
    public RetryRequestedException(Throwable originalError, int attempt) {
        this(originalError, attempt, Instant.now());
    }

    /**
     * Creates a retry marker stamped with the given instant.
     *
     * @param originalError the failure being retried
     * @param attempt the 1-based retry number
     * @param timestamp when the retry was requested
     */
    public RetryRequestedException(Throwable originalError, int attempt, Instant timestamp) {
        super(
                ErrorKind.NETWORK,
                null,
                "Operation failed, retry attempt " + attempt,
                details(originalError, attempt),
                originalError,
                timestamp);
        this.attempt = attempt;
    }

    private static Map<String, Object> details(Throwable originalError, int attempt) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("originalError", originalError);
        details.put("retryAttempt", attempt);
        return details;
    }

    /**
     * Returns the retry number.
     *
     * @return the 1-based attempt
     */
    public int attempt() {
        return attempt;
    }

    /**
     * Returns the failure being retried.
     *
     * @return the original error
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Throwable is exposed for diagnostics and cannot be safely copied.")
    public Throwable originalError() {
        return getCause();
    }
}
