package express.mvp.myra.resilience.handler;

/**
 * Node-style completion callback: exactly one of {@code error} and {@code result} is meaningful.
 *
 * <pre>{@code
 * executor.execute(() -> api.fetchThread(id), "fetchThread", options, (error, thread) -> {
 *     if (error != null) {
 *         showError(formatter.createErrorResponse(error));
 *     } else {
 *         render(thread);
 *     }
 * });
 * }</pre>
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface Callback<T> {

    /**
     * Called once when the operation completes.
     *
     * @param error the failure, or null on success
     * @param result the result, or null on failure
     */
    void onComplete(Throwable error, T result);
}
