package express.mvp.myra.resilience.handler;

import express.mvp.myra.resilience.error.ErrorClassifier;
import express.mvp.myra.resilience.error.StandardException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs an asynchronous operation and re-invokes it while the {@link FailureHandler} requests a
 * retry.
 *
 * <p>With {@code retry} enabled in the options the operation is invoked at most
 * {@code maxRetries + 1} times; the retry budgets may stop it earlier when other operations share
 * them. With {@code retry} disabled it is invoked once and a failure is handled without retry.
 * After a success the budget of the last failure is reset.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryingExecutor executor = resilience.executor();
 * CompletableFuture<Thread> thread =
 *     executor.execute(() -> api.fetchThread(id), "fetchThread", HandlerOptions.retrying());
 * }</pre>
 *
 * @see FailureHandler
 */
public final class RetryingExecutor {

    private final FailureHandler handler;

    /**
     * Creates an executor.
     *
     * @param handler the failure handler deciding on retries
     */
    public RetryingExecutor(FailureHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Executes the operation, retrying if the options allow it.
     *
     * @param operation the operation, invoked once per attempt
     * @param context where failures are attributed
     * @param options handling options
     * @param <T> the result type
     * @return the result, or a future failed with the classified error
     */
    public <T> CompletableFuture<T> execute(
            Supplier<? extends CompletionStage<T>> operation,
            String context,
            HandlerOptions options) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(options, "options");
        return attempt(operation, context, options, 0, new AtomicReference<>());
    }

    /**
     * Executes the operation with retries and never fails the returned future.
     *
     * @param operation the operation
     * @param context where failures are attributed
     * @param options handling options
     * @param <T> the result type
     * @return the value or the classified failure
     */
    public <T> CompletableFuture<Result<T>> executeForResult(
            Supplier<? extends CompletionStage<T>> operation,
            String context,
            HandlerOptions options) {
        return execute(operation, context, options)
                .handle(
                        (value, error) ->
                                error == null
                                        ? Result.<T>success(value)
                                        : Result.<T>failure(
                                                StandardException.wrap(
                                                        ErrorClassifier.unwrap(error),
                                                        handler.clock())));
    }

    /**
     * Executes the operation with retries and delivers the outcome to a callback.
     *
     * @param operation the operation
     * @param context where failures are attributed
     * @param options handling options
     * @param callback receives the value or the classified failure
     * @param <T> the result type
     */
    public <T> void execute(
            Supplier<? extends CompletionStage<T>> operation,
            String context,
            HandlerOptions options,
            Callback<? super T> callback) {
        Objects.requireNonNull(callback, "callback");
        Completion<T> completion = Completion.of(callback);
        executeForResult(operation, context, options)
                .thenAccept(
                        result -> {
                            if (result.isSuccess()) {
                                completion.resolve(result.value());
                            } else {
                                completion.reject(result.error());
                            }
                        });
    }

    private <T> CompletableFuture<T> attempt(
            Supplier<? extends CompletionStage<T>> operation,
            String context,
            HandlerOptions options,
            int retriesSoFar,
            AtomicReference<String> lastRetryKey) {
        CompletableFuture<T> stage;
        try {
            stage = operation.get().toCompletableFuture();
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        return stage.<CompletableFuture<T>>handle(
                        (value, error) -> {
                            if (error == null) {
                                String key = lastRetryKey.get();
                                if (key != null) {
                                    handler.coordinator().recordSuccess(key, context);
                                }
                                return CompletableFuture.completedFuture(value);
                            }
                            return handler.handle(error, context, options)
                                    .thenCompose(
                                            handled -> {
                                                lastRetryKey.set(handled.decision().retryKey());
                                                if (handled.isRetryRequested()
                                                        && retriesSoFar < options.maxRetries()) {
                                                    return attempt(
                                                            operation,
                                                            context,
                                                            options,
                                                            retriesSoFar + 1,
                                                            lastRetryKey);
                                                }
                                                return CompletableFuture.<T>failedFuture(
                                                        surfaced(handled));
                                            });
                        })
                .thenCompose(future -> future);
    }

    private StandardException surfaced(HandledFailure handled) {
        // local attempt limit reached while the budget still allowed a retry
        return handled.isRetryRequested()
                ? StandardException.wrap(handled.original(), handler.clock())
                : handled.error();
    }
}
