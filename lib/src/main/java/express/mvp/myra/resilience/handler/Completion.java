package express.mvp.myra.resilience.handler;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Settles an asynchronous operation either through a {@link Callback} or a future.
 *
 * <p>Lets one implementation serve both callback-style and future-style callers. When created
 * with a callback, {@link #future()} is empty and results go to the callback; otherwise results
 * complete the future. Only the first {@code resolve} or {@code reject} has an effect.
 *
 * <pre>{@code
 * public Optional<CompletableFuture<Thread>> fetchThread(String id, Callback<Thread> callback) {
 *     Completion<Thread> completion = Completion.of(callback);
 *     api.get(id).whenComplete((thread, error) -> {
 *         if (error != null) {
 *             completion.reject(error);
 *         } else {
 *             completion.resolve(thread);
 *         }
 *     });
 *     return completion.future();
 * }
 * }</pre>
 *
 * @param <T> the result type
 */
public final class Completion<T> {

    private final CompletableFuture<T> future;
    private final Callback<? super T> callback;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    private Completion(CompletableFuture<T> future, Callback<? super T> callback) {
        this.future = future;
        this.callback = callback;
    }

    /**
     * Creates a future-backed completion.
     *
     * @param <T> the result type
     * @return a new completion
     */
    public static <T> Completion<T> create() {
        return new Completion<>(new CompletableFuture<>(), null);
    }

    /**
     * Creates a completion delivering to the callback, or to a future if {@code callback} is null.
     *
     * @param callback the callback (may be null)
     * @param <T> the result type
     * @return a new completion
     */
    public static <T> Completion<T> of(Callback<? super T> callback) {
        return callback == null ? create() : new Completion<>(null, callback);
    }

    /**
     * Returns the future, present only when no callback was given.
     *
     * @return the future, or empty in callback mode
     */
    public Optional<CompletableFuture<T>> future() {
        return Optional.ofNullable(future);
    }

    /**
     * Delivers a result.
     *
     * @param value the result (may be null)
     * @return true if this call settled the completion
     */
    public boolean resolve(T value) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        if (callback != null) {
            callback.onComplete(null, value);
        } else {
            future.complete(value);
        }
        return true;
    }

    /**
     * Delivers a failure.
     *
     * @param error the failure
     * @return true if this call settled the completion
     */
    public boolean reject(Throwable error) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        if (callback != null) {
            callback.onComplete(error, null);
        } else {
            future.completeExceptionally(error);
        }
        return true;
    }

    /**
     * Checks if a result has been delivered.
     *
     * @return true after the first resolve or reject
     */
    public boolean isSettled() {
        return settled.get();
    }
}
