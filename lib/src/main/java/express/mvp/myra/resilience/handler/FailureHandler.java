package express.mvp.myra.resilience.handler;

import express.mvp.myra.resilience.error.ErrorClassifier;
import express.mvp.myra.resilience.error.StandardException;
import express.mvp.myra.resilience.retry.RetryCoordinator;
import express.mvp.myra.resilience.retry.RetryDecision;
import express.mvp.myra.resilience.retry.RetryRequestedException;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central failure path for client operations.
 *
 * <p>Every failure handed to {@link #handle} is logged, optionally reported, evaluated for retry
 * and then delivered in a classified form.
 *
 * <h2>Handling Flow</h2>
 *
 * <pre>
 * 1. Log "&lt;context&gt; error [&lt;code&gt;]" at the options' level
 * 2. Report asynchronously (if options.report)
 * 3. If options.retry and the scheduler is running:
 *    ├─▶ RETRY:     log "Retrying operation (n/max) for &lt;context&gt;", wait, deliver retry marker
 *    ├─▶ EXHAUSTED: log "Max retries exceeded for &lt;context&gt;" at WARNING
 *    └─▶ NOT_RETRYABLE
 * 4. Deliver the error: unchanged if classified, wrapped as a network error otherwise
 * </pre>
 *
 * <p>Neither the logging nor the reporting collaborator can change what is delivered: their
 * failures are written to this class's own logger and otherwise ignored.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * api.sendMessage(request)
 *     .exceptionallyCompose(error ->
 *         handler.fail(error, "sendMessage", HandlerOptions.retrying()));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances are thread-safe provided the collaborators are.
 *
 * @see RetryCoordinator
 * @see RetryingExecutor
 */
public final class FailureHandler {

    private static final Logger LOGGER = Logger.getLogger(FailureHandler.class.getName());

    private final RetryCoordinator coordinator;
    private final ErrorLog errorLog;
    private final ErrorReporter reporter;
    private final Executor reportExecutor;
    private final Clock clock;

    /**
     * Creates a handler.
     *
     * @param coordinator retry decisions and delays
     * @param errorLog logging collaborator
     * @param reporter reporting collaborator
     * @param reportExecutor executor running the reporter off the caller's thread
     * @param clock source of report timestamps
     */
    public FailureHandler(
            RetryCoordinator coordinator,
            ErrorLog errorLog,
            ErrorReporter reporter,
            Executor reportExecutor,
            Clock clock) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.errorLog = Objects.requireNonNull(errorLog, "errorLog");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.reportExecutor = Objects.requireNonNull(reportExecutor, "reportExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Handles a failure.
     *
     * <p>The returned future never fails: it completes with the error to deliver once any retry
     * delay has elapsed. Cancelling it cancels a pending retry delay. After the retry scheduler
     * has shut down, failures are delivered without retry.
     *
     * @param error the failure
     * @param context where the failure occurred, e.g. the operation name
     * @param options handling options
     * @return the handled failure
     */
    public CompletableFuture<HandledFailure> handle(
            Throwable error, String context, HandlerOptions options) {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(options, "options");
        Throwable failure = ErrorClassifier.unwrap(error);
        ErrorReport report = ErrorReport.of(failure, context, clock);

        safeLog(
                options.logLevel(),
                context + " error [" + report.code() + "]",
                report.toLogContext());

        if (options.report()) {
            report(report);
        }

        StandardException surfaced = StandardException.wrap(failure, clock);
        if (!options.retry()) {
            return CompletableFuture.completedFuture(
                    new HandledFailure(
                            failure, surfaced, RetryDecision.notRetryable(report.retryKey())));
        }
        if (coordinator.isShutdown()
                && coordinator.shouldRetry(report.retryKey(), options.maxRetries())) {
            safeLog(
                    Level.WARNING,
                    "Retry unavailable after shutdown for " + context,
                    Map.of("retryKey", report.retryKey()));
            return CompletableFuture.completedFuture(
                    new HandledFailure(
                            failure, surfaced, RetryDecision.notRetryable(report.retryKey())));
        }

        RetryDecision decision =
                coordinator.evaluate(report.retryKey(), context, options.maxRetries());
        switch (decision.outcome()) {
            case RETRY:
                return scheduleRetry(failure, surfaced, context, decision);
            case EXHAUSTED:
                safeLog(
                        Level.WARNING,
                        "Max retries exceeded for " + context,
                        Map.of(
                                "retryKey", decision.retryKey(),
                                "maxRetries", decision.maxRetries()));
                break;
            default:
                break;
        }
        return CompletableFuture.completedFuture(new HandledFailure(failure, surfaced, decision));
    }

    /**
     * Handles a failure and delivers the outcome to a callback.
     *
     * <p>The callback receives the error of the {@link HandledFailure}, which is a
     * {@link RetryRequestedException} when the caller should try again. It is always invoked
     * exactly once.
     *
     * @param error the failure
     * @param context where the failure occurred
     * @param options handling options
     * @param callback receives the error to deliver
     * @param <T> the callback's result type
     */
    public <T> void handle(
            Throwable error, String context, HandlerOptions options, Callback<T> callback) {
        Objects.requireNonNull(callback, "callback");
        handle(error, context, options)
                .whenComplete(
                        (handled, failure) ->
                                callback.onComplete(
                                        handled != null
                                                ? handled.error()
                                                : StandardException.wrap(
                                                        ErrorClassifier.unwrap(failure), clock),
                                        null));
    }

    /**
     * Handles a failure and returns a future failed with the error to deliver.
     *
     * @param error the failure
     * @param context where the failure occurred
     * @param options handling options
     * @param <T> the value type of the returned future
     * @return a future that fails after handling completes
     */
    public <T> CompletableFuture<T> fail(Throwable error, String context, HandlerOptions options) {
        return handle(error, context, options).thenCompose(HandledFailure::toFailedFuture);
    }

    /**
     * Wraps an asynchronous operation so every failure runs through this handler.
     *
     * <p>Failures thrown synchronously by {@code operation} are handled the same way as failed
     * stages.
     *
     * @param operation the operation
     * @param context where failures are attributed
     * @param options handling options
     * @param <T> the result type
     * @return the wrapped operation
     */
    public <T> Supplier<CompletableFuture<T>> withErrorHandling(
            Supplier<? extends CompletionStage<T>> operation,
            String context,
            HandlerOptions options) {
        Objects.requireNonNull(operation, "operation");
        return () -> {
            CompletionStage<T> stage;
            try {
                stage = operation.get();
            } catch (RuntimeException e) {
                return fail(e, context, options);
            }
            return stage.toCompletableFuture()
                    .<CompletableFuture<T>>handle(
                            (value, error) ->
                                    error == null
                                            ? CompletableFuture.completedFuture(value)
                                            : this.<T>fail(error, context, options))
                    .thenCompose(future -> future);
        };
    }

    /**
     * Returns the coordinator used for retry decisions.
     *
     * @return the coordinator
     */
    public RetryCoordinator coordinator() {
        return coordinator;
    }

    Clock clock() {
        return clock;
    }

    private CompletableFuture<HandledFailure> scheduleRetry(
            Throwable failure, StandardException surfaced, String context, RetryDecision decision) {
        safeLog(
                Level.INFO,
                "Retrying operation (" + decision.attempt() + "/" + decision.maxRetries() + ") for "
                        + context,
                Map.of("retryKey", decision.retryKey(), "delayMs", decision.delay().toMillis()));

        CompletableFuture<Void> timer = coordinator.delay(decision.delay());
        CompletableFuture<HandledFailure> result =
                timer.handle(
                        (ignored, error) -> {
                            if (error == null) {
                                return new HandledFailure(
                                        failure,
                                        new RetryRequestedException(
                                                failure, decision.attempt(), clock.instant()),
                                        decision);
                            }
                            if (!(ErrorClassifier.unwrap(error) instanceof CancellationException)) {
                                // scheduler stopped between evaluation and scheduling
                                LOGGER.log(Level.WARNING, "Retry delay failed for " + context, error);
                            }
                            return new HandledFailure(
                                    failure,
                                    surfaced,
                                    RetryDecision.notRetryable(decision.retryKey()));
                        });
        result.whenComplete(
                (handled, error) -> {
                    if (result.isCancelled()) {
                        timer.cancel(false);
                    }
                });
        return result;
    }

    private void report(ErrorReport report) {
        try {
            reportExecutor.execute(
                    () -> {
                        try {
                            reporter.report(report);
                        } catch (RuntimeException e) {
                            LOGGER.log(Level.WARNING, "Error reporter failed", e);
                        }
                    });
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.WARNING, "Error report dropped, executor rejected it", e);
        }
    }

    private void safeLog(Level level, String message, Map<String, ?> context) {
        try {
            errorLog.log(level, message, context);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Error log failed for: " + message, e);
        }
    }

    @Override
    public String toString() {
        return "FailureHandler[" + coordinator + "]";
    }
}
