package express.mvp.myra.resilience;

import express.mvp.myra.resilience.cache.CacheStore;
import express.mvp.myra.resilience.handler.ErrorReporter;
import express.mvp.myra.resilience.handler.FailureHandler;
import express.mvp.myra.resilience.handler.RetryingExecutor;
import express.mvp.myra.resilience.response.ResponseFormatter;
import express.mvp.myra.resilience.retry.RetryCoordinator;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point wiring the cache, retry coordinator, failure handler and response formatter.
 *
 * <p>Owns a scheduler for retry delays and a separate executor for error reports, so a slow
 * reporter never holds back a retry. Closing the instance stops both; delays already scheduled
 * still fire, and failures handled afterwards are delivered without retry.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (Resilience resilience = Resilience.create(ResilienceConfig.defaults())) {
 *     CacheStore<UserInfo> users = resilience.newCache();
 *     UserInfo user = users.getOrCompute(
 *         Fingerprint.of("getUserInfo", id), () -> api.getUserInfo(id));
 *
 *     resilience.executor()
 *         .execute(() -> api.sendMessage(body), "sendMessage", HandlerOptions.retrying())
 *         .exceptionally(error -> {
 *             render(resilience.formatter().createErrorResponse(error));
 *             return null;
 *         });
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class and all components it hands out are thread-safe.
 *
 * @see ResilienceConfig
 */
public final class Resilience implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(Resilience.class.getName());

    private final ResilienceConfig config;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService reportExecutor;
    private final RetryCoordinator coordinator;
    private final FailureHandler handler;
    private final RetryingExecutor executor;
    private final ResponseFormatter formatter;

    private Resilience(ResilienceConfig config) {
        this.config = config;
        this.scheduler =
                Executors.newScheduledThreadPool(
                        config.schedulerThreads(),
                        new ResilienceThreadFactory("myra-resilience-retry"));
        this.reportExecutor =
                Executors.newSingleThreadExecutor(
                        new ResilienceThreadFactory("myra-resilience-report"));
        this.coordinator =
                new RetryCoordinator(
                        config.retryPolicies(), scheduler, config.budgetScope(), config.clock());
        this.handler =
                new FailureHandler(
                        coordinator,
                        config.errorLog(),
                        config.reportingEnabled() ? config.reporter() : ErrorReporter.NONE,
                        reportExecutor,
                        config.clock());
        this.executor = new RetryingExecutor(handler);
        this.formatter = new ResponseFormatter(config.clock());
    }

    /**
     * Creates an instance.
     *
     * @param config the configuration
     * @return a new instance; close it to stop its scheduler
     */
    public static Resilience create(ResilienceConfig config) {
        Objects.requireNonNull(config, "config");
        LOGGER.log(Level.FINE, "Creating resilience layer: {0}", config);
        return new Resilience(config);
    }

    /**
     * Creates a cache sized and timed by the configuration.
     *
     * @param <V> the value type
     * @return a new, empty cache
     */
    public <V> CacheStore<V> newCache() {
        return new CacheStore<>(config.cacheCapacity(), config.cacheTtl(), config.clock());
    }

    /**
     * Returns the configuration this instance was created with.
     *
     * @return the configuration
     */
    public ResilienceConfig config() {
        return config;
    }

    /**
     * Returns the coordinator holding the retry budgets.
     *
     * @return the coordinator
     */
    public RetryCoordinator coordinator() {
        return coordinator;
    }

    /**
     * Returns the failure handler.
     *
     * @return the handler
     */
    public FailureHandler handler() {
        return handler;
    }

    /**
     * Returns the executor that re-invokes operations on retry.
     *
     * @return the executor
     */
    public RetryingExecutor executor() {
        return executor;
    }

    /**
     * Returns the formatter for external error responses.
     *
     * @return the formatter
     */
    public ResponseFormatter formatter() {
        return formatter;
    }

    /**
     * Checks if {@link #close()} was called.
     *
     * @return true once closed
     */
    public boolean isClosed() {
        return scheduler.isShutdown();
    }

    /** Stops accepting new retry delays and reports. Idempotent. */
    @Override
    public void close() {
        if (!scheduler.isShutdown()) {
            scheduler.shutdown();
            reportExecutor.shutdown();
            LOGGER.log(Level.FINE, "Resilience scheduler and report executor shut down");
        }
    }
}
