package express.mvp.myra.resilience;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.resilience.cache.CacheStore;
import express.mvp.myra.resilience.error.ErrorCode;
import express.mvp.myra.resilience.error.StandardException;
import express.mvp.myra.resilience.handler.ErrorReporter;
import express.mvp.myra.resilience.handler.HandledFailure;
import express.mvp.myra.resilience.handler.HandlerOptions;
import express.mvp.myra.resilience.retry.RetryPolicy;
import express.mvp.myra.resilience.retry.RetryPolicyTable;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Tests for {@link Resilience} wiring. */
@DisplayName("Resilience")
class ResilienceTest {

    @Test
    @DisplayName("newCache uses the configured capacity and TTL")
    void newCache() {
        MutableClock clock = new MutableClock();
        try (Resilience resilience =
                Resilience.create(
                        ResilienceConfig.builder()
                                .cacheCapacity(2)
                                .cacheTtl(Duration.ofSeconds(10))
                                .clock(clock)
                                .build())) {
            CacheStore<String> cache = resilience.newCache();

            assertEquals(2, cache.capacity());
            assertEquals(Duration.ofSeconds(10), cache.defaultTtl());

            cache.set("k", "v");
            clock.advance(Duration.ofSeconds(11));
            assertNull(cache.get("k"));
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("the executor retries through the shared coordinator")
    void executorRetries() {
        RetryPolicyTable policies =
                RetryPolicyTable.builder()
                        .put(ErrorCode.NETWORK_TIMEOUT, RetryPolicy.fixedDelay(3, Duration.ofMillis(1)))
                        .build();
        AtomicInteger calls = new AtomicInteger();

        try (Resilience resilience =
                Resilience.create(
                        ResilienceConfig.builder()
                                .retryPolicies(policies)
                                .reportingEnabled(false)
                                .build())) {
            CompletableFuture<String> result =
                    resilience
                            .executor()
                            .execute(
                                    () ->
                                            calls.incrementAndGet() < 3
                                                    ? CompletableFuture.failedFuture(
                                                            StandardException.network(
                                                                    ErrorCode.NETWORK_TIMEOUT,
                                                                    "timed out",
                                                                    Map.of()))
                                                    : CompletableFuture.completedFuture("ok"),
                                    "fetchThread",
                                    HandlerOptions.retrying());

            assertEquals("ok", result.join());
            assertEquals(3, calls.get());
            assertEquals(0, resilience.coordinator().attempts("NETWORK_TIMEOUT"));
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("a blocking reporter does not hold back retry delays")
    void blockingReporter_doesNotDelayRetry() throws Exception {
        RetryPolicyTable policies =
                RetryPolicyTable.builder()
                        .put(ErrorCode.NETWORK_TIMEOUT, RetryPolicy.fixedDelay(3, Duration.ofMillis(10)))
                        .build();
        CountDownLatch reporting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ErrorReporter blocking =
                report -> {
                    reporting.countDown();
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                };

        try (Resilience resilience =
                Resilience.create(
                        ResilienceConfig.builder().retryPolicies(policies).reporter(blocking).build())) {
            try {
                CompletableFuture<HandledFailure> handled =
                        resilience.handler().handle(timeout(), "fetchThread", HandlerOptions.retrying());

                assertTrue(reporting.await(5, TimeUnit.SECONDS));
                assertTrue(handled.get(2, TimeUnit.SECONDS).isRetryRequested());
            } finally {
                release.countDown();
            }
        }
    }

    @Test
    @DisplayName("after close retryable failures are delivered classified, without retry")
    void closed_deliversWithoutRetry() throws Exception {
        Resilience resilience = Resilience.create(ResilienceConfig.defaults());
        resilience.close();
        StandardException error = timeout();
        AtomicReference<Throwable> received = new AtomicReference<>();

        HandledFailure handled =
                resilience
                        .handler()
                        .handle(error, "op", HandlerOptions.retrying())
                        .get(5, TimeUnit.SECONDS);
        resilience.handler().<Void>handle(error, "op", HandlerOptions.retrying(), (e, r) -> received.set(e));
        CompletableFuture<Void> failed = resilience.handler().fail(error, "op", HandlerOptions.retrying());

        assertSame(error, handled.error());
        assertFalse(handled.isRetryRequested());
        assertSame(error, received.get());
        ExecutionException e = assertThrows(ExecutionException.class, failed::get);
        assertSame(error, e.getCause());
        assertEquals(0, resilience.coordinator().attempts("NETWORK_TIMEOUT"));
    }

    private static StandardException timeout() {
        return StandardException.network(ErrorCode.NETWORK_TIMEOUT, "timed out", Map.of());
    }

    @Test
    @DisplayName("close is idempotent")
    void closeIdempotent() {
        Resilience resilience = Resilience.create(ResilienceConfig.defaults());

        assertFalse(resilience.isClosed());
        resilience.close();
        resilience.close();
        assertTrue(resilience.isClosed());
    }

    @Test
    @DisplayName("the formatter uses the configured clock")
    void formatterClock() {
        MutableClock clock = new MutableClock();
        try (Resilience resilience =
                Resilience.create(ResilienceConfig.builder().clock(clock).build())) {
            assertEquals(
                    "2024-01-01T00:00:00Z",
                    resilience
                            .formatter()
                            .createErrorResponse(new IllegalStateException("x"))
                            .timestamp());
        }
    }
}
