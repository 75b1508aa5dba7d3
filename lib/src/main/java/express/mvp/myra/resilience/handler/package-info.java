/**
 * Failure handling for client operations: logging, reporting, retry and delivery.
 *
 * <p>{@link express.mvp.myra.resilience.handler.FailureHandler} is the single failure path.
 * {@link express.mvp.myra.resilience.handler.RetryingExecutor} drives an operation through it
 * until it succeeds or the retry budget runs out. Callers that prefer callbacks over futures use
 * {@link express.mvp.myra.resilience.handler.Callback} and
 * {@link express.mvp.myra.resilience.handler.Completion}.
 */
package express.mvp.myra.resilience.handler;
