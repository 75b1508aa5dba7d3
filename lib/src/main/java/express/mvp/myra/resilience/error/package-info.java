/**
 * Error taxonomy shared by every client operation.
 *
 * <p>This package defines the closed set of error kinds, the external code catalog, the single
 * exception type delivered to callers, and classification of arbitrary throwables.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.resilience.error.ErrorKind} - Failure categories and their codes
 *   <li>{@link express.mvp.myra.resilience.error.ErrorCode} - Catalog of sub-cases and external codes
 *   <li>{@link express.mvp.myra.resilience.error.ErrorCodeCatalog} - Lookup with general fallback
 *   <li>{@link express.mvp.myra.resilience.error.StandardException} - The classified error
 *   <li>{@link express.mvp.myra.resilience.error.ErrorClassifier} - Classifies JDK exceptions
 *   <li>{@link express.mvp.myra.resilience.error.ErrorMessages} - Safe external messages
 * </ul>
 *
 * <h2>Kind Code vs Catalog Code</h2>
 *
 * <p>The kind code ({@code AUTH_ERROR}) identifies the category. The catalog code
 * ({@code ERR_AUTH_01}) identifies a sub-case and is looked up by symbolic name
 * ({@code AUTH_LOGIN_FAILED}).
 *
 * @see express.mvp.myra.resilience.retry.RetryCoordinator
 */
package express.mvp.myra.resilience.error;
