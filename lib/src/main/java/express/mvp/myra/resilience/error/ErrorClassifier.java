package express.mvp.myra.resilience.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.security.GeneralSecurityException;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import javax.net.ssl.SSLException;

/**
 * Classifies throwables into error kinds and catalog sub-cases.
 *
 * <p>Already classified errors ({@link StandardException}) keep their own kind and reason.
 * Anything else is matched by exception type, then by message, then through its cause chain.
 * Custom classifiers can be registered for application-specific exceptions.
 *
 * <h2>Classification Strategy</h2>
 *
 * <ol>
 *   <li>Unwrap {@link CompletionException} and {@link ExecutionException}
 *   <li>Use the kind of a {@link StandardException}
 *   <li>Check custom classifiers (instance match)
 *   <li>Check exception type hierarchy
 *   <li>Analyze exception message for patterns
 *   <li>Check cause recursively
 *   <li>Default to {@link ErrorKind#UNKNOWN}
 * </ol>
 *
 * <h2>Custom Classifiers</h2>
 *
 * <pre>{@code
 * ErrorClassifier.registerClassifier(
 *     GraphQlException.class,
 *     e -> e.isAuthProblem() ? ErrorKind.AUTHENTICATION : ErrorKind.NETWORK);
 * }</pre>
 *
 * @see ErrorKind
 * @see ErrorCode
 */
public final class ErrorClassifier {

    /** Custom classifiers keyed by exception class. */
    private static final Map<Class<? extends Throwable>, Function<Throwable, ErrorKind>>
            CUSTOM_CLASSIFIERS = new ConcurrentHashMap<>();

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies a throwable into an error kind.
     *
     * @param throwable the throwable to classify
     * @return the error kind, {@link ErrorKind#UNKNOWN} for null or unrecognized input
     */
    public static ErrorKind classify(Throwable throwable) {
        Throwable t = unwrap(throwable);
        if (t == null) {
            return ErrorKind.UNKNOWN;
        }
        if (t instanceof StandardException classified) {
            return classified.kind();
        }

        ErrorKind custom = classifyCustom(t);
        if (custom != null) {
            return custom;
        }

        if (t instanceof SecurityException || t instanceof GeneralSecurityException) {
            return ErrorKind.SECURITY;
        }
        if (t instanceof SQLException) {
            return ErrorKind.DATABASE;
        }
        if (isNetworkError(t) || isTimeoutError(t)) {
            return ErrorKind.NETWORK;
        }

        ErrorKind messageKind = classifyByMessage(t);
        if (messageKind != null) {
            return messageKind;
        }

        Throwable cause = t.getCause();
        if (cause != null && cause != t) {
            return classify(cause);
        }

        return ErrorKind.UNKNOWN;
    }

    /**
     * Determines the catalog sub-case of a throwable.
     *
     * @param throwable the throwable to inspect
     * @return the sub-case, {@link ErrorCode#UNKNOWN_ERROR} if none applies
     */
    public static ErrorCode reasonFor(Throwable throwable) {
        Throwable t = unwrap(throwable);
        if (t == null) {
            return ErrorCode.UNKNOWN_ERROR;
        }
        if (t instanceof StandardException classified) {
            return classified.reason().orElse(ErrorCode.UNKNOWN_ERROR);
        }

        if (t instanceof CancellationException || t instanceof InterruptedException) {
            return ErrorCode.OPERATION_CANCELLED;
        }
        if (t instanceof UnsupportedOperationException) {
            return ErrorCode.NOT_IMPLEMENTED;
        }

        // SQL timeouts are database problems, not network ones
        if (t instanceof SQLTransientConnectionException) {
            return ErrorCode.DATABASE_CONNECTION_FAILED;
        }
        if (t instanceof SQLException) {
            return ErrorCode.DATABASE_QUERY_FAILED;
        }

        if (isTimeoutError(t)) {
            return ErrorCode.NETWORK_TIMEOUT;
        }
        if (isConnectionError(t)) {
            return ErrorCode.NETWORK_CONNECTION_FAILED;
        }
        if (t instanceof JsonProcessingException) {
            return ErrorCode.NETWORK_PARSE_FAILED;
        }
        if (isNetworkError(t)) {
            return ErrorCode.NETWORK_REQUEST_FAILED;
        }

        String msg = lowerMessage(t);
        if (msg != null && (msg.contains("rate limit") || msg.contains("too many requests"))) {
            return ErrorCode.NETWORK_RATE_LIMITED;
        }

        Throwable cause = t.getCause();
        if (cause != null && cause != t) {
            return reasonFor(cause);
        }

        return ErrorCode.UNKNOWN_ERROR;
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     *
     * @param t the throwable (may be null)
     * @return the innermost wrapped throwable, or {@code t} itself
     */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static ErrorKind classifyCustom(Throwable t) {
        for (Map.Entry<Class<? extends Throwable>, Function<Throwable, ErrorKind>> entry :
                CUSTOM_CLASSIFIERS.entrySet()) {
            if (entry.getKey().isInstance(t)) {
                ErrorKind kind = entry.getValue().apply(t);
                if (kind != null) {
                    return kind;
                }
            }
        }
        return null;
    }

    /** Connection establishment failures. */
    private static boolean isConnectionError(Throwable t) {
        if (t instanceof ConnectException) return true;
        if (t instanceof UnknownHostException) return true;
        if (t instanceof NoRouteToHostException) return true;
        if (t instanceof PortUnreachableException) return true;
        if (t instanceof ClosedChannelException) return true;

        if (t instanceof SocketException) {
            String msg = lowerMessage(t);
            return msg != null
                    && (msg.contains("connection reset")
                            || msg.contains("broken pipe")
                            || msg.contains("connection refused")
                            || msg.contains("network is unreachable"));
        }
        return false;
    }

    /** Any transport-level failure, connection or request. */
    private static boolean isNetworkError(Throwable t) {
        if (isConnectionError(t)) return true;
        if (t instanceof SocketException) return true;
        if (t instanceof SSLException) return true;

        if (t instanceof JsonProcessingException) return true;

        if (t instanceof IOException) {
            String msg = lowerMessage(t);
            return msg != null
                    && (msg.contains("connection")
                            || msg.contains("socket")
                            || msg.contains("network")
                            || msg.contains("http"));
        }
        return false;
    }

    private static boolean isTimeoutError(Throwable t) {
        if (t instanceof TimeoutException) return true;
        if (t instanceof SocketTimeoutException) return true;
        if (t instanceof HttpTimeoutException) return true;

        String msg = lowerMessage(t);
        return msg != null && (msg.contains("timeout") || msg.contains("timed out"));
    }

    private static ErrorKind classifyByMessage(Throwable t) {
        String msg = lowerMessage(t);
        if (msg == null || msg.isEmpty()) {
            return null;
        }

        if (msg.contains("unauthorized")
                || msg.contains("login")
                || msg.contains("checkpoint")
                || msg.contains("session expired")) {
            return ErrorKind.AUTHENTICATION;
        }

        if (msg.contains("connection")
                && (msg.contains("reset")
                        || msg.contains("refused")
                        || msg.contains("closed")
                        || msg.contains("lost"))) {
            return ErrorKind.NETWORK;
        }

        if (msg.contains("decrypt") || msg.contains("encrypt") || msg.contains("permission denied")) {
            return ErrorKind.SECURITY;
        }

        return null;
    }

    private static String lowerMessage(Throwable t) {
        String msg = t.getMessage();
        return msg == null ? null : msg.toLowerCase(Locale.ROOT);
    }

    /**
     * Registers a custom classifier for a specific exception type.
     *
     * <p>Custom classifiers are checked before built-in classification. A classifier returning
     * null falls through to the built-in rules.
     *
     * @param exceptionType the exception class to match
     * @param classifier function mapping a matching exception to its kind
     * @param <T> the exception type
     */
    @SuppressWarnings("unchecked")
    public static <T extends Throwable> void registerClassifier(
            Class<T> exceptionType, Function<? super T, ErrorKind> classifier) {
        CUSTOM_CLASSIFIERS.put(exceptionType, t -> classifier.apply((T) t));
    }

    /**
     * Removes a previously registered custom classifier.
     *
     * @param exceptionType the exception class
     */
    public static void removeClassifier(Class<? extends Throwable> exceptionType) {
        CUSTOM_CLASSIFIERS.remove(exceptionType);
    }

    /** Clears all custom classifiers. */
    public static void clearCustomClassifiers() {
        CUSTOM_CLASSIFIERS.clear();
    }
}
