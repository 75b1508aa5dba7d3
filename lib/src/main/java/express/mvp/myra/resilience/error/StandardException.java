package express.mvp.myra.resilience.error;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Unchecked exception carrying a classified failure.
 *
 * <p>Every failure that leaves a client operation is delivered as this type. It carries the
 * {@link ErrorKind}, the kind's stable {@link #code() code}, a message, a details map and the
 * instant it occurred. An optional catalog {@link #reason() reason} narrows the kind to a
 * specific sub-case such as {@link ErrorCode#NETWORK_TIMEOUT}; retry budgets are keyed by it.
 *
 * <p>Instances are immutable: the details map is copied on construction and exposed read-only.
 * The details are expected to be sanitized by the caller.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * throw StandardException.network(ErrorCode.NETWORK_TIMEOUT, "Upstream timed out",
 *         Map.of("endpoint", "/graphql"));
 * }</pre>
 *
 * @see ErrorKind
 * @see ErrorMessages
 */
public class StandardException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    /** Catalog sub-case, or null when only the kind is known. */
    private final ErrorCode reason;

    private final transient Map<String, Object> details;

    private final Instant timestamp;

    /**
     * Constructs an exception of the given kind.
     *
     * @param kind the error kind
     * @param message the detail message
     */
    public StandardException(ErrorKind kind, String message) {
        this(kind, null, message, Map.of(), null);
    }

    /**
     * Constructs an exception of the given kind with details.
     *
     * @param kind the error kind
     * @param message the detail message
     * @param details additional details (may be null)
     */
    public StandardException(ErrorKind kind, String message, Map<String, ?> details) {
        this(kind, null, message, details, null);
    }

    /**
     * Constructs an exception with a catalog reason.
     *
     * @param kind the error kind
     * @param reason the catalog sub-case (may be null)
     * @param message the detail message
     * @param details additional details (may be null)
     */
    public StandardException(
            ErrorKind kind, ErrorCode reason, String message, Map<String, ?> details) {
        this(kind, reason, message, details, null);
    }

    /**
     * Constructs an exception with a catalog reason and an underlying cause.
     *
     * @param kind the error kind
     * @param reason the catalog sub-case (may be null)
     * @param message the detail message
     * @param details additional details (may be null)
     * @param cause the underlying cause (may be null)
     */
    public StandardException(
            ErrorKind kind,
            ErrorCode reason,
            String message,
            Map<String, ?> details,
            Throwable cause) {
        this(kind, reason, message, details, cause, Instant.now());
    }

    /**
     * Constructs an exception stamped with the given instant.
     *
     * <p>The other constructors stamp the system time; use this one to take the timestamp from a
     * configured {@link Clock}.
     *
     * @param kind the error kind
     * @param reason the catalog sub-case (may be null)
     * @param message the detail message
     * @param details additional details (may be null)
     * @param cause the underlying cause (may be null)
     * @param timestamp when the error occurred
     */
    public StandardException(
            ErrorKind kind,
            ErrorCode reason,
            String message,
            Map<String, ?> details,
            Throwable cause,
            Instant timestamp) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reason = reason;
        this.details =
                details == null || details.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Wraps an unclassified throwable as a {@link ErrorKind#NETWORK} error stamped with the system
     * time.
     *
     * @param error the throwable to wrap
     * @return the wrapped error, or {@code error} itself if it is already classified
     * @see #wrap(Throwable, Clock)
     */
    public static StandardException wrap(Throwable error) {
        return wrap(error, Clock.systemUTC());
    }

    /**
     * Wraps an unclassified throwable as a {@link ErrorKind#NETWORK} error.
     *
     * <p>The throwable is kept both as the cause and under {@code details.originalError}. The kind
     * {@link ErrorClassifier} assigns to it is recorded under {@code details.classifiedKind}. When
     * the classifier recognizes a network sub-case, that sub-case becomes the reason.
     *
     * @param error the throwable to wrap
     * @param clock source of the timestamp
     * @return the wrapped error, or {@code error} itself if it is already classified
     */
    public static StandardException wrap(Throwable error, Clock clock) {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(clock, "clock");
        if (error instanceof StandardException classified) {
            return classified;
        }
        ErrorCode reason = ErrorClassifier.reasonFor(error);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("originalError", error);
        details.put("classifiedKind", ErrorClassifier.classify(error).code());
        return new StandardException(
                ErrorKind.NETWORK,
                reason.kind() == ErrorKind.NETWORK ? reason : null,
                "An unexpected error occurred",
                details,
                error,
                clock.instant());
    }

    /**
     * Creates an authentication error.
     *
     * @param message the detail message
     * @param details additional details (may be null)
     * @return the error
     */
    public static StandardException authentication(String message, Map<String, ?> details) {
        return new StandardException(ErrorKind.AUTHENTICATION, message, details);
    }

    /**
     * Creates an authentication error with a catalog reason.
     *
     * @param reason the sub-case, e.g. {@link ErrorCode#AUTH_SESSION_EXPIRED}
     * @param message the detail message
     * @param details additional details (may be null)
     * @return the error
     */
    public static StandardException authentication(
            ErrorCode reason, String message, Map<String, ?> details) {
        return new StandardException(ErrorKind.AUTHENTICATION, reason, message, details);
    }

    /**
     * Creates a network error.
     *
     * @param message the detail message
     * @param details additional details (may be null)
     * @return the error
     */
    public static StandardException network(String message, Map<String, ?> details) {
        return new StandardException(ErrorKind.NETWORK, message, details);
    }

    /**
     * Creates a network error with a catalog reason.
     *
     * @param reason the sub-case, e.g. {@link ErrorCode#NETWORK_TIMEOUT}
     * @param message the detail message
     * @param details additional details (may be null)
     * @return the error
     */
    public static StandardException network(
            ErrorCode reason, String message, Map<String, ?> details) {
        return new StandardException(ErrorKind.NETWORK, reason, message, details);
    }

    /**
     * Creates a validation error.
     *
     * @param message the detail message
     * @param details additional details (may be null)
     * @return the error
     */
    public static StandardException validation(String message, Map<String, ?> details) {
        return new StandardException(ErrorKind.VALIDATION, message, details);
    }

    /**
     * Creates a validation error with a catalog reason.
     *
     * @param reason the sub-case, e.g. {@link ErrorCode#VALIDATION_MISSING_PARAM}
     * @param message the detail message
     * @param details additional details (may be null)
     * @return the error
     */
    public static StandardException validation(
            ErrorCode reason, String message, Map<String, ?> details) {
        return new StandardException(ErrorKind.VALIDATION, reason, message, details);
    }

    /**
     * Creates a configuration error.
     *
     * @param message the detail message
     * @param details additional details (may be null)
     * @return the error
     */
    public static StandardException configuration(String message, Map<String, ?> details) {
        return new StandardException(ErrorKind.CONFIGURATION, message, details);
    }

    /**
     * Creates a security error. Its message is never shown outside the library.
     *
     * @param message the detail message
     * @param details additional details (may be null)
     * @return the error
     */
    public static StandardException security(String message, Map<String, ?> details) {
        return new StandardException(ErrorKind.SECURITY, message, details);
    }

    /**
     * Creates a security error with a catalog reason.
     *
     * @param reason the sub-case, e.g. {@link ErrorCode#SECURITY_PERMISSION_DENIED}
     * @param message the detail message
     * @param details additional details (may be null)
     * @return the error
     */
    public static StandardException security(
            ErrorCode reason, String message, Map<String, ?> details) {
        return new StandardException(ErrorKind.SECURITY, reason, message, details);
    }

    /**
     * Creates a database error.
     *
     * @param message the detail message
     * @param details additional details (may be null)
     * @return the error
     */
    public static StandardException database(String message, Map<String, ?> details) {
        return new StandardException(ErrorKind.DATABASE, message, details);
    }

    /**
     * Creates an error of unknown kind.
     *
     * @param message the detail message
     * @param details additional details (may be null)
     * @return the error
     */
    public static StandardException unknown(String message, Map<String, ?> details) {
        return new StandardException(ErrorKind.UNKNOWN, message, details);
    }

    /**
     * Returns the error kind.
     *
     * @return the kind (never null)
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * Returns the stable kind code.
     *
     * @return the code, always equal to {@code kind().code()}
     */
    public String code() {
        return kind.code();
    }

    /**
     * Returns the catalog sub-case.
     *
     * @return the reason, or empty if only the kind is known
     */
    public Optional<ErrorCode> reason() {
        return Optional.ofNullable(reason);
    }

    /**
     * Returns the key under which retry budgets for this error are kept.
     *
     * @return the reason's symbolic name if present, otherwise the kind code
     */
    public String retryKey() {
        return reason != null ? reason.name() : kind.code();
    }

    /**
     * Returns the details map.
     *
     * @return read-only details (never null)
     */
    public Map<String, Object> details() {
        // null only after deserialization
        return details != null ? details : Map.of();
    }

    /**
     * Returns the instant this error occurred.
     *
     * @return the timestamp
     */
    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Returns the message that may be shown outside the library.
     *
     * @return the safe message
     * @see ErrorMessages#safeMessage(Throwable)
     */
    public String safeMessage() {
        return ErrorMessages.safeMessage(this);
    }
}
