package express.mvp.myra.resilience.handler;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.myra.resilience.error.ErrorClassifier;
import express.mvp.myra.resilience.error.ErrorMessages;
import express.mvp.myra.resilience.error.StandardException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of a handled error as it goes to logs and to the {@link ErrorReporter}.
 *
 * <p>Unlike the external error response, a report carries the stack trace. It never leaves the
 * process through the response path.
 *
 * @param type the error type name, e.g. {@code NetworkError} or the exception's simple name
 * @param code the kind code, {@code UNKNOWN_ERROR} for unclassified throwables
 * @param retryKey the key used for retry budgets
 * @param message the error's own message
 * @param context where the error occurred
 * @param details the error's details, or for unclassified throwables the kind and reason
 *     {@link ErrorClassifier} assigns (read-only)
 * @param timestamp when the error was handled
 * @param stackTrace the printed stack trace
 */
@SuppressFBWarnings(
        value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
        justification = "Details are copied into an unmodifiable map.")
public record ErrorReport(
        String type,
        String code,
        String retryKey,
        String message,
        String context,
        Map<String, Object> details,
        Instant timestamp,
        String stackTrace) {

    /** Code used for throwables that are not {@link StandardException}s. */
    public static final String UNKNOWN_CODE = "UNKNOWN_ERROR";

    public ErrorReport {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(timestamp, "timestamp");
        details =
                details == null || details.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Formats a throwable for logging and reporting.
     *
     * @param error the handled error
     * @param context where the error occurred (may be null)
     * @param clock source of the report timestamp
     * @return the report
     */
    public static ErrorReport of(Throwable error, String context, Clock clock) {
        Objects.requireNonNull(error, "error");
        if (error instanceof StandardException classified) {
            return new ErrorReport(
                    classified.kind().typeName(),
                    classified.code(),
                    classified.retryKey(),
                    ErrorMessages.messageOrDefault(classified),
                    context,
                    classified.details(),
                    clock.instant(),
                    stackTraceOf(classified));
        }
        Map<String, Object> classification = new LinkedHashMap<>();
        classification.put("classifiedKind", ErrorClassifier.classify(error).code());
        classification.put("reason", ErrorClassifier.reasonFor(error).name());
        return new ErrorReport(
                error.getClass().getSimpleName(),
                UNKNOWN_CODE,
                UNKNOWN_CODE,
                ErrorMessages.messageOrDefault(error),
                context,
                classification,
                clock.instant(),
                stackTraceOf(error));
    }

    /**
     * Returns the report as a log context map.
     *
     * @return an ordered map with every field
     */
    public Map<String, Object> toLogContext() {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("type", type);
        ctx.put("message", message);
        ctx.put("code", code);
        ctx.put("context", context);
        ctx.put("timestamp", timestamp.toString());
        ctx.put("details", details);
        ctx.put("stack", stackTrace);
        return ctx;
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
