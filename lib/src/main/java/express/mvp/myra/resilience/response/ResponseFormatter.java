package express.mvp.myra.resilience.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import express.mvp.myra.resilience.error.ErrorClassifier;
import express.mvp.myra.resilience.error.ErrorCodeCatalog;
import express.mvp.myra.resilience.error.ErrorMessages;
import express.mvp.myra.resilience.error.StandardException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns errors into {@link ErrorResponse} payloads.
 *
 * <p>Classified errors keep their message, code, details and timestamp; the catalog code is looked
 * up by the kind code and falls back to {@code ERR_GENERAL_01}. Security errors show the fixed
 * safe message. Anything else becomes an {@code UNKNOWN_ERROR} response stamped with the current
 * time.
 *
 * <p>Throwables found in the details are rendered as {@code {type, message}}; stack traces are
 * never included.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ResponseFormatter formatter = new ResponseFormatter();
 * ErrorResponse response = formatter.createErrorResponse(error);
 * String body = formatter.toJson(response);
 * }</pre>
 */
public final class ResponseFormatter {

    /** Kind code used for unclassified errors. */
    public static final String UNKNOWN_CODE = "UNKNOWN_ERROR";

    private final Clock clock;
    private final ObjectMapper mapper;

    /** Creates a formatter using the system UTC clock. */
    public ResponseFormatter() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a formatter.
     *
     * @param clock source of timestamps for unclassified errors
     */
    public ResponseFormatter(Clock clock) {
        this(clock, new ObjectMapper());
    }

    /**
     * Creates a formatter with a custom mapper.
     *
     * @param clock source of timestamps for unclassified errors
     * @param mapper JSON mapper used by {@link #toJson(ErrorResponse)}
     */
    public ResponseFormatter(Clock clock, ObjectMapper mapper) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Builds the response for an error.
     *
     * @param error the error
     * @return the response
     */
    public ErrorResponse createErrorResponse(Throwable error) {
        Throwable failure = ErrorClassifier.unwrap(error);
        if (failure instanceof StandardException classified) {
            return new ErrorResponse(
                    true,
                    ErrorMessages.safeMessage(classified),
                    classified.code(),
                    ErrorCodeCatalog.lookup(classified.code()),
                    sanitize(classified.details()),
                    classified.timestamp().toString());
        }
        return new ErrorResponse(
                true,
                ErrorMessages.messageOrDefault(failure),
                UNKNOWN_CODE,
                ErrorCodeCatalog.GENERAL_FALLBACK,
                Map.of(),
                clock.instant().toString());
    }

    /**
     * Builds the response for an error and serializes it.
     *
     * @param error the error
     * @return the JSON body
     */
    public String toJson(Throwable error) {
        return toJson(createErrorResponse(error));
    }

    /**
     * Serializes a response.
     *
     * @param response the response
     * @return the JSON body
     * @throws IllegalStateException if the details cannot be serialized
     */
    public String toJson(ErrorResponse response) {
        try {
            return mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Error response cannot be serialized", e);
        }
    }

    /**
     * Looks up the catalog code for a symbolic name.
     *
     * @param symbolicName e.g. {@code NETWORK_TIMEOUT}
     * @return the catalog code, {@code ERR_GENERAL_01} if unknown
     */
    public String getErrorCode(String symbolicName) {
        return ErrorCodeCatalog.lookup(symbolicName);
    }

    private static Map<String, Object> sanitize(Map<String, ?> details) {
        Map<String, Object> out = new LinkedHashMap<>();
        details.forEach((key, value) -> out.put(key, sanitizeValue(value)));
        return out;
    }

    private static Object sanitizeValue(Object value) {
        if (value instanceof Throwable t) {
            Map<String, Object> rendered = new LinkedHashMap<>();
            rendered.put("type", t.getClass().getSimpleName());
            rendered.put("message", ErrorMessages.safeMessage(t));
            return rendered;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((key, v) -> nested.put(String.valueOf(key), sanitizeValue(v)));
            return nested;
        }
        if (value instanceof Collection<?> items) {
            List<Object> list = new ArrayList<>(items.size());
            items.forEach(item -> list.add(sanitizeValue(item)));
            return list;
        }
        return value;
    }
}
