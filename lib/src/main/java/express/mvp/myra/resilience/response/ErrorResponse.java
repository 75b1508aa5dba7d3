package express.mvp.myra.resilience.response;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Error payload returned to API callers.
 *
 * <p>Serialized as {@code {"error":true,"message":...,"code":...,"errorCode":...,"details":{...},
 * "timestamp":"2024-01-01T00:00:00Z"}}.
 *
 * @param error always {@code true}
 * @param message the safe message
 * @param code the kind code, e.g. {@code VALIDATION_ERROR}
 * @param errorCode the catalog code, e.g. {@code ERR_GENERAL_01}
 * @param details sanitized details (read-only)
 * @param timestamp ISO-8601 instant
 */
@JsonPropertyOrder({"error", "message", "code", "errorCode", "details", "timestamp"})
@SuppressFBWarnings(
        value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
        justification = "Details are copied into an unmodifiable map.")
public record ErrorResponse(
        boolean error,
        String message,
        String code,
        String errorCode,
        Map<String, Object> details,
        String timestamp) {

    public ErrorResponse {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(errorCode, "errorCode");
        Objects.requireNonNull(timestamp, "timestamp");
        details =
                details == null || details.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
