package express.mvp.myra.resilience.validation;

import express.mvp.myra.resilience.error.ErrorCode;
import express.mvp.myra.resilience.error.StandardException;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Synchronous checks on operation parameters.
 *
 * <pre>{@code
 * ParamValidator.validateRequiredParams(params, List.of("threadId", "body"));
 * }</pre>
 */
public final class ParamValidator {

    private ParamValidator() {
        // Utility class
    }

    /**
     * Checks that {@code params} is a map holding a non-null value for every required name.
     *
     * @param params the parameters (may be null)
     * @param required the required names, checked in iteration order
     * @throws StandardException of kind {@code VALIDATION} if {@code params} is not a map, or
     *     naming the first missing or null parameter
     * @throws NullPointerException if {@code required} is null or contains null
     */
    public static void validateRequiredParams(Object params, Collection<String> required) {
        Objects.requireNonNull(required, "required");
        for (String name : required) {
            Objects.requireNonNull(name, "required parameter name");
        }
        if (!(params instanceof Map<?, ?> map)) {
            throw StandardException.validation(
                    ErrorCode.VALIDATION_INVALID_FORMAT, "Parameters must be an object", null);
        }
        for (String name : required) {
            if (map.get(name) == null) {
                throw StandardException.validation(
                        ErrorCode.VALIDATION_MISSING_PARAM,
                        "Required parameter '" + name + "' is missing",
                        Map.of("param", name));
            }
        }
    }
}
