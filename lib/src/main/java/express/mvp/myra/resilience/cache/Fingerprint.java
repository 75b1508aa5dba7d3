package express.mvp.myra.resilience.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import express.mvp.myra.resilience.error.ErrorCode;
import express.mvp.myra.resilience.error.ErrorKind;
import express.mvp.myra.resilience.error.StandardException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;

/**
 * Derives stable cache keys from an operation name and its inputs.
 *
 * <p>Inputs are serialized to canonical JSON (map entries and bean properties sorted) and hashed
 * with SHA-256, so two calls with equal inputs produce the same key regardless of map iteration
 * order. The operation name stays readable as the key prefix.
 *
 * <pre>{@code
 * Fingerprint.of("getUserInfo", Map.of("id", "100004"));
 * // getUserInfo:3f1c...e9
 * }</pre>
 */
public final class Fingerprint {

    private static final ObjectMapper CANONICAL =
            JsonMapper.builder()
                    .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                    .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                    .build();

    private Fingerprint() {
        // Utility class
    }

    /**
     * Computes the fingerprint of an operation with named inputs.
     *
     * @param operation the operation name
     * @param inputs the operation inputs (may be empty)
     * @return the cache key
     * @throws StandardException of kind VALIDATION if the inputs cannot be serialized
     */
    public static String of(String operation, Map<String, ?> inputs) {
        return of(operation, (Object) (inputs == null ? Map.of() : inputs));
    }

    /**
     * Computes the fingerprint of an operation with positional inputs.
     *
     * @param operation the operation name
     * @param inputs the operation inputs
     * @return the cache key
     * @throws StandardException of kind VALIDATION if the inputs cannot be serialized
     */
    public static String of(String operation, Object... inputs) {
        Objects.requireNonNull(operation, "operation");
        Object payload = inputs != null && inputs.length == 1 ? inputs[0] : inputs;
        return operation + ":" + sha256(canonicalJson(payload));
    }

    static String canonicalJson(Object payload) {
        try {
            return CANONICAL.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StandardException(
                    ErrorKind.VALIDATION,
                    ErrorCode.VALIDATION_INVALID_FORMAT,
                    "Operation inputs cannot be fingerprinted",
                    Map.of("type", payload.getClass().getName()),
                    e);
        }
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
