package express.mvp.myra.resilience.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lookup of external catalog codes with the general fallback applied.
 *
 * <p>Lookups are by symbolic name only. Kind codes such as {@code VALIDATION_ERROR} are not
 * symbolic names, so looking one up yields the general fallback {@code ERR_GENERAL_01}.
 *
 * <pre>{@code
 * ErrorCodeCatalog.lookup("AUTH_LOGIN_FAILED"); // ERR_AUTH_01
 * ErrorCodeCatalog.lookup("VALIDATION_ERROR");  // ERR_GENERAL_01
 * }</pre>
 */
public final class ErrorCodeCatalog {

    /** External code returned for anything without a catalog entry. */
    public static final String GENERAL_FALLBACK = ErrorCode.UNKNOWN_ERROR.externalCode();

    private static final Map<String, String> TABLE;

    static {
        Map<String, String> table = new LinkedHashMap<>();
        for (ErrorCode code : ErrorCode.values()) {
            table.put(code.name(), code.externalCode());
        }
        TABLE = Collections.unmodifiableMap(table);
    }

    private ErrorCodeCatalog() {
        // Utility class
    }

    /**
     * Resolves a symbolic name to its external code.
     *
     * @param symbolicName the symbolic name (may be null)
     * @return the external code, or {@link #GENERAL_FALLBACK} if there is no entry
     */
    public static String lookup(String symbolicName) {
        if (symbolicName == null) {
            return GENERAL_FALLBACK;
        }
        return TABLE.getOrDefault(symbolicName, GENERAL_FALLBACK);
    }

    /**
     * Checks if a symbolic name has its own catalog entry.
     *
     * @param symbolicName the symbolic name
     * @return true if the catalog contains the name
     */
    public static boolean contains(String symbolicName) {
        return symbolicName != null && TABLE.containsKey(symbolicName);
    }

    /**
     * Returns the full catalog in declaration order.
     *
     * @return unmodifiable view of symbolic name to external code
     */
    public static Map<String, String> asMap() {
        return TABLE;
    }
}
