package express.mvp.myra.resilience.error;

import java.util.Optional;

/**
 * Catalog of symbolic failure sub-cases and their short external codes.
 *
 * <p>The external codes are part of the public contract and must never change. Each entry also
 * names the {@link ErrorKind} it belongs to; the general entries belong to
 * {@link ErrorKind#UNKNOWN}.
 *
 * <p>Use {@link ErrorCodeCatalog#lookup(String)} to resolve arbitrary strings with the general
 * fallback applied.
 *
 * @see ErrorCodeCatalog
 */
public enum ErrorCode {

    // Authentication
    AUTH_LOGIN_FAILED("ERR_AUTH_01", ErrorKind.AUTHENTICATION),
    AUTH_CHECKPOINT("ERR_AUTH_02", ErrorKind.AUTHENTICATION),
    AUTH_2FA_REQUIRED("ERR_AUTH_03", ErrorKind.AUTHENTICATION),
    AUTH_SESSION_EXPIRED("ERR_AUTH_04", ErrorKind.AUTHENTICATION),
    AUTH_CREDENTIALS_INVALID("ERR_AUTH_05", ErrorKind.AUTHENTICATION),

    // Network
    NETWORK_TIMEOUT("ERR_NETWORK_01", ErrorKind.NETWORK),
    NETWORK_CONNECTION_FAILED("ERR_NETWORK_02", ErrorKind.NETWORK),
    NETWORK_REQUEST_FAILED("ERR_NETWORK_03", ErrorKind.NETWORK),
    NETWORK_PARSE_FAILED("ERR_NETWORK_04", ErrorKind.NETWORK),
    NETWORK_RATE_LIMITED("ERR_NETWORK_05", ErrorKind.NETWORK),

    // Validation
    VALIDATION_MISSING_PARAM("ERR_VALIDATION_01", ErrorKind.VALIDATION),
    VALIDATION_INVALID_FORMAT("ERR_VALIDATION_02", ErrorKind.VALIDATION),
    VALIDATION_OUT_OF_RANGE("ERR_VALIDATION_03", ErrorKind.VALIDATION),

    // Configuration
    CONFIG_MISSING("ERR_CONFIG_01", ErrorKind.CONFIGURATION),
    CONFIG_INVALID("ERR_CONFIG_02", ErrorKind.CONFIGURATION),
    CONFIG_FILE_NOT_FOUND("ERR_CONFIG_03", ErrorKind.CONFIGURATION),

    // Security
    SECURITY_ENCRYPTION_FAILED("ERR_SECURITY_01", ErrorKind.SECURITY),
    SECURITY_DECRYPTION_FAILED("ERR_SECURITY_02", ErrorKind.SECURITY),
    SECURITY_VALIDATION_FAILED("ERR_SECURITY_03", ErrorKind.SECURITY),
    SECURITY_PERMISSION_DENIED("ERR_SECURITY_04", ErrorKind.SECURITY),

    // Database
    DATABASE_CONNECTION_FAILED("ERR_DATABASE_01", ErrorKind.DATABASE),
    DATABASE_QUERY_FAILED("ERR_DATABASE_02", ErrorKind.DATABASE),
    DATABASE_RECORD_NOT_FOUND("ERR_DATABASE_03", ErrorKind.DATABASE),

    // General
    UNKNOWN_ERROR("ERR_GENERAL_01", ErrorKind.UNKNOWN),
    NOT_IMPLEMENTED("ERR_GENERAL_02", ErrorKind.UNKNOWN),
    OPERATION_CANCELLED("ERR_GENERAL_03", ErrorKind.UNKNOWN);

    private final String externalCode;
    private final ErrorKind kind;

    ErrorCode(String externalCode, ErrorKind kind) {
        this.externalCode = externalCode;
        this.kind = kind;
    }

    /**
     * Returns the short external code.
     *
     * @return the catalog code, e.g. {@code ERR_AUTH_01}
     */
    public String externalCode() {
        return externalCode;
    }

    /**
     * Returns the kind this sub-case belongs to.
     *
     * @return the owning kind
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * Finds a catalog entry by its symbolic name.
     *
     * @param symbolicName the symbolic name, e.g. {@code NETWORK_TIMEOUT}
     * @return the entry, or empty if the name is not in the catalog
     */
    public static Optional<ErrorCode> find(String symbolicName) {
        if (symbolicName == null || symbolicName.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(symbolicName));
        } catch (IllegalArgumentException notInCatalog) {
            return Optional.empty();
        }
    }
}
