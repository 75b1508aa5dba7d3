package express.mvp.myra.resilience.error;

import java.util.Optional;

/**
 * Closed set of failure categories raised by client operations.
 *
 * <p>Each kind carries exactly one stable code. The code is what callers see in the {@code code}
 * field of an error response and is distinct from the short catalog codes in {@link ErrorCode}.
 *
 * <table border="1">
 *   <caption>Kind codes</caption>
 *   <tr><th>Kind</th><th>Code</th></tr>
 *   <tr><td>AUTHENTICATION</td><td>AUTH_ERROR</td></tr>
 *   <tr><td>NETWORK</td><td>NETWORK_ERROR</td></tr>
 *   <tr><td>VALIDATION</td><td>VALIDATION_ERROR</td></tr>
 *   <tr><td>CONFIGURATION</td><td>CONFIG_ERROR</td></tr>
 *   <tr><td>SECURITY</td><td>SECURITY_ERROR</td></tr>
 *   <tr><td>DATABASE</td><td>DATABASE_ERROR</td></tr>
 *   <tr><td>UNKNOWN</td><td>UNKNOWN_ERROR</td></tr>
 * </table>
 *
 * @see StandardException
 * @see ErrorClassifier
 */
public enum ErrorKind {

    /** Login, checkpoint, two-factor or session failures. */
    AUTHENTICATION("AUTH_ERROR", "AuthenticationError"),

    /**
     * Transport-level failures.
     *
     * <p>Unclassified throwables reaching the failure boundary are wrapped as this kind.
     */
    NETWORK("NETWORK_ERROR", "NetworkError"),

    /** Missing or malformed caller input. */
    VALIDATION("VALIDATION_ERROR", "ValidationError"),

    /** Missing or invalid settings. */
    CONFIGURATION("CONFIG_ERROR", "ConfigurationError"),

    /**
     * Encryption, decryption, integrity or permission failures.
     *
     * <p>The original message of a security error is never shown externally.
     */
    SECURITY("SECURITY_ERROR", "SecurityError"),

    /** Persistence failures. */
    DATABASE("DATABASE_ERROR", "DatabaseError"),

    /** Anything that could not be classified. */
    UNKNOWN("UNKNOWN_ERROR", "UnknownError");

    private final String code;
    private final String typeName;

    ErrorKind(String code, String typeName) {
        this.code = code;
        this.typeName = typeName;
    }

    /**
     * Returns the stable code of this kind.
     *
     * @return the kind code, e.g. {@code AUTH_ERROR}
     */
    public String code() {
        return code;
    }

    /**
     * Returns the type name used in formatted error reports.
     *
     * @return the report type name, e.g. {@code AuthenticationError}
     */
    public String typeName() {
        return typeName;
    }

    /**
     * Checks if errors of this kind must hide their original message.
     *
     * @return true only for {@link #SECURITY}
     */
    public boolean isSensitive() {
        return this == SECURITY;
    }

    /**
     * Resolves a kind from its stable code.
     *
     * @param code the kind code
     * @return the matching kind, or empty if the code is not a kind code
     */
    public static Optional<ErrorKind> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (ErrorKind kind : values()) {
            if (kind.code.equals(code)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return name() + " (" + code + ")";
    }
}
