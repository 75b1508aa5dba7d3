package express.mvp.myra.resilience.error;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ErrorKind}. */
@DisplayName("ErrorKind")
class ErrorKindTest {

    @Test
    @DisplayName("codes match the external contract")
    void codes() {
        assertEquals("AUTH_ERROR", ErrorKind.AUTHENTICATION.code());
        assertEquals("NETWORK_ERROR", ErrorKind.NETWORK.code());
        assertEquals("VALIDATION_ERROR", ErrorKind.VALIDATION.code());
        assertEquals("CONFIG_ERROR", ErrorKind.CONFIGURATION.code());
        assertEquals("SECURITY_ERROR", ErrorKind.SECURITY.code());
        assertEquals("DATABASE_ERROR", ErrorKind.DATABASE.code());
        assertEquals("UNKNOWN_ERROR", ErrorKind.UNKNOWN.code());
    }

    @Test
    @DisplayName("only SECURITY is sensitive")
    void onlySecurityIsSensitive() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertEquals(kind == ErrorKind.SECURITY, kind.isSensitive(), kind.name());
        }
    }

    @Test
    @DisplayName("fromCode resolves kind codes and rejects others")
    void fromCode() {
        assertEquals(Optional.of(ErrorKind.CONFIGURATION), ErrorKind.fromCode("CONFIG_ERROR"));
        assertTrue(ErrorKind.fromCode("NETWORK_TIMEOUT").isEmpty());
        assertTrue(ErrorKind.fromCode(null).isEmpty());
    }

    @Test
    @DisplayName("type names follow the error class names")
    void typeNames() {
        assertEquals("AuthenticationError", ErrorKind.AUTHENTICATION.typeName());
        assertEquals("NetworkError", ErrorKind.NETWORK.typeName());
    }
}
