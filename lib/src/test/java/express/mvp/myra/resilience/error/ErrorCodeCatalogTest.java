package express.mvp.myra.resilience.error;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ErrorCodeCatalog} and {@link ErrorCode}. */
@DisplayName("ErrorCodeCatalog")
class ErrorCodeCatalogTest {

    @Test
    @DisplayName("catalog matches the published table exactly")
    void catalog_matchesPublishedTable() {
        Map<String, String> expected = new LinkedHashMap<>();
        expected.put("AUTH_LOGIN_FAILED", "ERR_AUTH_01");
        expected.put("AUTH_CHECKPOINT", "ERR_AUTH_02");
        expected.put("AUTH_2FA_REQUIRED", "ERR_AUTH_03");
        expected.put("AUTH_SESSION_EXPIRED", "ERR_AUTH_04");
        expected.put("AUTH_CREDENTIALS_INVALID", "ERR_AUTH_05");
        expected.put("NETWORK_TIMEOUT", "ERR_NETWORK_01");
        expected.put("NETWORK_CONNECTION_FAILED", "ERR_NETWORK_02");
        expected.put("NETWORK_REQUEST_FAILED", "ERR_NETWORK_03");
        expected.put("NETWORK_PARSE_FAILED", "ERR_NETWORK_04");
        expected.put("NETWORK_RATE_LIMITED", "ERR_NETWORK_05");
        expected.put("VALIDATION_MISSING_PARAM", "ERR_VALIDATION_01");
        expected.put("VALIDATION_INVALID_FORMAT", "ERR_VALIDATION_02");
        expected.put("VALIDATION_OUT_OF_RANGE", "ERR_VALIDATION_03");
        expected.put("CONFIG_MISSING", "ERR_CONFIG_01");
        expected.put("CONFIG_INVALID", "ERR_CONFIG_02");
        expected.put("CONFIG_FILE_NOT_FOUND", "ERR_CONFIG_03");
        expected.put("SECURITY_ENCRYPTION_FAILED", "ERR_SECURITY_01");
        expected.put("SECURITY_DECRYPTION_FAILED", "ERR_SECURITY_02");
        expected.put("SECURITY_VALIDATION_FAILED", "ERR_SECURITY_03");
        expected.put("SECURITY_PERMISSION_DENIED", "ERR_SECURITY_04");
        expected.put("DATABASE_CONNECTION_FAILED", "ERR_DATABASE_01");
        expected.put("DATABASE_QUERY_FAILED", "ERR_DATABASE_02");
        expected.put("DATABASE_RECORD_NOT_FOUND", "ERR_DATABASE_03");
        expected.put("UNKNOWN_ERROR", "ERR_GENERAL_01");
        expected.put("NOT_IMPLEMENTED", "ERR_GENERAL_02");
        expected.put("OPERATION_CANCELLED", "ERR_GENERAL_03");

        assertEquals(expected, ErrorCodeCatalog.asMap());
        assertEquals(26, ErrorCode.values().length);
    }

    @Test
    @DisplayName("unknown names fall back to ERR_GENERAL_01")
    void lookup_unknown_fallsBack() {
        assertEquals("ERR_GENERAL_01", ErrorCodeCatalog.lookup("NO_SUCH_CODE"));
        assertEquals("ERR_GENERAL_01", ErrorCodeCatalog.lookup("VALIDATION_ERROR"));
        assertEquals("ERR_GENERAL_01", ErrorCodeCatalog.lookup(null));
        assertFalse(ErrorCodeCatalog.contains("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("known names resolve to their code")
    void lookup_known() {
        assertEquals("ERR_NETWORK_01", ErrorCodeCatalog.lookup("NETWORK_TIMEOUT"));
        assertTrue(ErrorCodeCatalog.contains("AUTH_2FA_REQUIRED"));
    }

    @Test
    @DisplayName("every catalog entry belongs to the kind its prefix names")
    void errorCode_kinds() {
        assertEquals(ErrorKind.AUTHENTICATION, ErrorCode.AUTH_CHECKPOINT.kind());
        assertEquals(ErrorKind.NETWORK, ErrorCode.NETWORK_RATE_LIMITED.kind());
        assertEquals(ErrorKind.CONFIGURATION, ErrorCode.CONFIG_MISSING.kind());
        assertEquals(ErrorKind.UNKNOWN, ErrorCode.NOT_IMPLEMENTED.kind());
    }

    @Test
    @DisplayName("find resolves symbolic names only")
    void find() {
        assertEquals(ErrorCode.NETWORK_TIMEOUT, ErrorCode.find("NETWORK_TIMEOUT").orElseThrow());
        assertTrue(ErrorCode.find("ERR_NETWORK_01").isEmpty());
        assertTrue(ErrorCode.find("").isEmpty());
    }

    @Test
    @DisplayName("asMap is read-only")
    void asMap_readOnly() {
        assertThrows(
                UnsupportedOperationException.class,
                () -> ErrorCodeCatalog.asMap().put("X", "Y"));
    }
}
