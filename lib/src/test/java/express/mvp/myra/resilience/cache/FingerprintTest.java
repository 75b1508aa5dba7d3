package express.mvp.myra.resilience.cache;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.resilience.error.ErrorCode;
import express.mvp.myra.resilience.error.ErrorKind;
import express.mvp.myra.resilience.error.StandardException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link Fingerprint}. */
@DisplayName("Fingerprint")
class FingerprintTest {

    @Test
    @DisplayName("key is prefixed with the operation name")
    void of_prefixesOperation() {
        String key = Fingerprint.of("getUserInfo", "100001");

        assertTrue(key.startsWith("getUserInfo:"));
        assertEquals("getUserInfo:".length() + 64, key.length());
    }

    @Test
    @DisplayName("map entry order does not change the key")
    void of_mapOrderIndependent() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("threadId", "t1");
        first.put("limit", 20);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("limit", 20);
        second.put("threadId", "t1");

        assertEquals(Fingerprint.of("getThreadHistory", first), Fingerprint.of("getThreadHistory", second));
    }

    @Test
    @DisplayName("different inputs or operations give different keys")
    void of_distinguishesInputs() {
        assertNotEquals(Fingerprint.of("op", "a"), Fingerprint.of("op", "b"));
        assertNotEquals(Fingerprint.of("op1", "a"), Fingerprint.of("op2", "a"));
        assertNotEquals(Fingerprint.of("op", "a", "b"), Fingerprint.of("op", "b", "a"));
    }

    @Test
    @DisplayName("nested maps are canonicalized")
    void canonicalJson_sortsNestedMaps() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("z", 1);
        inner.put("a", 2);

        assertEquals("{\"k\":{\"a\":2,\"z\":1}}", Fingerprint.canonicalJson(Map.of("k", inner)));
        assertEquals("[1,\"x\"]", Fingerprint.canonicalJson(List.of(1, "x")));
    }

    @Test
    @DisplayName("unserializable inputs raise a validation error")
    void of_unserializable_throwsValidation() {
        StandardException e =
                assertThrows(StandardException.class, () -> Fingerprint.of("op", new Exploding()));

        assertEquals(ErrorKind.VALIDATION, e.kind());
        assertEquals(ErrorCode.VALIDATION_INVALID_FORMAT, e.reason().orElseThrow());
        assertNotNull(e.getCause());
    }

    static final class Exploding {
        public String getValue() {
            throw new IllegalStateException("no value");
        }
    }
}
