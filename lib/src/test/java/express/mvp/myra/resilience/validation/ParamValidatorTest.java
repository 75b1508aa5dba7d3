package express.mvp.myra.resilience.validation;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.resilience.error.ErrorCode;
import express.mvp.myra.resilience.error.ErrorKind;
import express.mvp.myra.resilience.error.StandardException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ParamValidator}. */
@DisplayName("ParamValidator")
class ParamValidatorTest {

    @Test
    @DisplayName("passes when every required parameter is present")
    void valid() {
        assertDoesNotThrow(
                () ->
                        ParamValidator.validateRequiredParams(
                                Map.of("threadId", "1", "body", "hi"), List.of("threadId", "body")));
    }

    @Test
    @DisplayName("passes with no required parameters")
    void nothingRequired() {
        assertDoesNotThrow(() -> ParamValidator.validateRequiredParams(Map.of(), List.of()));
    }

    @Test
    @DisplayName("rejects null parameters")
    void nullParams() {
        StandardException e =
                assertThrows(
                        StandardException.class,
                        () -> ParamValidator.validateRequiredParams(null, List.of("id")));

        assertEquals(ErrorKind.VALIDATION, e.kind());
        assertEquals("Parameters must be an object", e.getMessage());
        assertEquals(Optional.of(ErrorCode.VALIDATION_INVALID_FORMAT), e.reason());
    }

    @Test
    @DisplayName("rejects parameters that are not a map")
    void notAMap() {
        StandardException e =
                assertThrows(
                        StandardException.class,
                        () -> ParamValidator.validateRequiredParams("id=1", List.of("id")));

        assertEquals("Parameters must be an object", e.getMessage());
    }

    @Test
    @DisplayName("names the first missing parameter")
    void missing() {
        StandardException e =
                assertThrows(
                        StandardException.class,
                        () ->
                                ParamValidator.validateRequiredParams(
                                        Map.of("threadId", "1"), List.of("threadId", "body", "to")));

        assertEquals("Required parameter 'body' is missing", e.getMessage());
        assertEquals(Optional.of(ErrorCode.VALIDATION_MISSING_PARAM), e.reason());
        assertEquals(Map.of("param", "body"), e.details());
    }

    @Test
    @DisplayName("treats a null value as missing")
    void nullValue() {
        Map<String, Object> params = new HashMap<>();
        params.put("body", null);

        StandardException e =
                assertThrows(
                        StandardException.class,
                        () -> ParamValidator.validateRequiredParams(params, List.of("body")));

        assertEquals("Required parameter 'body' is missing", e.getMessage());
    }

    @Test
    @DisplayName("rejects a null required name before looking anything up")
    void nullRequiredName() {
        NullPointerException e =
                assertThrows(
                        NullPointerException.class,
                        () ->
                                ParamValidator.validateRequiredParams(
                                        Map.of("id", "1"), Arrays.asList("id", null)));

        assertEquals("required parameter name", e.getMessage());
    }
}
