package express.mvp.myra.resilience.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ErrorMessages}. */
@DisplayName("ErrorMessages")
class ErrorMessagesTest {

    @Test
    @DisplayName("classified non-security errors keep their message")
    void classified_keepsMessage() {
        assertEquals(
                "Session expired",
                ErrorMessages.safeMessage(StandardException.authentication("Session expired", null)));
    }

    @Test
    @DisplayName("security errors use the fixed sentence")
    void security_fixedSentence() {
        assertEquals(
                "A security error occurred. Please check your credentials and try again.",
                ErrorMessages.safeMessage(StandardException.security("AES key mismatch", null)));
    }

    @Test
    @DisplayName("unclassified throwables use the generic sentence")
    void unclassified_genericSentence() {
        assertEquals(
                "An unexpected error occurred. Please try again later.",
                ErrorMessages.safeMessage(new IllegalStateException("internal detail")));
        assertEquals(ErrorMessages.UNEXPECTED_MESSAGE, ErrorMessages.safeMessage(null));
    }

    @Test
    @DisplayName("empty messages fall back to the default")
    void emptyMessage_default() {
        assertEquals(
                "An unknown error occurred",
                ErrorMessages.safeMessage(new StandardException(ErrorKind.NETWORK, "")));
        assertEquals(ErrorMessages.DEFAULT_MESSAGE, ErrorMessages.messageOrDefault(new RuntimeException()));
    }
}
