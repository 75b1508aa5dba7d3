package express.mvp.myra.resilience.handler;

import static org.junit.jupiter.api.Assertions.*;

import java.util.logging.Level;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link HandlerOptions}. */
@DisplayName("HandlerOptions")
class HandlerOptionsTest {

    @Test
    @DisplayName("defaults: no retry, three retries, report, SEVERE")
    void defaults() {
        HandlerOptions options = HandlerOptions.defaults();

        assertFalse(options.retry());
        assertEquals(3, options.maxRetries());
        assertTrue(options.report());
        assertEquals(Level.SEVERE, options.logLevel());
    }

    @Test
    @DisplayName("retrying only flips the retry flag")
    void retrying() {
        assertEquals(
                HandlerOptions.defaults().toBuilder().retry(true).build(), HandlerOptions.retrying());
    }

    @Test
    @DisplayName("negative maxRetries is rejected")
    void negativeMaxRetries() {
        assertThrows(IllegalArgumentException.class, () -> HandlerOptions.builder().maxRetries(-1));
    }
}
