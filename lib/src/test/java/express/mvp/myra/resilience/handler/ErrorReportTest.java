package express.mvp.myra.resilience.handler;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.resilience.MutableClock;
import express.mvp.myra.resilience.error.ErrorCode;
import express.mvp.myra.resilience.error.StandardException;
import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ErrorReport}. */
@DisplayName("ErrorReport")
class ErrorReportTest {

    private final MutableClock clock = new MutableClock();

    @Test
    @DisplayName("classified errors report kind, code and details")
    void classified() {
        StandardException error =
                StandardException.authentication(
                        ErrorCode.AUTH_SESSION_EXPIRED, "Session expired", Map.of("userId", "1"));

        ErrorReport report = ErrorReport.of(error, "refresh", clock);

        assertEquals("AuthenticationError", report.type());
        assertEquals("AUTH_ERROR", report.code());
        assertEquals("AUTH_SESSION_EXPIRED", report.retryKey());
        assertEquals("Session expired", report.message());
        assertEquals("refresh", report.context());
        assertEquals(Map.of("userId", "1"), report.details());
        assertEquals(clock.instant(), report.timestamp());
    }

    @Test
    @DisplayName("unclassified errors report UNKNOWN_ERROR")
    void unclassified() {
        ErrorReport report = ErrorReport.of(new IllegalStateException("boom"), "ctx", clock);

        assertEquals("IllegalStateException", report.type());
        assertEquals("UNKNOWN_ERROR", report.code());
        assertEquals("UNKNOWN_ERROR", report.retryKey());
        assertEquals(
                Map.of("classifiedKind", "UNKNOWN_ERROR", "reason", "UNKNOWN_ERROR"),
                report.details());
    }

    @Test
    @DisplayName("unclassified errors carry the classifier's kind and reason")
    void unclassified_classification() {
        ErrorReport report =
                ErrorReport.of(new SQLTransientConnectionException("pool exhausted"), "query", clock);

        assertEquals("DATABASE_ERROR", report.details().get("classifiedKind"));
        assertEquals("DATABASE_CONNECTION_FAILED", report.details().get("reason"));
    }

    @Test
    @DisplayName("log context carries every field in order")
    void toLogContext() {
        ErrorReport report = ErrorReport.of(new IllegalStateException("boom"), "ctx", clock);

        Map<String, Object> context = report.toLogContext();

        assertEquals(
                List.of("type", "message", "code", "context", "timestamp", "details", "stack"),
                List.copyOf(context.keySet()));
        assertEquals("2024-01-01T00:00:00Z", context.get("timestamp"));
        assertTrue(((String) context.get("stack")).contains("boom"));
    }
}
