package express.mvp.myra.resilience.handler;

import java.util.Map;
import java.util.logging.Level;

/**
 * Logging collaborator of the {@link FailureHandler}.
 *
 * <p>Called once for every handled error and once for every retry decision. Implementations may
 * throw; the handler catches the failure and still delivers the original error.
 *
 * <pre>{@code
 * ErrorLog log = (level, message, context) -> audit.write(level.getName(), message, context);
 * }</pre>
 *
 * @see JulErrorLog
 */
@FunctionalInterface
public interface ErrorLog {

    /**
     * Records a log entry.
     *
     * @param level the severity
     * @param message the message
     * @param context structured context (never null, may be empty)
     */
    void log(Level level, String message, Map<String, ?> context);
}
