package express.mvp.myra.resilience.handler;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * {@link ErrorLog} writing to a {@code java.util.logging} logger.
 *
 * <p>The context map is attached as the record's single parameter, so formatters can render it
 * with {@code {0}}. A {@link Throwable} under {@code "error"} becomes the record's thrown.
 */
public final class JulErrorLog implements ErrorLog {

    /** Logger name used by {@link #JulErrorLog()}. */
    public static final String DEFAULT_LOGGER_NAME = "express.mvp.myra.resilience.errors";

    private final Logger logger;

    /** Creates a log writing to {@value #DEFAULT_LOGGER_NAME}. */
    public JulErrorLog() {
        this(Logger.getLogger(DEFAULT_LOGGER_NAME));
    }

    /**
     * Creates a log writing to the given logger.
     *
     * @param logger the target logger
     */
    public JulErrorLog(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void log(Level level, String message, Map<String, ?> context) {
        if (!logger.isLoggable(level)) {
            return;
        }
        LogRecord record = new LogRecord(level, message);
        record.setLoggerName(logger.getName());
        record.setParameters(new Object[] {context});
        if (context != null && context.get("error") instanceof Throwable thrown) {
            record.setThrown(thrown);
        }
        logger.log(record);
    }

    /**
     * Returns the target logger.
     *
     * @return the logger
     */
    public Logger logger() {
        return logger;
    }

    @Override
    public String toString() {
        return "JulErrorLog[" + logger.getName() + "]";
    }
}
