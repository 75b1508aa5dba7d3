package express.mvp.myra.resilience.handler;

import java.util.logging.Level;
import java.util.logging.Logger;

/** Default {@link ErrorReporter}: writes the report to the JUL logger at {@code FINE}. */
public final class LoggingErrorReporter implements ErrorReporter {

    private static final Logger LOGGER = Logger.getLogger(LoggingErrorReporter.class.getName());

    @Override
    public void report(ErrorReport report) {
        LOGGER.log(Level.FINE, "Error reported to tracking service: {0}", report.toLogContext());
    }
}
