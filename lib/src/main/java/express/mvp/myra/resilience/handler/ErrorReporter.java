package express.mvp.myra.resilience.handler;

/**
 * Reporting collaborator of the {@link FailureHandler}, e.g. an error tracking service.
 *
 * <p>Invoked at most once per handled error, off the caller's thread. Whatever the reporter does
 * or throws has no effect on the error delivered to the caller.
 *
 * @see LoggingErrorReporter
 */
@FunctionalInterface
public interface ErrorReporter {

    /** Reporter that discards every report. */
    ErrorReporter NONE = report -> { };

    /**
     * Reports a handled error.
     *
     * @param report the formatted error
     */
    void report(ErrorReport report);
}
