package express.mvp.myra.resilience.error;

/**
 * Safe-message extraction for errors shown outside the library.
 *
 * <p>Security errors never reveal their original message, and unclassified throwables are
 * replaced with a generic sentence since their text comes from code we do not control.
 */
public final class ErrorMessages {

    /** Message shown in place of any security error's own message. */
    public static final String SECURITY_MESSAGE =
            "A security error occurred. Please check your credentials and try again.";

    /** Message shown in place of an unclassified throwable's message. */
    public static final String UNEXPECTED_MESSAGE =
            "An unexpected error occurred. Please try again later.";

    /** Message used when a throwable has no message of its own. */
    public static final String DEFAULT_MESSAGE = "An unknown error occurred";

    private ErrorMessages() {
        // Utility class
    }

    /**
     * Returns the message that may be shown to end users.
     *
     * @param error the error (may be null)
     * @return the safe message (never null)
     */
    public static String safeMessage(Throwable error) {
        if (error instanceof StandardException classified) {
            if (classified.kind().isSensitive()) {
                return SECURITY_MESSAGE;
            }
            return messageOrDefault(classified);
        }
        return UNEXPECTED_MESSAGE;
    }

    /**
     * Returns the throwable's own message, or {@link #DEFAULT_MESSAGE} when it has none.
     *
     * @param error the error (may be null)
     * @return the message (never null)
     */
    public static String messageOrDefault(Throwable error) {
        if (error == null) {
            return DEFAULT_MESSAGE;
        }
        String message = error.getMessage();
        return message == null || message.isEmpty() ? DEFAULT_MESSAGE : message;
    }
}
