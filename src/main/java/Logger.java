import org.slf4j.LoggerFactory;

/**
 * Static logging facade used throughout the proxy.
 * Delegates to SLF4J; output format and appenders are configured in {@code logback.xml}.
 */
public final class Logger {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger("llm-failover-proxy");

    /**
     * Private constructor to prevent instantiation of the class.
     */
    private Logger() {
    }

    /**
     * Logs an informational message.
     *
     * @param message The message to be logged.
     */
    public static void info(String message) {
        LOG.info(message);
    }

    /**
     * Logs a warning message.
     *
     * @param message The message to be logged.
     */
    public static void warning(String message) {
        LOG.warn(message);
    }

    /**
     * Logs a warning message with an associated exception. Only the exception message is
     * appended, stack traces are reserved for errors.
     *
     * @param message The message to be logged.
     * @param e The exception to be logged.
     */
    public static void warning(String message, Exception e) {
        LOG.warn("{}: {}", message, e.getMessage());
    }

    /**
     * Logs an error message.
     *
     * @param message The message to be logged.
     */
    public static void error(String message) {
        LOG.error(message);
    }

    /**
     * Logs an error message with an associated exception.
     *
     * @param message The message to be logged.
     * @param e The exception to be logged.
     */
    public static void error(String message, Exception e) {
        LOG.error(message + ": " + e.getMessage(), e);
    }

    /**
     * Masks a credential for log output, keeping the first and last four characters.
     *
     * @param token The credential to mask
     * @return The masked form, or {@code ****} if the token is too short to mask meaningfully
     */
    public static String maskToken(String token) {
        if (token == null || token.length() <= 8) {
            return "****";
        }
        return token.substring(0, 4) + "..." + token.substring(token.length() - 4);
    }

    /**
     * Truncates a body preview for log output.
     */
    public static String preview(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() > maxChars ? text.substring(0, maxChars) + "..." : text;
    }
}
