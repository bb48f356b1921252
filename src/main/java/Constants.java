import java.time.Duration;

/**
 * Constants for the failover proxy server configuration and operation.
 */
public final class Constants {

    /**
     * Private constructor to prevent instantiation of the class.
     */
    private Constants() {
    }

    // Debug Flags
    public static final boolean DEBUG_REQUEST = false;     // Controls outbound JSON logging

    // Configuration Constants
    public static final String CONFIG_FILE = "config.toml";
    public static final String BACKUP_DIRECTORY = "backups";
    public static final int MAX_CONFIG_BACKUPS = 5;

    // Defaults applied when a numeric setting is missing or zero
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final int DEFAULT_OPEN_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_HALF_OPEN_REQUESTS = 1;
    public static final int DEFAULT_COOLDOWN_SECONDS = 60;

    // Timeout Constants
    // NOTE: No global request timeout on the client, streaming generations can run for many minutes.
    public static final Duration CONNECTION_TIMEOUT = Duration.ofSeconds(10);
    public static final int SHUTDOWN_GRACE_SECONDS = 10;

    // API Constants
    public static final String MESSAGES_ENDPOINT = "/v1/messages";
    public static final String CHAT_COMPLETIONS_ENDPOINT = "/v1/chat/completions";
    public static final String DEFAULT_FOREIGN_MODEL = "gpt-4o";

    // Logging Constants
    public static final int ERROR_BODY_PREVIEW = 500;

    // HTTP Constants
    public static final String CONTENT_TYPE_JSON = "application/json";
    public static final String CONTENT_TYPE_STREAM = "text/event-stream";
}
