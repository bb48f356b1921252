/**
 * Classification of an upstream status code, which decides whether the forwarder returns the
 * response to the client or moves on to the next backend.
 */
public enum ResponseClass {
    SUCCESS,        // 2xx: record success, deliver
    RATE_LIMITED,   // 429: record rate limit, retry elsewhere
    SERVER_ERROR,   // 5xx: record failure, retry elsewhere
    AUTH_ERROR,     // 401/403: deliver, not recorded
    OTHER;          // anything else: deliver, not recorded

    public static ResponseClass of(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return SUCCESS;
        }
        if (statusCode == 429) {
            return RATE_LIMITED;
        }
        if (statusCode >= 500) {
            return SERVER_ERROR;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTH_ERROR;
        }
        return OTHER;
    }
}
