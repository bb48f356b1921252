import java.time.Instant;

/**
 * Runtime state of one backend. Created once at startup and kept for the life of the process.
 * Every field except {@link #backend} is guarded by the owning {@link CircuitBreaker}'s lock
 * and must not be read or written outside it.
 */
public final class BackendState {

    private final Backend backend;

    boolean enabled;
    int consecutiveFailures;
    Instant lastFailureTime;    // null when no failure since the last success
    String lastError;
    boolean circuitOpen;        // implies consecutiveFailures reached the threshold since the last success
    Instant last429Time;        // null until the first 429
    Instant retryAfterUntil;    // parsed Retry-After deadline, diagnostics only
    int halfOpenTries;

    BackendState(Backend backend) {
        this.backend = backend;
        this.enabled = backend.enabled();
    }

    public Backend backend() {
        return backend;
    }

    public String name() {
        return backend.name();
    }
}
