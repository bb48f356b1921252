import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-backend circuit breaker and rate-limit tracker.
 *
 * <p>States per backend: closed (normal), open (blocking) and half-open (probing). A backend
 * opens once {@code failureThreshold} consecutive failures are recorded. When the open timeout
 * has elapsed since the last failure, up to {@code halfOpenRequests} probe attempts are let
 * through. A single success closes the circuit immediately. A failed probe restarts the open
 * window; once the whole trial budget has been spent the trial counter resets, so the next
 * window grants a fresh budget.
 *
 * <p>Rate limiting is tracked separately: a 429 demotes the backend to the tail of the
 * priority order for the cooldown period but never excludes it.
 *
 * <p>All state lives in {@link BackendState} records owned by this instance and guarded by a
 * single lock. The lock is never held across network I/O.
 */
public class CircuitBreaker {

    /**
     * Result of evaluating a backend before an attempt.
     *
     * @param skip              true if the backend must not be attempted
     * @param reason            human readable reason when skipped
     * @param remainingSeconds  seconds left in the open window, 0 if not applicable
     * @param halfOpenTrial     true if the attempt is a half-open probe
     */
    public record SkipDecision(boolean skip, String reason, long remainingSeconds, boolean halfOpenTrial) {

        static SkipDecision allow() {
            return new SkipDecision(false, null, 0, false);
        }

        static SkipDecision probe() {
            return new SkipDecision(false, null, 0, true);
        }

        static SkipDecision skip(String reason, long remainingSeconds) {
            return new SkipDecision(true, reason, remainingSeconds, false);
        }
    }

    /**
     * Point-in-time view of a backend's runtime state, for the management API.
     */
    public record Status(
            String name,
            boolean enabled,
            String state,
            int consecutiveFailures,
            Instant lastFailureTime,
            String lastError,
            Instant cooldownUntil,
            long retryAfterSeconds
    ) {}

    private final RuntimeConfig.CircuitBreakerSettings settings;
    private final List<BackendState> states;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public CircuitBreaker(RuntimeConfig config) {
        this(config.backends, config.circuitBreaker, Clock.systemUTC());
    }

    CircuitBreaker(List<Backend> backends, RuntimeConfig.CircuitBreakerSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        List<BackendState> created = new ArrayList<>(backends.size());
        for (Backend backend : backends) {
            created.add(new BackendState(backend));
        }
        this.states = Collections.unmodifiableList(created);
    }

    /**
     * Returns every backend state in configured order, enabled or not.
     */
    public List<BackendState> states() {
        return states;
    }

    /**
     * Returns the enabled backends in attempt order: backends outside their 429 cooldown first,
     * then rate-limited ones. Configured order is kept within each group. Disabled backends
     * are omitted.
     */
    public List<BackendState> sortBackendsByPriority() {
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            List<BackendState> normal = new ArrayList<>();
            List<BackendState> rateLimited = new ArrayList<>();
            for (BackendState state : states) {
                if (!state.enabled) {
                    continue;
                }
                if (inCooldown(state, now)) {
                    rateLimited.add(state);
                } else {
                    normal.add(state);
                }
            }
            normal.addAll(rateLimited);
            return normal;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Evaluates whether a backend must be skipped. Read-only; does not reserve a probe.
     * Rate limiting alone never causes a skip.
     */
    public SkipDecision shouldSkipBackend(BackendState state) {
        lock.readLock().lock();
        try {
            return evaluate(state, clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Evaluates a backend and, if the attempt is a half-open probe, reserves one trial in the
     * same critical section.
     */
    public SkipDecision admit(BackendState state) {
        lock.writeLock().lock();
        try {
            SkipDecision decision = evaluate(state, clock.instant());
            if (decision.halfOpenTrial()) {
                state.halfOpenTries++;
            }
            return decision;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private SkipDecision evaluate(BackendState state, Instant now) {
        if (!state.enabled) {
            return SkipDecision.skip("disabled", 0);
        }
        if (!state.circuitOpen) {
            return SkipDecision.allow();
        }

        Duration elapsed = Duration.between(state.lastFailureTime, now);
        if (state.halfOpenTries == 0 && elapsed.compareTo(settings.openTimeout) < 0) {
            long remaining = ceilSeconds(settings.openTimeout.minus(elapsed));
            return SkipDecision.skip("circuit open (" + remaining + "s remaining)", remaining);
        }
        if (state.halfOpenTries >= settings.halfOpenRequests) {
            return SkipDecision.skip("half-open probing (" + state.halfOpenTries + "/" + settings.halfOpenRequests + " trials in use)", 0);
        }
        return SkipDecision.probe();
    }

    /**
     * Records a successful response. Closes the circuit immediately and clears failure state.
     */
    public void recordSuccess(BackendState state) {
        lock.writeLock().lock();
        try {
            if (state.circuitOpen) {
                Logger.info("[circuit-closed] " + state.name() + " - backend recovered");
            }
            state.consecutiveFailures = 0;
            state.circuitOpen = false;
            state.halfOpenTries = 0;
            state.lastFailureTime = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records a failure: a 5xx response, a transport error (statusCode 0) or a local
     * forwarding failure.
     *
     * @param detail short summary kept as the backend's last error
     */
    public void recordFailure(BackendState state, int statusCode, String detail) {
        lock.writeLock().lock();
        try {
            state.consecutiveFailures++;
            state.lastFailureTime = clock.instant();
            state.lastError = detail != null ? detail : "HTTP " + statusCode;

            long openSeconds = settings.openTimeout.toSeconds();
            if (state.circuitOpen) {
                if (state.halfOpenTries >= settings.halfOpenRequests) {
                    state.halfOpenTries = 0;
                    Logger.warning("[circuit-probe-failed] " + state.name() + " - staying open for " + openSeconds + "s");
                } else {
                    Logger.warning("[circuit-probe-failed] " + state.name() + " - "
                        + state.halfOpenTries + "/" + settings.halfOpenRequests + " trials used");
                }
                return;
            }

            if (state.consecutiveFailures >= settings.failureThreshold) {
                state.circuitOpen = true;
                state.halfOpenTries = 0;
                Logger.warning("[circuit-open] " + state.name() + " - " + state.consecutiveFailures
                    + " consecutive failures, open for " + openSeconds + "s (" + state.lastError + ")");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns a reserved half-open trial when the probe ended without a verdict on backend
     * health (a 429 or a client error).
     */
    public void releaseHalfOpenTrial(BackendState state) {
        lock.writeLock().lock();
        try {
            if (state.circuitOpen && state.halfOpenTries > 0) {
                state.halfOpenTries--;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records a 429 response. Starts the cooldown window; never counts as a failure.
     *
     * @param retryAfter raw Retry-After header value, may be null
     */
    public void record429(BackendState state, String retryAfter) {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            state.last429Time = now;
            state.retryAfterUntil = null;

            Integer seconds = parseRetryAfter(retryAfter);
            if (seconds != null) {
                state.retryAfterUntil = now.plusSeconds(seconds);
                Logger.warning("[rate-limit] " + state.name() + " - HTTP 429, Retry-After: " + seconds + "s");
            } else {
                Logger.warning("[rate-limit] " + state.name() + " - HTTP 429, cooling down for "
                    + settings.rateLimitCooldown.toSeconds() + "s");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns a snapshot of the named backend, or null if no such backend exists.
     */
    public Status status(String name) {
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            for (BackendState state : states) {
                if (!state.name().equals(name)) {
                    continue;
                }

                String circuit = "closed";
                if (state.circuitOpen) {
                    boolean windowElapsed = Duration.between(state.lastFailureTime, now).compareTo(settings.openTimeout) >= 0;
                    circuit = windowElapsed || state.halfOpenTries > 0 ? "half-open" : "open";
                }

                Instant cooldownUntil = null;
                long retryAfterSeconds = 0;
                if (inCooldown(state, now)) {
                    cooldownUntil = state.last429Time.plus(settings.rateLimitCooldown);
                    retryAfterSeconds = Duration.between(now, cooldownUntil).toSeconds();
                }

                return new Status(state.name(), state.enabled, circuit, state.consecutiveFailures,
                    state.lastFailureTime, state.lastError, cooldownUntil, retryAfterSeconds);
            }
            return null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Marks a backend enabled and resets its circuit state. Called after the management API
     * has persisted the change.
     *
     * @return false if no backend has that name
     */
    public boolean onBackendEnabled(String name) {
        lock.writeLock().lock();
        try {
            for (BackendState state : states) {
                if (state.name().equals(name)) {
                    state.enabled = true;
                    state.consecutiveFailures = 0;
                    state.circuitOpen = false;
                    state.halfOpenTries = 0;
                    Logger.info("[backend-enabled] " + name + " - enabled, circuit state reset");
                    return true;
                }
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Marks a backend disabled.
     *
     * @return false if no backend has that name
     */
    public boolean onBackendDisabled(String name) {
        lock.writeLock().lock();
        try {
            for (BackendState state : states) {
                if (state.name().equals(name)) {
                    state.enabled = false;
                    Logger.info("[backend-disabled] " + name + " - disabled");
                    return true;
                }
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean inCooldown(BackendState state, Instant now) {
        return state.last429Time != null
            && Duration.between(state.last429Time, now).compareTo(settings.rateLimitCooldown) < 0;
    }

    private static long ceilSeconds(Duration d) {
        long seconds = d.getSeconds();
        return d.getNano() > 0 ? seconds + 1 : seconds;
    }

    private static Integer parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            int seconds = Integer.parseInt(value.trim());
            return seconds >= 0 ? seconds : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
