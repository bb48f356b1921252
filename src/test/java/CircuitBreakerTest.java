import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies the per-backend circuit and rate-limit state machine against a controlled clock.
 */
class CircuitBreakerTest {

    private static final RuntimeConfig.CircuitBreakerSettings SETTINGS = new RuntimeConfig.CircuitBreakerSettings(
        3, Duration.ofSeconds(30), 1, Duration.ofSeconds(60));

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        breaker = new CircuitBreaker(List.of(
            backend("a", true),
            backend("b", true),
            backend("c", true)
        ), SETTINGS, clock);
    }

    @Test
    void opensAfterThresholdConsecutiveFailures() {
        BackendState a = state("a");
        breaker.recordFailure(a, 500, null);
        breaker.recordFailure(a, 502, null);
        assertFalse(breaker.shouldSkipBackend(a).skip(), "Two failures stay below the threshold");

        breaker.recordFailure(a, 503, null);
        CircuitBreaker.SkipDecision decision = breaker.shouldSkipBackend(a);
        assertTrue(decision.skip());
        assertEquals(30, decision.remainingSeconds());
        assertTrue(decision.reason().contains("30s remaining"), decision.reason());
        assertEquals("open", breaker.status("a").state());
        assertEquals("HTTP 503", breaker.status("a").lastError());
    }

    @Test
    void successResetsFailureCount() {
        BackendState a = state("a");
        breaker.recordFailure(a, 500, null);
        breaker.recordFailure(a, 500, null);
        breaker.recordSuccess(a);
        breaker.recordFailure(a, 500, null);
        breaker.recordFailure(a, 500, null);

        assertFalse(breaker.shouldSkipBackend(a).skip());
        assertEquals(2, breaker.status("a").consecutiveFailures());
    }

    @Test
    void halfOpenAdmitsExactlyTheTrialBudgetAfterTimeout() {
        BackendState a = state("a");
        tripCircuit(a);

        clock.advance(Duration.ofSeconds(29));
        assertTrue(breaker.admit(a).skip(), "Still inside the open window");

        clock.advance(Duration.ofSeconds(1));
        CircuitBreaker.SkipDecision first = breaker.admit(a);
        assertFalse(first.skip());
        assertTrue(first.halfOpenTrial());
        assertEquals("half-open", breaker.status("a").state());

        CircuitBreaker.SkipDecision second = breaker.admit(a);
        assertTrue(second.skip(), "Only one probe may be in flight");
        assertTrue(second.reason().startsWith("half-open probing"), second.reason());
    }

    @Test
    void successfulProbeClosesCircuit() {
        BackendState a = state("a");
        tripCircuit(a);
        clock.advance(Duration.ofSeconds(30));

        assertTrue(breaker.admit(a).halfOpenTrial());
        breaker.recordSuccess(a);

        CircuitBreaker.Status status = breaker.status("a");
        assertEquals("closed", status.state());
        assertEquals(0, status.consecutiveFailures());
        assertFalse(breaker.admit(a).skip());
        assertFalse(breaker.admit(a).halfOpenTrial());
    }

    @Test
    void failedProbeRestartsOpenWindow() {
        BackendState a = state("a");
        tripCircuit(a);
        clock.advance(Duration.ofSeconds(30));

        assertTrue(breaker.admit(a).halfOpenTrial());
        breaker.recordFailure(a, 500, null);

        CircuitBreaker.SkipDecision decision = breaker.admit(a);
        assertTrue(decision.skip());
        assertEquals(30, decision.remainingSeconds());

        clock.advance(Duration.ofSeconds(30));
        assertTrue(breaker.admit(a).halfOpenTrial(), "A fresh budget is granted after the new window");
    }

    @Test
    void largerTrialBudgetKeepsProbingUntilSpent() {
        breaker = new CircuitBreaker(List.of(backend("a", true)),
            new RuntimeConfig.CircuitBreakerSettings(1, Duration.ofSeconds(10), 2, Duration.ofSeconds(60)), clock);
        BackendState a = state("a");
        breaker.recordFailure(a, 500, null);
        clock.advance(Duration.ofSeconds(10));

        assertTrue(breaker.admit(a).halfOpenTrial());
        breaker.recordFailure(a, 500, null);
        assertTrue(breaker.admit(a).halfOpenTrial(), "Second trial of the budget is still available");
        breaker.recordFailure(a, 500, null);

        assertTrue(breaker.admit(a).skip(), "Budget spent, window restarted");
        clock.advance(Duration.ofSeconds(10));
        assertTrue(breaker.admit(a).halfOpenTrial());
    }

    @Test
    void releasedTrialCanBeReused() {
        BackendState a = state("a");
        tripCircuit(a);
        clock.advance(Duration.ofSeconds(30));

        assertTrue(breaker.admit(a).halfOpenTrial());
        breaker.releaseHalfOpenTrial(a);
        assertTrue(breaker.admit(a).halfOpenTrial());
    }

    @Test
    void rateLimitDemotesWithoutSkipping() {
        BackendState a = state("a");
        breaker.record429(a, null);

        assertEquals(List.of("b", "c", "a"), names(breaker.sortBackendsByPriority()));
        assertFalse(breaker.shouldSkipBackend(a).skip(), "Rate limiting never excludes a backend");
        assertEquals(0, breaker.status("a").consecutiveFailures());
        assertNotNull(breaker.status("a").cooldownUntil());
        assertEquals(60, breaker.status("a").retryAfterSeconds());

        clock.advance(Duration.ofSeconds(60));
        assertEquals(List.of("a", "b", "c"), names(breaker.sortBackendsByPriority()));
        assertNull(breaker.status("a").cooldownUntil());
    }

    @Test
    void rateLimitedBackendsKeepConfiguredOrder() {
        breaker.record429(state("c"), "5");
        breaker.record429(state("a"), "not-a-number");

        assertEquals(List.of("b", "a", "c"), names(breaker.sortBackendsByPriority()));
    }

    @Test
    void repeatedRateLimitsNeverOpenCircuit() {
        BackendState a = state("a");
        for (int i = 0; i < 10; i++) {
            breaker.record429(a, "1");
        }
        assertEquals("closed", breaker.status("a").state());
    }

    @Test
    void disabledBackendsAreOmittedAndSkipped() {
        breaker = new CircuitBreaker(List.of(backend("a", false), backend("b", true)), SETTINGS, clock);

        assertEquals(List.of("b"), names(breaker.sortBackendsByPriority()));
        CircuitBreaker.SkipDecision decision = breaker.shouldSkipBackend(state("a"));
        assertTrue(decision.skip());
        assertEquals("disabled", decision.reason());
    }

    @Test
    void enablingResetsCircuitState() {
        BackendState a = state("a");
        tripCircuit(a);

        assertTrue(breaker.onBackendDisabled("a"));
        assertEquals(List.of("b", "c"), names(breaker.sortBackendsByPriority()));

        assertTrue(breaker.onBackendEnabled("a"));
        CircuitBreaker.Status status = breaker.status("a");
        assertTrue(status.enabled());
        assertEquals("closed", status.state());
        assertEquals(0, status.consecutiveFailures());
        assertFalse(breaker.shouldSkipBackend(a).skip());
    }

    @Test
    void unknownBackendNamesAreReported() {
        assertFalse(breaker.onBackendEnabled("missing"));
        assertFalse(breaker.onBackendDisabled("missing"));
        assertNull(breaker.status("missing"));
    }

    private void tripCircuit(BackendState state) {
        for (int i = 0; i < SETTINGS.failureThreshold; i++) {
            breaker.recordFailure(state, 500, null);
        }
    }

    private BackendState state(String name) {
        return breaker.states().stream()
            .filter(s -> s.name().equals(name))
            .findFirst()
            .orElseThrow();
    }

    private static List<String> names(List<BackendState> states) {
        return states.stream().map(BackendState::name).collect(Collectors.toList());
    }

    private static Backend backend(String name, boolean enabled) {
        return new Backend(name, "http://" + name + ".invalid", "token-" + name, enabled, null, Backend.Platform.ANTHROPIC);
    }

    /**
     * Clock whose time only moves when the test says so.
     */
    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
