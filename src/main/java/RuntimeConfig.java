import java.time.Duration;
import java.util.List;

/**
 * Compiled, validated, immutable runtime configuration used by the proxy.
 */
public class RuntimeConfig {

    public static final class CircuitBreakerSettings {
        public final int failureThreshold;
        public final Duration openTimeout;
        public final int halfOpenRequests;
        public final Duration rateLimitCooldown;

        public CircuitBreakerSettings(int failureThreshold, Duration openTimeout, int halfOpenRequests, Duration rateLimitCooldown) {
            this.failureThreshold = failureThreshold;
            this.openTimeout = openTimeout;
            this.halfOpenRequests = halfOpenRequests;
            this.rateLimitCooldown = rateLimitCooldown;
        }
    }

    public final int port;
    public final List<Backend> backends;    // configured order = priority order
    public final Duration requestTimeout;   // non-streaming requests only
    public final CircuitBreakerSettings circuitBreaker;

    public RuntimeConfig(int port, List<Backend> backends, Duration requestTimeout, CircuitBreakerSettings circuitBreaker) {
        this.port = port;
        this.backends = List.copyOf(backends);
        this.requestTimeout = requestTimeout;
        this.circuitBreaker = circuitBreaker;
    }
}
