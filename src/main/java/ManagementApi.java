import java.io.IOException;
import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;

/**
 * Operator endpoints served on the proxy port:
 *
 * <pre>
 * GET       /health                  liveness and backend counts
 * GET       /backends                configured backends, tokens masked
 * GET       /backends/status         circuit and rate-limit state per backend
 * GET|POST  /backend/{name}/enable   enable and persist
 * GET|POST  /backend/{name}/disable  disable and persist
 * </pre>
 *
 * Any other path belongs to the proxy.
 */
public class ManagementApi {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final Pattern TOGGLE_PATH = Pattern.compile("^/backend/([^/]+)/(enable|disable)/?$");

    private final ConfigurationManager configManager;
    private final CircuitBreaker circuitBreaker;

    public ManagementApi(ConfigurationManager configManager, CircuitBreaker circuitBreaker) {
        this.configManager = configManager;
        this.circuitBreaker = circuitBreaker;
    }

    /**
     * Serves the exchange if it targets a management route.
     *
     * @return false if the path is not a management route and nothing was written
     * @throws IOException if writing the response fails
     */
    public boolean handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String method = exchange.getRequestMethod();

        if (path.equals("/health")) {
            if (requireMethod(exchange, method, false)) {
                sendHealth(exchange);
            }
            return true;
        }
        if (path.equals("/backends") || path.equals("/backends/")) {
            if (requireMethod(exchange, method, false)) {
                sendBackends(exchange);
            }
            return true;
        }
        if (path.equals("/backends/status")) {
            if (requireMethod(exchange, method, false)) {
                sendStatus(exchange);
            }
            return true;
        }

        Matcher toggle = TOGGLE_PATH.matcher(path);
        if (toggle.matches()) {
            if (requireMethod(exchange, method, true)) {
                toggleBackend(exchange, toggle.group(1), toggle.group(2).equals("enable"));
            }
            return true;
        }
        return false;
    }

    private void sendHealth(HttpExchange exchange) throws IOException {
        int enabled = 0;
        for (BackendState state : circuitBreaker.states()) {
            CircuitBreaker.Status status = circuitBreaker.status(state.name());
            if (status != null && status.enabled()) {
                enabled++;
            }
        }

        ObjectNode body = JSON_MAPPER.createObjectNode();
        body.put("status", "healthy");
        body.put("total_backends", circuitBreaker.states().size());
        body.put("enabled_backends", enabled);
        body.put("timestamp", Instant.now().toString());
        HttpServerWrapper.sendJson(exchange, 200, body);
    }

    private void sendBackends(HttpExchange exchange) throws IOException {
        ObjectNode body = JSON_MAPPER.createObjectNode();
        ArrayNode backends = body.putArray("backends");
        for (BackendState state : circuitBreaker.states()) {
            Backend backend = state.backend();
            CircuitBreaker.Status status = circuitBreaker.status(backend.name());
            ObjectNode info = backends.addObject();
            info.put("name", backend.name());
            info.put("base_url", backend.baseUrl());
            info.put("enabled", status != null && status.enabled());
            if (backend.hasModelOverride()) {
                info.put("model", backend.model());
            }
            info.put("platform", backend.platform().tag());
            info.put("token_masked", Logger.maskToken(backend.token()));
        }
        body.put("count", backends.size());
        HttpServerWrapper.sendJson(exchange, 200, body);
    }

    private void sendStatus(HttpExchange exchange) throws IOException {
        ObjectNode body = JSON_MAPPER.createObjectNode();
        ArrayNode backends = body.putArray("backends");
        for (BackendState state : circuitBreaker.states()) {
            CircuitBreaker.Status status = circuitBreaker.status(state.name());
            if (status == null) {
                continue;
            }
            ObjectNode entry = backends.addObject();
            entry.put("name", status.name());
            entry.put("enabled", status.enabled());

            ObjectNode circuit = entry.putObject("circuit_breaker");
            circuit.put("state", status.state());
            circuit.put("consecutive_failures", status.consecutiveFailures());
            putInstant(circuit, "last_failure_time", status.lastFailureTime());

            ObjectNode rateLimit = entry.putObject("rate_limit");
            putInstant(rateLimit, "cooldown_until", status.cooldownUntil());
            rateLimit.put("retry_after_seconds", status.retryAfterSeconds());

            if (status.lastError() != null) {
                entry.put("last_error", status.lastError());
            }
        }
        body.put("count", backends.size());
        HttpServerWrapper.sendJson(exchange, 200, body);
    }

    private void toggleBackend(HttpExchange exchange, String name, boolean enable) throws IOException {
        String action = enable ? "enable" : "disable";
        try {
            if (enable) {
                configManager.enableBackend(name);
                circuitBreaker.onBackendEnabled(name);
            } else {
                configManager.disableBackend(name);
                circuitBreaker.onBackendDisabled(name);
            }
        } catch (IllegalArgumentException | IOException e) {
            Logger.warning("[management] failed to " + action + " backend '" + name + "'", e);
            ObjectNode error = JSON_MAPPER.createObjectNode();
            error.put("error", "Failed to " + action + " backend");
            error.put("message", e.getMessage());
            HttpServerWrapper.sendJson(exchange, 400, error);
            return;
        }

        ObjectNode body = JSON_MAPPER.createObjectNode();
        body.put("success", true);
        body.put("message", "Backend '" + name + "' has been " + action + "d");
        HttpServerWrapper.sendJson(exchange, 200, body);
    }

    private static boolean requireMethod(HttpExchange exchange, String method, boolean allowPost) throws IOException {
        if (method.equals("GET") || allowPost && method.equals("POST")) {
            return true;
        }
        ObjectNode error = JSON_MAPPER.createObjectNode();
        error.put("error", "Method not allowed");
        error.put("message", method + " is not supported on " + exchange.getRequestURI().getPath());
        exchange.getResponseHeaders().set("Allow", allowPost ? "GET, POST" : "GET");
        HttpServerWrapper.sendJson(exchange, 405, error);
        return false;
    }

    private static void putInstant(ObjectNode node, String field, Instant value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.put(field, value.toString());
        }
    }
}
