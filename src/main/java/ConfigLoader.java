import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.toml.TomlFactory;

/**
 * Reads, validates and compiles the configuration file into {@link RuntimeConfig}.
 * TOML is the default format; a path ending in {@code .json} is read as JSON.
 * Schema:
 *
 * port = 8080                              # optional; default 8080
 *
 * [[backends]]
 * name = "primary"                         # required
 * base_url = "https://..."                 # required; may carry a path prefix
 * token = "sk-..."                         # bearer credential for this backend
 * enabled = true                           # optional; default true
 * model = "..."                            # optional; overrides the request's model field
 * platform = "openai"                      # optional; "anthropic" (default) or "openai"
 *
 * [retry]
 * timeout_seconds = 30                     # non-streaming request timeout
 *
 * [failover.circuit_breaker]
 * failure_threshold = 3
 * open_timeout_seconds = 30
 * half_open_requests = 1
 *
 * [failover.rate_limit]
 * cooldown_seconds = 60
 */
public class ConfigLoader {

    private static final ObjectMapper TOML = new ObjectMapper(new TomlFactory());
    private static final ObjectMapper JSON = new ObjectMapper();

    private ConfigLoader() {
    }

    /**
     * Returns the mapper matching the file format of the given path.
     */
    public static ObjectMapper mapperFor(Path path) {
        String fileName = path.getFileName().toString().toLowerCase();
        return fileName.endsWith(".json") ? JSON : TOML;
    }

    /**
     * Reads the raw configuration tree.
     *
     * @throws IOException if the file cannot be read or parsed
     */
    public static ObjectNode readTree(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        JsonNode root = mapperFor(path).readTree(content);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Empty configuration");
        }
        return (ObjectNode) root;
    }

    /**
     * Validates the raw tree and compiles it, applying defaults for missing or zero values.
     *
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static RuntimeConfig compile(JsonNode root) {
        JsonNode backendsNode = root.get("backends");
        if (backendsNode == null || !backendsNode.isArray() || backendsNode.isEmpty()) {
            throw new IllegalArgumentException("Configuration must define at least one backend");
        }

        List<Backend> backends = new ArrayList<>();
        for (JsonNode node : backendsNode) {
            backends.add(compileBackend(node, backends.size()));
        }

        int port = positiveOrDefault(getInt(root, "port"), Constants.DEFAULT_PORT);

        JsonNode retry = child(root, "retry");
        int timeoutSeconds = positiveOrDefault(getInt(retry, "timeout_seconds"), Constants.DEFAULT_TIMEOUT_SECONDS);

        JsonNode failover = child(root, "failover");
        JsonNode breaker = child(failover, "circuit_breaker");
        JsonNode rateLimit = child(failover, "rate_limit");

        RuntimeConfig.CircuitBreakerSettings settings = new RuntimeConfig.CircuitBreakerSettings(
            positiveOrDefault(getInt(breaker, "failure_threshold"), Constants.DEFAULT_FAILURE_THRESHOLD),
            Duration.ofSeconds(positiveOrDefault(getInt(breaker, "open_timeout_seconds"), Constants.DEFAULT_OPEN_TIMEOUT_SECONDS)),
            positiveOrDefault(getInt(breaker, "half_open_requests"), Constants.DEFAULT_HALF_OPEN_REQUESTS),
            Duration.ofSeconds(positiveOrDefault(getInt(rateLimit, "cooldown_seconds"), Constants.DEFAULT_COOLDOWN_SECONDS))
        );

        return new RuntimeConfig(port, backends, Duration.ofSeconds(timeoutSeconds), settings);
    }

    private static Backend compileBackend(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Backend #" + (index + 1) + " must be a table/object");
        }

        String name = getText(node, "name");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Backend #" + (index + 1) + " must define 'name'");
        }

        String baseUrl = getText(node, "base_url");
        if (baseUrl == null || baseUrl.isEmpty()) {
            throw new IllegalArgumentException("Backend [" + name + "] must define 'base_url' as a string");
        }
        validateUrl(baseUrl, "Backend [" + name + "] base_url");

        String token = getText(node, "token");
        boolean enabled = getBoolean(node, "enabled", true);
        String model = getText(node, "model");
        Backend.Platform platform = Backend.Platform.fromTag(getText(node, "platform"));

        return new Backend(name, baseUrl, token != null ? token : "", enabled,
            model != null && !model.isEmpty() ? model : null, platform);
    }

    private static JsonNode child(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode n = node.get(field);
        if (n == null || n.isNull()) return null;
        if (!n.isObject()) throw new IllegalArgumentException("'" + field + "' must be a table/object");
        return n;
    }

    private static String getText(JsonNode obj, String field) {
        JsonNode n = obj.get(field);
        return (n != null && n.isTextual()) ? n.asText() : null;
    }

    private static int getInt(JsonNode obj, String field) {
        if (obj == null) return 0;
        JsonNode n = obj.get(field);
        if (n == null || n.isNull()) return 0;
        if (!n.isIntegralNumber()) throw new IllegalArgumentException("Expected integer for '" + field + "' but got: " + n.getNodeType());
        return n.asInt();
    }

    private static boolean getBoolean(JsonNode obj, String field, boolean defaultVal) {
        JsonNode n = obj.get(field);
        if (n == null || n.isNull()) return defaultVal;
        if (!n.isBoolean()) throw new IllegalArgumentException("Expected boolean for '" + field + "' but got: " + n.getNodeType());
        return n.asBoolean();
    }

    private static int positiveOrDefault(int value, int defaultVal) {
        return value > 0 ? value : defaultVal;
    }

    private static void validateUrl(String url, String label) {
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new IllegalArgumentException(label + " invalid: " + url);
            }
        } catch (Exception e) {
            throw new IllegalArgumentException(label + " invalid: " + url);
        }
    }
}
