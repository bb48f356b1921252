import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies configuration parsing, defaults and validation.
 */
class ConfigLoaderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void readsTomlWithAllSections() throws Exception {
        Path path = tempDir.resolve("config.toml");
        Files.writeString(path, ""
            + "port = 9090\n"
            + "\n"
            + "[[backends]]\n"
            + "name = \"primary\"\n"
            + "base_url = \"https://api.example.com/prefix\"\n"
            + "token = \"sk-primary\"\n"
            + "\n"
            + "[[backends]]\n"
            + "name = \"fallback\"\n"
            + "base_url = \"https://openai.example.com\"\n"
            + "token = \"sk-fallback\"\n"
            + "enabled = false\n"
            + "model = \"gpt-4o-mini\"\n"
            + "platform = \"openai\"\n"
            + "\n"
            + "[retry]\n"
            + "timeout_seconds = 45\n"
            + "\n"
            + "[failover.circuit_breaker]\n"
            + "failure_threshold = 5\n"
            + "open_timeout_seconds = 90\n"
            + "half_open_requests = 2\n"
            + "\n"
            + "[failover.rate_limit]\n"
            + "cooldown_seconds = 15\n");

        RuntimeConfig config = ConfigLoader.compile(ConfigLoader.readTree(path));

        assertEquals(9090, config.port);
        assertEquals(Duration.ofSeconds(45), config.requestTimeout);
        assertEquals(2, config.backends.size());

        Backend primary = config.backends.get(0);
        assertEquals("primary", primary.name());
        assertEquals("https://api.example.com/prefix", primary.baseUrl());
        assertTrue(primary.enabled());
        assertNull(primary.model());
        assertEquals(Backend.Platform.ANTHROPIC, primary.platform());

        Backend fallback = config.backends.get(1);
        assertFalse(fallback.enabled());
        assertEquals("gpt-4o-mini", fallback.model());
        assertEquals(Backend.Platform.OPENAI, fallback.platform());

        assertEquals(5, config.circuitBreaker.failureThreshold);
        assertEquals(Duration.ofSeconds(90), config.circuitBreaker.openTimeout);
        assertEquals(2, config.circuitBreaker.halfOpenRequests);
        assertEquals(Duration.ofSeconds(15), config.circuitBreaker.rateLimitCooldown);
    }

    @Test
    void jsonFileIsReadAsJson() throws Exception {
        Path path = tempDir.resolve("config.json");
        Files.writeString(path, "{\"backends\":[{\"name\":\"a\",\"base_url\":\"http://localhost:9000\",\"token\":\"t\"}]}");

        RuntimeConfig config = ConfigLoader.compile(ConfigLoader.readTree(path));

        assertEquals("a", config.backends.get(0).name());
    }

    @Test
    void missingAndZeroValuesTakeDefaults() throws Exception {
        JsonNode root = MAPPER.readTree("{\"port\":0,\"backends\":[{\"name\":\"a\",\"base_url\":\"https://x.example.com\"}],"
            + "\"failover\":{\"circuit_breaker\":{\"failure_threshold\":0}}}");

        RuntimeConfig config = ConfigLoader.compile(root);

        assertEquals(Constants.DEFAULT_PORT, config.port);
        assertEquals(Duration.ofSeconds(Constants.DEFAULT_TIMEOUT_SECONDS), config.requestTimeout);
        assertEquals(Constants.DEFAULT_FAILURE_THRESHOLD, config.circuitBreaker.failureThreshold);
        assertEquals(Duration.ofSeconds(Constants.DEFAULT_OPEN_TIMEOUT_SECONDS), config.circuitBreaker.openTimeout);
        assertEquals(Constants.DEFAULT_HALF_OPEN_REQUESTS, config.circuitBreaker.halfOpenRequests);
        assertEquals(Duration.ofSeconds(Constants.DEFAULT_COOLDOWN_SECONDS), config.circuitBreaker.rateLimitCooldown);
        assertEquals("", config.backends.get(0).token());
        assertTrue(config.backends.get(0).enabled());
    }

    @Test
    void invalidConfigurationsAreRejected() {
        assertInvalid("{}", "at least one backend");
        assertInvalid("{\"backends\":[]}", "at least one backend");
        assertInvalid("{\"backends\":[{\"base_url\":\"https://x.example.com\"}]}", "must define 'name'");
        assertInvalid("{\"backends\":[{\"name\":\"a\"}]}", "must define 'base_url'");
        assertInvalid("{\"backends\":[{\"name\":\"a\",\"base_url\":\"ftp://x.example.com\"}]}", "base_url invalid");
        assertInvalid("{\"backends\":[{\"name\":\"a\",\"base_url\":\"https://x.example.com\",\"platform\":\"gemini\"}]}", "Unknown platform");
        assertInvalid("{\"backends\":[{\"name\":\"a\",\"base_url\":\"https://x.example.com\",\"enabled\":\"yes\"}]}", "Expected boolean");
        assertInvalid("{\"port\":\"80\",\"backends\":[{\"name\":\"a\",\"base_url\":\"https://x.example.com\"}]}", "Expected integer");
    }

    private static void assertInvalid(String json, String expectedMessage) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ConfigLoader.compile(MAPPER.readTree(json)));
        assertTrue(e.getMessage().contains(expectedMessage), () -> "Unexpected message: " + e.getMessage());
    }
}
