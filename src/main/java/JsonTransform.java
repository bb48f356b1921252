import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Utility functions for inspecting and patching client request bodies.
 */
public class JsonTransform {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * The two request fields the forwarder needs to know about. Everything else is opaque.
     */
    public record RequestProbe(String model, Boolean stream) {

        public boolean isStreaming() {
            return Boolean.TRUE.equals(stream);
        }
    }

    private static final RequestProbe EMPTY_PROBE = new RequestProbe(null, null);

    /**
     * Reads {@code model} and {@code stream} from a request body. Bodies that are empty, not
     * JSON, or carry those fields with other types yield an empty probe.
     */
    public static RequestProbe probe(byte[] body) {
        if (body == null || body.length == 0) {
            return EMPTY_PROBE;
        }
        try {
            RequestProbe probe = JSON_MAPPER.readValue(body, RequestProbe.class);
            return probe != null ? probe : EMPTY_PROBE;
        } catch (IOException e) {
            return EMPTY_PROBE;
        }
    }

    /**
     * Sets the top-level {@code model} field, keeping every other field as sent. A body that is
     * not a JSON object is returned unchanged.
     */
    public static byte[] overrideModel(byte[] body, String model) {
        if (body == null || body.length == 0 || model == null) {
            return body;
        }
        try {
            JsonNode parsed = JSON_MAPPER.readTree(body);
            if (parsed == null || !parsed.isObject()) {
                return body;
            }
            ObjectNode objectNode = (ObjectNode) parsed;
            objectNode.put("model", model);
            return JSON_MAPPER.writeValueAsBytes(objectNode);
        } catch (IOException e) {
            return body;
        }
    }

    /**
     * Pretty-prints a body for debug logging, or returns it as text if it is not JSON.
     */
    public static String prettyPrint(byte[] body) {
        try {
            JsonNode jsonNode = JSON_MAPPER.readTree(body);
            return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(jsonNode);
        } catch (IOException e) {
            return new String(body, StandardCharsets.UTF_8);
        }
    }
}
