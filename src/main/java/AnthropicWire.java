import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Minimal typed shapes of the native Messages API, covering the fields the converter reads.
 * Fields whose JSON type varies (string or block array) stay as {@link JsonNode}.
 */
public final class AnthropicWire {

    private AnthropicWire() {
    }

    public record MessageRequest(
            String model,
            @JsonProperty("max_tokens") Integer maxTokens,
            Double temperature,
            @JsonProperty("top_p") Double topP,
            Boolean stream,
            JsonNode system,                      // string or array of text blocks
            List<Message> messages,
            List<Tool> tools,
            @JsonProperty("tool_choice") JsonNode toolChoice,
            @JsonProperty("stop_sequences") List<String> stopSequences
    ) {}

    public record Message(String role, JsonNode content) {}

    /**
     * Union of the block kinds the converter understands: text, image, tool_use and tool_result.
     */
    public record ContentBlock(
            String type,
            String text,
            ImageSource source,
            String id,
            String name,
            JsonNode input,
            @JsonProperty("tool_use_id") String toolUseId,
            JsonNode content
    ) {}

    public record ImageSource(
            String type,                          // "base64" | "url"
            @JsonProperty("media_type") String mediaType,
            String data,
            String url
    ) {}

    public record Tool(
            String name,
            String description,
            @JsonProperty("input_schema") JsonNode inputSchema
    ) {}
}
