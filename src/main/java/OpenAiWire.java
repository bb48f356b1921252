import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Minimal typed shapes of the Chat Completions API responses, both whole bodies and
 * streaming chunks (which carry {@code delta} instead of {@code message}).
 */
public final class OpenAiWire {

    private OpenAiWire() {
    }

    public record ChatCompletion(
            String id,
            String model,
            List<Choice> choices,
            Usage usage
    ) {}

    public record Choice(
            ChatMessage message,
            ChatMessage delta,
            @JsonProperty("finish_reason") String finishReason
    ) {}

    public record ChatMessage(
            String role,
            JsonNode content,                     // string, null, or array of parts
            @JsonProperty("tool_calls") List<ToolCall> toolCalls
    ) {}

    public record ToolCall(
            Integer index,                        // present on streaming deltas
            String id,
            String type,
            FunctionCall function
    ) {}

    public record FunctionCall(String name, JsonNode arguments) {}

    public record Usage(
            @JsonProperty("prompt_tokens") int promptTokens,
            @JsonProperty("completion_tokens") int completionTokens,
            @JsonProperty("prompt_tokens_details") PromptTokensDetails promptTokensDetails
    ) {

        public int cachedTokens() {
            return promptTokensDetails != null ? promptTokensDetails.cachedTokens() : 0;
        }
    }

    public record PromptTokensDetails(@JsonProperty("cached_tokens") int cachedTokens) {}
}
