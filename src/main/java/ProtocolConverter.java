import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Translates non-streaming bodies between the native Messages API and the foreign
 * Chat Completions API. Streaming responses are handled by {@link OpenAiStreamTranslator}.
 */
public final class ProtocolConverter {

    static final ObjectMapper JSON = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final Map<String, String> MODEL_MAP = Map.of(
        "claude-3-5-sonnet-20241022", "gpt-4o",
        "claude-sonnet-4-5", "gpt-4o",
        "claude-sonnet-4-5-thinking", "gpt-4o",
        "claude-3-opus-20240229", "gpt-4-turbo",
        "claude-3-sonnet-20240229", "gpt-4",
        "claude-3-haiku-20240307", "gpt-3.5-turbo"
    );

    private ProtocolConverter() {
    }

    // ---------------------------------------------------------------------
    // Requests: native -> foreign
    // ---------------------------------------------------------------------

    /**
     * Converts a native Messages request body into a Chat Completions request body.
     *
     * @throws ConversionException if the body is not a valid Messages request
     */
    public static byte[] toOpenAiRequest(byte[] body) throws ConversionException {
        AnthropicWire.MessageRequest request;
        try {
            request = JSON.readValue(body, AnthropicWire.MessageRequest.class);
        } catch (IOException e) {
            throw new ConversionException("invalid request body: " + e.getMessage(), e);
        }
        if (request == null) {
            throw new ConversionException("invalid request body: empty document");
        }
        try {
            return JSON.writeValueAsBytes(toOpenAiRequest(request));
        } catch (JsonProcessingException e) {
            throw new ConversionException("failed to serialize converted request", e);
        }
    }

    static ObjectNode toOpenAiRequest(AnthropicWire.MessageRequest request) throws ConversionException {
        if (request.messages() == null) {
            throw new ConversionException("request has no messages");
        }

        ObjectNode out = JSON.createObjectNode();
        if (request.model() != null) {
            out.put("model", mapModel(request.model()));
        }

        ArrayNode messages = out.putArray("messages");
        String system = systemText(request.system());
        if (!system.isEmpty()) {
            messages.addObject().put("role", "system").put("content", system);
        }
        for (AnthropicWire.Message message : request.messages()) {
            convertMessage(message, messages);
        }

        if (request.maxTokens() != null) {
            out.put("max_tokens", request.maxTokens());
        }
        if (request.temperature() != null) {
            out.put("temperature", request.temperature());
        }
        if (request.topP() != null) {
            out.put("top_p", request.topP());
        }
        if (request.stream() != null) {
            out.put("stream", request.stream());
        }
        if (request.stopSequences() != null && !request.stopSequences().isEmpty()) {
            ArrayNode stop = out.putArray("stop");
            request.stopSequences().forEach(stop::add);
        }

        if (request.tools() != null && !request.tools().isEmpty()) {
            ArrayNode tools = out.putArray("tools");
            for (AnthropicWire.Tool tool : request.tools()) {
                ObjectNode function = tools.addObject().put("type", "function").putObject("function");
                function.put("name", tool.name());
                if (tool.description() != null) {
                    function.put("description", tool.description());
                }
                if (tool.inputSchema() != null && !tool.inputSchema().isNull()) {
                    function.set("parameters", tool.inputSchema());
                }
            }
        }
        convertToolChoice(request.toolChoice(), out);
        return out;
    }

    private static String systemText(JsonNode system) {
        if (system == null || system.isNull()) {
            return "";
        }
        if (system.isTextual()) {
            return system.asText();
        }
        if (system.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode block : system) {
                if ("text".equals(block.path("type").asText()) && block.hasNonNull("text")) {
                    parts.add(block.get("text").asText());
                }
            }
            return String.join("\n", parts);
        }
        return "";
    }

    private static void convertMessage(AnthropicWire.Message message, ArrayNode out) throws ConversionException {
        String role = message.role();
        if (role == null || role.isBlank()) {
            return;
        }

        JsonNode content = message.content();
        if (content == null || content.isNull()) {
            out.addObject().put("role", role).put("content", "");
            return;
        }
        if (content.isTextual()) {
            out.addObject().put("role", role).put("content", content.asText());
            return;
        }
        if (!content.isArray()) {
            throw new ConversionException("unsupported content for role '" + role + "'");
        }

        List<AnthropicWire.ContentBlock> blocks = new ArrayList<>(content.size());
        for (JsonNode node : content) {
            try {
                blocks.add(JSON.treeToValue(node, AnthropicWire.ContentBlock.class));
            } catch (JsonProcessingException e) {
                throw new ConversionException("invalid content block for role '" + role + "'", e);
            }
        }

        if (role.equals("assistant")) {
            convertAssistantBlocks(blocks, out);
        } else if (role.equals("user")) {
            convertUserBlocks(blocks, out);
        } else {
            out.addObject().put("role", role).put("content", joinText(blocks));
        }
    }

    private static void convertUserBlocks(List<AnthropicWire.ContentBlock> blocks, ArrayNode out) {
        ArrayNode parts = JSON.createArrayNode();
        for (AnthropicWire.ContentBlock block : blocks) {
            String type = block.type() != null ? block.type() : "";
            switch (type) {
                case "tool_result":
                    if (block.toolUseId() != null) {
                        out.addObject()
                            .put("role", "tool")
                            .put("tool_call_id", block.toolUseId())
                            .put("content", toolResultText(block.content()));
                    }
                    break;
                case "text":
                    parts.addObject().put("type", "text").put("text", block.text() != null ? block.text() : "");
                    break;
                case "image":
                    String url = imageUrl(block.source());
                    if (url != null) {
                        parts.addObject().put("type", "image_url").putObject("image_url").put("url", url);
                    }
                    break;
                default:
                    break;
            }
        }

        if (parts.isEmpty()) {
            return;
        }
        ObjectNode message = out.addObject().put("role", "user");
        if (parts.size() == 1 && "text".equals(parts.get(0).path("type").asText())) {
            message.put("content", parts.get(0).path("text").asText());
        } else {
            message.set("content", parts);
        }
    }

    private static void convertAssistantBlocks(List<AnthropicWire.ContentBlock> blocks, ArrayNode out) {
        List<String> text = new ArrayList<>();
        ArrayNode toolCalls = JSON.createArrayNode();
        for (AnthropicWire.ContentBlock block : blocks) {
            if ("text".equals(block.type()) && block.text() != null) {
                text.add(block.text());
            } else if ("tool_use".equals(block.type()) && block.id() != null && block.name() != null) {
                JsonNode input = block.input() != null && !block.input().isNull() ? block.input() : JSON.createObjectNode();
                ObjectNode call = toolCalls.addObject().put("id", block.id()).put("type", "function");
                call.putObject("function")
                    .put("name", block.name())
                    .put("arguments", input.toString());
            }
        }

        ObjectNode message = out.addObject().put("role", "assistant");
        String joined = String.join("\n", text);
        if (toolCalls.isEmpty()) {
            message.put("content", joined);
        } else {
            if (joined.isEmpty()) {
                message.putNull("content");
            } else {
                message.put("content", joined);
            }
            message.set("tool_calls", toolCalls);
        }
    }

    private static String joinText(List<AnthropicWire.ContentBlock> blocks) {
        List<String> text = new ArrayList<>();
        for (AnthropicWire.ContentBlock block : blocks) {
            if ("text".equals(block.type()) && block.text() != null) {
                text.add(block.text());
            }
        }
        return String.join("\n", text);
    }

    private static String toolResultText(JsonNode content) {
        if (content == null || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            List<String> text = new ArrayList<>();
            for (JsonNode block : content) {
                if (block.hasNonNull("text")) {
                    text.add(block.get("text").asText());
                }
            }
            return String.join("\n", text);
        }
        return content.toString();
    }

    private static String imageUrl(AnthropicWire.ImageSource source) {
        if (source == null) {
            return null;
        }
        if ("base64".equals(source.type()) && source.data() != null) {
            String mediaType = source.mediaType() != null ? source.mediaType() : "image/png";
            return "data:" + mediaType + ";base64," + source.data();
        }
        return source.url();
    }

    private static void convertToolChoice(JsonNode choice, ObjectNode out) {
        if (choice == null || choice.isNull()) {
            return;
        }
        if (choice.isTextual()) {
            out.put("tool_choice", choice.asText());
            return;
        }
        if (!choice.isObject()) {
            return;
        }

        String type = choice.path("type").asText();
        switch (type) {
            case "auto":
            case "none":
                out.put("tool_choice", type);
                break;
            case "any":
                out.put("tool_choice", "required");
                break;
            case "tool":
                if (choice.hasNonNull("name")) {
                    out.putObject("tool_choice")
                        .put("type", "function")
                        .putObject("function").put("name", choice.get("name").asText());
                } else {
                    out.put("tool_choice", "auto");
                }
                break;
            default:
                out.set("tool_choice", choice);
                break;
        }
        if (choice.path("disable_parallel_tool_use").asBoolean(false)) {
            out.put("parallel_tool_calls", false);
        }
    }

    // ---------------------------------------------------------------------
    // Responses: foreign -> native
    // ---------------------------------------------------------------------

    /**
     * Converts a non-streaming Chat Completions response body into a native Messages response.
     * A body that is already native is returned unchanged.
     *
     * @throws ConversionException if the body is not valid JSON or not a completion object
     */
    public static byte[] toAnthropicResponse(byte[] body) throws ConversionException {
        JsonNode root;
        try {
            root = JSON.readTree(body);
        } catch (IOException e) {
            throw new ConversionException("upstream response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConversionException("upstream response is not a JSON object");
        }
        if ("message".equals(root.path("type").asText())) {
            return body;
        }

        OpenAiWire.ChatCompletion completion;
        try {
            completion = JSON.treeToValue(root, OpenAiWire.ChatCompletion.class);
        } catch (JsonProcessingException e) {
            throw new ConversionException("upstream response has an unexpected shape", e);
        }

        try {
            return JSON.writeValueAsBytes(toAnthropicResponse(completion));
        } catch (JsonProcessingException e) {
            throw new ConversionException("failed to serialize converted response", e);
        }
    }

    static ObjectNode toAnthropicResponse(OpenAiWire.ChatCompletion completion) {
        ObjectNode out = JSON.createObjectNode();
        out.put("id", completion.id() != null ? completion.id() : newMessageId());
        out.put("type", "message");
        out.put("role", "assistant");
        out.put("model", completion.model());

        ArrayNode content = out.putArray("content");
        String finishReason = null;
        if (completion.choices() != null && !completion.choices().isEmpty()) {
            OpenAiWire.Choice choice = completion.choices().get(0);
            finishReason = choice.finishReason();
            OpenAiWire.ChatMessage message = choice.message();
            if (message != null) {
                String text = contentText(message.content());
                if (!text.isEmpty()) {
                    content.addObject().put("type", "text").put("text", text);
                }
                if (message.toolCalls() != null) {
                    for (OpenAiWire.ToolCall call : message.toolCalls()) {
                        if (call.function() == null) {
                            continue;
                        }
                        ObjectNode block = content.addObject()
                            .put("type", "tool_use")
                            .put("id", call.id())
                            .put("name", call.function().name());
                        block.set("input", parseArguments(call.function().arguments()));
                    }
                }
            }
        }

        out.put("stop_reason", mapFinishReason(finishReason));
        out.putNull("stop_sequence");
        out.set("usage", usageNode(completion.usage(), true));
        return out;
    }

    /**
     * Builds a native usage object. Cached prompt tokens are reported separately from input.
     */
    static ObjectNode usageNode(OpenAiWire.Usage usage, boolean includeInput) {
        ObjectNode node = JSON.createObjectNode();
        int prompt = usage != null ? usage.promptTokens() : 0;
        int cached = usage != null ? usage.cachedTokens() : 0;
        if (includeInput) {
            node.put("input_tokens", Math.max(0, prompt - cached));
        }
        node.put("output_tokens", usage != null ? usage.completionTokens() : 0);
        if (cached > 0) {
            node.put("cache_read_input_tokens", cached);
        }
        return node;
    }

    static String contentText(JsonNode content) {
        if (content == null || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : content) {
                if (part.hasNonNull("text")) {
                    sb.append(part.get("text").asText());
                }
            }
            return sb.toString();
        }
        return "";
    }

    private static JsonNode parseArguments(JsonNode arguments) {
        if (arguments == null || arguments.isNull()) {
            return JSON.createObjectNode();
        }
        if (arguments.isObject()) {
            return arguments;
        }
        String raw = arguments.asText();
        if (raw.isBlank()) {
            return JSON.createObjectNode();
        }
        try {
            JsonNode parsed = JSON.readTree(raw);
            if (parsed != null && parsed.isObject()) {
                return parsed;
            }
        } catch (JsonProcessingException e) {
            Logger.warning("[convert] tool call arguments are not valid JSON, using empty input");
        }
        return JSON.createObjectNode();
    }

    // ---------------------------------------------------------------------
    // Shared mappings
    // ---------------------------------------------------------------------

    /**
     * Maps a native model name to a foreign one. Names that are not native pass through.
     */
    public static String mapModel(String model) {
        if (model == null) {
            return null;
        }
        String mapped = MODEL_MAP.get(model);
        if (mapped != null) {
            return mapped;
        }
        return model.startsWith("claude-") ? Constants.DEFAULT_FOREIGN_MODEL : model;
    }

    /**
     * Maps a foreign finish reason to a native stop reason. Unknown or absent reasons map to
     * {@code end_turn}.
     */
    public static String mapFinishReason(String finishReason) {
        if (finishReason == null) {
            return "end_turn";
        }
        switch (finishReason) {
            case "length":
                return "max_tokens";
            case "tool_calls":
            case "function_call":
                return "tool_use";
            case "content_filter":
                return "stop_sequence";
            case "stop":
            default:
                return "end_turn";
        }
    }

    static String newMessageId() {
        return "msg_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }
}
