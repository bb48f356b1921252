import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Rewrites a Chat Completions event stream into the native Messages event stream, one line at a
 * time. Not thread-safe: one instance per stream.
 *
 * <p>The mode is decided by the first data line. A foreign chunk switches to translation; a line
 * that already carries a native {@code type} switches the whole stream to verbatim passthrough,
 * replaying any {@code event:} lines held back while undecided.
 */
public class OpenAiStreamTranslator {

    private enum Mode { UNDECIDED, TRANSLATING, PASSTHROUGH }

    private final String model;
    private final String messageId;

    private Mode mode = Mode.UNDECIDED;
    private final List<String> pendingLines = new ArrayList<>();
    private boolean started;
    private boolean finished;

    private int nextBlockIndex;
    private int currentBlockIndex = -1;
    private String currentBlockType;
    private final Map<Integer, Integer> toolBlockIndexes = new HashMap<>();

    private String finishReason;
    private OpenAiWire.Usage usage;

    private int chunkCount;
    private int textChars;
    private boolean sawDone;

    public OpenAiStreamTranslator(String model) {
        this.model = model != null ? model : "unknown";
        this.messageId = "msg_" + System.currentTimeMillis();
    }

    /**
     * Translates one upstream line (without its terminator).
     *
     * @return the text to write to the client, possibly empty
     */
    public String translateLine(String line) {
        if (mode == Mode.PASSTHROUGH) {
            return line + "\n";
        }
        if (finished) {
            return "";
        }
        if (line.isEmpty()) {
            return "";
        }
        if (line.startsWith(":")) {
            return line + "\n";
        }
        if (!line.startsWith("data:")) {
            if (mode == Mode.UNDECIDED) {
                pendingLines.add(line);
            }
            return "";
        }

        String data = line.substring(5).trim();
        if (data.equals("[DONE]")) {
            sawDone = true;
            return finish();
        }

        JsonNode node;
        try {
            node = ProtocolConverter.JSON.readTree(data);
        } catch (JsonProcessingException e) {
            return "";
        }
        if (node == null || !node.isObject()) {
            return "";
        }

        if (node.path("type").isTextual()) {
            if (mode == Mode.UNDECIDED) {
                mode = Mode.PASSTHROUGH;
                StringBuilder sb = new StringBuilder();
                for (String pending : pendingLines) {
                    sb.append(pending).append('\n');
                }
                pendingLines.clear();
                return sb.append(line).append('\n').toString();
            }
            return line + "\n\n";
        }

        mode = Mode.TRANSLATING;
        pendingLines.clear();
        StringBuilder sb = new StringBuilder();
        ensureStarted(sb);
        translateChunk(node, sb);
        return sb.toString();
    }

    /**
     * Closes the translated stream: open block, message_delta, message_stop. Idempotent, and a
     * no-op in passthrough mode.
     */
    public String finish() {
        if (mode == Mode.PASSTHROUGH || finished) {
            return "";
        }
        finished = true;

        StringBuilder sb = new StringBuilder();
        ensureStarted(sb);
        closeCurrentBlock(sb);

        ObjectNode messageDelta = ProtocolConverter.JSON.createObjectNode();
        messageDelta.put("type", "message_delta");
        messageDelta.putObject("delta")
            .put("stop_reason", ProtocolConverter.mapFinishReason(finishReason))
            .putNull("stop_sequence");
        messageDelta.set("usage", ProtocolConverter.usageNode(usage, true));
        event(sb, "message_delta", messageDelta);

        ObjectNode stop = ProtocolConverter.JSON.createObjectNode();
        stop.put("type", "message_stop");
        event(sb, "message_stop", stop);
        return sb.toString();
    }

    private void translateChunk(JsonNode node, StringBuilder sb) {
        OpenAiWire.ChatCompletion chunk;
        try {
            chunk = ProtocolConverter.JSON.treeToValue(node, OpenAiWire.ChatCompletion.class);
        } catch (JsonProcessingException e) {
            return;
        }
        if (chunk.usage() != null) {
            usage = chunk.usage();
        }
        if (chunk.choices() == null || chunk.choices().isEmpty()) {
            return;
        }

        chunkCount++;
        OpenAiWire.Choice choice = chunk.choices().get(0);
        OpenAiWire.ChatMessage delta = choice.delta();
        if (delta != null) {
            String text = ProtocolConverter.contentText(delta.content());
            if (!text.isEmpty()) {
                appendText(text, sb);
            }
            if (delta.toolCalls() != null) {
                for (OpenAiWire.ToolCall call : delta.toolCalls()) {
                    appendToolCall(call, sb);
                }
            }
        }
        if (choice.finishReason() != null && !choice.finishReason().isEmpty()) {
            finishReason = choice.finishReason();
        }
    }

    private void appendText(String text, StringBuilder sb) {
        textChars += text.codePointCount(0, text.length());
        if (!"text".equals(currentBlockType)) {
            closeCurrentBlock(sb);
            ObjectNode start = blockStart(nextBlockIndex);
            start.putObject("content_block").put("type", "text").put("text", "");
            openBlock(sb, start, "text");
        }

        ObjectNode delta = ProtocolConverter.JSON.createObjectNode();
        delta.put("type", "content_block_delta");
        delta.put("index", currentBlockIndex);
        delta.putObject("delta").put("type", "text_delta").put("text", text);
        event(sb, "content_block_delta", delta);
    }

    private void appendToolCall(OpenAiWire.ToolCall call, StringBuilder sb) {
        int key = call.index() != null ? call.index() : 0;
        Integer blockIndex = toolBlockIndexes.get(key);
        if (blockIndex == null || call.id() != null && blockIndex != currentBlockIndex) {
            closeCurrentBlock(sb);
            blockIndex = nextBlockIndex;
            toolBlockIndexes.put(key, blockIndex);
            ObjectNode start = blockStart(blockIndex);
            ObjectNode block = start.putObject("content_block");
            block.put("type", "tool_use");
            block.put("id", call.id() != null ? call.id() : "toolu_" + messageId + "_" + key);
            block.put("name", call.function() != null ? call.function().name() : null);
            block.putObject("input");
            openBlock(sb, start, "tool_use");
        }

        JsonNode arguments = call.function() != null ? call.function().arguments() : null;
        if (arguments == null || arguments.isNull()) {
            return;
        }
        String fragment = arguments.isTextual() ? arguments.asText() : arguments.toString();
        if (fragment.isEmpty()) {
            return;
        }
        ObjectNode delta = ProtocolConverter.JSON.createObjectNode();
        delta.put("type", "content_block_delta");
        delta.put("index", blockIndex);
        delta.putObject("delta").put("type", "input_json_delta").put("partial_json", fragment);
        event(sb, "content_block_delta", delta);
    }

    private ObjectNode blockStart(int index) {
        ObjectNode start = ProtocolConverter.JSON.createObjectNode();
        start.put("type", "content_block_start");
        start.put("index", index);
        return start;
    }

    private void openBlock(StringBuilder sb, ObjectNode start, String type) {
        event(sb, "content_block_start", start);
        currentBlockIndex = nextBlockIndex++;
        currentBlockType = type;
    }

    private void closeCurrentBlock(StringBuilder sb) {
        if (currentBlockIndex < 0) {
            return;
        }
        ObjectNode stop = ProtocolConverter.JSON.createObjectNode();
        stop.put("type", "content_block_stop");
        stop.put("index", currentBlockIndex);
        event(sb, "content_block_stop", stop);
        currentBlockIndex = -1;
        currentBlockType = null;
    }

    private void ensureStarted(StringBuilder sb) {
        if (started) {
            return;
        }
        started = true;
        ObjectNode start = ProtocolConverter.JSON.createObjectNode();
        start.put("type", "message_start");
        ObjectNode message = start.putObject("message");
        message.put("id", messageId);
        message.put("type", "message");
        message.put("role", "assistant");
        message.put("model", model);
        message.putArray("content");
        message.putNull("stop_reason");
        message.putNull("stop_sequence");
        message.putObject("usage").put("input_tokens", 0).put("output_tokens", 0);
        event(sb, "message_start", start);
    }

    private static void event(StringBuilder sb, String name, ObjectNode payload) {
        sb.append("event: ").append(name).append('\n')
          .append("data: ").append(payload.toString()).append("\n\n");
    }

    public boolean isPassthrough() {
        return mode == Mode.PASSTHROUGH;
    }

    public int chunkCount() {
        return chunkCount;
    }

    public int textChars() {
        return textChars;
    }

    public String finishReason() {
        return finishReason;
    }

    public boolean sawDone() {
        return sawDone;
    }

    /**
     * True once the closing events have been produced. Always false in passthrough mode.
     */
    public boolean isFinished() {
        return finished;
    }
}
