import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Copies an upstream event stream to the client incrementally, flushing after every write.
 * Runs on the request's worker thread: the upstream body is the only reader and the sink the
 * only writer. When the client goes away the upstream body is closed immediately, which
 * aborts the pending upstream read.
 */
public class SseRelay {

    /**
     * Raised when writing to the client fails, as opposed to reading from upstream.
     */
    public static class ClientDisconnectedException extends IOException {
        public ClientDisconnectedException(Throwable cause) {
            super("client disconnected", cause);
        }
    }

    private final SseSink sink;
    private final String backendName;

    public SseRelay(SseSink sink, String backendName) {
        this.sink = sink;
        this.backendName = backendName;
    }

    /**
     * Relays bytes unchanged. Closes {@code in}.
     *
     * @return number of bytes relayed
     * @throws ClientDisconnectedException if the client stopped accepting data
     */
    public long relayVerbatim(InputStream in) throws IOException {
        long total = 0;
        try (in) {
            byte[] buffer = new byte[8192];
            int n;
            while (true) {
                try {
                    n = in.read(buffer);
                } catch (IOException e) {
                    Logger.warning("[stream] " + backendName + " - upstream read failed after " + total + " bytes", e);
                    break;
                }
                if (n == -1) {
                    break;
                }
                emit(buffer, n);
                total += n;
            }
        }
        Logger.info("[stream] " + backendName + " - relayed " + total + " bytes");
        return total;
    }

    /**
     * Relays a foreign event stream line by line through the translator. The translated stream
     * is always closed with its final events, even when upstream ends without {@code [DONE]}
     * or fails midway. Returns as soon as {@code [DONE]} has been translated, without waiting
     * for upstream to close its connection. Closes {@code in}.
     *
     * @throws ClientDisconnectedException if the client stopped accepting data
     */
    public void relayTranslated(InputStream in, OpenAiStreamTranslator translator) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            while (true) {
                String line;
                try {
                    line = reader.readLine();
                } catch (IOException e) {
                    Logger.warning("[stream] " + backendName + " - upstream read failed, closing translated stream", e);
                    break;
                }
                if (line == null) {
                    break;
                }
                emit(translator.translateLine(line));
                if (translator.isFinished()) {
                    break;
                }
            }
            emit(translator.finish());
        }

        if (translator.isPassthrough()) {
            Logger.info("[stream] " + backendName + " - upstream already native, relayed unchanged");
        } else {
            Logger.info("[stream] " + backendName + " - chunks=" + translator.chunkCount()
                + " text_chars=" + translator.textChars()
                + " finish_reason=" + translator.finishReason()
                + " saw_done=" + translator.sawDone());
        }
    }

    private void emit(String text) throws IOException {
        if (text.isEmpty()) {
            return;
        }
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        emit(bytes, bytes.length);
    }

    private void emit(byte[] data, int length) throws IOException {
        try {
            sink.write(data, 0, length);
            sink.flush();
        } catch (IOException e) {
            Logger.warning("[stream] " + backendName + " - client disconnected, closing upstream");
            throw new ClientDisconnectedException(e);
        }
    }
}
