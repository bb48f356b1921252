import java.io.IOException;
import java.io.OutputStream;

/**
 * Client-facing side of a streaming relay. Every write is followed by a flush so events reach
 * the client as soon as they are produced.
 */
public interface SseSink {

    void write(byte[] data, int offset, int length) throws IOException;

    void flush() throws IOException;

    /**
     * Adapts a response body stream, such as {@code HttpExchange.getResponseBody()}.
     */
    static SseSink of(OutputStream out) {
        return new SseSink() {
            @Override
            public void write(byte[] data, int offset, int length) throws IOException {
                out.write(data, offset, length);
            }

            @Override
            public void flush() throws IOException {
                out.flush();
            }
        };
    }
}
