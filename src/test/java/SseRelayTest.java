import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import org.junit.jupiter.api.Test;

/**
 * Verifies incremental relaying of event streams, translated and verbatim.
 */
class SseRelayTest {

    @Test
    void translatedStreamConcatenatesToUpstreamText() throws Exception {
        String upstream = ""
            + "data: {\"choices\":[{\"delta\":{\"role\":\"assistant\",\"content\":\"\"}}]}\n\n"
            + "data: {\"choices\":[{\"delta\":{\"content\":\"The answer \"}}]}\n\n"
            + "data: {\"choices\":[{\"delta\":{\"content\":\"is 42.\"}}]}\n\n"
            + "data: [DONE]\n\n";
        RecordingSink sink = new RecordingSink();

        new SseRelay(sink, "foreign").relayTranslated(stream(upstream), new OpenAiStreamTranslator("gpt-4o"));

        List<OpenAiStreamTranslatorTest.Event> events = OpenAiStreamTranslatorTest.parse(sink.text());
        assertEquals("message_start", events.get(0).name);
        assertEquals("message_stop", events.get(events.size() - 1).name);
        assertEquals("The answer is 42.", OpenAiStreamTranslatorTest.concatenatedText(events));
        assertTrue(sink.flushes >= sink.writes, "Every write is flushed");
    }

    @Test
    void translatedStreamIsClosedWhenUpstreamEndsWithoutDone() throws Exception {
        String upstream = "data: {\"choices\":[{\"delta\":{\"content\":\"cut\"}}]}\n";
        RecordingSink sink = new RecordingSink();

        new SseRelay(sink, "foreign").relayTranslated(stream(upstream), new OpenAiStreamTranslator("gpt-4o"));

        List<OpenAiStreamTranslatorTest.Event> events = OpenAiStreamTranslatorTest.parse(sink.text());
        assertEquals(List.of("message_start", "content_block_start", "content_block_delta", "content_block_stop",
            "message_delta", "message_stop"), OpenAiStreamTranslatorTest.names(events));
    }

    @Test
    void translatedStreamIsClosedWhenUpstreamFails() throws Exception {
        byte[] prefix = "data: {\"choices\":[{\"delta\":{\"content\":\"partial\"}}]}\n\n".getBytes(StandardCharsets.UTF_8);
        InputStream failing = new InputStream() {
            private int pos;

            @Override
            public int read() throws IOException {
                if (pos < prefix.length) {
                    return prefix[pos++];
                }
                throw new IOException("stream reset");
            }
        };
        RecordingSink sink = new RecordingSink();

        new SseRelay(sink, "foreign").relayTranslated(failing, new OpenAiStreamTranslator("gpt-4o"));

        List<OpenAiStreamTranslatorTest.Event> events = OpenAiStreamTranslatorTest.parse(sink.text());
        assertEquals("partial", OpenAiStreamTranslatorTest.concatenatedText(events));
        assertEquals("message_stop", events.get(events.size() - 1).name);
    }

    @Test
    void translatedStreamEndsAtDoneWhileUpstreamStaysOpen() {
        HeldOpenInputStream upstream = new HeldOpenInputStream(""
            + "data: {\"choices\":[{\"delta\":{\"content\":\"done soon\"}}]}\n\n"
            + "data: [DONE]\n\n");
        RecordingSink sink = new RecordingSink();

        assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> new SseRelay(sink, "foreign").relayTranslated(upstream, new OpenAiStreamTranslator("gpt-4o")));

        assertTrue(upstream.closed, "Upstream is released once the stream is complete");
        assertTrue(sink.text().endsWith("event: message_stop\ndata: {\"type\":\"message_stop\"}\n\n"));
        assertEquals(1, sink.text().split("event: message_stop", -1).length - 1);
    }

    @Test
    void verbatimRelayCopiesBytesExactly() throws Exception {
        String upstream = "event: message_start\ndata: {\"type\":\"message_start\"}\n\n: ping\n\nevent: message_stop\ndata: {\"type\":\"message_stop\"}\n\n";
        RecordingSink sink = new RecordingSink();

        long relayed = new SseRelay(sink, "native").relayVerbatim(stream(upstream));

        assertEquals(upstream, sink.text());
        assertEquals(upstream.getBytes(StandardCharsets.UTF_8).length, relayed);
        assertEquals(sink.writes, sink.flushes);
    }

    @Test
    void clientDisconnectClosesUpstream() {
        TrackingInputStream upstream = new TrackingInputStream("data: {\"type\":\"ping\"}\n\n".repeat(100));
        SseSink broken = new SseSink() {
            @Override
            public void write(byte[] data, int offset, int length) throws IOException {
                throw new IOException("Broken pipe");
            }

            @Override
            public void flush() {
            }
        };

        assertThrows(SseRelay.ClientDisconnectedException.class,
            () -> new SseRelay(broken, "native").relayVerbatim(upstream));
        assertTrue(upstream.closed, "Upstream body must be closed once the client is gone");

        TrackingInputStream translatedUpstream = new TrackingInputStream("data: {\"choices\":[{\"delta\":{\"content\":\"x\"}}]}\n\n");
        assertThrows(SseRelay.ClientDisconnectedException.class,
            () -> new SseRelay(broken, "foreign").relayTranslated(translatedUpstream, new OpenAiStreamTranslator("m")));
        assertTrue(translatedUpstream.closed);
    }

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static final class RecordingSink implements SseSink {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        int writes;
        int flushes;

        @Override
        public void write(byte[] data, int offset, int length) {
            out.write(data, offset, length);
            writes++;
        }

        @Override
        public void flush() {
            flushes++;
        }

        String text() {
            return out.toString(StandardCharsets.UTF_8);
        }
    }

    /**
     * Serves its content, then blocks like an idle keep-alive connection until closed.
     */
    private static final class HeldOpenInputStream extends InputStream {
        private final byte[] content;
        private final CountDownLatch closeSignal = new CountDownLatch(1);
        private int pos;
        volatile boolean closed;

        HeldOpenInputStream(String text) {
            this.content = text.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            return read(one, 0, 1) == -1 ? -1 : one[0] & 0xff;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (pos < content.length) {
                int n = Math.min(len, content.length - pos);
                System.arraycopy(content, pos, b, off, n);
                pos += n;
                return n;
            }
            try {
                closeSignal.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
            return -1;
        }

        @Override
        public void close() {
            closed = true;
            closeSignal.countDown();
        }
    }

    private static final class TrackingInputStream extends ByteArrayInputStream {
        boolean closed;

        TrackingInputStream(String text) {
            super(text.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }
}
