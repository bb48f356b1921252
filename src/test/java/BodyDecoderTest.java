import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpHeaders;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

import com.github.luben.zstd.Zstd;
import org.junit.jupiter.api.Test;

/**
 * Verifies that compressed bodies are decoded by header or by magic bytes and that decoding
 * failures never hide the original content.
 */
class BodyDecoderTest {

    private static final String ERROR_JSON = "{\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}";

    @Test
    void decodesDeclaredGzip() throws IOException {
        byte[] compressed = gzip(ERROR_JSON);
        assertEquals(ERROR_JSON, text(BodyDecoder.decode(compressed, "gzip")));
        assertEquals(ERROR_JSON, text(BodyDecoder.decode(compressed, "GZIP")));
    }

    @Test
    void decodesDeclaredZstd() {
        byte[] compressed = Zstd.compress(ERROR_JSON.getBytes(StandardCharsets.UTF_8));
        assertEquals(ERROR_JSON, text(BodyDecoder.decode(compressed, "zstd")));
    }

    @Test
    void sniffsUndeclaredGzipAndZstd() throws IOException {
        assertEquals(ERROR_JSON, text(BodyDecoder.decode(gzip(ERROR_JSON), null)));
        assertEquals(ERROR_JSON, text(BodyDecoder.decode(Zstd.compress(ERROR_JSON.getBytes(StandardCharsets.UTF_8)), "")));
    }

    @Test
    void plainBodyIsReturnedUnchanged() {
        byte[] plain = ERROR_JSON.getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(plain, BodyDecoder.decode(plain, null));
        assertArrayEquals(plain, BodyDecoder.decode(plain, "identity"));
    }

    @Test
    void corruptDeclaredBodyFallsBackToRawBytes() {
        byte[] notGzip = "this is not compressed".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(notGzip, BodyDecoder.decode(notGzip, "gzip"));
    }

    @Test
    void fakeMagicFallsBackToRawBytes() {
        byte[] fake = {(byte) 0x1f, (byte) 0x8b, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10};
        assertArrayEquals(fake, BodyDecoder.decode(fake, null));
    }

    @Test
    void truncatedGzipKeepsDecodedPrefix() throws IOException {
        String large = "x".repeat(200_000);
        byte[] compressed = gzip(large);
        byte[] truncated = Arrays.copyOf(compressed, compressed.length - 8);

        byte[] decoded = BodyDecoder.decode(truncated, "gzip");
        String result = text(decoded);
        assertEquals(large.substring(0, result.length()), result, "Partial output must be a prefix of the original");
        assertTrue(result.length() > 0);
    }

    @Test
    void readBodyUsesContentEncodingHeader() throws IOException {
        HttpResponse<InputStream> response = response(gzip(ERROR_JSON), Map.of("Content-Encoding", List.of("gzip")));
        assertEquals(ERROR_JSON, text(BodyDecoder.readBody(response)));
    }

    @Test
    void readBodyKeepsBytesReadBeforeFailure() {
        byte[] prefix = "partial-body".getBytes(StandardCharsets.UTF_8);
        InputStream failing = new InputStream() {
            private int pos;

            @Override
            public int read() throws IOException {
                if (pos < prefix.length) {
                    return prefix[pos++];
                }
                throw new IOException("connection reset");
            }
        };
        HttpResponse<InputStream> response = responseWithStream(failing, Map.of());

        assertEquals("partial-body", text(BodyDecoder.readBody(response)));
    }

    @Test
    void decodingStreamWrapsDeclaredEncodingOnly() throws IOException {
        try (InputStream in = BodyDecoder.decodingStream(new ByteArrayInputStream(gzip("data: {}\n\n")), "gzip")) {
            assertEquals("data: {}\n\n", text(in.readAllBytes()));
        }

        ByteArrayInputStream plain = new ByteArrayInputStream(new byte[0]);
        assertSame(plain, BodyDecoder.decodingStream(plain, null));
    }

    private static HttpResponse<InputStream> response(byte[] body, Map<String, List<String>> headers) {
        return responseWithStream(new ByteArrayInputStream(body), headers);
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<InputStream> responseWithStream(InputStream body, Map<String, List<String>> headers) {
        HttpResponse<InputStream> response = mock(HttpResponse.class);
        when(response.headers()).thenReturn(HttpHeaders.of(headers, (name, value) -> true));
        when(response.body()).thenReturn(body);
        return response;
    }

    private static byte[] gzip(String text) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
