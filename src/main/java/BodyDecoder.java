import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.util.zip.GZIPInputStream;

import com.github.luben.zstd.ZstdInputStream;

/**
 * Makes upstream bodies readable regardless of compression. Honours a declared
 * {@code Content-Encoding} of gzip or zstd and sniffs magic bytes when none is declared.
 * Decoding is best-effort: on failure the caller gets the raw bytes, never an exception.
 */
public final class BodyDecoder {

    private static final byte[] GZIP_MAGIC = {(byte) 0x1f, (byte) 0x8b};
    private static final byte[] ZSTD_MAGIC = {(byte) 0x28, (byte) 0xb5, (byte) 0x2f, (byte) 0xfd};

    private enum Encoding { GZIP, ZSTD, NONE }

    private BodyDecoder() {
    }

    /**
     * Reads and decodes a complete response body. Closes the body stream.
     */
    public static byte[] readBody(HttpResponse<InputStream> response) {
        String contentEncoding = response.headers().firstValue("Content-Encoding").orElse(null);
        byte[] raw = readFully(response.body());
        return decode(raw, contentEncoding);
    }

    /**
     * Decodes an in-memory body according to the declared encoding or its magic bytes.
     *
     * @param raw             body as received
     * @param contentEncoding declared Content-Encoding, may be null
     * @return decoded bytes, partially decoded bytes if decoding failed midway, or the raw bytes
     */
    public static byte[] decode(byte[] raw, String contentEncoding) {
        if (raw.length == 0) {
            return raw;
        }

        Encoding declared = parse(contentEncoding);
        Encoding effective = declared;
        boolean sniffed = false;
        if (declared == Encoding.NONE && isBlank(contentEncoding)) {
            effective = sniff(raw);
            sniffed = effective != Encoding.NONE;
        }
        if (effective == Encoding.NONE) {
            return raw;
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(raw.length * 4);
        try (InputStream in = wrap(new ByteArrayInputStream(raw), effective)) {
            in.transferTo(out);
        } catch (IOException e) {
            if (out.size() > 0) {
                Logger.warning("[body] " + effective + " stream ended early, keeping " + out.size() + " decoded bytes", e);
                return out.toByteArray();
            }
            Logger.warning("[body] " + effective + " decoding failed, returning raw bytes", e);
            return raw;
        }

        if (sniffed) {
            Logger.info("[body] decoded undeclared " + effective + " body: " + raw.length + " -> " + out.size() + " bytes");
        }
        return out.toByteArray();
    }

    /**
     * Wraps a live stream in the decompressor for the declared encoding. Unknown or absent
     * encodings return the stream unchanged; no sniffing is attempted on live streams.
     */
    public static InputStream decodingStream(InputStream in, String contentEncoding) throws IOException {
        Encoding encoding = parse(contentEncoding);
        return encoding == Encoding.NONE ? in : wrap(in, encoding);
    }

    private static InputStream wrap(InputStream in, Encoding encoding) throws IOException {
        switch (encoding) {
            case GZIP:
                return new GZIPInputStream(in);
            case ZSTD:
                return new ZstdInputStream(in);
            default:
                return in;
        }
    }

    /**
     * Reads until EOF and closes the stream. A read error keeps whatever was read before it.
     */
    static byte[] readFully(InputStream in) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        try (in) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                out.write(buffer, 0, n);
            }
        } catch (IOException e) {
            Logger.warning("[body] read failed, keeping " + out.size() + " bytes already read", e);
        }
        return out.toByteArray();
    }

    private static Encoding parse(String contentEncoding) {
        if (isBlank(contentEncoding)) {
            return Encoding.NONE;
        }
        String value = contentEncoding.trim();
        if (value.equalsIgnoreCase("gzip") || value.equalsIgnoreCase("x-gzip")) {
            return Encoding.GZIP;
        }
        if (value.equalsIgnoreCase("zstd")) {
            return Encoding.ZSTD;
        }
        return Encoding.NONE;
    }

    private static Encoding sniff(byte[] data) {
        if (startsWith(data, GZIP_MAGIC)) {
            return Encoding.GZIP;
        }
        if (startsWith(data, ZSTD_MAGIC)) {
            return Encoding.ZSTD;
        }
        return Encoding.NONE;
    }

    private static boolean startsWith(byte[] data, byte[] magic) {
        if (data.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (data[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
