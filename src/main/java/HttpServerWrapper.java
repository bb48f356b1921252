import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

/**
 * A wrapper around {@link HttpServer} that provides simplified HTTP server management
 * for handling incoming requests. Each exchange runs on its own pooled daemon thread,
 * so a long streaming response never blocks other clients.
 *
 * @see com.sun.net.httpserver.HttpServer
 */
public class HttpServerWrapper {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private HttpServer httpServer;
    private ExecutorService executor;
    private final int port;

    /**
     * Creates a new HTTP server wrapper.
     *
     * @param port The port to bind the server to, 0 for an ephemeral port
     */
    public HttpServerWrapper(int port) {
        this.port = port;
    }

    /**
     * Starts the HTTP server and registers the provided handler for all requests.
     *
     * @param handler The handler to process all incoming requests
     * @throws IOException If the server fails to start
     */
    public void start(HttpHandler handler) throws IOException {
        try {
            httpServer = HttpServer.create(new InetSocketAddress(port), 0); // 0 = Use system default backlog
            httpServer.createContext("/", handler);

            executor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r);
                t.setDaemon(true);
                t.setName("HttpServer-Worker");
                return t;
            });
            httpServer.setExecutor(executor);

            httpServer.start();
        } catch (Exception e) {
            throw new IOException("Failed to start server on port " + port, e);
        }
    }

    /**
     * Returns the bound port, which differs from the configured one when that was 0.
     */
    public int getPort() {
        return httpServer != null ? httpServer.getAddress().getPort() : port;
    }

    /**
     * Stops accepting connections, then waits up to {@code graceSeconds} for in-flight
     * exchanges to finish.
     *
     * @throws IOException If the server fails to stop
     */
    public void stop(int graceSeconds) throws IOException {
        if (httpServer != null) {
            try {
                httpServer.stop(graceSeconds);
                httpServer = null;
            } catch (Exception e) {
                throw new IOException("Failed to stop server", e);
            }
        }

        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(graceSeconds, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
    }

    /**
     * Reads the complete request body from an HTTP exchange.
     *
     * @param exchange The HTTP exchange
     * @return The raw request body, empty if there is none
     * @throws IOException If reading the body fails
     */
    public static byte[] readRequestBody(HttpExchange exchange) throws IOException {
        try (InputStream inputStream = exchange.getRequestBody()) {
            return inputStream.readAllBytes();
        } catch (Exception e) {
            throw new IOException("Failed to read request body", e);
        }
    }

    /**
     * Sends a response with the specified status code, content type, and body.
     *
     * @param exchange The HTTP exchange
     * @param statusCode The HTTP status code
     * @param contentType The content type header value
     * @param responseBody The response body
     * @throws IOException If sending the response fails
     */
    public static void sendResponse(HttpExchange exchange, int statusCode, String contentType, String responseBody) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        sendResponse(exchange, statusCode, responseBody.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Sends a response body with whatever headers are already set on the exchange.
     * An empty body is sent without a body stream, as required for 204 and 304.
     *
     * @throws IOException If sending the response fails
     */
    public static void sendResponse(HttpExchange exchange, int statusCode, byte[] responseBytes) throws IOException {
        try {
            if (responseBytes.length == 0) {
                exchange.sendResponseHeaders(statusCode, -1);
                exchange.close();
                return;
            }
            exchange.sendResponseHeaders(statusCode, responseBytes.length);
            try (OutputStream output = exchange.getResponseBody()) {
                output.write(responseBytes);
            }
        } catch (Exception e) {
            throw new IOException("Failed to send response", e);
        }
    }

    /**
     * Sends a JSON document.
     *
     * @throws IOException If sending the response fails
     */
    public static void sendJson(HttpExchange exchange, int statusCode, ObjectNode body) throws IOException {
        sendResponse(exchange, statusCode, Constants.CONTENT_TYPE_JSON, JSON_MAPPER.writeValueAsString(body));
    }

    /**
     * Sends an error in the native API's error envelope:
     * {@code {"type":"error","error":{"type":...,"message":...}}}.
     *
     * @throws IOException If sending the response fails
     */
    public static void sendError(HttpExchange exchange, int statusCode, String errorType, String message) throws IOException {
        ObjectNode body = JSON_MAPPER.createObjectNode();
        body.put("type", "error");
        body.putObject("error").put("type", errorType).put("message", message);
        sendJson(exchange, statusCode, body);
    }
}
