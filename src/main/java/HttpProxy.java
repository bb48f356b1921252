import java.io.IOException;
import java.net.URI;
import java.time.Duration;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

/**
 * A failover HTTP proxy that forwards each request to the first healthy backend.
 * Uses {@link HttpServerWrapper} for incoming requests and {@link FailoverForwarder}
 * to drive the attempts. Supports both streaming and non-streaming responses.
 */
public class HttpProxy implements HttpHandler {

    /**
     * Interface for preparing a request for one particular backend.
     */
    public interface RequestRouter {
        /**
         * Determines the target URI and outbound body for a given backend.
         *
         * @param backend The backend about to be attempted
         * @param path Raw client request path
         * @param rawQuery Raw client query string, may be null
         * @param body Client request body, possibly empty
         * @return ProxyTarget for this attempt
         * @throws ConversionException if the body cannot be converted to the backend's protocol
         * @throws IllegalArgumentException if the target URL cannot be built
         */
        ProxyTarget route(Backend backend, String path, String rawQuery, byte[] body) throws ConversionException;
    }

    /**
     * Target information for one attempt.
     *
     * @param uri             full upstream URL
     * @param body            outbound body after override and conversion
     * @param isStreaming     true if the body asks for a streamed response
     * @param convertResponse true if the response must be converted back to the native protocol
     * @param model           model named in the outbound body, may be null
     */
    public record ProxyTarget(URI uri, byte[] body, boolean isStreaming, boolean convertResponse, String model) {}

    private final HttpServerWrapper serverWrapper;
    private final FailoverForwarder forwarder;

    /**
     * Creates a new HTTP proxy server.
     *
     * @param port The port to bind the server to
     * @param connectionTimeout Timeout for establishing backend connections
     * @param requestTimeout Timeout for complete non-streaming request/response cycles
     * @param circuitBreaker Backend health state shared with the management API
     * @param router The router to prepare each attempt
     */
    public HttpProxy(int port, Duration connectionTimeout, Duration requestTimeout,
                     CircuitBreaker circuitBreaker, RequestRouter router) {
        this.serverWrapper = new HttpServerWrapper(port);
        this.forwarder = new FailoverForwarder(
            circuitBreaker, new HttpClientWrapper(connectionTimeout), router, requestTimeout);
    }

    /**
     * Starts the proxy server.
     *
     * @throws IOException If the server fails to start
     */
    public void start() throws IOException {
        serverWrapper.start(this);
    }

    /**
     * Stops the proxy server, letting in-flight requests finish within the grace period.
     *
     * @throws IOException If the server fails to stop
     */
    public void stop() throws IOException {
        serverWrapper.stop(Constants.SHUTDOWN_GRACE_SECONDS);
    }

    public int getPort() {
        return serverWrapper.getPort();
    }

    /**
     * Handles incoming HTTP requests by forwarding them through the backend list.
     */
    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            byte[] body = HttpServerWrapper.readRequestBody(exchange);
            forwarder.forward(exchange, body);
        } catch (SseRelay.ClientDisconnectedException e) {
            Logger.info("[request] client went away during " + exchange.getRequestURI().getPath());
        } catch (Exception e) {
            Logger.error("[request] unhandled error on " + exchange.getRequestURI().getPath(), e);
            if (exchange.getResponseCode() == -1) {
                HttpServerWrapper.sendError(exchange, 500, "api_error", "Internal Server Error");
            }
        } finally {
            exchange.close();
        }
    }
}
