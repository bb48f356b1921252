import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;

/**
 * Drives one client request through the backends in priority order. Each attempt ends either
 * with the client answered or with a reason to try the next backend; when every backend has
 * failed or been skipped the client gets a 502.
 */
public class FailoverForwarder {

    // Hop-by-hop headers plus those the JDK client refuses to set.
    private static final Set<String> SKIPPED_REQUEST_HEADERS = Set.of(
        "authorization", "connection", "content-length", "date", "expect", "from", "host",
        "upgrade", "via", "warning", "keep-alive", "proxy-connection", "transfer-encoding",
        "te", "trailer", "http2-settings"
    );

    private static final Set<String> SKIPPED_RESPONSE_HEADERS = Set.of(
        "connection", "content-length", "date", "keep-alive", "proxy-connection",
        "transfer-encoding", "te", "trailer", "upgrade"
    );

    private final CircuitBreaker circuitBreaker;
    private final HttpClientWrapper clientWrapper;
    private final HttpProxy.RequestRouter router;
    private final Duration requestTimeout;

    public FailoverForwarder(CircuitBreaker circuitBreaker, HttpClientWrapper clientWrapper,
                             HttpProxy.RequestRouter router, Duration requestTimeout) {
        this.circuitBreaker = circuitBreaker;
        this.clientWrapper = clientWrapper;
        this.router = router;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Forwards a request whose body has already been read.
     *
     * @throws IOException if writing to the client fails
     */
    public void forward(HttpExchange exchange, byte[] body) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getRawPath();
        String rawQuery = exchange.getRequestURI().getRawQuery();

        List<BackendState> candidates = circuitBreaker.sortBackendsByPriority();
        Logger.info("[request] " + method + " " + path + " - " + candidates.size() + " backend(s) available");

        String lastFailure = null;
        String lastSkip = null;
        int attemptCount = 0;
        for (BackendState state : candidates) {
            CircuitBreaker.SkipDecision decision = circuitBreaker.admit(state);
            if (decision.skip()) {
                Logger.info("[skip] " + state.name() + " - " + decision.reason());
                lastSkip = state.name() + ": " + decision.reason();
                continue;
            }

            attemptCount++;
            AttemptOutcome outcome = attempt(exchange, state, method, path, rawQuery, body,
                attemptCount, decision.halfOpenTrial());
            if (outcome.responded()) {
                return;
            }
            lastFailure = state.name() + ": " + outcome.failure();
        }

        String message;
        if (lastFailure != null) {
            message = "All backends failed. Last error: " + lastFailure;
        } else if (lastSkip != null) {
            message = "No backend available. Last skip reason: " + lastSkip;
        } else {
            message = "No enabled backends configured";
        }
        Logger.error("[exhausted] " + method + " " + path + " - " + attemptCount + " attempt(s) - " + message);
        HttpServerWrapper.sendError(exchange, 502, "api_error", message);
    }

    private AttemptOutcome attempt(HttpExchange exchange, BackendState state, String method, String path,
                                   String rawQuery, byte[] body, int attemptNumber, boolean probe) throws IOException {
        Backend backend = state.backend();

        HttpProxy.ProxyTarget target;
        HttpRequest request;
        try {
            target = router.route(backend, path, rawQuery, body);
            request = buildUpstreamRequest(method, exchange.getRequestHeaders(), backend, target);
        } catch (ConversionException | IllegalArgumentException e) {
            String detail = "request preparation failed: " + e.getMessage();
            circuitBreaker.recordFailure(state, 0, detail);
            Logger.warning("[failure #" + attemptNumber + "] " + backend.name() + " - " + detail);
            return AttemptOutcome.retry(detail);
        }

        Logger.info("[attempt #" + attemptNumber + "] " + backend.name() + " - " + method + " " + target.uri()
            + " (token: " + Logger.maskToken(backend.token()) + ")"
            + (target.isStreaming() ? " [stream]" : " [timeout " + requestTimeout.toSeconds() + "s]")
            + (probe ? " [half-open probe]" : ""));

        HttpResponse<InputStream> response;
        try {
            response = target.isStreaming()
                ? clientWrapper.send(request)
                : clientWrapper.sendBuffered(request, requestTimeout);
        } catch (HttpTimeoutException e) {
            String detail = "timeout after " + requestTimeout.toSeconds() + "s";
            circuitBreaker.recordFailure(state, 0, detail);
            Logger.warning("[timeout #" + attemptNumber + "] " + backend.name() + " - " + detail);
            return AttemptOutcome.retry(detail);
        } catch (IOException e) {
            String detail = "connection error: " + describe(e);
            circuitBreaker.recordFailure(state, 0, detail);
            Logger.warning("[failure #" + attemptNumber + "] " + backend.name() + " - " + detail);
            return AttemptOutcome.retry(detail);
        } catch (InterruptedException e) {
            if (probe) {
                circuitBreaker.releaseHalfOpenTrial(state);
            }
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for " + backend.name());
        }

        int status = response.statusCode();
        ResponseClass responseClass = ResponseClass.of(status);
        if (responseClass == ResponseClass.SUCCESS) {
            circuitBreaker.recordSuccess(state);
            Logger.info("[success #" + attemptNumber + "] " + backend.name() + " - HTTP " + status);
            deliverSuccess(exchange, response, target, backend);
            return AttemptOutcome.delivered();
        }

        byte[] errorBody = BodyDecoder.readBody(response);
        Logger.warning("[error-detail] " + backend.name() + " - HTTP " + status + " - response: "
            + Logger.preview(new String(errorBody, StandardCharsets.UTF_8), Constants.ERROR_BODY_PREVIEW));

        switch (responseClass) {
            case RATE_LIMITED:
                circuitBreaker.record429(state, response.headers().firstValue("Retry-After").orElse(null));
                if (probe) {
                    circuitBreaker.releaseHalfOpenTrial(state);
                }
                return AttemptOutcome.retry("HTTP 429 (rate limited)");
            case SERVER_ERROR:
                circuitBreaker.recordFailure(state, status, "HTTP " + status);
                return AttemptOutcome.retry("HTTP " + status);
            default:
                if (probe) {
                    circuitBreaker.releaseHalfOpenTrial(state);
                }
                Logger.info("[return-client #" + attemptNumber + "] " + backend.name() + " - HTTP " + status
                    + (responseClass == ResponseClass.AUTH_ERROR ? " (credential error, not retried)" : " (client error, not retried)"));
                copyResponseHeaders(response.headers(), exchange.getResponseHeaders(), true);
                HttpServerWrapper.sendResponse(exchange, status, errorBody);
                return AttemptOutcome.delivered();
        }
    }

    /**
     * Builds the outbound request: client method, headers and the prepared body, re-signed with
     * the backend's credential. Only non-streaming requests carry a deadline.
     *
     * @throws IllegalArgumentException if a header or the method is rejected by the client
     */
    HttpRequest buildUpstreamRequest(String method, Headers clientHeaders, Backend backend, HttpProxy.ProxyTarget target) {
        HttpRequest.BodyPublisher publisher = target.body().length == 0
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(target.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder(target.uri()).method(method, publisher);
        for (Map.Entry<String, List<String>> header : clientHeaders.entrySet()) {
            String name = header.getKey();
            if (name == null || SKIPPED_REQUEST_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            for (String value : header.getValue()) {
                builder.header(name, value);
            }
        }
        builder.header("Authorization", "Bearer " + backend.token());

        if (!target.isStreaming()) {
            builder.timeout(requestTimeout);
        }
        return builder.build();
    }

    private void deliverSuccess(HttpExchange exchange, HttpResponse<InputStream> response,
                                HttpProxy.ProxyTarget target, Backend backend) throws IOException {
        int status = response.statusCode();
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        String contentEncoding = response.headers().firstValue("Content-Encoding").orElse(null);
        Headers out = exchange.getResponseHeaders();

        if (contentType.toLowerCase(Locale.ROOT).contains(Constants.CONTENT_TYPE_STREAM)) {
            if (target.convertResponse()) {
                InputStream decoded;
                try {
                    decoded = BodyDecoder.decodingStream(response.body(), contentEncoding);
                } catch (IOException e) {
                    response.body().close();
                    Logger.error("[convert] " + backend.name() + " - cannot decode event stream", e);
                    HttpServerWrapper.sendError(exchange, 500, "api_error", "Failed to decode upstream event stream");
                    return;
                }
                copyResponseHeaders(response.headers(), out, true);
                out.set("Content-Type", Constants.CONTENT_TYPE_STREAM);
                out.set("Cache-Control", "no-cache");
                Logger.info("[stream] " + backend.name() + " - converting chat completions stream");
                streamTo(exchange, status, backend, relay -> relay.relayTranslated(decoded, new OpenAiStreamTranslator(target.model())));
            } else {
                copyResponseHeaders(response.headers(), out, false);
                streamTo(exchange, status, backend, relay -> relay.relayVerbatim(response.body()));
            }
            return;
        }

        if (!target.convertResponse()) {
            copyResponseHeaders(response.headers(), out, false);
            HttpServerWrapper.sendResponse(exchange, status, BodyDecoder.readFully(response.body()));
            return;
        }

        byte[] decoded = BodyDecoder.readBody(response);
        byte[] converted;
        try {
            converted = ProtocolConverter.toAnthropicResponse(decoded);
        } catch (ConversionException e) {
            Logger.error("[convert] " + backend.name() + " - response conversion failed: " + e.getMessage()
                + " - body: " + Logger.preview(new String(decoded, StandardCharsets.UTF_8), Constants.ERROR_BODY_PREVIEW));
            HttpServerWrapper.sendError(exchange, 500, "api_error", "Failed to convert upstream response: " + e.getMessage());
            return;
        }
        Logger.info("[convert] " + backend.name() + " - response converted to messages format");
        copyResponseHeaders(response.headers(), out, true);
        out.set("Content-Type", Constants.CONTENT_TYPE_JSON);
        HttpServerWrapper.sendResponse(exchange, status, converted);
    }

    private interface RelayAction {
        void run(SseRelay relay) throws IOException;
    }

    private void streamTo(HttpExchange exchange, int status, Backend backend, RelayAction action) throws IOException {
        exchange.sendResponseHeaders(status, 0); // 0 means chunked encoding
        try (OutputStream output = exchange.getResponseBody()) {
            action.run(new SseRelay(SseSink.of(output), backend.name()));
        }
    }

    /**
     * Copies upstream response headers to the client, dropping hop-by-hop headers. When the
     * body has been decoded or rewritten, the upstream encoding no longer applies.
     */
    static void copyResponseHeaders(HttpHeaders upstream, Headers client, boolean bodyRewritten) {
        for (Map.Entry<String, List<String>> header : upstream.map().entrySet()) {
            String name = header.getKey();
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith(":") || SKIPPED_RESPONSE_HEADERS.contains(lower)) {
                continue;
            }
            if (bodyRewritten && lower.equals("content-encoding")) {
                continue;
            }
            client.put(name, new ArrayList<>(header.getValue()));
        }
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        return message != null ? e.getClass().getSimpleName() + ": " + message : e.getClass().getSimpleName();
    }
}
