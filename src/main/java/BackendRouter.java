import java.net.URI;

/**
 * Prepares one attempt against one backend: resolves the target URL, applies the backend's
 * model override, converts the body for foreign backends and detects streaming.
 */
public class BackendRouter implements HttpProxy.RequestRouter {

    @Override
    public HttpProxy.ProxyTarget route(Backend backend, String path, String rawQuery, byte[] body) throws ConversionException {
        boolean convert = backend.requiresConversion()
            && path.endsWith(Constants.MESSAGES_ENDPOINT)
            && body.length > 0;

        String targetPath = path;
        if (convert) {
            targetPath = path.substring(0, path.length() - Constants.MESSAGES_ENDPOINT.length())
                + Constants.CHAT_COMPLETIONS_ENDPOINT;
            Logger.info("[path-rewrite] " + backend.name() + " - " + Constants.MESSAGES_ENDPOINT
                + " -> " + Constants.CHAT_COMPLETIONS_ENDPOINT);
        }
        URI targetUri = resolveUri(backend.baseUrl(), targetPath, rawQuery);

        byte[] transformedBody = body;
        if (backend.hasModelOverride() && body.length > 0) {
            transformedBody = JsonTransform.overrideModel(body, backend.model());
            Logger.info("[model-override] " + backend.name() + " - using configured model: " + backend.model());
        }

        if (convert) {
            transformedBody = ProtocolConverter.toOpenAiRequest(transformedBody);
            Logger.info("[convert] " + backend.name() + " - request converted to chat completions format");
        }
        logRequestPayloadIfDebug(transformedBody);

        JsonTransform.RequestProbe probe = JsonTransform.probe(transformedBody);
        return new HttpProxy.ProxyTarget(targetUri, transformedBody, probe.isStreaming(), convert, probe.model());
    }

    /**
     * Appends the client path and query to the base URL, keeping any path prefix the base
     * URL carries.
     *
     * @throws IllegalArgumentException if the base URL or the resulting URL is malformed
     */
    static URI resolveUri(String baseUrl, String path, String rawQuery) {
        URI base = URI.create(baseUrl);
        if (base.getScheme() == null || base.getRawAuthority() == null) {
            throw new IllegalArgumentException("base_url is not absolute: " + baseUrl);
        }

        String basePath = base.getRawPath() != null ? base.getRawPath() : "";
        while (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }
        String suffix = path.startsWith("/") ? path : "/" + path;

        StringBuilder url = new StringBuilder()
            .append(base.getScheme()).append("://").append(base.getRawAuthority())
            .append(basePath).append(suffix);
        if (rawQuery != null && !rawQuery.isEmpty()) {
            url.append('?').append(rawQuery);
        }
        return URI.create(url.toString());
    }

    private void logRequestPayloadIfDebug(byte[] requestBody) {
        if (Constants.DEBUG_REQUEST && requestBody != null && requestBody.length > 0) {
            Logger.info("Sending JSON:\n" + JsonTransform.prettyPrint(requestBody) + "\n---");
        }
    }
}
