import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A wrapper around the shared {@link HttpClient} used for every upstream call.
 * The client has a connect timeout only. Non-streaming calls go through
 * {@link #sendBuffered}, which bounds headers and body together; streaming calls run unbounded.
 *
 * @see java.net.http.HttpClient
 */
public class HttpClientWrapper {

    // Completes only once the whole body has arrived; the body is then served from memory.
    private static final HttpResponse.BodyHandler<InputStream> BUFFERED = responseInfo ->
        HttpResponse.BodySubscribers.mapping(HttpResponse.BodySubscribers.ofByteArray(), ByteArrayInputStream::new);

    private final HttpClient httpClient;

    /**
     * Creates a new HTTP client wrapper.
     *
     * @param connectionTimeout Timeout for establishing backend connections
     */
    public HttpClientWrapper(Duration connectionTimeout) {
        this.httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(connectionTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    }

    /**
     * Sends a request and returns as soon as the response headers arrive. The body is left
     * unread; the caller must consume or close it.
     *
     * @throws IOException If the request fails or times out
     * @throws InterruptedException If the calling thread is interrupted
     */
    public HttpResponse<InputStream> send(HttpRequest request) throws IOException, InterruptedException {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
    }

    /**
     * Sends a request and waits for the complete response, headers and body, within one
     * deadline. The pending exchange is cancelled when the deadline passes.
     *
     * @throws HttpTimeoutException If the full response did not arrive within {@code deadline}
     * @throws IOException If the request fails
     * @throws InterruptedException If the calling thread is interrupted
     */
    public HttpResponse<InputStream> sendBuffered(HttpRequest request, Duration deadline) throws IOException, InterruptedException {
        CompletableFuture<HttpResponse<InputStream>> future = httpClient.sendAsync(request, BUFFERED);
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new HttpTimeoutException("response not complete within " + deadline.toSeconds() + "s");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("request failed: " + cause, cause);
        }
    }
}
