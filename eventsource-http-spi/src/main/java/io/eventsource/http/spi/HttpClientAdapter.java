package io.eventsource.http.spi;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>This interface allows the event source to work with different
 * HTTP client libraries (JDK HttpClient, OkHttp, etc.)
 * without direct dependency on any specific implementation.
 *
 * <p>Implementations should be thread-safe and reusable.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("http://example.com/events")).build();
 * try (HttpClientResponse response = adapter.sendStreaming(request)) {
 *     InputStream body = response.bodyAsStream();
 * }
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and returns the response with body as a stream.
     *
     * <p>The call returns once the status line and headers have arrived; the body is read
     * incrementally afterwards.
     *
     * <p>The caller is responsible for closing the returned response.
     *
     * @param request the HTTP request to send
     * @return the HTTP response with body as InputStream
     * @throws HttpClientException if the request fails
     */
    HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException;

    /**
     * Prepares a request whose wait for response headers can be cancelled from another thread.
     *
     * <p>The default cancels by interrupting the thread blocked in
     * {@link #sendStreaming(HttpClientRequest)}. Adapters over a client that ignores interrupts
     * must override this.
     *
     * @param request the HTTP request to send
     * @return a call that has not been executed yet
     */
    default HttpClientCall newCall(HttpClientRequest request) {
        return new InterruptibleCall(this, request);
    }
}
