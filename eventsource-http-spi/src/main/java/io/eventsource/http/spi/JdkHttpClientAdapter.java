package io.eventsource.http.spi;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link HttpClientAdapter} backed by {@code java.net.http.HttpClient}. This is the default
 * transport of an event source.
 *
 * <p>{@link HttpClient#send} is interruptible, so interrupting the calling thread abandons a request
 * that is still waiting for its response headers, and the default {@link #newCall} cancels that
 * way. The request timeout has the same scope: once the headers are in, the body may stay open
 * indefinitely.
 *
 * <p>Header values are handed to the JDK client as they are. It accepts characters up to
 * {@code U+00FF}, so octet values from {@link HttpClientRequest.Builder#header(String, byte[])}
 * pass validation; the JDK decides how it encodes the non-ASCII ones on the wire.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private final HttpClient httpClient;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates an adapter over a fresh client that follows same-protocol and downgrade-free redirects.
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    /**
     * @param httpClient the client to send through, shared with the caller
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create(HttpClient httpClient) {
        return new JdkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException {
        HttpRequest jdkRequest;
        try {
            jdkRequest = toJdkRequest(request);
        } catch (IllegalArgumentException e) {
            throw new HttpClientException("Invalid request " + describe(request), e);
        }
        try {
            return new StreamingResponse(httpClient.send(jdkRequest, HttpResponse.BodyHandlers.ofInputStream()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException("Request interrupted", e);
        } catch (IOException e) {
            throw new HttpClientException(describe(request) + " failed", e);
        }
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.BodyPublisher publisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .method(request.method(), publisher);
        request.headers().forEach(builder::header);
        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        return builder.build();
    }

    private static String describe(HttpClientRequest request) {
        return request.method() + " " + request.uri();
    }

    /**
     * Closing the body stream is the only way to release a JDK streaming exchange, and it also wakes
     * a reader blocked on it, so {@link #close()} and {@link #abort()} do the same thing once.
     */
    private static final class StreamingResponse implements HttpClientResponse {
        private final HttpResponse<InputStream> response;
        private final InputStream body;
        private final AtomicBoolean closed = new AtomicBoolean();

        StreamingResponse(HttpResponse<InputStream> response) {
            this.response = response;
            this.body = response.body();
        }

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }

        @Override
        public InputStream bodyAsStream() {
            return body;
        }

        @Override
        public void close() throws IOException {
            if (closed.compareAndSet(false, true) && body != null) {
                body.close();
            }
        }
    }
}
