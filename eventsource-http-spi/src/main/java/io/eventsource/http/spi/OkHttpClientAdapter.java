package io.eventsource.http.spi;

import okhttp3.Call;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link HttpClientAdapter} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
 *
 * <p>A request timeout bounds connecting and writing the request only. An event stream may stay
 * quiet for a long time, so the read timeout is whatever the supplied client uses, and
 * {@link #create()} disables it.
 *
 * <p>OkHttp ignores interrupts, so calls are cancelled through {@link Call#cancel()}. It also writes
 * header values as UTF-8: a non-ASCII value made of octets that form valid UTF-8 is sent as exactly
 * those octets.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private static final byte[] EMPTY = new byte[0];
    // OkHttp rejects these without a body
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * @return an adapter over a new client without read timeout
     */
    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient.Builder()
                .readTimeout(Duration.ZERO)
                .build());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException {
        return newCall(request).execute();
    }

    @Override
    public HttpClientCall newCall(HttpClientRequest request) {
        return new PendingCall(request);
    }

    private OkHttpClient clientFor(HttpClientRequest request) {
        Duration timeout = request.timeout();
        if (timeout == null) {
            return httpClient;
        }
        return httpClient.newBuilder()
                .connectTimeout(timeout)
                .writeTimeout(timeout)
                .build();
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Headers.Builder headers = new Headers.Builder();
        request.headers().forEach((name, value) -> addHeader(headers, name, value));

        String method = request.method();
        RequestBody body = null;
        if (request.body() != null) {
            MediaType mediaType = request.header("Content-Type").map(MediaType::parse).orElse(null);
            body = RequestBody.create(request.body(), mediaType);
        } else if (BODY_METHODS.contains(method)) {
            body = RequestBody.create(EMPTY, null);
        }
        return new Request.Builder()
                .url(request.uri().toString())
                .headers(headers.build())
                .method(method, body)
                .build();
    }

    private static void addHeader(Headers.Builder headers, String name, String value) {
        boolean ascii = true;
        boolean octets = true;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if ((c < 0x20 && c != '\t') || c == 0x7f) {
                throw new IllegalArgumentException("Control character in header " + name);
            }
            ascii &= c < 0x80;
            octets &= c <= 0xff;
        }
        if (ascii) {
            headers.add(name, value);
        } else {
            headers.addUnsafeNonAscii(name, octets ? decodeUtf8Octets(value) : value);
        }
    }

    private static String decodeUtf8Octets(String value) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .decode(ByteBuffer.wrap(value.getBytes(StandardCharsets.ISO_8859_1)))
                    .toString();
        } catch (CharacterCodingException e) {
            // not UTF-8: these octets cannot go out unchanged, send the characters instead
            return value;
        }
    }

    private final class PendingCall implements HttpClientCall {
        private final HttpClientRequest request;
        private final Call call;
        private final IllegalArgumentException invalid;

        PendingCall(HttpClientRequest request) {
            this.request = request;
            Call created = null;
            IllegalArgumentException failure = null;
            try {
                created = clientFor(request).newCall(toOkHttpRequest(request));
            } catch (IllegalArgumentException e) {
                failure = e;
            }
            this.call = created;
            this.invalid = failure;
        }

        @Override
        public HttpClientResponse execute() throws HttpClientException {
            String target = request.method() + " " + request.uri();
            if (invalid != null) {
                throw new HttpClientException("Invalid request " + target, invalid);
            }
            try {
                return new StreamingResponse(call, call.execute());
            } catch (IOException e) {
                throw new HttpClientException(target + (call.isCanceled() ? " cancelled" : " failed"), e);
            }
        }

        @Override
        public void cancel() {
            if (call != null) {
                call.cancel();
            }
        }
    }

    /**
     * {@link #abort()} cancels the call, which fails a read blocked on the body from any thread.
     */
    private static final class StreamingResponse implements HttpClientResponse {
        private final Call call;
        private final Response response;

        StreamingResponse(Call call, Response response) {
            this.call = call;
            this.response = response;
        }

        @Override
        public int statusCode() {
            return response.code();
        }

        @Override
        public Optional<String> header(String name) {
            return Optional.ofNullable(response.header(name));
        }

        @Override
        public InputStream bodyAsStream() {
            ResponseBody body = response.body();
            return body != null ? body.byteStream() : null;
        }

        @Override
        public void close() {
            response.close();
        }

        @Override
        public void abort() {
            call.cancel();
        }
    }
}
