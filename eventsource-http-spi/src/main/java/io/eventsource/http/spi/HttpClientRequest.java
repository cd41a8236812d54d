package io.eventsource.http.spi;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Represents an HTTP request to be sent by an {@link HttpClientAdapter}.
 * This is an immutable value type with a fluent builder API.
 *
 * <p>Because it is immutable, a request can serve as a prototype: {@link #toBuilder()} clones it
 * so each attempt can add its own headers.
 *
 * <p>Header values travel as strings. A value set from raw bytes with
 * {@link Builder#header(String, byte[])} holds one ISO-8859-1 character per byte, which is how
 * HTTP/1.1 treats field values; adapters turn such values back into the same octets where their
 * client allows it.
 */
public final class HttpClientRequest {

    private final URI uri;
    private final String method;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Duration timeout;

    private HttpClientRequest(URI uri, String method, Map<String, String> headers, byte[] body, Duration timeout) {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.method = Objects.requireNonNull(method, "method");
        this.headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
        this.timeout = timeout;
    }

    public URI uri() { return uri; }
    public String method() { return method; }
    public Map<String, String> headers() { return headers; }
    public byte[] body() { return body; }
    public Duration timeout() { return timeout; }

    /**
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    public Optional<String> header(String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return Optional.ofNullable(e.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * @return a builder pre-populated with this request
     */
    public Builder toBuilder() {
        Builder b = new Builder(uri, method);
        b.headers(headers);
        b.body = body;
        b.timeout = timeout;
        return b;
    }

    public static Builder builder(URI uri, String method) {
        return new Builder(uri, method);
    }

    public static Builder get(URI uri) { return new Builder(uri, "GET"); }
    public static Builder post(URI uri) { return new Builder(uri, "POST"); }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private Map<String, String> headers;
        private byte[] body;
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = uri;
            this.method = method;
        }

        /**
         * Sets a header, replacing any value stored under the same name in any letter case.
         */
        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            if (headers == null) headers = new LinkedHashMap<>();
            headers.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
            headers.put(name, value);
            return this;
        }

        /**
         * Sets a header from raw octets, for values that are not necessarily text, such as an
         * event id echoed back to the server.
         */
        public Builder header(String name, byte[] value) {
            Objects.requireNonNull(value, "value");
            return header(name, new String(value, StandardCharsets.ISO_8859_1));
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(uri, method, headers, body, timeout);
        }
    }
}
