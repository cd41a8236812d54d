package io.eventsource.client;

import io.eventsource.core.BufferLimits;
import io.eventsource.core.Protocol;
import io.eventsource.http.spi.HttpClientAdapter;
import io.eventsource.http.spi.HttpClientRequest;
import io.eventsource.http.spi.JdkHttpClientAdapter;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings for an {@link EventSource}.
 *
 * <p>Only the target is required. Every other setting has a default:
 * <ul>
 *   <li>{@code httpClient}: {@link JdkHttpClientAdapter#create()}</li>
 *   <li>{@code callback}: none, every dispatch is dropped</li>
 *   <li>{@code cancellation}: none, only {@link EventSource#close()} stops the source</li>
 *   <li>{@code bufferLimits}: {@link BufferLimits#DEFAULTS}</li>
 *   <li>{@code retryDelay}: {@value #DEFAULT_RETRY_DELAY_MILLIS} ms, until the stream sends {@code retry}</li>
 *   <li>{@code lastEventId}: none</li>
 *   <li>{@code threadName}: {@value #DEFAULT_THREAD_NAME}</li>
 * </ul>
 */
public final class EventSourceConfig {

    public static final long DEFAULT_RETRY_DELAY_MILLIS = 1000;
    public static final String DEFAULT_THREAD_NAME = "eventsource-worker";

    private final HttpClientRequest request;
    private final HttpClientAdapter httpClient;
    private final EventCallback callback;
    private final CancellationToken cancellation;
    private final BufferLimits bufferLimits;
    private final Duration retryDelay;
    private final String lastEventId;
    private final String threadName;

    private EventSourceConfig(Builder b) {
        this.request = b.request != null ? b.request : defaultRequest(b.uri);
        this.httpClient = b.httpClient != null ? b.httpClient : JdkHttpClientAdapter.create();
        this.callback = b.callback;
        this.cancellation = b.cancellation;
        this.bufferLimits = (b.bufferLimits != null ? b.bufferLimits : BufferLimits.DEFAULTS).resolve();
        this.retryDelay = b.retryDelay != null ? b.retryDelay : Duration.ofMillis(DEFAULT_RETRY_DELAY_MILLIS);
        this.lastEventId = b.lastEventId;
        this.threadName = b.threadName != null ? b.threadName : DEFAULT_THREAD_NAME;
    }

    private static HttpClientRequest defaultRequest(URI uri) {
        return HttpClientRequest.get(uri)
                .header(Protocol.H_ACCEPT, Protocol.CT_EVENT_STREAM)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return the request prototype, cloned for every connection attempt */
    public HttpClientRequest request() { return request; }
    public HttpClientAdapter httpClient() { return httpClient; }
    /** @return the callback, or {@code null} */
    public EventCallback callback() { return callback; }
    /** @return the parent cancellation token, or {@code null} */
    public CancellationToken cancellation() { return cancellation; }
    /** @return the buffer limits with defaults applied */
    public BufferLimits bufferLimits() { return bufferLimits; }
    public Duration retryDelay() { return retryDelay; }
    /** @return the initial resumption id, or {@code null} */
    public String lastEventId() { return lastEventId; }
    public String threadName() { return threadName; }

    public static final class Builder {
        private URI uri;
        private HttpClientRequest request;
        private HttpClientAdapter httpClient;
        private EventCallback callback;
        private CancellationToken cancellation;
        private BufferLimits bufferLimits;
        private Duration retryDelay;
        private String lastEventId;
        private String threadName;

        private Builder() {}

        /**
         * Streams from {@code uri} with a plain {@code GET}.
         */
        public Builder uri(URI uri) {
            this.uri = Objects.requireNonNull(uri, "uri");
            return this;
        }

        public Builder uri(String uri) {
            return uri(URI.create(uri));
        }

        /**
         * Streams with a caller-built request. Each connection attempt sends a copy of it,
         * plus {@code Last-Event-Id} once an id has been seen.
         */
        public Builder request(HttpClientRequest request) {
            this.request = Objects.requireNonNull(request, "request");
            return this;
        }

        public Builder httpClient(HttpClientAdapter httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
            return this;
        }

        public Builder callback(EventCallback callback) {
            this.callback = callback;
            return this;
        }

        public Builder cancellation(CancellationToken cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public Builder bufferLimits(BufferLimits bufferLimits) {
            this.bufferLimits = bufferLimits;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            Objects.requireNonNull(retryDelay, "retryDelay");
            if (retryDelay.isNegative()) {
                throw new IllegalArgumentException("retryDelay must not be negative: " + retryDelay);
            }
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder lastEventId(String lastEventId) {
            this.lastEventId = lastEventId;
            return this;
        }

        public Builder threadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        /**
         * @throws IllegalStateException unless exactly one of {@code uri} and {@code request} is set
         */
        public EventSourceConfig build() {
            if (uri == null && request == null) {
                throw new IllegalStateException("either uri or request is required");
            }
            if (uri != null && request != null) {
                throw new IllegalStateException("uri and request are mutually exclusive");
            }
            return new EventSourceConfig(this);
        }
    }
}
