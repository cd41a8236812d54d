package io.eventsource.client;

import io.eventsource.core.BufferLimits;
import io.eventsource.http.spi.HttpClientRequest;
import io.eventsource.http.spi.JdkHttpClientAdapter;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventSourceConfigTest {

    private static final URI STREAM = URI.create("http://localhost/events");

    @Test
    void defaults() {
        EventSourceConfig config = EventSourceConfig.builder().uri(STREAM).build();

        assertThat(config.request().method()).isEqualTo("GET");
        assertThat(config.request().uri()).isEqualTo(STREAM);
        assertThat(config.request().header("Accept")).contains("text/event-stream");
        assertThat(config.httpClient()).isInstanceOf(JdkHttpClientAdapter.class);
        assertThat(config.callback()).isNull();
        assertThat(config.cancellation()).isNull();
        assertThat(config.bufferLimits()).isEqualTo(BufferLimits.DEFAULTS);
        assertThat(config.retryDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.lastEventId()).isNull();
        assertThat(config.threadName()).isEqualTo("eventsource-worker");
    }

    @Test
    void partialBufferLimitsAreResolved() {
        EventSourceConfig config = EventSourceConfig.builder()
                .uri(STREAM)
                .bufferLimits(new BufferLimits(0, 0, 1024, 0))
                .build();

        assertThat(config.bufferLimits()).isEqualTo(new BufferLimits(256, 256, 1024, 1034));
    }

    @Test
    void requestPrototypeIsKeptAsIs() {
        HttpClientRequest prototype = HttpClientRequest.post(STREAM).header("X-Token", "t").build();

        EventSourceConfig config = EventSourceConfig.builder().request(prototype).build();

        assertThat(config.request()).isSameAs(prototype);
    }

    @Test
    void targetIsRequired() {
        assertThatThrownBy(() -> EventSourceConfig.builder().build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void uriAndRequestAreExclusive() {
        EventSourceConfig.Builder builder = EventSourceConfig.builder()
                .uri(STREAM)
                .request(HttpClientRequest.get(STREAM).build());

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void negativeRetryDelayIsRejected() {
        assertThatThrownBy(() -> EventSourceConfig.builder().retryDelay(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
