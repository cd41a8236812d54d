package io.eventsource.http.spi;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpClientRequestTest {

    private static final URI URI_ = URI.create("http://localhost/events");

    @Test
    void toBuilderClonesWithoutTouchingPrototype() {
        HttpClientRequest prototype = HttpClientRequest.post(URI_)
                .header("Authorization", "Bearer t")
                .body("{}".getBytes(StandardCharsets.UTF_8))
                .timeout(Duration.ofSeconds(5))
                .build();

        HttpClientRequest attempt = prototype.toBuilder()
                .header("Last-Event-Id", "42")
                .build();

        assertThat(attempt.method()).isEqualTo("POST");
        assertThat(attempt.uri()).isEqualTo(URI_);
        assertThat(attempt.body()).isEqualTo("{}".getBytes(StandardCharsets.UTF_8));
        assertThat(attempt.timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(attempt.headers()).containsEntry("Authorization", "Bearer t").containsEntry("Last-Event-Id", "42");
        assertThat(prototype.headers()).doesNotContainKey("Last-Event-Id");
    }

    @Test
    void headerReplacesAnyLetterCase() {
        HttpClientRequest request = HttpClientRequest.get(URI_)
                .header("last-event-id", "1")
                .header("Last-Event-Id", "2")
                .build();

        assertThat(request.headers()).hasSize(1).containsEntry("Last-Event-Id", "2");
        assertThat(request.header("LAST-EVENT-ID")).contains("2");
    }

    @Test
    void headersAreImmutable() {
        HttpClientRequest request = HttpClientRequest.get(URI_).header("A", "b").build();

        assertThatThrownBy(() -> request.headers().put("C", "d"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void missingHeaderIsEmpty() {
        assertThat(HttpClientRequest.get(URI_).build().header("Accept")).isEmpty();
    }

    @Test
    void octetHeaderKeepsOneCharacterPerByte() {
        HttpClientRequest request = HttpClientRequest.get(URI_)
                .header("Last-Event-Id", new byte[] {'a', (byte) 0xc3, (byte) 0xa9, (byte) 0xff})
                .build();

        assertThat(request.header("last-event-id")).contains("a\u00c3\u00a9\u00ff");
    }
}
