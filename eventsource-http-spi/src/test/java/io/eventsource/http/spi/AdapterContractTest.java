package io.eventsource.http.spi;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behaviour every adapter must share; subclasses supply the adapter.
 */
abstract class AdapterContractTest {

    protected MockWebServer server;
    protected HttpClientAdapter adapter;

    protected abstract HttpClientAdapter createAdapter();

    protected static URI unusedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return URI.create("http://127.0.0.1:" + socket.getLocalPort() + "/");
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        adapter = createAdapter();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void streamsBodyAndExposesHeaders() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "text/event-stream")
                .setBody("data: hello\n\n"));

        HttpClientRequest request = HttpClientRequest.get(server.url("/events").uri())
                .header("Last-Event-Id", "7")
                .build();

        try (HttpClientResponse response = adapter.sendStreaming(request)) {
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.header("content-type")).contains("text/event-stream");
            assertThat(new String(response.bodyAsStream().readAllBytes(), StandardCharsets.UTF_8))
                    .isEqualTo("data: hello\n\n");
        }

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getHeader("Last-Event-Id")).isEqualTo("7");
    }

    @Test
    void sendsPostBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(""));

        HttpClientRequest request = HttpClientRequest.post(server.url("/events").uri())
                .header("Content-Type", "application/json")
                .body("{\"a\":1}".getBytes(StandardCharsets.UTF_8))
                .build();

        try (HttpClientResponse response = adapter.sendStreaming(request)) {
            assertThat(response.statusCode()).isEqualTo(200);
        }

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"a\":1}");
    }

    @Test
    void reportsNonSuccessStatus() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));

        try (HttpClientResponse response = adapter.sendStreaming(HttpClientRequest.get(server.url("/").uri()).build())) {
            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(response.header("Content-Type")).isEmpty();
        }
    }

    @Test
    void abortUnblocksPendingRead() throws Exception {
        // the body trickles in far slower than the test runs, so the reader is blocked when aborted
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "text/event-stream")
                .setBody("data: first\n\n" + ": padding\n".repeat(1000))
                .throttleBody(13, 500, TimeUnit.MILLISECONDS));

        HttpClientResponse response = adapter.sendStreaming(HttpClientRequest.get(server.url("/").uri()).build());
        InputStream body = response.bodyAsStream();

        CompletableFuture<Void> reader = CompletableFuture.runAsync(() -> {
            byte[] buf = new byte[256];
            try {
                while (body.read(buf) >= 0) {
                    // keep reading until the stream ends or fails
                }
            } catch (Exception expected) {
                // aborted
            }
        });

        Thread.sleep(100);
        response.abort();

        reader.get(5, TimeUnit.SECONDS);
        assertThat(reader).isDone();
    }

    @Test
    void cancelAbortsCallWaitingForHeaders() throws Exception {
        // never answered
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        HttpClientCall call = adapter.newCall(HttpClientRequest.get(server.url("/").uri()).build());

        CompletableFuture<Throwable> outcome = new CompletableFuture<>();
        AtomicBoolean interruptLeft = new AtomicBoolean();
        Thread caller = new Thread(() -> {
            try {
                call.execute().close();
                outcome.complete(null);
            } catch (Throwable t) {
                interruptLeft.set(Thread.currentThread().isInterrupted());
                outcome.complete(t);
            }
        });
        caller.start();
        assertThat(server.takeRequest(5, TimeUnit.SECONDS)).isNotNull();
        Thread.sleep(100);
        call.cancel();

        assertThat(outcome.get(5, TimeUnit.SECONDS)).isInstanceOf(HttpClientException.class);
        assertThat(interruptLeft).isFalse();
    }

    @Test
    void cancelledCallFailsWithoutSending() throws Exception {
        HttpClientCall call = adapter.newCall(HttpClientRequest.get(server.url("/").uri()).build());
        call.cancel();

        assertThatThrownBy(call::execute).isInstanceOf(HttpClientException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void acceptsNonAsciiOctetHeader() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(""));

        HttpClientRequest request = HttpClientRequest.get(server.url("/").uri())
                .header("Last-Event-Id", "\u00e9v-1".getBytes(StandardCharsets.UTF_8))
                .build();

        try (HttpClientResponse response = adapter.sendStreaming(request)) {
            assertThat(response.statusCode()).isEqualTo(200);
        }

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getHeader("Last-Event-Id")).isNotNull().endsWith("v-1");
    }

    @Test
    void controlCharacterInHeaderIsRejected() {
        HttpClientRequest request = HttpClientRequest.get(server.url("/").uri())
                .header("X-Bad", "a\u0001b")
                .build();

        assertThatThrownBy(() -> adapter.sendStreaming(request)).isInstanceOf(HttpClientException.class);
    }

    @Test
    void connectionFailureIsWrapped() throws Exception {
        URI closed = unusedPort();

        assertThatThrownBy(() -> adapter.sendStreaming(HttpClientRequest.get(closed).build()))
                .isInstanceOf(HttpClientException.class);
    }
}
