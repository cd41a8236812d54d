package io.eventsource.http.spi;

import okhttp3.mockwebserver.MockResponse;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OkHttpClientAdapterTest extends AdapterContractTest {

    @Override
    protected HttpClientAdapter createAdapter() {
        return OkHttpClientAdapter.create();
    }

    @Test
    void utf8OctetHeaderGoesOutUnchanged() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(""));

        HttpClientRequest request = HttpClientRequest.get(server.url("/").uri())
                .header("Last-Event-Id", "\u4e8b\u4ef6-1".getBytes(StandardCharsets.UTF_8))
                .build();
        adapter.sendStreaming(request).close();

        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getHeader("Last-Event-Id")).isEqualTo("\u4e8b\u4ef6-1");
    }
}
