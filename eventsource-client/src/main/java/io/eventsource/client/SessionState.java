package io.eventsource.client;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * State that survives reconnects for the lifetime of one event source.
 *
 * <p>Written by the worker thread only; fields are volatile so other threads can observe them.
 * The last event id is kept as the raw bytes the server sent, since it goes back to the server as
 * a header and need not be valid UTF-8.
 */
final class SessionState {
    private volatile byte[] lastEventId;
    private volatile Duration retryDelay;
    private volatile SseLoop.State state = SseLoop.State.CONNECTING;

    SessionState(String lastEventId, Duration retryDelay) {
        this.lastEventId = lastEventId != null ? lastEventId.getBytes(StandardCharsets.UTF_8) : null;
        this.retryDelay = retryDelay;
    }

    /**
     * @return the last event id decoded as UTF-8, or {@code null}
     */
    String lastEventId() {
        byte[] id = lastEventId;
        return id != null ? new String(id, StandardCharsets.UTF_8) : null;
    }

    /**
     * @return the last event id as received; callers must not modify it
     */
    byte[] lastEventIdBytes() {
        return lastEventId;
    }

    void lastEventId(byte[] lastEventId) {
        this.lastEventId = lastEventId;
    }

    Duration retryDelay() {
        return retryDelay;
    }

    void retryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    SseLoop.State state() {
        return state;
    }

    void state(SseLoop.State state) {
        this.state = state;
    }
}
