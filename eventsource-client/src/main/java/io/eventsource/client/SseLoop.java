package io.eventsource.client;

import io.eventsource.core.BufferLimits;
import io.eventsource.core.EventSourceException;
import io.eventsource.core.Line;
import io.eventsource.core.LineReader;
import io.eventsource.core.MediaTypes;
import io.eventsource.core.Message;
import io.eventsource.core.MessageAssembler;
import io.eventsource.core.Protocol;
import io.eventsource.http.spi.HttpClientCall;
import io.eventsource.http.spi.HttpClientException;
import io.eventsource.http.spi.HttpClientRequest;
import io.eventsource.http.spi.HttpClientResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Optional;

/**
 * Internal implementation of the connect, stream and reconnect cycle.
 *
 * <p>This class is not intended to be used directly by clients; {@link EventSource} runs one
 * instance on its worker thread.
 *
 * <p>Every failure except cancellation is reported to the callback and followed by a reconnect
 * after the current retry delay. A clean end of stream reconnects without reporting anything.
 */
public final class SseLoop implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(SseLoop.class);

    static final int MAX_DRAIN_BYTES = 64 * 1024;

    /**
     * Where the loop currently is.
     */
    public enum State {
        CONNECTING,
        STREAMING,
        BACKING_OFF,
        /** Terminal: the worker has exited or is about to. */
        STOPPED
    }

    private final EventSourceConfig config;
    private final CancellationToken token;
    private final SessionState session;
    private final BufferLimits limits;
    private final MessageAssembler assembler;
    private final MessageAssembler.Handler handler = new Dispatcher();

    SseLoop(EventSourceConfig config, CancellationToken token, SessionState session) {
        this.config = config;
        this.token = token;
        this.session = session;
        this.limits = config.bufferLimits();
        this.assembler = new MessageAssembler(limits);
    }

    @Override
    public void run() {
        log.info("event source started for {}", config.request().uri());
        try {
            while (connectAndStream() && backOff()) {
                // next attempt
            }
        } catch (RuntimeException e) {
            log.error("event source stopped by unexpected failure", e);
        } finally {
            assembler.reset();
            session.state(State.STOPPED);
            log.info("event source stopped for {}", config.request().uri());
        }
    }

    /**
     * Runs one connection attempt to completion.
     *
     * @return true to reconnect, false to stop
     */
    boolean connectAndStream() {
        session.state(State.CONNECTING);
        if (token.isCancelled()) {
            return false;
        }

        HttpClientRequest request = nextRequest();
        log.debug("connecting to {} (last event id {})", request.uri(), session.lastEventId());

        HttpClientResponse response;
        try {
            response = execute(request);
        } catch (HttpClientException | RuntimeException e) {
            if (token.isCancelled()) {
                return false;
            }
            dispatch(null, new EventSourceException.Transport(e));
            return true;
        }

        try (CancellationToken.Registration ignored = token.onCancel(response::abort)) {
            return consume(response);
        } finally {
            closeQuietly(response);
        }
    }

    private HttpClientResponse execute(HttpClientRequest request) throws HttpClientException {
        HttpClientCall call = config.httpClient().newCall(request);
        try (CancellationToken.Registration ignored = token.onCancel(call::cancel)) {
            return call.execute();
        }
    }

        private boolean consume(HttpClientResponse response) {
        if (response.statusCode() != Protocol.STATUS_OK) {
            dispatch(null, new EventSourceException.InvalidStatus(response.statusCode()));
            drain(response);
            return true;
        }
        Optional<String> contentType = response.header(Protocol.H_CONTENT_TYPE);
        if (!MediaTypes.isEventStream(contentType)) {
            dispatch(null, new EventSourceException.InvalidContentType(contentType.orElse(null)));
            drain(response);
            return true;
        }

        InputStream body = response.bodyAsStream();
        if (body == null) {
            body = InputStream.nullInputStream();
        }
        assembler.reset();
        session.state(State.STREAMING);
        return stream(new LineReader(body, limits.maxReadBuffer()));
    }

    private boolean stream(LineReader reader) {
        while (!token.isCancelled()) {
            Line line = reader.readLine();
            switch (line.status()) {
                case TERMINATED -> assembler.accept(line, handler);
                case END_OF_STREAM -> {
                    if (!token.isCancelled()) {
                        log.debug("stream ended, reconnecting");
                    }
                    return !token.isCancelled();
                }
                case BUFFER_FULL -> {
                    if (token.isCancelled()) {
                        return false;
                    }
                    dispatch(null, new EventSourceException.LineTooLong(limits.maxReadBuffer()));
                    return true;
                }
                case FAILED -> {
                    if (token.isCancelled()) {
                        return false;
                    }
                    dispatch(null, new EventSourceException.BodyRead(line.failure()));
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Waits out the retry delay.
     *
     * @return true to reconnect, false if cancelled while waiting
     */
    boolean backOff() {
        session.state(State.BACKING_OFF);
        Duration delay = session.retryDelay();
        log.debug("reconnecting in {} ms", delay.toMillis());
        try {
            return !token.await(delay);
        } catch (InterruptedException e) {
            // our own thread: an interrupt means stop
            Thread.currentThread().interrupt();
            token.cancel();
            return false;
        }
    }

    HttpClientRequest nextRequest() {
        HttpClientRequest.Builder builder = config.request().toBuilder();
        byte[] lastEventId = session.lastEventIdBytes();
        if (lastEventId != null && lastEventId.length > 0) {
            if (isFieldValue(lastEventId)) {
                builder.header(Protocol.H_LAST_EVENT_ID, lastEventId);
            } else {
                log.debug("last event id contains control characters, not sending it");
            }
        }
        return builder.build();
    }

    // HTTP field values may hold any octet except controls other than HTAB
    private static boolean isFieldValue(byte[] value) {
        for (byte b : value) {
            int c = b & 0xff;
            if ((c < 0x20 && c != '\t') || c == 0x7f) {
                return false;
            }
        }
        return true;
    }

    /**
     * Reads what is left of a rejected response, up to {@value #MAX_DRAIN_BYTES} bytes, so the
     * connection can go back to the client's pool.
     */
    private static void drain(HttpClientResponse response) {
        InputStream body = response.bodyAsStream();
        if (body == null) {
            return;
        }
        byte[] buf = new byte[8192];
        int left = MAX_DRAIN_BYTES;
        try {
            int n;
            while (left > 0 && (n = body.read(buf, 0, Math.min(buf.length, left))) > 0) {
                left -= n;
            }
        } catch (IOException e) {
            log.debug("failed to drain rejected response", e);
        }
    }

    private void dispatch(Message message, EventSourceException error) {
        if (error != null) {
            log.warn("{}", error.getMessage());
        }
        EventCallback callback = config.callback();
        if (callback == null || token.isCancelled()) {
            return;
        }
        try {
            callback.onEvent(message, error);
        } catch (RuntimeException e) {
            log.warn("event callback failed", e);
        }
    }

    private static void closeQuietly(HttpClientResponse response) {
        try {
            response.close();
        } catch (IOException e) {
            log.debug("failed to close response", e);
        }
    }

    private final class Dispatcher implements MessageAssembler.Handler {
        @Override
        public void onMessage(Message message) {
            ByteBuffer id = message.id();
            if (id != null && id.hasRemaining()) {
                byte[] copy = new byte[id.remaining()];
                id.get(copy);
                session.lastEventId(copy);
            }
            dispatch(message, null);
        }

        @Override
        public void onError(EventSourceException error) {
            dispatch(null, error);
        }

        @Override
        public void onRetry(long millis) {
            log.debug("server set retry delay to {} ms", millis);
            session.retryDelay(Duration.ofMillis(millis));
        }
    }
}
