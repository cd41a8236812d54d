package io.eventsource.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * A Server-Sent Events client that keeps one stream open on a background thread.
 *
 * <p>The worker connects as soon as the source is opened, hands every message and error to the
 * configured {@link EventCallback}, and reconnects after any failure, sending
 * {@code Last-Event-Id} so the server can resume. It never gives up on its own: only
 * {@link #close()} or the configured {@link CancellationToken} stops it.
 *
 * <pre>{@code
 * try (EventSource source = EventSource.open(EventSourceConfig.builder()
 *         .uri("https://example.com/events")
 *         .callback((message, error) -> {
 *             if (message != null) queue.add(message.copy());
 *         })
 *         .build())) {
 *     ...
 * }
 * }</pre>
 */
public final class EventSource implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(EventSource.class);

    private final CancellationToken token;
    private final SessionState session;
    private final Thread worker;

    private EventSource(EventSourceConfig config) {
        this.token = config.cancellation() != null ? config.cancellation().child() : CancellationToken.create();
        this.session = new SessionState(config.lastEventId(), config.retryDelay());
        this.worker = new Thread(new SseLoop(config, token, session), config.threadName());
        this.worker.setDaemon(true);
    }

    /**
     * Starts streaming.
     *
     * @param config the settings
     * @return a running event source
     */
    public static EventSource open(EventSourceConfig config) {
        EventSource source = new EventSource(Objects.requireNonNull(config, "config"));
        source.worker.start();
        return source;
    }

    /**
     * Starts streaming from {@code uri} with default settings.
     */
    public static EventSource open(URI uri, EventCallback callback) {
        return open(EventSourceConfig.builder().uri(uri).callback(callback).build());
    }

    /**
     * Stops the source and waits for the worker to exit. Once this returns the callback will not be
     * invoked again.
     *
     * <p>Idempotent. When called from inside the callback it only signals the worker, which
     * exits once the callback returns.
     */
    @Override
    public void close() {
        if (token.cancel()) {
            log.debug("closing event source");
        }
        if (Thread.currentThread() == worker) {
            return;
        }
        boolean interrupted = false;
        while (true) {
            try {
                worker.join();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Waits for the worker to exit without stopping it.
     *
     * @return true if the worker has exited
     * @throws InterruptedException if the calling thread is interrupted
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        worker.join(Math.max(1, timeout.toMillis()));
        return !worker.isAlive();
    }

    /**
     * @return true once {@link #close()} was called or the parent token was cancelled
     */
    public boolean isClosed() {
        return token.isCancelled();
    }

    public SseLoop.State state() {
        return session.state();
    }

    /**
     * @return the id that the next connection attempt will send, decoded as UTF-8, or {@code null}
     */
    public String lastEventId() {
        return session.lastEventId();
    }

    /**
     * @return the delay before the next reconnect, as last set by configuration or the server
     */
    public Duration retryDelay() {
        return session.retryDelay();
    }
}
