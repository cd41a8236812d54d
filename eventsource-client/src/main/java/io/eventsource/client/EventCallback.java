package io.eventsource.client;

import io.eventsource.core.EventSourceException;
import io.eventsource.core.Message;

/**
 * Receives messages and errors from an {@link EventSource}.
 *
 * <p>Exactly one argument is non-null per call. The callback runs on the event source's worker
 * thread and should hand work off instead of blocking. A message is only valid until the callback
 * returns; use {@link Message#copy()} to keep it.
 */
@FunctionalInterface
public interface EventCallback {

    /**
     * @param message the received message, or {@code null} when reporting an error
     * @param error the error, or {@code null} when delivering a message
     */
    void onEvent(Message message, EventSourceException error);
}
