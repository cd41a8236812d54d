package io.eventsource.core;

import java.io.IOException;

/**
 * Thrown when a byte source keeps returning zero bytes without reaching end of stream.
 */
public class NoProgressException extends IOException {

    public NoProgressException(int attempts) {
        super("eventsource: " + attempts + " consecutive reads returned no data");
    }
}
