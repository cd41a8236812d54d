package io.eventsource.http.spi;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Represents a streaming HTTP response from an {@link HttpClientAdapter}.
 */
public interface HttpClientResponse extends Closeable {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * Returns the response body as an input stream.
     * @return the body stream, or null if the response has no body
     */
    InputStream bodyAsStream();

    /**
     * Releases the connection. Called by the thread that reads the body.
     */
    @Override
    void close() throws IOException;

    /**
     * Tears the exchange down from another thread, so that a read blocked on
     * {@link #bodyAsStream()} returns or fails promptly.
     *
     * <p>The default closes the response.
     *
     * @throws UncheckedIOException if closing fails
     */
    default void abort() {
        try {
            close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
