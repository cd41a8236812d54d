package io.eventsource.http.spi;

/**
 * A request did not produce a response. The causes an adapter reports this way:
 * <ul>
 *   <li>the request could not be built for the underlying client, for example because a header
 *       value contains a control character;</li>
 *   <li>the exchange failed before the response headers arrived: connection refused, TLS failure,
 *       timeout, reset;</li>
 *   <li>the call was cancelled or the sending thread was interrupted.</li>
 * </ul>
 * Failures while reading the body surface as {@link java.io.IOException} from the body stream
 * instead. The underlying client's exception is kept as the cause.
 */
public class HttpClientException extends Exception {

    public HttpClientException(String message) {
        super(message);
    }

    public HttpClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public HttpClientException(Throwable cause) {
        super(cause);
    }
}
