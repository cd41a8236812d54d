package io.eventsource.http.spi;

/**
 * A request that has been prepared but not necessarily sent. Splitting preparation from execution
 * gives another thread a handle to {@link #cancel()} while {@link #execute()} is still waiting for
 * the response headers.
 *
 * <p>A call executes at most once.
 */
public interface HttpClientCall {

    /**
     * Sends the request and blocks until the status line and headers have arrived.
     *
     * @return the response, with the body still to be read
     * @throws HttpClientException if the request fails or the call was cancelled
     * @throws IllegalStateException if the call was already executed
     */
    HttpClientResponse execute() throws HttpClientException;

    /**
     * Cancels the call from any thread. A pending {@link #execute()} fails promptly, a later one
     * fails immediately. Has no effect once {@code execute} has returned a response; use
     * {@link HttpClientResponse#abort()} for that.
     */
    void cancel();
}
