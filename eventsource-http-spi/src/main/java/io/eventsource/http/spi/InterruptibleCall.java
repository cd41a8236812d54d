package io.eventsource.http.spi;

import java.io.IOException;
import java.util.Objects;

/**
 * Cancels by interrupting the thread blocked in {@link HttpClientAdapter#sendStreaming}, for
 * adapters whose underlying client responds to interrupts. The interrupt is cleared again before
 * {@link #execute()} returns, so it never outlives the call.
 */
final class InterruptibleCall implements HttpClientCall {

    private final HttpClientAdapter adapter;
    private final HttpClientRequest request;
    private Thread caller;
    private boolean executed;
    private boolean cancelled;
    private boolean interrupted;

    InterruptibleCall(HttpClientAdapter adapter, HttpClientRequest request) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.request = Objects.requireNonNull(request, "request");
    }

    @Override
    public HttpClientResponse execute() throws HttpClientException {
        synchronized (this) {
            if (executed) {
                throw new IllegalStateException("Already executed");
            }
            executed = true;
            if (cancelled) {
                throw new HttpClientException("Request cancelled");
            }
            caller = Thread.currentThread();
        }

        HttpClientResponse response;
        try {
            response = adapter.sendStreaming(request);
        } catch (HttpClientException | RuntimeException e) {
            if (release()) {
                throw new HttpClientException("Request cancelled", e);
            }
            throw e;
        }
        if (release()) {
            HttpClientException failure = new HttpClientException("Request cancelled");
            try {
                response.close();
            } catch (IOException e) {
                failure.addSuppressed(e);
            }
            throw failure;
        }
        return response;
    }

    @Override
    public void cancel() {
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            if (caller != null) {
                interrupted = true;
                caller.interrupt();
            }
        }
    }

    /**
     * @return true if the call was cancelled while executing
     */
    private boolean release() {
        boolean clearInterrupt;
        boolean wasCancelled;
        synchronized (this) {
            caller = null;
            clearInterrupt = interrupted;
            wasCancelled = cancelled;
        }
        if (clearInterrupt) {
            Thread.interrupted();
        }
        return wasCancelled;
    }
}
