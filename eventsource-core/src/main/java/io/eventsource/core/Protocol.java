package io.eventsource.core;

/**
 * Server-Sent Events protocol constants (field names, header names, and well-known values).
 *
 * <p>This module intentionally contains no HTTP client bindings.
 * It only models protocol-level concerns shared by the parser and the client.
 */
public final class Protocol {
    private Protocol() {}

    // Field names
    public static final String F_ID = "id";
    public static final String F_EVENT = "event";
    public static final String F_DATA = "data";
    public static final String F_RETRY = "retry";

    // HTTP headers
    public static final String H_LAST_EVENT_ID = "Last-Event-Id";
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_ACCEPT = "Accept";

    // Content types
    public static final String CT_EVENT_STREAM = "text/event-stream";

    /** The only response status that starts a stream. */
    public static final int STATUS_OK = 200;

    /** Default maximum size of the "id" field buffer. */
    public static final int DEFAULT_MAX_ID = 256;

    /** Default maximum size of the "event" field buffer. */
    public static final int DEFAULT_MAX_EVENT = 256;

    /** Default maximum size of the "data" field buffer. */
    public static final int DEFAULT_MAX_DATA = 4 * 1024 * 1024;

    /** Bytes a read buffer needs beyond the largest field value: {@code "event: \r\n"} plus one. */
    public static final int LINE_FRAMING_OVERHEAD = "event: \r\n".length() + 1;
}
