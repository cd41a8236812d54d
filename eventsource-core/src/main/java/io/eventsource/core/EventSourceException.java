package io.eventsource.core;

/**
 * Base class for every error an event source reports to its callback.
 *
 * <p>Each subclass names one failure class. Callers tell them apart with {@code instanceof};
 * the original cause is preserved when there is one.
 */
public abstract class EventSourceException extends RuntimeException {

    protected EventSourceException(String message) {
        super(message);
    }

    protected EventSourceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the HTTP response status is not 200.
     */
    public static class InvalidStatus extends EventSourceException {
        private final int status;

        public InvalidStatus(int status) {
            super("eventsource: http response status code is not 200: " + status);
            this.status = status;
        }

        public int status() {
            return status;
        }
    }

    /**
     * Raised when the HTTP response does not carry {@code text/event-stream}.
     */
    public static class InvalidContentType extends EventSourceException {
        private final String contentType;

        public InvalidContentType(String contentType) {
            super("eventsource: http response content type is not text/event-stream: " + contentType);
            this.contentType = contentType;
        }

        /**
         * @return the offending header value, or {@code null} if the header was missing
         */
        public String contentType() {
            return contentType;
        }
    }

    /**
     * Raised when a bounded buffer had no room left.
     */
    public static class BufferFull extends EventSourceException {
        private final int limit;

        public BufferFull(String message, int limit) {
            super(message);
            this.limit = limit;
        }

        public int limit() {
            return limit;
        }
    }

    /**
     * Raised when a single field value exceeds its cap. Scoped to one message.
     */
    public static class FieldTooLong extends BufferFull {
        private final String field;

        public FieldTooLong(String field, int limit) {
            super("eventsource: " + field + " field is too long (limit " + limit + " bytes)", limit);
            this.field = field;
        }

        public String field() {
            return field;
        }
    }

    /**
     * Raised when a raw line does not fit in the read buffer.
     */
    public static class LineTooLong extends BufferFull {
        public LineTooLong(int limit) {
            super("eventsource: line does not fit in read buffer (limit " + limit + " bytes)", limit);
        }
    }

    /**
     * Raised when the request could not be sent or the response could not be obtained.
     */
    public static class Transport extends EventSourceException {
        public Transport(Throwable cause) {
            super("eventsource: http response error: " + cause.getMessage(), cause);
        }
    }

    /**
     * Raised when reading the response body fails.
     */
    public static class BodyRead extends EventSourceException {
        public BodyRead(Throwable cause) {
            super("eventsource: http response body read error: " + cause.getMessage(), cause);
        }
    }
}
