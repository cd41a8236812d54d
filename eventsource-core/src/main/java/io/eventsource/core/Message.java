package io.eventsource.core;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One event received from the stream.
 *
 * <p>Each part corresponds to an SSE field ({@code id}, {@code event}, {@code data}) and is
 * {@code null} when the event did not carry that field, which is different from carrying it with
 * an empty value.
 *
 * <p>A message handed to a callback is a read-only view over buffers that are reused for the next
 * event as soon as the callback returns. Call {@link #copy()} or one of the {@code *AsString()}
 * methods to keep anything past that point.
 */
public final class Message {
    private final ByteBuffer id;
    private final ByteBuffer event;
    private final ByteBuffer data;

    Message(ByteBuffer id, ByteBuffer event, ByteBuffer data) {
        this.id = id;
        this.event = event;
        this.data = data;
    }

    /**
     * Creates a detached message from strings, each encoded as UTF-8.
     *
     * @param id the id, or {@code null} if absent
     * @param event the event type, or {@code null} if absent
     * @param data the data, or {@code null} if absent
     * @return a message that owns its content
     */
    public static Message of(String id, String event, String data) {
        return new Message(encode(id), encode(event), encode(data));
    }

    /** @return the id field, or {@code null} if absent */
    public ByteBuffer id() {
        return id == null ? null : id.duplicate();
    }

    /** @return the event field, or {@code null} if absent */
    public ByteBuffer event() {
        return event == null ? null : event.duplicate();
    }

    /** @return the data field, or {@code null} if absent */
    public ByteBuffer data() {
        return data == null ? null : data.duplicate();
    }

    public boolean hasId() {
        return id != null;
    }

    public boolean hasEvent() {
        return event != null;
    }

    public boolean hasData() {
        return data != null;
    }

    public String idAsString() {
        return decode(id);
    }

    public String eventAsString() {
        return decode(event);
    }

    public String dataAsString() {
        return decode(data);
    }

    /**
     * Copies every present part into fresh arrays.
     *
     * @return a message that stays valid after the callback returns
     */
    public Message copy() {
        return new Message(copyOf(id), copyOf(event), copyOf(data));
    }

    private static ByteBuffer copyOf(ByteBuffer src) {
        if (src == null) return null;
        ByteBuffer dup = src.duplicate();
        byte[] bytes = new byte[dup.remaining()];
        dup.get(bytes);
        return ByteBuffer.wrap(bytes).asReadOnlyBuffer();
    }

    private static ByteBuffer encode(String s) {
        return s == null ? null : ByteBuffer.wrap(s.getBytes(StandardCharsets.UTF_8)).asReadOnlyBuffer();
    }

    private static String decode(ByteBuffer b) {
        if (b == null) return null;
        ByteBuffer dup = b.duplicate();
        byte[] bytes = new byte[dup.remaining()];
        dup.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message other = (Message) o;
        return Objects.equals(id, other.id)
                && Objects.equals(event, other.event)
                && Objects.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, event, data);
    }

    @Override
    public String toString() {
        return "Message{id=" + idAsString() + ", event=" + eventAsString() + ", data=" + dataAsString() + "}";
    }
}
