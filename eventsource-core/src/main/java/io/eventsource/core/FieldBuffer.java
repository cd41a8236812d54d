package io.eventsource.core;

import java.nio.ByteBuffer;

/**
 * Growable byte buffer for one field value, capped at a fixed size.
 *
 * <p>Tracks presence separately from length so that a field sent with an empty value can be told
 * apart from a field that was never sent.
 */
final class FieldBuffer {
    private static final byte[] EMPTY = new byte[0];

    private final String field;
    private final int limit;
    private byte[] buf = EMPTY;
    private int len;
    private boolean present;

    FieldBuffer(String field, int limit) {
        this.field = field;
        this.limit = limit;
    }

    String field() {
        return field;
    }

    int limit() {
        return limit;
    }

    /**
     * Replaces the content.
     *
     * @return false if the value exceeds the cap; the buffer is left unchanged
     */
    boolean replace(byte[] src, int off, int n) {
        if (n > limit) {
            return false;
        }
        ensureCapacity(n);
        System.arraycopy(src, off, buf, 0, n);
        len = n;
        present = true;
        return true;
    }

    /**
     * Appends the value, preceded by a line feed when the buffer already holds bytes.
     *
     * @return false if the result would exceed the cap; the buffer is left unchanged
     */
    boolean appendLine(byte[] src, int off, int n) {
        int separator = len == 0 ? 0 : 1;
        long required = (long) len + separator + n;
        if (required > limit) {
            return false;
        }
        ensureCapacity((int) required);
        if (separator == 1) {
            buf[len++] = '\n';
        }
        System.arraycopy(src, off, buf, len, n);
        len += n;
        present = true;
        return true;
    }

    boolean isPresent() {
        return present;
    }

    int length() {
        return len;
    }

    /**
     * @return a read-only view of the content, or {@code null} if the field was not sent
     */
    ByteBuffer view() {
        return present ? ByteBuffer.wrap(buf, 0, len).slice().asReadOnlyBuffer() : null;
    }

    /** Truncates the content and keeps the allocation. */
    void clear() {
        len = 0;
        present = false;
    }

    /** Truncates the content and drops the allocation. */
    void release() {
        clear();
        buf = EMPTY;
    }

    private void ensureCapacity(int required) {
        if (buf.length >= required) {
            return;
        }
        int newCap = (int) Math.min(limit, Math.max(required, buf.length * 2L));
        byte[] grown = new byte[newCap];
        System.arraycopy(buf, 0, grown, 0, len);
        buf = grown;
    }
}
