package io.eventsource.core;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Arrays;

/**
 * A line returned by {@link LineReader}, without its terminator.
 *
 * <p>The bytes are not copied: {@link #array()} is the reader's own buffer and the line occupies
 * {@code [offset, offset + length)}. The view is only valid until the next call to
 * {@link LineReader#readLine()}. Use {@link #toByteArray()} to keep the content.
 */
public final class Line {

    /**
     * How the line ended.
     */
    public enum Status {
        /** Ended by CR, LF or CRLF. */
        TERMINATED,
        /** The source is exhausted; the line holds the final unterminated bytes, possibly none. */
        END_OF_STREAM,
        /** The read buffer reached its cap before a terminator was found. */
        BUFFER_FULL,
        /** The source failed; see {@link #failure()}. */
        FAILED
    }

    private byte[] array;
    private int offset;
    private int length;
    private Status status = Status.TERMINATED;
    private IOException failure;

    Line() {}

    void set(byte[] array, int offset, int length, Status status, IOException failure) {
        this.array = array;
        this.offset = offset;
        this.length = length;
        this.status = status;
        this.failure = failure;
    }

    public byte[] array() {
        return array;
    }

    public int offset() {
        return offset;
    }

    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public Status status() {
        return status;
    }

    /**
     * @return true when the line ended with a terminator and no condition is pending
     */
    public boolean isTerminated() {
        return status == Status.TERMINATED;
    }

    /**
     * @return the source failure for {@link Status#FAILED}, otherwise {@code null}
     */
    public IOException failure() {
        return failure;
    }

    public byte[] toByteArray() {
        return Arrays.copyOfRange(array, offset, offset + length);
    }

    public String toString(Charset charset) {
        return new String(array, offset, length, charset);
    }
}
