package io.eventsource.core;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Buffers a byte stream and splits it into lines, where a line ends with CR, LF, or CRLF.
 * The SSE specification allows any of these line endings for any line in the stream, which
 * rules out {@link java.io.BufferedReader#readLine()} for raw bytes.
 *
 * <p>The backing buffer starts small and doubles as needed, but never beyond {@code maxSize}.
 * A line that does not fit is returned truncated to the buffer with
 * {@link Line.Status#BUFFER_FULL}; memory stays bounded whatever the input looks like.
 *
 * <p>Returned lines point into the buffer and are only valid until the next
 * {@link #readLine()} call.
 *
 * <p>This class is not thread-safe.
 */
public final class LineReader {

    static final int DEFAULT_BUFFER_SIZE = 4096;
    static final int MAX_CONSECUTIVE_EMPTY_READS = 100;

    private final InputStream source;
    private final int maxSize;
    private final Line line = new Line();

    private byte[] buf;
    private int r;
    private int w;
    private Line.Status pendingStatus;
    private IOException pendingFailure;
    // previous line ended with a bare CR, so a leading LF belongs to that terminator
    private boolean crLine;

    public LineReader(InputStream source, int maxSize) {
        this.source = Objects.requireNonNull(source, "source");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.buf = new byte[Math.min(maxSize, DEFAULT_BUFFER_SIZE)];
    }

    /**
     * Reads the next line.
     *
     * <p>When the source is exhausted the remaining unterminated bytes are returned once with
     * {@link Line.Status#END_OF_STREAM}; every later call returns an empty line with the same status.
     *
     * @return the line view, owned by this reader
     * @throws IllegalStateException if the source reports a negative byte count other than -1
     */
    public Line readLine() {
        int s = 0;
        while (true) {
            if (crLine && w > r) {
                // Only reached with s == 0: either we entered with unread bytes, or the buffer was
                // empty and the previous iteration's fill brought new ones.
                crLine = false;
                if (buf[r] == '\n') {
                    r++;
                }
            }

            int i = indexOfTerminator(r + s, w);
            if (i >= 0) {
                line.set(buf, r, i - r, Line.Status.TERMINATED, null);
                crLine = buf[i] == '\r';
                r = i + 1;
                return line;
            }

            if (pendingStatus != null) {
                line.set(buf, r, w - r, pendingStatus, pendingFailure);
                r = w;
                pendingStatus = null;
                pendingFailure = null;
                return line;
            }

            s = w - r; // do not rescan bytes already searched
            fill();
        }
    }

    /**
     * @return the current size of the backing buffer
     */
    int capacity() {
        return buf.length;
    }

    private int indexOfTerminator(int from, int to) {
        for (int i = from; i < to; i++) {
            byte b = buf[i];
            if (b == '\r' || b == '\n') {
                return i;
            }
        }
        return -1;
    }

    private void fill() {
        if (r > 0) {
            System.arraycopy(buf, r, buf, 0, w - r);
            w -= r;
            r = 0;
        }

        if (w >= buf.length && !grow()) {
            pendingStatus = Line.Status.BUFFER_FULL;
            return;
        }

        for (int attempt = 0; attempt < MAX_CONSECUTIVE_EMPTY_READS; attempt++) {
            int n;
            try {
                n = source.read(buf, w, buf.length - w);
            } catch (IOException e) {
                pendingStatus = Line.Status.FAILED;
                pendingFailure = e;
                return;
            }
            if (n == -1) {
                pendingStatus = Line.Status.END_OF_STREAM;
                return;
            }
            if (n < 0) {
                throw new IllegalStateException("eventsource: source returned negative count from read: " + n);
            }
            w += n;
            if (n > 0) {
                return;
            }
        }
        pendingStatus = Line.Status.FAILED;
        pendingFailure = new NoProgressException(MAX_CONSECUTIVE_EMPTY_READS);
    }

    private boolean grow() {
        if (buf.length >= maxSize) {
            return false;
        }
        int newSize = (int) Math.min(maxSize, buf.length * 2L);
        byte[] grown = new byte[newSize];
        System.arraycopy(buf, 0, grown, 0, w);
        buf = grown;
        return true;
    }
}
