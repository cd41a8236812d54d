package io.eventsource.core;

import java.util.Objects;

/**
 * Accumulates field lines into messages and emits one result per blank line.
 *
 * <p>Within a message, {@code id} and {@code event} replace earlier values, {@code data} values are
 * joined with a line feed, and {@code retry} is forwarded to the handler as soon as it is parsed.
 * Once any field overflows its cap the rest of the message is skipped, and the blank line emits the
 * overflow error instead of a message.
 *
 * <p>This class is not thread-safe.
 */
public final class MessageAssembler {

    /**
     * Receives what the assembler produces. Invoked synchronously from {@link #accept}.
     */
    public interface Handler {
        /**
         * A message is complete. The message is only valid for the duration of the call.
         */
        void onMessage(Message message);

        /**
         * A message was discarded because one of its fields overflowed.
         */
        void onError(EventSourceException error);

        /**
         * The stream asked for a new reconnect delay.
         */
        void onRetry(long millis);
    }

    private final FieldBuffer id;
    private final FieldBuffer event;
    private final FieldBuffer data;
    private final Field field = new Field();
    private EventSourceException messageError;

    public MessageAssembler(BufferLimits limits) {
        BufferLimits resolved = Objects.requireNonNull(limits, "limits").resolve();
        this.id = new FieldBuffer(Protocol.F_ID, resolved.maxId());
        this.event = new FieldBuffer(Protocol.F_EVENT, resolved.maxEvent());
        this.data = new FieldBuffer(Protocol.F_DATA, resolved.maxData());
    }

    public void accept(Line line, Handler handler) {
        accept(line.array(), line.offset(), line.length(), handler);
    }

    /**
     * Feeds one line, without its terminator.
     */
    public void accept(byte[] array, int offset, int length, Handler handler) {
        if (length == 0) {
            dispatch(handler);
            return;
        }
        if (messageError != null) {
            // draining the rest of a broken message
            return;
        }

        FieldParser.parse(array, offset, length, field);
        switch (field.name()) {
            case ID -> {
                if (!id.replace(array, field.valueOffset(), field.valueLength())) {
                    overflow(id);
                }
            }
            case EVENT -> {
                if (!event.replace(array, field.valueOffset(), field.valueLength())) {
                    overflow(event);
                }
            }
            case DATA -> {
                if (!data.appendLine(array, field.valueOffset(), field.valueLength())) {
                    overflow(data);
                }
            }
            case RETRY -> {
                long millis = parseRetry(array, field.valueOffset(), field.valueLength());
                if (millis >= 0) {
                    handler.onRetry(millis);
                }
            }
            default -> {
                // comments and unknown fields carry nothing
            }
        }
    }

    /**
     * @return true while the current message is being skipped after an overflow
     */
    public boolean hasPendingError() {
        return messageError != null;
    }

    /**
     * Discards any partial message and releases the field buffers.
     */
    public void reset() {
        id.release();
        event.release();
        data.release();
        messageError = null;
    }

    private void dispatch(Handler handler) {
        try {
            if (messageError == null) {
                handler.onMessage(new Message(id.view(), event.view(), data.view()));
            } else {
                handler.onError(messageError);
            }
        } finally {
            id.clear();
            event.clear();
            data.clear();
            messageError = null;
        }
    }

    private void overflow(FieldBuffer buffer) {
        messageError = new EventSourceException.FieldTooLong(buffer.field(), buffer.limit());
    }

    /**
     * Parses a non-negative decimal count of milliseconds.
     *
     * @return the value, or -1 if the bytes are not all digits or the value overflows
     */
    static long parseRetry(byte[] array, int offset, int length) {
        if (length == 0) {
            return -1;
        }
        long value = 0;
        for (int i = offset; i < offset + length; i++) {
            int digit = array[i] - '0';
            if (digit < 0 || digit > 9) {
                return -1;
            }
            if (value > (Long.MAX_VALUE - digit) / 10) {
                return -1;
            }
            value = value * 10 + digit;
        }
        return value;
    }
}
