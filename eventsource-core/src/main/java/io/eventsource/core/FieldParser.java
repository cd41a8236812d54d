package io.eventsource.core;

import java.nio.charset.StandardCharsets;

/**
 * Splits SSE lines into fields.
 *
 * <p>The key is everything before the first colon; the value is everything after it, minus at most
 * one leading space. A line without a colon is all key and has no value. A line starting with a
 * colon is a comment.
 */
public final class FieldParser {
    private FieldParser() {}

    private static final byte[] ID = Protocol.F_ID.getBytes(StandardCharsets.US_ASCII);
    private static final byte[] EVENT = Protocol.F_EVENT.getBytes(StandardCharsets.US_ASCII);
    private static final byte[] DATA = Protocol.F_DATA.getBytes(StandardCharsets.US_ASCII);
    private static final byte[] RETRY = Protocol.F_RETRY.getBytes(StandardCharsets.US_ASCII);

    public static Field parse(Line line, Field into) {
        return parse(line.array(), line.offset(), line.length(), into);
    }

    /**
     * Parses {@code array[offset, offset + length)} into {@code into}.
     *
     * @return {@code into}, for chaining
     */
    public static Field parse(byte[] array, int offset, int length, Field into) {
        int end = offset + length;
        int colon = -1;
        for (int i = offset; i < end; i++) {
            if (array[i] == ':') {
                colon = i;
                break;
            }
        }

        if (colon < 0) {
            into.set(array, classify(array, offset, length), offset, length, end, 0, false);
            return into;
        }

        int keyLength = colon - offset;
        int valueStart = colon + 1;
        if (valueStart < end && array[valueStart] == ' ') {
            valueStart++;
        }
        Field.Name name = keyLength == 0 ? Field.Name.COMMENT : classify(array, offset, keyLength);
        into.set(array, name, offset, keyLength, valueStart, end - valueStart, true);
        return into;
    }

    private static Field.Name classify(byte[] array, int offset, int length) {
        if (equals(ID, array, offset, length)) return Field.Name.ID;
        if (equals(EVENT, array, offset, length)) return Field.Name.EVENT;
        if (equals(DATA, array, offset, length)) return Field.Name.DATA;
        if (equals(RETRY, array, offset, length)) return Field.Name.RETRY;
        return Field.Name.UNKNOWN;
    }

    private static boolean equals(byte[] known, byte[] array, int offset, int length) {
        if (known.length != length) return false;
        for (int i = 0; i < length; i++) {
            if (known[i] != array[offset + i]) return false;
        }
        return true;
    }
}
