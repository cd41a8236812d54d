package io.eventsource.core;

import java.nio.charset.StandardCharsets;

/**
 * A line split into key and value by {@link FieldParser}.
 *
 * <p>Like {@link Line}, a field is a view over a caller-owned array and is reused between parses.
 */
public final class Field {

    /**
     * Classification of the key.
     */
    public enum Name {
        ID,
        EVENT,
        DATA,
        RETRY,
        /** The key is empty: the line started with a colon. */
        COMMENT,
        /** Any other key. Ignored by the protocol. */
        UNKNOWN
    }

    private byte[] array;
    private Name name = Name.UNKNOWN;
    private int keyOffset;
    private int keyLength;
    private int valueOffset;
    private int valueLength;
    private boolean hasValue;

    public Field() {}

    void set(byte[] array, Name name, int keyOffset, int keyLength, int valueOffset, int valueLength, boolean hasValue) {
        this.array = array;
        this.name = name;
        this.keyOffset = keyOffset;
        this.keyLength = keyLength;
        this.valueOffset = valueOffset;
        this.valueLength = valueLength;
        this.hasValue = hasValue;
    }

    public Name name() {
        return name;
    }

    public byte[] array() {
        return array;
    }

    public int keyOffset() {
        return keyOffset;
    }

    public int keyLength() {
        return keyLength;
    }

    public int valueOffset() {
        return valueOffset;
    }

    /**
     * @return the value length; 0 when there is no value
     */
    public int valueLength() {
        return valueLength;
    }

    /**
     * @return false when the line had no colon at all
     */
    public boolean hasValue() {
        return hasValue;
    }

    public String key() {
        return new String(array, keyOffset, keyLength, StandardCharsets.UTF_8);
    }

    /**
     * @return the value decoded as UTF-8, or {@code null} when the line had no colon
     */
    public String value() {
        return hasValue ? new String(array, valueOffset, valueLength, StandardCharsets.UTF_8) : null;
    }
}
