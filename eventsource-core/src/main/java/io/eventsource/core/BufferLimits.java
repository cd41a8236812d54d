package io.eventsource.core;

/**
 * Size limits for the buffers an event source holds in memory.
 *
 * <p>For every parsed message the id, event and data values are copied out of the read buffer into
 * their own buffers. All buffers grow as needed, but never beyond these caps. A value of {@code 0}
 * selects the default:
 * <ul>
 *   <li>id: {@value Protocol#DEFAULT_MAX_ID} bytes</li>
 *   <li>event: {@value Protocol#DEFAULT_MAX_EVENT} bytes</li>
 *   <li>data: {@value Protocol#DEFAULT_MAX_DATA} bytes</li>
 *   <li>read buffer: the largest field cap plus {@value Protocol#LINE_FRAMING_OVERHEAD}</li>
 * </ul>
 *
 * @param maxId cap for the id field
 * @param maxEvent cap for the event field
 * @param maxData cap for the accumulated data field
 * @param maxReadBuffer cap for the raw line buffer
 */
public record BufferLimits(int maxId, int maxEvent, int maxData, int maxReadBuffer) {

    // Largest array most VMs will allocate.
    private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    public static final BufferLimits DEFAULTS = new BufferLimits(0, 0, 0, 0).resolve();

    public BufferLimits {
        requireNonNegative(maxId, "maxId");
        requireNonNegative(maxEvent, "maxEvent");
        requireNonNegative(maxData, "maxData");
        requireNonNegative(maxReadBuffer, "maxReadBuffer");
    }

    /**
     * Replaces every zero cap with its default.
     *
     * @return limits with all caps positive
     */
    public BufferLimits resolve() {
        int id = maxId == 0 ? Protocol.DEFAULT_MAX_ID : maxId;
        int event = maxEvent == 0 ? Protocol.DEFAULT_MAX_EVENT : maxEvent;
        int data = maxData == 0 ? Protocol.DEFAULT_MAX_DATA : maxData;
        int read = maxReadBuffer;
        if (read == 0) {
            long wanted = (long) Math.max(id, Math.max(event, data)) + Protocol.LINE_FRAMING_OVERHEAD;
            read = (int) Math.min(wanted, MAX_ARRAY_SIZE);
        }
        return new BufferLimits(id, event, data, read);
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
