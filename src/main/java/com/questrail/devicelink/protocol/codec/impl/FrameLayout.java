package com.questrail.devicelink.protocol.codec.impl;

/**
 * FrameLayout
 * -----------------------------------------------------------------------------
 * Byte offsets and constants of the device frame envelope.
 *
 * <pre>
 *   offset 0..1 : magic   (0xF0 0x0D)
 *   offset 2    : version (0x01)
 *   offset 3..6 : payload length, unsigned 32-bit big-endian
 *   offset 7..  : payload
 * </pre>
 */
public final class FrameLayout
{
    public static final int MAGIC_0 = 0xF0;
    public static final int MAGIC_1 = 0x0D;

    public static final int VERSION = 0x01;

    public static final int VERSION_OFFSET = 2;
    public static final int LENGTH_OFFSET = 3;

    /** magic(2) + version(1) + length(4). */
    public static final int HEADER_SIZE = 7;

    /** Default upper bound on a single payload; matches the device read cap. */
    public static final int DEFAULT_MAX_PAYLOAD_SIZE = 65_536;

    /** Largest cap whose whole frame still fits in one Java array index. */
    public static final int LIMIT_MAX_PAYLOAD_SIZE = Integer.MAX_VALUE - HEADER_SIZE;

    private FrameLayout() {}

    static void writeHeader(byte[] frame, int payloadLength)
    {
        frame[0] = (byte) MAGIC_0;
        frame[1] = (byte) MAGIC_1;
        frame[VERSION_OFFSET] = (byte) VERSION;
        frame[LENGTH_OFFSET] = (byte) (payloadLength >>> 24);
        frame[LENGTH_OFFSET + 1] = (byte) (payloadLength >>> 16);
        frame[LENGTH_OFFSET + 2] = (byte) (payloadLength >>> 8);
        frame[LENGTH_OFFSET + 3] = (byte) payloadLength;
    }

    /**
     * Reads the unsigned length field. Returned as {@code long} because the
     * field is a u32 and a hostile peer may set the high bit.
     */
    static long readLength(byte[] buffer, int headerStart)
    {
        int at = headerStart + LENGTH_OFFSET;
        return ((buffer[at] & 0xFFL) << 24)
                | ((buffer[at + 1] & 0xFFL) << 16)
                | ((buffer[at + 2] & 0xFFL) << 8)
                | (buffer[at + 3] & 0xFFL);
    }

    public static void requireValidMax(int maxPayloadSize)
    {
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("maxPayloadSize must be > 0");
        }
        if (maxPayloadSize > LIMIT_MAX_PAYLOAD_SIZE) {
            throw new IllegalArgumentException(
                    "maxPayloadSize must be <= " + LIMIT_MAX_PAYLOAD_SIZE + " but was " + maxPayloadSize);
        }
    }
}
