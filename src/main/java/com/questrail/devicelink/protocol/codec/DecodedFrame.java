package com.questrail.devicelink.protocol.codec;

/**
 * DecodedFrame
 * -----------------------------------------------------------------------------
 * Result of a successful {@link FrameDecoder#decode(byte[], int, int)} call.
 *
 * <p>{@code bytesConsumed} is the full on-wire size of the frame (header plus
 * payload). Bytes after that belong to the next frame and are left for the
 * caller.</p>
 *
 * The payload array is copied in and out.
 */
public final class DecodedFrame
{
    private final byte[] payload;
    private final int bytesConsumed;

    public DecodedFrame(byte[] payload, int bytesConsumed)
    {
        this.payload = (payload == null) ? new byte[0] : payload.clone();
        this.bytesConsumed = bytesConsumed;
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] payload()
    {
        return payload.clone();
    }

    public int payloadLength()
    {
        return payload.length;
    }

    public int bytesConsumed()
    {
        return bytesConsumed;
    }

    @Override
    public String toString()
    {
        return "DecodedFrame[payloadLength=" + payload.length + ", bytesConsumed=" + bytesConsumed + ']';
    }
}
