package com.questrail.devicelink.protocol.codec;

/**
 * FrameEncoder
 * -----------------------------------------------------------------------------
 * Outbound half of the wire framing boundary.
 *
 * <p>Wraps an opaque payload in the envelope
 * {@code [magic:2][version:1][length:u32 BE][payload]}. The encoder never
 * inspects the payload; JSON encoding happens one layer above.</p>
 */
public interface FrameEncoder
{
    /**
     * Encode a single frame.
     *
     * @param payload payload bytes, never {@code null}
     * @return the complete frame, header included
     * @throws FrameCodecException with {@link FrameError#FRAME_TOO_LARGE} if the
     *         payload exceeds the configured maximum payload size
     */
    byte[] encode(byte[] payload);
}
