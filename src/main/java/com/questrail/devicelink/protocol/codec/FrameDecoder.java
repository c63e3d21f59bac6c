package com.questrail.devicelink.protocol.codec;

/**
 * FrameDecoder
 * -----------------------------------------------------------------------------
 * Inbound half of the wire framing boundary.
 *
 * <p>The decoder is stateless. TCP delivers a byte stream, not frames, so
 * callers accumulate received bytes themselves and re-invoke
 * {@link #decode(byte[], int, int)} whenever more bytes arrive. A
 * {@link FrameError#TRUNCATED_FRAME} failure means "not enough bytes yet" and
 * leaves the caller's buffer untouched; every other {@link FrameError} is fatal
 * for the connection that produced the bytes.</p>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Parsing the JSON payload</li>
 *   <li>Correlating frames to outstanding requests</li>
 *   <li>Buffering partial reads</li>
 * </ul>
 */
public interface FrameDecoder
{
    /**
     * Attempt to decode one frame starting at {@code offset}.
     *
     * @param buffer accumulated bytes
     * @param offset index of the first unconsumed byte
     * @param length number of readable bytes from {@code offset}
     * @return the payload and the number of bytes the frame occupied
     * @throws FrameCodecException describing why no frame could be produced
     */
    DecodedFrame decode(byte[] buffer, int offset, int length);

    /**
     * Convenience overload decoding from the start of {@code buffer}.
     */
    default DecodedFrame decode(byte[] buffer)
    {
        return decode(buffer, 0, buffer.length);
    }
}
