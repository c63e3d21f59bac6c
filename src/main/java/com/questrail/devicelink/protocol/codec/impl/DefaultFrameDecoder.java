package com.questrail.devicelink.protocol.codec.impl;

import com.questrail.devicelink.protocol.codec.DecodedFrame;
import com.questrail.devicelink.protocol.codec.FrameCodecException;
import com.questrail.devicelink.protocol.codec.FrameDecoder;
import com.questrail.devicelink.protocol.codec.FrameError;

import java.util.Arrays;
import java.util.Objects;

/**
 * DefaultFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FrameDecoder}.
 *
 * <p>Validation happens in wire order and stops at the first failure:</p>
 * <ol>
 *   <li>Magic bytes (fatal on mismatch)</li>
 *   <li>Version byte (fatal on mismatch)</li>
 *   <li>Declared length against the payload cap (fatal when exceeded)</li>
 *   <li>Payload completeness (recoverable: wait for more bytes)</li>
 * </ol>
 *
 * <p>Each header field is checked as soon as its bytes are available, so a
 * peer sending garbage is rejected after two bytes rather than after it has
 * filled a read buffer.</p>
 */
public final class DefaultFrameDecoder implements FrameDecoder
{
    private final int maxPayloadSize;

    public DefaultFrameDecoder()
    {
        this(FrameLayout.DEFAULT_MAX_PAYLOAD_SIZE);
    }

    public DefaultFrameDecoder(int maxPayloadSize)
    {
        FrameLayout.requireValidMax(maxPayloadSize);
        this.maxPayloadSize = maxPayloadSize;
    }

    @Override
    public DecodedFrame decode(byte[] buffer, int offset, int length)
    {
        Objects.requireNonNull(buffer, "buffer");
        Objects.checkFromIndexSize(offset, length, buffer.length);

        // 1) Magic
        if (length >= 1 && (buffer[offset] & 0xFF) != FrameLayout.MAGIC_0) {
            throw badMagic(buffer, offset);
        }
        if (length >= 2 && (buffer[offset + 1] & 0xFF) != FrameLayout.MAGIC_1) {
            throw badMagic(buffer, offset);
        }

        // 2) Version
        if (length > FrameLayout.VERSION_OFFSET) {
            int version = buffer[offset + FrameLayout.VERSION_OFFSET] & 0xFF;
            if (version != FrameLayout.VERSION) {
                throw new FrameCodecException(FrameError.UNSUPPORTED_VERSION,
                        "Unsupported frame version 0x" + Integer.toHexString(version));
            }
        }

        if (length < FrameLayout.HEADER_SIZE) {
            throw truncated(length, FrameLayout.HEADER_SIZE);
        }

        // 3) Length
        long declared = FrameLayout.readLength(buffer, offset);
        if (declared > maxPayloadSize) {
            throw new FrameCodecException(FrameError.FRAME_TOO_LARGE,
                    "Declared payload length " + declared + " exceeds maximum of " + maxPayloadSize);
        }

        // 4) Payload
        int frameSize = FrameLayout.HEADER_SIZE + (int) declared;
        if (length < frameSize) {
            throw truncated(length, frameSize);
        }

        int payloadStart = offset + FrameLayout.HEADER_SIZE;
        byte[] payload = Arrays.copyOfRange(buffer, payloadStart, payloadStart + (int) declared);
        return new DecodedFrame(payload, frameSize);
    }

    public int maxPayloadSize()
    {
        return maxPayloadSize;
    }

    private static FrameCodecException badMagic(byte[] buffer, int offset)
    {
        return new FrameCodecException(FrameError.BAD_MAGIC,
                "Bad frame magic starting with 0x" + Integer.toHexString(buffer[offset] & 0xFF));
    }

    private static FrameCodecException truncated(int available, int required)
    {
        return new FrameCodecException(FrameError.TRUNCATED_FRAME,
                "Need " + required + " bytes, have " + available);
    }
}
