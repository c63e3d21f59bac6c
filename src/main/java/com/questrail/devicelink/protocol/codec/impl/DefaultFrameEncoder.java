package com.questrail.devicelink.protocol.codec.impl;

import com.questrail.devicelink.protocol.codec.FrameCodecException;
import com.questrail.devicelink.protocol.codec.FrameEncoder;
import com.questrail.devicelink.protocol.codec.FrameError;

import java.util.Objects;

/**
 * DefaultFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FrameEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultFrameDecoder}.</p>
 */
public final class DefaultFrameEncoder implements FrameEncoder
{
    private final int maxPayloadSize;

    public DefaultFrameEncoder()
    {
        this(FrameLayout.DEFAULT_MAX_PAYLOAD_SIZE);
    }

    public DefaultFrameEncoder(int maxPayloadSize)
    {
        FrameLayout.requireValidMax(maxPayloadSize);
        this.maxPayloadSize = maxPayloadSize;
    }

    @Override
    public byte[] encode(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        if (payload.length > maxPayloadSize) {
            throw new FrameCodecException(FrameError.FRAME_TOO_LARGE,
                    "Payload of " + payload.length + " bytes exceeds maximum of " + maxPayloadSize);
        }

        byte[] frame = new byte[FrameLayout.HEADER_SIZE + payload.length];
        FrameLayout.writeHeader(frame, payload.length);
        System.arraycopy(payload, 0, frame, FrameLayout.HEADER_SIZE, payload.length);
        return frame;
    }

    public int maxPayloadSize()
    {
        return maxPayloadSize;
    }
}
