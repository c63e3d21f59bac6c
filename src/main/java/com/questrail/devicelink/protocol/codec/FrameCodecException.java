package com.questrail.devicelink.protocol.codec;

import java.util.Objects;

/**
 * Raised by the frame codec when bytes cannot be framed or a payload cannot be
 * wrapped.
 *
 * <p>Callers branch on {@link #error()}, never on the message text.</p>
 */
public final class FrameCodecException extends RuntimeException
{
    private final FrameError error;

    public FrameCodecException(FrameError error, String message)
    {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public FrameError error()
    {
        return error;
    }

    public boolean isRecoverable()
    {
        return error.isRecoverable();
    }
}
