package com.questrail.devicelink.session;

import com.questrail.devicelink.protocol.codec.FrameError;

import java.util.Objects;
import java.util.Optional;

/**
 * Transport failure raised by a {@link DeviceSession} operation.
 *
 * <p>By the time this is thrown the session is already
 * {@link SessionState#DISCONNECTED}.</p>
 */
public final class DeviceSessionException extends Exception
{
    private final SessionFailure failure;
    private final FrameError frameError;

    public DeviceSessionException(SessionFailure failure, String message)
    {
        this(failure, null, message, null);
    }

    public DeviceSessionException(SessionFailure failure, String message, Throwable cause)
    {
        this(failure, null, message, cause);
    }

    public DeviceSessionException(SessionFailure failure, FrameError frameError, String message, Throwable cause)
    {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
        this.frameError = frameError;
    }

    public SessionFailure failure()
    {
        return failure;
    }

    /**
     * The framing defect behind a {@link SessionFailure#PROTOCOL_ERROR}.
     */
    public Optional<FrameError> frameError()
    {
        return Optional.ofNullable(frameError);
    }
}
