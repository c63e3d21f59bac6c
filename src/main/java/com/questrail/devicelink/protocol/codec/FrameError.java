package com.questrail.devicelink.protocol.codec;

/**
 * Classification of framing failures.
 *
 * <p>Only {@link #TRUNCATED_FRAME} is recoverable: the caller reads more bytes
 * and retries. The others mean the peer is not speaking this protocol (or is
 * misbehaving) and the connection must be dropped.</p>
 */
public enum FrameError {
    BAD_MAGIC(false),
    UNSUPPORTED_VERSION(false),
    TRUNCATED_FRAME(true),
    FRAME_TOO_LARGE(false);

    private final boolean recoverable;

    FrameError(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
