package com.questrail.devicelink.session;

/**
 * Typed transport failures surfaced by a {@link DeviceSession}.
 *
 * <p>{@link #isRecoverable()} is the retry classification used by the
 * engine: a recoverable failure may be retried on a fresh connection, the
 * others end the command.</p>
 */
public enum SessionFailure {
    CONNECT_TIMEOUT(true, true),
    CONNECT_REFUSED(true, false),
    SEND_TIMEOUT(true, true),
    RECV_TIMEOUT(true, true),
    PEER_CLOSED(true, false),
    IO_ERROR(false, false),
    /** The peer sent bytes that failed frame validation. */
    PROTOCOL_ERROR(false, false),
    /** The session was closed locally, typically by cancellation. */
    CLOSED(false, false);

    private final boolean recoverable;
    private final boolean timeout;

    SessionFailure(boolean recoverable, boolean timeout) {
        this.recoverable = recoverable;
        this.timeout = timeout;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
