package com.questrail.devicelink.session;

/**
 * Connection lifecycle of a {@link DeviceSession}.
 *
 * <pre>
 *   DISCONNECTED → CONNECTING → CONNECTED → (SENDING ⇄ RECEIVING) → CLOSING → DISCONNECTED
 * </pre>
 *
 * Any failure or timeout moves directly to {@link #DISCONNECTED}.
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    SENDING,
    RECEIVING,
    CLOSING;

    /**
     * True while frames can be written and read.
     */
    public boolean isOpen() {
        return this == CONNECTED || this == SENDING || this == RECEIVING;
    }
}
