package com.questrail.devicelink.api;

/**
 * Lifecycle of a command inside the engine.
 *
 * <pre>
 *   CREATED → QUEUED → SENT → AWAITING_RESPONSE → { SUCCESS | RETRY | FAILED }
 *                                      RETRY → SENT
 * </pre>
 *
 * {@link #SUCCESS} and {@link #FAILED} are terminal.
 */
public enum CommandState {
    CREATED,
    QUEUED,
    SENT,
    AWAITING_RESPONSE,
    RETRY,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
