package com.questrail.devicelink.idempotency;

/**
 * Outcome remembered for a message id.
 */
public enum RecordedOutcome {
    /** The device acknowledged the command. */
    SUCCESS,

    /** The device explicitly rejected the command. */
    REJECTED
}
