package com.questrail.devicelink.api;

/**
 * Result of a single transmission of a command.
 */
public enum AttemptOutcome {
    PENDING,
    SUCCESS,
    /** Device answered with a negative acknowledgement. */
    REJECTED,
    TIMEOUT,
    ERROR
}
