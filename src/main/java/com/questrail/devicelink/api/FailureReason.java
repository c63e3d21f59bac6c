package com.questrail.devicelink.api;

/**
 * Why a command ended in {@link CommandState#FAILED}.
 */
public enum FailureReason {
    /** Queue at capacity under the reject-new policy. No attempt was made. */
    QUEUE_FULL,
    /** Queue stayed full for the whole block-with-timeout window. */
    ENQUEUE_TIMEOUT,
    /** Evicted from the queue by a newer command under the drop-oldest policy. */
    SUPERSEDED,
    CANCELLED,
    /** The overall command deadline elapsed. */
    DEADLINE_EXCEEDED,
    /** Every attempt ended in a timeout. */
    ALL_ATTEMPTS_TIMED_OUT,
    /** Attempts ran out with at least one non-timeout recoverable failure. */
    ATTEMPTS_EXHAUSTED,
    /** The device answered with an explicit negative acknowledgement. */
    DEVICE_REJECTED,
    /** The peer sent bytes that are not valid frames. */
    PROTOCOL_ERROR,
    /** Unrecoverable transport failure. */
    IO_ERROR,
    ENGINE_SHUTDOWN
}
