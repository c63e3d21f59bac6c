package com.questrail.devicelink.observability;

import com.questrail.devicelink.session.SessionFailure;
import com.questrail.devicelink.session.SessionState;

import java.time.Instant;

/**
 * Record of a device session changing state.
 *
 * @param cause failure that forced the transition; {@code null} for orderly ones
 */
public record SessionTransitionEvent(
    Instant timestamp,
    String deviceId,
    SessionState from,
    SessionState to,
    SessionFailure cause
) {
    public boolean isFailure() {
        return cause != null;
    }
}
