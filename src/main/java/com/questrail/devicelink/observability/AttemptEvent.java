package com.questrail.devicelink.observability;

import com.questrail.devicelink.api.AttemptOutcome;
import com.questrail.devicelink.protocol.message.MessageId;
import com.questrail.devicelink.session.SessionFailure;

import java.time.Instant;

/**
 * Emitted once per transmission attempt, after its outcome is known.
 *
 * @param failure transport failure behind a TIMEOUT/ERROR outcome; may be {@code null}
 */
public record AttemptEvent(
    Instant timestamp,
    MessageId msgId,
    String deviceId,
    int attemptNumber,
    AttemptOutcome outcome,
    SessionFailure failure,
    long elapsedMillis
) {
}
