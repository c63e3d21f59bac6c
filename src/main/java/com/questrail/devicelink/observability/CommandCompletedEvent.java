package com.questrail.devicelink.observability;

import com.questrail.devicelink.api.CommandOutcome;
import com.questrail.devicelink.protocol.message.MessageId;

import java.time.Instant;

/**
 * Emitted exactly once per command when it reaches a terminal state.
 *
 * @param elapsedMillis time from submission to the terminal outcome
 */
public record CommandCompletedEvent(
    Instant timestamp,
    MessageId msgId,
    String deviceId,
    CommandOutcome outcome,
    long elapsedMillis
) {
}
