package com.questrail.devicelink.observability;

import com.questrail.devicelink.protocol.message.MessageId;

import java.time.Instant;

/**
 * A transmission was skipped because the idempotency cache already held a
 * success for the command's msg_id.
 *
 * @param attemptNumber the attempt that would have been sent
 */
public record DuplicateSuppressedEvent(
    Instant timestamp,
    MessageId msgId,
    String deviceId,
    int attemptNumber
) {
}
