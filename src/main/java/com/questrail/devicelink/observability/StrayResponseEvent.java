package com.questrail.devicelink.observability;

import com.questrail.devicelink.protocol.message.MessageId;

import java.time.Instant;

/**
 * A response frame that matched no command awaiting a response.
 *
 * <p>Typically a late duplicate or an answer to a command that already timed
 * out. Such responses are discarded, never attributed to another command.</p>
 *
 * @param expected msg_id of the command awaiting a response at the time; may be {@code null}
 * @param received msg_id carried by the stray response; {@code null} if it could not be decoded
 * @param detail   why the response was not correlated
 */
public record StrayResponseEvent(
    Instant timestamp,
    String deviceId,
    MessageId expected,
    MessageId received,
    String detail
) {
}
