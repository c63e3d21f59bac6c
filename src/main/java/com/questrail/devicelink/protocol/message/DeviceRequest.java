package com.questrail.devicelink.protocol.message;

import java.util.Objects;

/**
 * Request payload carried inside a frame.
 *
 * <p>Wire form: {@code {"opcode": "toggle", "device_id": "...", "msg_id": "...", "state": true}}.</p>
 */
public record DeviceRequest(
        Opcode opcode,
        String deviceId,
        MessageId msgId,
        boolean state
) {
    public DeviceRequest {
        Objects.requireNonNull(opcode, "opcode");
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(msgId, "msgId");
    }
}
