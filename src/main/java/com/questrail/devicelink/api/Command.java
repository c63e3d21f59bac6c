package com.questrail.devicelink.api;

import com.questrail.devicelink.protocol.message.DeviceRequest;
import com.questrail.devicelink.protocol.message.MessageId;
import com.questrail.devicelink.protocol.message.Opcode;

import java.util.Objects;

/**
 * A caller-issued intent to change a device.
 *
 * <p>{@link #msgId()} is fixed at creation. Every attempt made for this
 * command carries the same value, which is what lets the idempotency cache
 * recognize a late response to an earlier attempt.</p>
 */
public record Command(
        MessageId msgId,
        String deviceId,
        Opcode opcode,
        boolean desiredState
) {
    public Command {
        Objects.requireNonNull(msgId, "msgId");
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(opcode, "opcode");
        if (deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId must not be blank");
        }
    }

    /**
     * Creates a toggle command with a freshly generated msg_id.
     */
    public static Command toggle(String deviceId, boolean desiredState) {
        return new Command(MessageId.random(), deviceId, Opcode.TOGGLE, desiredState);
    }

    /**
     * The wire request for this command. Identical for every attempt.
     */
    public DeviceRequest toRequest() {
        return new DeviceRequest(opcode, deviceId, msgId, desiredState);
    }
}
