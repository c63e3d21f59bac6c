package com.questrail.devicelink.protocol.message;

import java.util.Objects;
import java.util.Optional;

/**
 * Response payload carried inside a frame.
 *
 * <p>Echoes the request's {@code msg_id} and carries an explicit
 * acknowledgement flag: {@code ack=true} means the device applied the command,
 * {@code ack=false} means it refused it. {@code state} and {@code reason} are
 * optional.</p>
 */
public record DeviceResponse(
        Opcode opcode,
        String deviceId,
        MessageId msgId,
        boolean ack,
        Boolean state,
        String reason
) {
    public DeviceResponse {
        Objects.requireNonNull(opcode, "opcode");
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(msgId, "msgId");
    }

    public static DeviceResponse ack(DeviceRequest request) {
        return new DeviceResponse(request.opcode(), request.deviceId(), request.msgId(), true, request.state(), null);
    }

    public static DeviceResponse nack(DeviceRequest request, String reason) {
        return new DeviceResponse(request.opcode(), request.deviceId(), request.msgId(), false, null, reason);
    }

    public Optional<Boolean> reportedState() {
        return Optional.ofNullable(state);
    }

    public Optional<String> rejectionReason() {
        return Optional.ofNullable(reason);
    }

    /**
     * True if this response answers {@code request}: same msg_id and opcode.
     */
    public boolean correlatesWith(DeviceRequest request) {
        return msgId.equals(request.msgId()) && opcode == request.opcode();
    }
}
