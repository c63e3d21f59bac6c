package com.questrail.devicelink.protocol.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.Objects;

/**
 * PayloadCodec
 * =============================================================================
 * JSON mapping between {@link DeviceRequest}/{@link DeviceResponse} and frame
 * payload bytes.
 *
 * <p>Field names are the snake_case wire names. Unknown fields are ignored so
 * a device firmware that adds fields does not break correlation. The mapping
 * is done on the Jackson tree model rather than by binding, which keeps the
 * domain records free of serialization annotations.</p>
 *
 * <p>Thread-safe: {@link ObjectMapper} is safe for concurrent reads and writes
 * once configured.</p>
 */
public final class PayloadCodec
{
    static final String OPCODE = "opcode";
    static final String DEVICE_ID = "device_id";
    static final String MSG_ID = "msg_id";
    static final String STATE = "state";
    static final String ACK = "ack";
    static final String REASON = "reason";

    private final ObjectMapper mapper;

    public PayloadCodec()
    {
        this(new ObjectMapper());
    }

    public PayloadCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public byte[] encodeRequest(DeviceRequest request)
    {
        Objects.requireNonNull(request, "request");

        ObjectNode node = mapper.createObjectNode();
        node.put(OPCODE, request.opcode().wireName());
        node.put(DEVICE_ID, request.deviceId());
        node.put(MSG_ID, request.msgId().value());
        node.put(STATE, request.state());
        return write(node);
    }

    public DeviceRequest decodeRequest(byte[] payload)
    {
        JsonNode node = readObject(payload);
        return new DeviceRequest(
                opcode(node),
                requiredText(node, DEVICE_ID),
                msgId(node),
                requiredBoolean(node, STATE)
        );
    }

    public byte[] encodeResponse(DeviceResponse response)
    {
        Objects.requireNonNull(response, "response");

        ObjectNode node = mapper.createObjectNode();
        node.put(OPCODE, response.opcode().wireName());
        node.put(DEVICE_ID, response.deviceId());
        node.put(MSG_ID, response.msgId().value());
        node.put(ACK, response.ack());
        response.reportedState().ifPresent(s -> node.put(STATE, s));
        response.rejectionReason().ifPresent(r -> node.put(REASON, r));
        return write(node);
    }

    public DeviceResponse decodeResponse(byte[] payload)
    {
        JsonNode node = readObject(payload);

        JsonNode state = node.get(STATE);
        JsonNode reason = node.get(REASON);
        return new DeviceResponse(
                opcode(node),
                requiredText(node, DEVICE_ID),
                msgId(node),
                requiredBoolean(node, ACK),
                (state != null && state.isBoolean()) ? state.booleanValue() : null,
                (reason != null && reason.isTextual()) ? reason.textValue() : null
        );
    }

    private byte[] write(ObjectNode node)
    {
        try {
            return mapper.writeValueAsBytes(node);
        }
        catch (JsonProcessingException e) {
            // An ObjectNode of strings and booleans always serializes.
            throw new IllegalStateException("Failed to serialize payload", e);
        }
    }

    private JsonNode readObject(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        final JsonNode node;
        try {
            node = mapper.readTree(payload);
        }
        catch (IOException e) {
            throw new PayloadDecodeException("Payload is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new PayloadDecodeException("Payload is not a JSON object");
        }
        return node;
    }

    private static Opcode opcode(JsonNode node)
    {
        String raw = requiredText(node, OPCODE);
        try {
            return Opcode.fromWire(raw);
        }
        catch (IllegalArgumentException e) {
            throw new PayloadDecodeException(e.getMessage(), e);
        }
    }

    private static MessageId msgId(JsonNode node)
    {
        String raw = requiredText(node, MSG_ID);
        try {
            return MessageId.of(raw);
        }
        catch (IllegalArgumentException e) {
            throw new PayloadDecodeException("Malformed msg_id: " + raw, e);
        }
    }

    private static String requiredText(JsonNode node, String field)
    {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.textValue().isBlank()) {
            throw new PayloadDecodeException("Missing or non-string field '" + field + "'");
        }
        return value.textValue();
    }

    private static boolean requiredBoolean(JsonNode node, String field)
    {
        JsonNode value = node.get(field);
        if (value == null || !value.isBoolean()) {
            throw new PayloadDecodeException("Missing or non-boolean field '" + field + "'");
        }
        return value.booleanValue();
    }
}
