package com.questrail.devicelink.protocol.message;

/**
 * Indicates that a correctly framed payload could not be translated into a
 * request or response.
 *
 * This typically reflects:
 * <ul>
 *   <li>Bytes that are not a JSON object</li>
 *   <li>A missing or malformed {@code msg_id}</li>
 *   <li>An unknown opcode</li>
 *   <li>A response without its {@code ack} indicator</li>
 * </ul>
 */
public final class PayloadDecodeException extends RuntimeException
{
    public PayloadDecodeException(String message) {
        super(message);
    }

    public PayloadDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
