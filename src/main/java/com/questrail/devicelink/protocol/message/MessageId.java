package com.questrail.devicelink.protocol.message;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * MessageId
 * -----------------------------------------------------------------------------
 * Identity of one logical command on the wire ({@code msg_id}).
 *
 * <p>Assigned once when a command is created and reused unchanged on every
 * retry attempt; it is the idempotency key. The value is a lowercase hex
 * string (16 characters when generated here).</p>
 */
public record MessageId(String value) {

    private static final int GENERATED_LENGTH = 16;
    private static final int MAX_LENGTH = 64;

    public MessageId {
        Objects.requireNonNull(value, "value");
        value = value.toLowerCase(Locale.ROOT);
        if (value.isEmpty() || value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("msg_id must be 1-" + MAX_LENGTH + " hex characters");
        }
        for (int i = 0; i < value.length(); i++) {
            if (!isHexDigit(value.charAt(i))) {
                throw new IllegalArgumentException("msg_id must be hex: " + value);
            }
        }
    }

    // ASCII only; Character.digit also accepts other Unicode digit blocks.
    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f');
    }

    public static MessageId of(String value) {
        return new MessageId(value);
    }

    /**
     * Generates a fresh random identifier.
     */
    public static MessageId random() {
        String hex = UUID.randomUUID().toString().replace("-", "");
        return new MessageId(hex.substring(0, GENERATED_LENGTH));
    }

    @Override
    public String toString() {
        return value;
    }
}
