package com.questrail.devicelink.protocol.message;

import java.util.Locale;

/**
 * Device operations understood by the payload codec.
 *
 * <p>Wire names are lowercase strings; {@link #wireName()} is what appears in
 * the {@code opcode} field.</p>
 */
public enum Opcode {
    TOGGLE("toggle");

    private final String wireName;

    Opcode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws IllegalArgumentException if {@code wireName} names no known opcode
     */
    public static Opcode fromWire(String wireName) {
        if (wireName != null) {
            String normalized = wireName.trim().toLowerCase(Locale.ROOT);
            for (Opcode opcode : values()) {
                if (opcode.wireName.equals(normalized)) {
                    return opcode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown opcode: " + wireName);
    }
}
