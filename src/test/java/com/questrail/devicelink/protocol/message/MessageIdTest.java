package com.questrail.devicelink.protocol.message;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class MessageIdTest
{
    @Test
    void generatedIdsAreSixteenLowercaseHexCharacters()
    {
        MessageId id = MessageId.random();

        assertEquals(16, id.value().length());
        assertTrue(id.value().matches("[0-9a-f]{16}"));
    }

    @Test
    void generatedIdsAreDistinct()
    {
        Set<MessageId> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            assertTrue(seen.add(MessageId.random()));
        }
    }

    @Test
    void valueIsNormalizedToLowercase()
    {
        assertEquals(MessageId.of("abcdef"), MessageId.of("ABCDEF"));
    }

    @Test
    void invalidValuesAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> MessageId.of(""));
        assertThrows(IllegalArgumentException.class, () -> MessageId.of("xyz"));
        assertThrows(IllegalArgumentException.class, () -> MessageId.of("a".repeat(65)));
    }

    @Test
    void nonAsciiDigitsAreRejected()
    {
        // Arabic-Indic one, fullwidth one, fullwidth small a
        assertThrows(IllegalArgumentException.class, () -> MessageId.of("ab\u0661"));
        assertThrows(IllegalArgumentException.class, () -> MessageId.of("\uFF11abc"));
        assertThrows(IllegalArgumentException.class, () -> MessageId.of("0\uFF41"));
    }
}
