package com.ryuqq.fleetflow.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MessageId Value Object 테스트.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
class MessageIdTest {

    @Test
    void of_ValidValue_CreatesMessageId() {
        // Given
        String value = "msg-analysis_42";

        // When
        MessageId messageId = MessageId.of(value);

        // Then
        assertEquals(value, messageId.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> MessageId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> MessageId.of("msg 42")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void of_TooLong_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> MessageId.of("a".repeat(256)));
    }

    @Test
    void generate_ProducesDistinctPrefixedIds() {
        // When
        MessageId first = MessageId.generate();
        MessageId second = MessageId.generate();

        // Then
        assertNotEquals(first, second);
        assertTrue(first.getValue().startsWith("msg-"));
    }

    @Test
    void equals_SameValue_AreEqual() {
        // Given
        MessageId a = MessageId.of("msg-1");
        MessageId b = MessageId.of("msg-1");

        // Then
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("MessageId{msg-1}", a.toString());
    }
}
