package com.ryuqq.fleetflow.core.contract;

import com.ryuqq.fleetflow.core.model.CorrelationId;
import com.ryuqq.fleetflow.core.model.MessageId;
import com.ryuqq.fleetflow.core.model.MessageType;
import com.ryuqq.fleetflow.core.model.Payload;
import com.ryuqq.fleetflow.core.model.Priority;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Message 봉투 테스트.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
class MessageTest {

    private final CorrelationId correlationId = CorrelationId.of("workflow-VIN-1-abc");

    @Test
    void create_UsesDefaultTtlAndFreshId() {
        // When
        Message first = Message.create(correlationId, "orchestrator", "analysis_agent",
            MessageType.ANALYSIS_REQUEST, Priority.NORMAL, Payload.empty());
        Message second = Message.create(correlationId, "orchestrator", "analysis_agent",
            MessageType.ANALYSIS_REQUEST, Priority.NORMAL, Payload.empty());

        // Then
        assertEquals(Message.DEFAULT_TTL_MS, first.ttlMs());
        assertNotEquals(first.messageId(), second.messageId());
        assertFalse(first.isReply());
        assertFalse(first.isBroadcast());
    }

    @Test
    void reply_InheritsCorrelationAndPriority() {
        // Given
        Message request = Message.create(correlationId, "orchestrator", "engagement_agent",
            MessageType.ENGAGEMENT_REQUEST, Priority.CRITICAL, Payload.empty());

        // When
        Message reply = Message.reply(request, "engagement_agent", MessageType.ENGAGEMENT_RESULT,
            Payload.of(Map.of("decision", "accepted")));

        // Then
        assertEquals(correlationId, reply.correlationId());
        assertEquals(Priority.CRITICAL, reply.priority());
        assertEquals(request.messageId(), reply.replyTo());
        assertEquals("orchestrator", reply.receiver());
        assertTrue(reply.isReply());
    }

    @Test
    void constructor_NullPayload_BecomesEmpty() {
        // When
        Message message = new Message(MessageId.of("m-1"), correlationId, 0L, "orchestrator", null,
            MessageType.ERROR, Priority.HIGH, null, 1000L, null);

        // Then
        assertTrue(message.payload().isEmpty());
        assertTrue(message.isBroadcast());
    }

    @Test
    void constructor_NonPositiveTtl_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Message(MessageId.of("m-1"), correlationId, 0L, "orchestrator", null,
                MessageType.ERROR, Priority.HIGH, null, 0L, Payload.empty())
        );
        assertTrue(exception.getMessage().contains("must be positive"));
    }

    @Test
    void isExpired_AfterCreatedAtPlusTtl() {
        // Given
        Message message = new Message(MessageId.of("m-1"), correlationId, 1_000L, "orchestrator", null,
            MessageType.TIMEOUT, Priority.NORMAL, null, 500L, Payload.empty());

        // Then
        assertFalse(message.isExpired(1_499L));
        assertTrue(message.isExpired(1_500L));
        assertEquals(1_500L, message.expiresAt());
    }
}
