package com.ryuqq.fleetflow.core.spi;

import com.ryuqq.fleetflow.core.contract.Channel;
import com.ryuqq.fleetflow.core.contract.Message;
import com.ryuqq.fleetflow.core.model.CorrelationId;
import com.ryuqq.fleetflow.core.model.MessageId;
import com.ryuqq.fleetflow.core.model.MessageType;
import com.ryuqq.fleetflow.core.model.Priority;

/**
 * One entry of the bus audit log.
 *
 * @param timestamp time of the action (epoch millis)
 * @param channel channel the message travelled on
 * @param action what happened
 * @param messageId message identifier
 * @param correlationId workflow correlation identifier
 * @param sender message sender
 * @param receiver message receiver (nullable for broadcasts)
 * @param type message type
 * @param priority message priority
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public record BusLogEntry(
    long timestamp,
    Channel channel,
    BusAction action,
    MessageId messageId,
    CorrelationId correlationId,
    String sender,
    String receiver,
    MessageType type,
    Priority priority
) {

    /**
     * Builds an entry from a message.
     */
    public static BusLogEntry of(long timestamp, Channel channel, BusAction action, Message message) {
        return new BusLogEntry(timestamp, channel, action, message.messageId(), message.correlationId(),
            message.sender(), message.receiver(), message.type(), message.priority());
    }
}
