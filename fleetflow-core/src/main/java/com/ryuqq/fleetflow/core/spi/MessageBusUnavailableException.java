package com.ryuqq.fleetflow.core.spi;

import com.ryuqq.fleetflow.core.contract.Channel;

/**
 * The bus refused a publish because it is stopped.
 *
 * <p>Fatal for the orchestrator: its periodic duties halt.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public class MessageBusUnavailableException extends RuntimeException {

    private final Channel channel;

    public MessageBusUnavailableException(Channel channel) {
        super("Message bus unavailable, publish rejected on channel " + channel);
        this.channel = channel;
    }

    public Channel getChannel() {
        return channel;
    }
}
