package com.ryuqq.fleetflow.core.spi;

import com.ryuqq.fleetflow.core.contract.Channel;

/**
 * Handle of one channel subscription.
 *
 * @param id unique subscription identifier
 * @param channel subscribed channel
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public record Subscription(String id, Channel channel) {

    public Subscription {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
    }
}
