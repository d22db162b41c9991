package com.ryuqq.fleetflow.core.spi;

import com.ryuqq.fleetflow.core.contract.Message;

/**
 * Receives messages delivered on a subscribed channel.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Handles one delivered message.
     *
     * @param message the delivered message
     */
    void onMessage(Message message);
}
