package com.ryuqq.fleetflow.core.spi;

/**
 * Audit log action.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public enum BusAction {

    /** Accepted by {@link MessageBus#publish}. */
    PUBLISHED,

    /** Handed to one subscriber's handler. */
    DELIVERED,

    /** Discarded: expired before dispatch or evicted from a full mailbox. */
    DROPPED
}
