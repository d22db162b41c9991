package com.ryuqq.fleetflow.core.spi;

import com.ryuqq.fleetflow.core.contract.Channel;
import com.ryuqq.fleetflow.core.contract.Message;

import java.util.List;

/**
 * Prioritized publish/subscribe SPI.
 *
 * <p>Every subscriber of a channel receives its own copy of each message published on that
 * channel after it subscribed. Channels are created implicitly on first publish or subscribe
 * and live as long as the bus.</p>
 *
 * <p><strong>Delivery Guarantees:</strong></p>
 * <ul>
 *   <li>Per subscriber, buffered messages are delivered highest priority first, FIFO within
 *       a priority band</li>
 *   <li>Delivery is non-preemptive: a CRITICAL message never interrupts a delivery in progress</li>
 *   <li>A subscriber's handler is never invoked concurrently with itself; different
 *       subscribers run concurrently</li>
 *   <li>At-least-once inside one process; nothing survives a restart</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called from any thread, including from handlers</li>
 *   <li>Non-blocking publish: enqueue and return</li>
 *   <li>Handler exceptions must not stop the subscriber's delivery</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * bus.start();
 * Subscription sub = bus.subscribe(Channel.ANALYSIS_RESULT, message -&gt; handle(message));
 * bus.publish(Channel.ANALYSIS_REQUEST, request);
 * ...
 * bus.unsubscribe(sub);
 * bus.stop();
 * </pre>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public interface MessageBus {

    /**
     * Starts accepting publishes and dispatching deliveries. Idempotent.
     */
    void start();

    /**
     * Stops the bus.
     *
     * <p>New publishes are rejected immediately. Deliveries already in progress and messages
     * already buffered are given a bounded amount of time to finish. Idempotent.</p>
     */
    void stop();

    /**
     * Publishes a message to every current subscriber of the channel.
     *
     * <p>Publishing to a channel without subscribers is not an error; the message is logged
     * and discarded.</p>
     *
     * @param channel target channel
     * @param message message to publish
     * @return {@code true} if accepted, {@code false} if the bus is not running
     * @throws IllegalArgumentException if channel or message is null
     */
    boolean publish(Channel channel, Message message);

    /**
     * Registers a handler on a channel.
     *
     * @param channel channel to listen on
     * @param handler handler receiving each delivered message
     * @return the subscription handle, used to unsubscribe
     * @throws IllegalArgumentException if channel or handler is null
     */
    Subscription subscribe(Channel channel, MessageHandler handler);

    /**
     * Removes a subscription.
     *
     * <p>Messages already buffered for the subscriber are still delivered. Unknown or already
     * removed subscriptions are ignored.</p>
     *
     * @param subscription subscription to remove
     */
    void unsubscribe(Subscription subscription);

    /**
     * Current statistics.
     *
     * @return subscriber counts, logged message count and queue depths per channel
     */
    BusStats stats();

    /**
     * Most recent audit log entries, oldest first.
     *
     * @param limit maximum number of entries to return
     * @return up to {@code limit} entries
     * @throws IllegalArgumentException if limit is not positive
     */
    List<BusLogEntry> auditLog(int limit);

    /**
     * Registers an observer receiving every new audit log entry.
     *
     * <p>Sinks are pure observers; a failing sink never affects delivery.</p>
     *
     * @param sink observer
     * @throws IllegalArgumentException if sink is null
     */
    void registerAuditSink(AuditSink sink);
}
