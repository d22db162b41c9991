package com.ryuqq.fleetflow.core.spi;

import com.ryuqq.fleetflow.core.model.MessageId;

import java.util.concurrent.CompletableFuture;

/**
 * Tracks reply deadlines of outstanding requests.
 *
 * <p><strong>Exclusivity:</strong> for every registration exactly one of the following
 * happens, even when {@link #acknowledge} races with expiry:</p>
 * <ul>
 *   <li>{@link #acknowledge} returns {@code true}, the callback never runs and the future
 *       completes with {@link DeadlineResolution#ACKNOWLEDGED}</li>
 *   <li>the callback runs exactly once, asynchronously, every later {@link #acknowledge}
 *       returns {@code false} and the future completes with {@link DeadlineResolution#EXPIRED}</li>
 * </ul>
 *
 * <p>Escalation (retry counting) is the caller's concern.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public interface DeadlineManager {

    /**
     * Registers a deadline.
     *
     * @param messageId request awaiting a reply
     * @param deadlineAtMillis absolute expiry time (epoch millis); a time in the past expires
     *                         immediately
     * @param onExpire callback run once on expiry
     * @return single-shot future completed when the registration resolves
     * @throws IllegalArgumentException if messageId or onExpire is null
     * @throws IllegalStateException if messageId is already pending or the manager is shut down
     */
    CompletableFuture<DeadlineResolution> register(MessageId messageId, long deadlineAtMillis, ExpiryCallback onExpire);

    /**
     * Cancels a pending deadline.
     *
     * @param messageId request whose reply arrived
     * @return {@code true} if this call cancelled the deadline; {@code false} if it had already
     *         expired, was already acknowledged or was never registered
     */
    boolean acknowledge(MessageId messageId);

    /**
     * Number of registrations neither acknowledged nor expired.
     */
    int pendingCount();

    /**
     * Cancels every pending deadline without running callbacks and releases threads.
     * Pending futures are completed exceptionally with {@link java.util.concurrent.CancellationException}.
     */
    void shutdown();
}
