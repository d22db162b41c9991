/**
 * In-memory message bus adapter.
 *
 * <p>{@link com.ryuqq.fleetflow.adapter.inmemory.bus.InMemoryMessageBus} implements the
 * {@link com.ryuqq.fleetflow.core.spi.MessageBus} SPI inside one JVM: one priority mailbox per
 * subscriber, a shared dispatch pool, and a bounded audit log.</p>
 *
 * <h2>Thread Safety</h2>
 * <ul>
 *   <li>Channel subscriber lists: CopyOnWriteArrayList inside a ConcurrentHashMap</li>
 *   <li>Mailboxes: guarded by the mailbox monitor, drained by at most one task at a time</li>
 *   <li>Audit log: guarded by a dedicated lock</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li>No persistence: buffered messages are lost when the JVM stops</li>
 *   <li>Single process only</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fleetflow Team
 */
package com.ryuqq.fleetflow.adapter.inmemory.bus;
