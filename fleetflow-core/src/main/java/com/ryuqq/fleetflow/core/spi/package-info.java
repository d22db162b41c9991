/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented by infrastructure adapters and consumed by the orchestration loop.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleetflow.core.spi.MessageBus} - prioritized publish/subscribe with audit log</li>
 *   <li>{@link com.ryuqq.fleetflow.core.spi.DeadlineManager} - reply deadlines with ack/expiry exclusivity</li>
 *   <li>{@link com.ryuqq.fleetflow.core.spi.IngestionSource} - pull-based work unit source</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>{@code fleetflow-adapter-inmemory} provides the in-process bus and deadline manager.
 * Contract tests for both live in {@code fleetflow-testkit}.</p>
 *
 * @since 1.0.0
 * @author Fleetflow Team
 */
package com.ryuqq.fleetflow.core.spi;
