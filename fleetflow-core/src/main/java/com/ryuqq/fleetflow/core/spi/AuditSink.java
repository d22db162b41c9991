package com.ryuqq.fleetflow.core.spi;

/**
 * Observer of the bus audit log, used by monitoring collaborators.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AuditSink {

    void accept(BusLogEntry entry);
}
