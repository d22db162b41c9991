package com.ryuqq.fleetflow.core.spi;

/**
 * Thrown by an {@link IngestionSource} that cannot be read.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
