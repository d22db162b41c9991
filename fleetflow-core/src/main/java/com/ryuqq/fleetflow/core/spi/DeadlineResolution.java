package com.ryuqq.fleetflow.core.spi;

/**
 * How a deadline registration ended.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public enum DeadlineResolution {

    ACKNOWLEDGED,

    EXPIRED
}
