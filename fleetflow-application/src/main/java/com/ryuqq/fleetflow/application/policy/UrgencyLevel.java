package com.ryuqq.fleetflow.application.policy;

/**
 * 분석 결과에서 도출한 긴급도.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public enum UrgencyLevel {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
