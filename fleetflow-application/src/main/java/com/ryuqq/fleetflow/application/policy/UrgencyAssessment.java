package com.ryuqq.fleetflow.application.policy;

import com.ryuqq.fleetflow.core.model.Priority;

/**
 * 긴급도 평가 결과.
 *
 * @param level 긴급도
 * @param engagementRequired 외부 응대가 필요한지 여부
 * @param engagementPriority 응대 요청 우선순위
 * @param schedulingPriority 예약 요청 우선순위
 * @param reason 판단 사유 (이력에 기록)
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public record UrgencyAssessment(
    UrgencyLevel level,
    boolean engagementRequired,
    Priority engagementPriority,
    Priority schedulingPriority,
    String reason
) {

    public UrgencyAssessment {
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        if (engagementPriority == null) {
            throw new IllegalArgumentException("engagementPriority cannot be null");
        }
        if (schedulingPriority == null) {
            throw new IllegalArgumentException("schedulingPriority cannot be null");
        }
        if (reason == null) {
            reason = level.name();
        }
    }
}
