package com.ryuqq.fleetflow.application.policy;

import com.ryuqq.fleetflow.core.model.EntityId;
import com.ryuqq.fleetflow.core.model.Payload;

/**
 * 단계 결과를 다음 전이로 바꾸는 판단 규칙.
 *
 * <p>오케스트레이터는 payload 내용을 해석하지 않고, 이 정책에 판단을 위임합니다.
 * 구현체는 스레드 안전해야 합니다 (여러 워크플로의 결과가 동시에 평가됨).</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public interface DecisionPolicy {

    /**
     * 분석 결과로 긴급도 평가.
     *
     * @param entityId 대상 엔티티
     * @param analysis 분석 결과 payload
     * @return 평가 결과
     */
    UrgencyAssessment assessUrgency(EntityId entityId, Payload analysis);

    /**
     * 응대 결과가 수락인지 판단.
     *
     * @param engagement 응대 결과 payload
     * @return 수락이면 true
     */
    boolean isEngagementAccepted(Payload engagement);

    /**
     * 예약 결과가 확정인지 판단.
     *
     * @param scheduling 예약 결과 payload
     * @return 확정이면 true
     */
    boolean isBookingConfirmed(Payload scheduling);
}
