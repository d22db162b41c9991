package com.ryuqq.fleetflow.application.policy;

import com.ryuqq.fleetflow.core.model.EntityId;
import com.ryuqq.fleetflow.core.model.Payload;
import com.ryuqq.fleetflow.core.model.Priority;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ThresholdDecisionPolicy 유닛 테스트.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
class ThresholdDecisionPolicyTest {

    private static final EntityId VIN = EntityId.of("VIN-001");

    private final ThresholdDecisionPolicy policy = new ThresholdDecisionPolicy();

    private UrgencyAssessment assess(Object days) {
        return policy.assessUrgency(VIN, Payload.of(Map.of(ThresholdDecisionPolicy.DAYS_TO_FAILURE_KEY, days)));
    }

    @Test
    void 하루_미만이면_CRITICAL_응대() {
        // when
        UrgencyAssessment assessment = assess(0.5);

        // then
        assertThat(assessment.level()).isEqualTo(UrgencyLevel.CRITICAL);
        assertThat(assessment.engagementRequired()).isTrue();
        assertThat(assessment.engagementPriority()).isEqualTo(Priority.CRITICAL);
        assertThat(assessment.schedulingPriority()).isEqualTo(Priority.HIGH);
    }

    @Test
    void 칠일_미만이면_HIGH_응대() {
        // when
        UrgencyAssessment assessment = assess(3);

        // then
        assertThat(assessment.level()).isEqualTo(UrgencyLevel.HIGH);
        assertThat(assessment.engagementPriority()).isEqualTo(Priority.HIGH);
        assertThat(assessment.schedulingPriority()).isEqualTo(Priority.NORMAL);
    }

    @Test
    void 삼십일_미만이면_MEDIUM_일반_우선순위로_응대() {
        // when
        UrgencyAssessment assessment = assess("12");

        // then
        assertThat(assessment.level()).isEqualTo(UrgencyLevel.MEDIUM);
        assertThat(assessment.engagementRequired()).isTrue();
        assertThat(assessment.engagementPriority()).isEqualTo(Priority.NORMAL);
    }

    @Test
    void 경계값_칠일은_MEDIUM() {
        // then
        assertThat(assess(7).level()).isEqualTo(UrgencyLevel.MEDIUM);
        assertThat(assess(30).level()).isEqualTo(UrgencyLevel.LOW);
    }

    @Test
    void 예측값이_없으면_LOW_조치불필요() {
        // when
        UrgencyAssessment assessment = policy.assessUrgency(VIN, Payload.empty());

        // then
        assertThat(assessment.level()).isEqualTo(UrgencyLevel.LOW);
        assertThat(assessment.engagementRequired()).isFalse();
        assertThat(assessment.reason()).isEqualTo("no failure prediction");
    }

    @Test
    void accepted만_수락으로_판단() {
        // then
        assertThat(policy.isEngagementAccepted(Payload.of(Map.of("decision", "accepted")))).isTrue();
        assertThat(policy.isEngagementAccepted(Payload.of(Map.of("decision", " Accepted ")))).isTrue();
        assertThat(policy.isEngagementAccepted(Payload.of(Map.of("decision", "declined")))).isFalse();
        assertThat(policy.isEngagementAccepted(Payload.empty())).isFalse();
    }

    @Test
    void 예약_상태가_confirmed나_scheduled면_확정() {
        // then
        assertThat(policy.isBookingConfirmed(Payload.of(Map.of("status", "confirmed")))).isTrue();
        assertThat(policy.isBookingConfirmed(Payload.of(Map.of("status", "scheduled")))).isTrue();
        assertThat(policy.isBookingConfirmed(Payload.of(Map.of("booking_confirmed", true)))).isTrue();
        assertThat(policy.isBookingConfirmed(Payload.of(Map.of("status", "no_slots")))).isFalse();
    }

    @Test
    void 임계값이_오름차순이_아니면_예외() {
        // when & then
        assertThatThrownBy(() -> new ThresholdDecisionPolicy(7, 1, 30))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ascending");
    }
}
