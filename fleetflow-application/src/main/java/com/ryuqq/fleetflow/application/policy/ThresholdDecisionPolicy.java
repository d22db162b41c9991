package com.ryuqq.fleetflow.application.policy;

import com.ryuqq.fleetflow.core.model.EntityId;
import com.ryuqq.fleetflow.core.model.Payload;
import com.ryuqq.fleetflow.core.model.Priority;

import java.util.Locale;

/**
 * 고장 예측 일수 임계값 기반 기본 판단 규칙.
 *
 * <p><strong>긴급도 (predicted_days_to_failure 기준):</strong></p>
 * <ul>
 *   <li>1일 미만: CRITICAL (응대 우선순위 CRITICAL, 예약 우선순위 HIGH)</li>
 *   <li>7일 미만: HIGH (응대 우선순위 HIGH)</li>
 *   <li>30일 미만: MEDIUM (응대 우선순위 NORMAL)</li>
 *   <li>그 외 또는 값 없음: LOW (응대 불필요)</li>
 * </ul>
 *
 * <p><strong>응대:</strong> {@code decision}이 "accepted"일 때만 수락.</p>
 * <p><strong>예약:</strong> {@code status}가 "confirmed" 또는 "scheduled"이거나
 * {@code booking_confirmed}가 true일 때 확정.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class ThresholdDecisionPolicy implements DecisionPolicy {

    public static final String DAYS_TO_FAILURE_KEY = "predicted_days_to_failure";
    public static final String DECISION_KEY = "decision";
    public static final String BOOKING_STATUS_KEY = "status";
    public static final String BOOKING_CONFIRMED_KEY = "booking_confirmed";

    private final double criticalDays;
    private final double highDays;
    private final double mediumDays;

    /**
     * 기본 임계값(1일, 7일, 30일)으로 생성.
     */
    public ThresholdDecisionPolicy() {
        this(1.0, 7.0, 30.0);
    }

    /**
     * 임계값 지정 생성.
     *
     * @throws IllegalArgumentException 임계값이 양수가 아니거나 오름차순이 아닌 경우
     */
    public ThresholdDecisionPolicy(double criticalDays, double highDays, double mediumDays) {
        if (criticalDays <= 0) {
            throw new IllegalArgumentException("criticalDays must be positive (current: " + criticalDays + ")");
        }
        if (highDays < criticalDays || mediumDays < highDays) {
            throw new IllegalArgumentException(
                "Thresholds must be ascending (critical: " + criticalDays + ", high: " + highDays + ", medium: " + mediumDays + ")");
        }
        this.criticalDays = criticalDays;
        this.highDays = highDays;
        this.mediumDays = mediumDays;
    }

    @Override
    public UrgencyAssessment assessUrgency(EntityId entityId, Payload analysis) {
        Payload safe = analysis == null ? Payload.empty() : analysis;
        double days = safe.getNumber(DAYS_TO_FAILURE_KEY).orElse(Double.MAX_VALUE);
        String reason = days == Double.MAX_VALUE
            ? "no failure prediction"
            : "failure predicted in " + days + " days";

        if (days < criticalDays) {
            return new UrgencyAssessment(UrgencyLevel.CRITICAL, true, Priority.CRITICAL, Priority.HIGH, reason);
        }
        if (days < highDays) {
            return new UrgencyAssessment(UrgencyLevel.HIGH, true, Priority.HIGH, Priority.NORMAL, reason);
        }
        if (days < mediumDays) {
            return new UrgencyAssessment(UrgencyLevel.MEDIUM, true, Priority.NORMAL, Priority.NORMAL, reason);
        }
        return new UrgencyAssessment(UrgencyLevel.LOW, false, Priority.NORMAL, Priority.NORMAL, reason);
    }

    @Override
    public boolean isEngagementAccepted(Payload engagement) {
        if (engagement == null) {
            return false;
        }
        return engagement.getString(DECISION_KEY)
            .map(decision -> "accepted".equals(decision.trim().toLowerCase(Locale.ROOT)))
            .orElse(false);
    }

    @Override
    public boolean isBookingConfirmed(Payload scheduling) {
        if (scheduling == null) {
            return false;
        }
        boolean flagged = scheduling.getString(BOOKING_CONFIRMED_KEY)
            .map(Boolean::parseBoolean)
            .orElse(false);
        if (flagged) {
            return true;
        }
        return scheduling.getString(BOOKING_STATUS_KEY)
            .map(status -> status.trim().toLowerCase(Locale.ROOT))
            .map(status -> status.equals("confirmed") || status.equals("scheduled"))
            .orElse(false);
    }
}
