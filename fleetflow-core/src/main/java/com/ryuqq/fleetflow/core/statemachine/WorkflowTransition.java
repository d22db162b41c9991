package com.ryuqq.fleetflow.core.statemachine;

/**
 * 워크플로 상태 전이 검증 및 실행.
 *
 * <p>전이는 (현재 상태, 트리거) 쌍으로 표현되며, {@link WorkflowTrigger}에
 * 정의된 표에 있는 쌍만 허용됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>COMPLETED에서는 어떤 트리거도 허용되지 않음</li>
 *   <li>ERROR에서는 RETRY 또는 RETRIES_EXHAUSTED만 허용</li>
 *   <li>INGESTING으로 들어가는 트리거는 없음</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class WorkflowTransition {

    private WorkflowTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 허용 여부.
     *
     * @param from 현재 상태
     * @param trigger 트리거
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 trigger가 null인 경우
     */
    public static boolean isAllowed(WorkflowState from, WorkflowTrigger trigger) {
        if (from == null || trigger == null) {
            throw new IllegalArgumentException("State and trigger cannot be null (from: " + from + ", trigger: " + trigger + ")");
        }
        if (from.isTerminal()) {
            return false;
        }
        return trigger.appliesTo(from);
    }

    /**
     * 전이 검증.
     *
     * @param from 현재 상태
     * @param trigger 트리거
     * @throws IllegalArgumentException from 또는 trigger가 null인 경우
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public static void validate(WorkflowState from, WorkflowTrigger trigger) {
        if (!isAllowed(from, trigger)) {
            if (from.isTerminal()) {
                throw new IllegalStateException(
                    String.format("Cannot transition from terminal state: %s (trigger: %s)", from, trigger)
                );
            }
            throw new IllegalStateException(
                String.format("Invalid state transition: %s --%s--> %s", from, trigger, trigger.target())
            );
        }
    }

    /**
     * 검증 후 다음 상태 반환.
     *
     * @param current 현재 상태
     * @param trigger 트리거
     * @return 도착 상태
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public static WorkflowState next(WorkflowState current, WorkflowTrigger trigger) {
        validate(current, trigger);
        return trigger.target();
    }
}
