package com.ryuqq.fleetflow.core.statemachine;

import java.util.EnumSet;
import java.util.Set;

/**
 * 워크플로 상태 전이를 일으키는 사건.
 *
 * <p>각 트리거는 허용되는 출발 상태 집합과 도착 상태 하나를 가집니다.
 * 출발 상태가 집합에 없으면 전이는 거부됩니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public enum WorkflowTrigger {

    NEW_INPUT(EnumSet.of(WorkflowState.IDLE), WorkflowState.ANALYZING),

    ANALYSIS_RESULT(EnumSet.of(WorkflowState.ANALYZING), WorkflowState.ASSESSING),

    ENGAGEMENT_REQUIRED(EnumSet.of(WorkflowState.ASSESSING), WorkflowState.ENGAGING),

    NO_ACTION_REQUIRED(EnumSet.of(WorkflowState.ASSESSING), WorkflowState.COMPLETED),

    ENGAGEMENT_ACCEPTED(EnumSet.of(WorkflowState.ENGAGING), WorkflowState.SCHEDULING),

    ENGAGEMENT_DECLINED(EnumSet.of(WorkflowState.ENGAGING), WorkflowState.COMPLETED),

    BOOKING_CONFIRMED(EnumSet.of(WorkflowState.SCHEDULING), WorkflowState.AWAITING_EXTERNAL),

    EXTERNAL_COMPLETION(EnumSet.of(WorkflowState.AWAITING_EXTERNAL), WorkflowState.COLLECTING_OUTCOME),

    OUTCOME_RECORDED(EnumSet.of(WorkflowState.COLLECTING_OUTCOME), WorkflowState.COMPLETED),

    /**
     * 실패 또는 데드라인 만료. COMPLETED, ERROR를 제외한 모든 상태에서 허용.
     */
    FAILURE(EnumSet.complementOf(EnumSet.of(WorkflowState.COMPLETED, WorkflowState.ERROR)), WorkflowState.ERROR),

    /**
     * 재시도 재진입. 재시도 한도 확인은 {@code Workflow}가 담당.
     */
    RETRY(EnumSet.of(WorkflowState.ERROR), WorkflowState.IDLE),

    RETRIES_EXHAUSTED(EnumSet.of(WorkflowState.ERROR), WorkflowState.COMPLETED);

    private final Set<WorkflowState> sources;
    private final WorkflowState target;

    WorkflowTrigger(Set<WorkflowState> sources, WorkflowState target) {
        this.sources = sources;
        this.target = target;
    }

    /**
     * 주어진 상태에서 이 트리거가 허용되는지 확인.
     *
     * @param from 현재 상태
     * @return 허용되면 true
     */
    public boolean appliesTo(WorkflowState from) {
        return sources.contains(from);
    }

    public WorkflowState target() {
        return target;
    }
}
