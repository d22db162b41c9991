package com.ryuqq.fleetflow.application.orchestrator;

import com.ryuqq.fleetflow.core.model.CorrelationId;
import com.ryuqq.fleetflow.core.model.EntityId;
import com.ryuqq.fleetflow.core.statemachine.WorkflowState;
import com.ryuqq.fleetflow.core.workflow.TransitionRecord;
import com.ryuqq.fleetflow.core.workflow.Workflow;
import com.ryuqq.fleetflow.core.workflow.WorkflowOutcome;

import java.util.List;

/**
 * 워크플로 상태 스냅샷.
 *
 * @param entityId 엔티티 ID
 * @param state 현재 상태
 * @param correlationId 상관관계 ID
 * @param retryCount 재시도 횟수
 * @param errorCount 오류 횟수
 * @param history 전이 이력 (시간순)
 * @param lastUpdate 마지막 전이 시각 (epoch millis)
 * @param outcome 결과 태그 (종료 전이면 null)
 * @param retired 라이브 집합에서 제거되었는지 여부
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public record WorkflowStatus(
    EntityId entityId,
    WorkflowState state,
    CorrelationId correlationId,
    int retryCount,
    int errorCount,
    List<TransitionRecord> history,
    long lastUpdate,
    WorkflowOutcome outcome,
    boolean retired
) {

    public WorkflowStatus {
        history = history == null ? List.of() : List.copyOf(history);
    }

    /**
     * 워크플로에서 스냅샷 생성. 호출 중 워크플로 잠금을 잡아 일관된 값을 읽습니다.
     *
     * @param workflow 대상 워크플로
     * @return 스냅샷
     */
    public static WorkflowStatus from(Workflow workflow) {
        workflow.lock();
        try {
            return new WorkflowStatus(
                workflow.getEntityId(),
                workflow.getState(),
                workflow.getCorrelationId(),
                workflow.getRetryCount(),
                workflow.getErrorCount(),
                workflow.getHistory(),
                workflow.getLastUpdate(),
                workflow.getOutcome().orElse(null),
                workflow.isRetired()
            );
        } finally {
            workflow.unlock();
        }
    }
}
