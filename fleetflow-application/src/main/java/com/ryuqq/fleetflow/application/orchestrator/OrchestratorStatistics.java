package com.ryuqq.fleetflow.application.orchestrator;

import com.ryuqq.fleetflow.core.statemachine.WorkflowState;

import java.util.Map;

/**
 * 오케스트레이터 통계 스냅샷.
 *
 * @param countsByState 살아있는 워크플로의 상태별 개수
 * @param totalIngested 수집한 입력 레코드 수
 * @param totalCompleted 종료(COMPLETED)된 워크플로 수
 * @param totalErrored ERROR 상태에 진입한 횟수
 * @param workflowsCreated 생성된 워크플로 수
 * @param retries 재시도(ERROR → IDLE) 횟수
 * @param staleResultsDropped 대기 중인 요청과 맞지 않아 버린 결과 수
 * @param ingestionFailures 입력 소스 조회 실패 횟수
 * @param timeouts 데드라인 만료 횟수
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public record OrchestratorStatistics(
    Map<WorkflowState, Integer> countsByState,
    long totalIngested,
    long totalCompleted,
    long totalErrored,
    long workflowsCreated,
    long retries,
    long staleResultsDropped,
    long ingestionFailures,
    long timeouts
) {

    public OrchestratorStatistics {
        countsByState = countsByState == null ? Map.of() : Map.copyOf(countsByState);
    }

    public int countIn(WorkflowState state) {
        return countsByState.getOrDefault(state, 0);
    }

    /**
     * 살아있는 워크플로 수.
     */
    public int activeWorkflows() {
        return countsByState.values().stream().mapToInt(Integer::intValue).sum();
    }
}
