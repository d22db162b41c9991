package com.ryuqq.fleetflow.application.orchestrator;

import com.ryuqq.fleetflow.core.model.EntityId;

import java.util.Optional;

/**
 * 엔티티별 워크플로 조정자.
 *
 * <p>입력을 수집해 엔티티별 워크플로를 만들고, 각 단계를 협력 컴포넌트에 요청하며,
 * 결과·만료·재시도를 처리해 워크플로를 완료까지 끌고 갑니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkflowOrchestrator orchestrator = OrchestrationLoop.create(source, policy, config);
 * orchestrator.start();
 *
 * orchestrator.getWorkflowStatus(EntityId.of("VIN-001"))
 *     .ifPresent(status -&gt; log.info("state={}", status.state()));
 *
 * orchestrator.stop();
 * </pre>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public interface WorkflowOrchestrator {

    /**
     * 주기 작업(수집, 지연 점검)과 결과 구독을 시작.
     *
     * @throws IllegalStateException 이미 정지된 경우
     */
    void start();

    /**
     * 주기 작업을 취소하고 구독을 해제.
     *
     * <p>진행 중인 처리는 끝까지 수행됩니다. 소유한 버스와 데드라인 관리자도 함께 정지합니다.</p>
     */
    void stop();

    /**
     * 워크플로 상태 조회.
     *
     * <p>살아있는 워크플로가 없으면 가장 최근에 종료된 워크플로를 반환합니다.</p>
     *
     * @param entityId 엔티티 ID
     * @return 상태 스냅샷 (이력이 없으면 empty)
     */
    Optional<WorkflowStatus> getWorkflowStatus(EntityId entityId);

    /**
     * 통계 조회.
     *
     * @return 통계 스냅샷
     */
    OrchestratorStatistics getStatistics();
}
