/**
 * 오케스트레이터 진입점.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.fleetflow.application.orchestrator.WorkflowOrchestrator} - 생명주기와 조회 인터페이스</li>
 *   <li>{@link com.ryuqq.fleetflow.application.orchestrator.WorkflowStatus} - 워크플로 상태 스냅샷</li>
 *   <li>{@link com.ryuqq.fleetflow.application.orchestrator.OrchestratorStatistics} - 통계 스냅샷</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code OrchestrationLoop}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.fleetflow.application.orchestrator;
