/**
 * Orchestration Loop 구현.
 *
 * <p>{@link com.ryuqq.fleetflow.adapter.runner.OrchestrationLoop}가 입력 수집, 결과 처리,
 * 정체 점검, 재시도 재시작을 조립합니다. 워크플로 전이 규칙은
 * {@link com.ryuqq.fleetflow.adapter.runner.WorkflowCoordinator}에 모여 있습니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
package com.ryuqq.fleetflow.adapter.runner;
