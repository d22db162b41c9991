package com.ryuqq.fleetflow.core.workflow;

/**
 * 종료된 워크플로의 결과 태그.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public enum WorkflowOutcome {

    /** 전체 단계를 거쳐 결과까지 기록됨. */
    SUCCEEDED,

    /** 분석 결과 조치 불필요. */
    NO_ACTION,

    /** 외부 응대 거절. */
    DECLINED,

    /** 재시도 소진. */
    FAILED
}
