package com.ryuqq.fleetflow.core.statemachine;

/**
 * 엔티티 워크플로의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *   │ (새 입력)
 *   ▼
 * ANALYZING ──(분석 결과)──► ASSESSING
 *                              │
 *            ┌─(조치 불필요)────┤
 *            │                 ▼ (외부 응대 필요)
 *            │             ENGAGING ──(거절)──┐
 *            │                 │ (수락)       │
 *            │                 ▼              │
 *            │             SCHEDULING         │
 *            │                 │ (예약 확정)   │
 *            │                 ▼              │
 *            │          AWAITING_EXTERNAL     │
 *            │                 │ (외부 완료)   │
 *            │                 ▼              │
 *            │         COLLECTING_OUTCOME     │
 *            │                 │ (결과 기록)   │
 *            ▼                 ▼              ▼
 *          COMPLETED ◄──────────────────────────
 *
 * 모든 비종료 상태 ──(실패/만료)──► ERROR
 * ERROR ──(재시도 가능)──► IDLE
 * ERROR ──(재시도 소진)──► COMPLETED (실패 사유 기록)
 * </pre>
 *
 * <p>{@code INGESTING}은 원래 상태 집합과의 호환을 위해 남겨둔 상태로,
 * 이 상태로 들어가는 전이는 없습니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public enum WorkflowState {

    /**
     * 대기 (입력 대기 또는 재시도 대기).
     */
    IDLE,

    /**
     * 입력 수집 중 (전이 없음).
     */
    INGESTING,

    /**
     * 분석 결과 대기.
     */
    ANALYZING,

    /**
     * 긴급도 평가 중.
     */
    ASSESSING,

    /**
     * 외부 응대 결과 대기.
     */
    ENGAGING,

    /**
     * 예약 결과 대기.
     */
    SCHEDULING,

    /**
     * 외부 완료 신호 대기.
     */
    AWAITING_EXTERNAL,

    /**
     * 결과(피드백) 수집 대기.
     */
    COLLECTING_OUTCOME,

    /**
     * 완료 (종료 상태).
     */
    COMPLETED,

    /**
     * 오류. 재시도 가능하면 IDLE로 재진입, 아니면 COMPLETED로 종료.
     */
    ERROR;

    /**
     * 종료 상태인지 확인.
     *
     * <p>ERROR는 재시도 여부가 워크플로의 재시도 카운터에 달려 있으므로
     * 여기서는 종료 상태로 보지 않습니다.</p>
     *
     * @return COMPLETED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED;
    }

    /**
     * 협력 컴포넌트나 외부 신호를 기다리는 활성 상태인지 확인.
     *
     * @return IDLE, COMPLETED, ERROR가 아니면 true
     */
    public boolean isActive() {
        return this != IDLE && this != COMPLETED && this != ERROR;
    }
}
