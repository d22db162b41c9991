package com.ryuqq.fleetflow.core.model;

/**
 * 메시지 우선순위.
 *
 * <p><strong>순서:</strong> CRITICAL &gt; HIGH &gt; NORMAL &gt; LOW</p>
 *
 * <p>버스는 구독자별로 대기 중인 메시지를 우선순위 순으로 전달하며,
 * 같은 우선순위 안에서는 게시 순서(FIFO)를 지킵니다.
 * 이미 처리 중인 메시지를 선점하지는 않습니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public enum Priority {

    /**
     * 안전/긴급 메시지. 대기 중인 모든 일반 작업보다 먼저 전달.
     */
    CRITICAL(4),

    /**
     * 높은 우선순위.
     */
    HIGH(3),

    /**
     * 일반 트래픽 (기본값).
     */
    NORMAL(2),

    /**
     * 낮은 우선순위 (예: 통계성 알림).
     */
    LOW(1);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    /**
     * 정렬용 순위 (높을수록 먼저 전달).
     *
     * @return 순위 값
     */
    public int rank() {
        return rank;
    }

    /**
     * 다른 우선순위보다 높은지 확인.
     *
     * @param other 비교 대상
     * @return this가 더 높으면 true
     */
    public boolean isHigherThan(Priority other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return rank > other.rank;
    }
}
