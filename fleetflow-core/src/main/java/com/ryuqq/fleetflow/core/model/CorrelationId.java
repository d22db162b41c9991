package com.ryuqq.fleetflow.core.model;

import java.util.UUID;

/**
 * 워크플로 단위 상관관계 식별자.
 *
 * <p>하나의 워크플로 인스턴스에 속한 모든 메시지가 같은 CorrelationId를 공유하며,
 * 종단 간 추적에 사용됩니다. 워크플로가 살아있는 동안 값은 바뀌지 않습니다
 * (재시도 시에도 동일 값 유지).</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class CorrelationId {

    private final String value;

    private CorrelationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CorrelationId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("CorrelationId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * CorrelationId 생성.
     *
     * @param value CorrelationId 값
     * @return CorrelationId 인스턴스
     * @throws IllegalArgumentException null 또는 빈 문자열인 경우
     */
    public static CorrelationId of(String value) {
        return new CorrelationId(value);
    }

    /**
     * 엔티티용 새 CorrelationId 발급.
     *
     * <p>형식: {@code workflow-{entityId}-{uuid}}</p>
     *
     * @param entityId 워크플로 대상 엔티티
     * @return 새로 발급된 CorrelationId
     * @throws IllegalArgumentException entityId가 null인 경우
     */
    public static CorrelationId newFor(EntityId entityId) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        return new CorrelationId("workflow-" + entityId.getValue() + "-" + UUID.randomUUID());
    }

    /**
     * CorrelationId 값 조회.
     *
     * @return CorrelationId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorrelationId that = (CorrelationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CorrelationId{" + value + '}';
    }
}
