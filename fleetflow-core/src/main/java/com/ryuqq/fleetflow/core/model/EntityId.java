package com.ryuqq.fleetflow.core.model;

/**
 * 워크플로 추적 대상 엔티티 식별자 (예: 차량 VIN, 작업 ID).
 *
 * <p>엔티티당 동시에 살아있는 워크플로는 최대 하나이며, EntityId가 그 키입니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class EntityId {

    private final String value;

    private EntityId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EntityId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("EntityId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9.\\-_]+$")) {
            throw new IllegalArgumentException("EntityId contains invalid characters. Only alphanumeric, dot, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * EntityId 생성.
     *
     * @param value EntityId 값
     * @return EntityId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EntityId of(String value) {
        return new EntityId(value);
    }

    /**
     * EntityId 값 조회.
     *
     * @return EntityId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityId entityId = (EntityId) o;
        return value.equals(entityId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EntityId{" + value + '}';
    }
}
