package com.ryuqq.fleetflow.core.model;

/**
 * 수집 소스에서 가져온 작업 입력 한 건.
 *
 * @param entityId 대상 엔티티
 * @param payload 입력 데이터 (예: 텔레메트리 스냅샷)
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public record IngestionRecord(
    EntityId entityId,
    Payload payload
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException entityId가 null인 경우
     */
    public IngestionRecord {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        if (payload == null) {
            payload = Payload.empty();
        }
    }

    /**
     * IngestionRecord 생성.
     *
     * @param entityId 엔티티 ID 값
     * @param payload 입력 데이터
     * @return 생성된 IngestionRecord
     */
    public static IngestionRecord of(String entityId, Payload payload) {
        return new IngestionRecord(EntityId.of(entityId), payload);
    }
}
