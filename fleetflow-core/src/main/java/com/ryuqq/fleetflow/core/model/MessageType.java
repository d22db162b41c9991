package com.ryuqq.fleetflow.core.model;

/**
 * 버스 메시지 타입 (닫힌 열거형).
 *
 * <p>메시지 소비 지점에서 {@code switch}로 전수 매칭되므로 새 타입 추가 시
 * 컴파일러가 누락된 분기를 알려줍니다.</p>
 *
 * <p>{@link #SCHEMA_VERSION}은 타입 집합이 바뀔 때 올립니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public enum MessageType {

    ANALYSIS_REQUEST,
    ANALYSIS_RESULT,
    ENGAGEMENT_REQUEST,
    ENGAGEMENT_RESULT,
    SCHEDULING_REQUEST,
    SCHEDULING_RESULT,
    SERVICE_COMPLETION,
    FEEDBACK_REQUEST,
    FEEDBACK_RESULT,
    QUALITY_INSIGHT,
    ERROR,
    TIMEOUT;

    /**
     * 메시지 타입 집합의 스키마 버전.
     */
    public static final int SCHEMA_VERSION = 1;

    /**
     * 협력 컴포넌트가 보내는 결과 타입인지 확인.
     *
     * @return 결과 타입이면 true
     */
    public boolean isResult() {
        return switch (this) {
            case ANALYSIS_RESULT, ENGAGEMENT_RESULT, SCHEDULING_RESULT, FEEDBACK_RESULT -> true;
            default -> false;
        };
    }
}
