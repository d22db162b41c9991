package com.ryuqq.fleetflow.core.model;

import java.util.UUID;

/**
 * 메시지의 전역 고유 식별자.
 *
 * <p>버스에 게시되는 모든 메시지는 고유한 MessageId를 가지며, 한 번 발급된 값은
 * 재사용되지 않습니다. 요청-응답 상관관계(reply-to)와 데드라인 추적의 키로 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class MessageId {

    private static final String PREFIX = "msg-";

    private final String value;

    private MessageId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MessageId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("MessageId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("MessageId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * MessageId 생성.
     *
     * @param value MessageId 값
     * @return MessageId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static MessageId of(String value) {
        return new MessageId(value);
    }

    /**
     * 새 MessageId 발급 (UUID 기반).
     *
     * @return 새로 발급된 MessageId
     */
    public static MessageId generate() {
        return new MessageId(PREFIX + UUID.randomUUID());
    }

    /**
     * MessageId 값 조회.
     *
     * @return MessageId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageId that = (MessageId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "MessageId{" + value + '}';
    }
}
