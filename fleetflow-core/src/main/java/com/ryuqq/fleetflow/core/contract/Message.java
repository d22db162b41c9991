package com.ryuqq.fleetflow.core.contract;

import com.ryuqq.fleetflow.core.model.CorrelationId;
import com.ryuqq.fleetflow.core.model.MessageId;
import com.ryuqq.fleetflow.core.model.MessageType;
import com.ryuqq.fleetflow.core.model.Payload;
import com.ryuqq.fleetflow.core.model.Priority;

/**
 * 버스로 전달되는 불변 메시지 봉투.
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>messageId:</strong> 전역 고유 식별자 (재사용 불가)</li>
 *   <li><strong>correlationId:</strong> 워크플로 단위 추적 식별자</li>
 *   <li><strong>createdAt:</strong> 생성 시각 (epoch milliseconds)</li>
 *   <li><strong>sender / receiver:</strong> 발신자, 수신자 (receiver가 null이면 채널 브로드캐스트)</li>
 *   <li><strong>type / priority:</strong> 메시지 타입, 우선순위</li>
 *   <li><strong>replyTo:</strong> 응답 대상 요청의 messageId (요청이면 null)</li>
 *   <li><strong>ttlMs:</strong> 유효 시간 (밀리초)</li>
 *   <li><strong>payload:</strong> 업무 데이터</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * // 요청 생성
 * Message request = Message.create(correlationId, "orchestrator", "analysis_agent",
 *     MessageType.ANALYSIS_REQUEST, Priority.NORMAL, payload);
 *
 * // 협력 컴포넌트의 응답
 * Message result = Message.reply(request, "analysis_agent", MessageType.ANALYSIS_RESULT, resultPayload);
 * </pre>
 *
 * @param messageId 메시지 고유 식별자
 * @param correlationId 워크플로 상관관계 식별자
 * @param createdAt 생성 시각 (epoch millis)
 * @param sender 발신자
 * @param receiver 수신자 (null이면 브로드캐스트)
 * @param type 메시지 타입
 * @param priority 우선순위
 * @param replyTo 응답 대상 요청 ID (nullable)
 * @param ttlMs 유효 시간 (밀리초)
 * @param payload 업무 데이터
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public record Message(
    MessageId messageId,
    CorrelationId correlationId,
    long createdAt,
    String sender,
    String receiver,
    MessageType type,
    Priority priority,
    MessageId replyTo,
    long ttlMs,
    Payload payload
) {

    /**
     * 기본 유효 시간: 300초.
     */
    public static final long DEFAULT_TTL_MS = 300_000L;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 시간 값이 유효하지 않은 경우
     */
    public Message {
        if (messageId == null) {
            throw new IllegalArgumentException("messageId cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        if (createdAt < 0) {
            throw new IllegalArgumentException("createdAt must be non-negative (current: " + createdAt + ")");
        }
        if (sender == null || sender.isBlank()) {
            throw new IllegalArgumentException("sender cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive (current: " + ttlMs + ")");
        }
        if (payload == null) {
            payload = Payload.empty();
        }
    }

    /**
     * 새 메시지 생성 (현재 시각, 새 MessageId, 기본 TTL).
     *
     * @param correlationId 워크플로 상관관계 식별자
     * @param sender 발신자
     * @param receiver 수신자 (null이면 브로드캐스트)
     * @param type 메시지 타입
     * @param priority 우선순위
     * @param payload 업무 데이터
     * @return 생성된 Message
     */
    public static Message create(CorrelationId correlationId, String sender, String receiver,
                                 MessageType type, Priority priority, Payload payload) {
        return new Message(MessageId.generate(), correlationId, System.currentTimeMillis(),
            sender, receiver, type, priority, null, DEFAULT_TTL_MS, payload);
    }

    /**
     * 요청에 대한 응답 메시지 생성.
     *
     * <p>correlationId와 priority는 요청에서 물려받고, receiver는 요청의 sender,
     * replyTo는 요청의 messageId가 됩니다.</p>
     *
     * @param request 원본 요청
     * @param sender 응답 발신자
     * @param type 응답 타입
     * @param payload 응답 데이터
     * @return 응답 Message
     * @throws IllegalArgumentException request가 null인 경우
     */
    public static Message reply(Message request, String sender, MessageType type, Payload payload) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return new Message(MessageId.generate(), request.correlationId(), System.currentTimeMillis(),
            sender, request.sender(), type, request.priority(), request.messageId(),
            DEFAULT_TTL_MS, payload);
    }

    /**
     * TTL만 변경한 새 인스턴스 생성 (messageId 유지).
     */
    public Message withTtlMs(long ttlMs) {
        return new Message(messageId, correlationId, createdAt, sender, receiver, type, priority, replyTo, ttlMs, payload);
    }

    /**
     * 브로드캐스트 메시지인지 확인.
     *
     * @return receiver가 지정되지 않았으면 true
     */
    public boolean isBroadcast() {
        return receiver == null || receiver.isBlank();
    }

    /**
     * 응답 메시지인지 확인.
     *
     * @return replyTo가 있으면 true
     */
    public boolean isReply() {
        return replyTo != null;
    }

    /**
     * 만료 시각.
     *
     * @return createdAt + ttlMs (epoch millis)
     */
    public long expiresAt() {
        return createdAt + ttlMs;
    }

    /**
     * 주어진 시각 기준 만료 여부.
     *
     * @param nowMillis 기준 시각 (epoch millis)
     * @return 만료되었으면 true
     */
    public boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAt();
    }
}
