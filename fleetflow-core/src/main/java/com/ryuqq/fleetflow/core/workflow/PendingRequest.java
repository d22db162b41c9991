package com.ryuqq.fleetflow.core.workflow;

import com.ryuqq.fleetflow.core.contract.Stage;
import com.ryuqq.fleetflow.core.model.MessageId;

/**
 * 응답을 기다리는 요청.
 *
 * <p>워크플로당 최대 하나만 존재하며, 응답 메시지의 replyTo가 이 messageId와
 * 일치해야 유효한 결과로 처리됩니다.</p>
 *
 * @param messageId 요청 메시지 ID
 * @param stage 요청 단계
 * @param issuedAt 발행 시각 (epoch millis)
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public record PendingRequest(MessageId messageId, Stage stage, long issuedAt) {

    public PendingRequest {
        if (messageId == null) {
            throw new IllegalArgumentException("messageId cannot be null");
        }
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
    }
}
