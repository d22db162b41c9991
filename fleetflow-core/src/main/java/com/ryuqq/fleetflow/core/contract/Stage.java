package com.ryuqq.fleetflow.core.contract;

import com.ryuqq.fleetflow.core.model.MessageType;

/**
 * 협력 컴포넌트에 위임되는 처리 단계.
 *
 * <p>각 단계는 요청/결과 채널 쌍, 메시지 타입 쌍, 수신자 이름을 묶습니다.
 * 결과 payload는 워크플로 컨텍스트에 {@link #contextKey()} 이름으로 저장됩니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public enum Stage {

    ANALYSIS("analysis", "analysis_agent",
        Channel.ANALYSIS_REQUEST, Channel.ANALYSIS_RESULT,
        MessageType.ANALYSIS_REQUEST, MessageType.ANALYSIS_RESULT),

    ENGAGEMENT("engagement", "engagement_agent",
        Channel.ENGAGEMENT_REQUEST, Channel.ENGAGEMENT_RESULT,
        MessageType.ENGAGEMENT_REQUEST, MessageType.ENGAGEMENT_RESULT),

    SCHEDULING("scheduling", "scheduling_agent",
        Channel.SCHEDULING_REQUEST, Channel.SCHEDULING_RESULT,
        MessageType.SCHEDULING_REQUEST, MessageType.SCHEDULING_RESULT),

    FEEDBACK("feedback", "feedback_agent",
        Channel.FEEDBACK_REQUEST, Channel.FEEDBACK_RESULT,
        MessageType.FEEDBACK_REQUEST, MessageType.FEEDBACK_RESULT);

    private final String contextKey;
    private final String collaborator;
    private final Channel requestChannel;
    private final Channel resultChannel;
    private final MessageType requestType;
    private final MessageType resultType;

    Stage(String contextKey, String collaborator,
          Channel requestChannel, Channel resultChannel,
          MessageType requestType, MessageType resultType) {
        this.contextKey = contextKey;
        this.collaborator = collaborator;
        this.requestChannel = requestChannel;
        this.resultChannel = resultChannel;
        this.requestType = requestType;
        this.resultType = resultType;
    }

    public String contextKey() {
        return contextKey;
    }

    public String collaborator() {
        return collaborator;
    }

    public Channel requestChannel() {
        return requestChannel;
    }

    public Channel resultChannel() {
        return resultChannel;
    }

    public MessageType requestType() {
        return requestType;
    }

    public MessageType resultType() {
        return resultType;
    }
}
