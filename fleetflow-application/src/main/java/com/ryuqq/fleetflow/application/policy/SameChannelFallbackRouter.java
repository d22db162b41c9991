package com.ryuqq.fleetflow.application.policy;

import com.ryuqq.fleetflow.core.contract.Channel;
import com.ryuqq.fleetflow.core.contract.Stage;

/**
 * 재시도 요청도 원래 단계 채널로 보내는 기본 라우터.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class SameChannelFallbackRouter implements FallbackRouter {

    @Override
    public Channel requestChannel(Stage stage, int retryCount) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        return stage.requestChannel();
    }
}
