package com.ryuqq.fleetflow.application.policy;

import com.ryuqq.fleetflow.core.contract.Channel;
import com.ryuqq.fleetflow.core.contract.Stage;

/**
 * 재시도 시 요청을 보낼 채널을 결정.
 *
 * <p>대체 협력 컴포넌트로 요청을 돌리고 싶을 때 구현합니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FallbackRouter {

    /**
     * 재발행 요청 채널.
     *
     * @param stage 재발행 단계
     * @param retryCount 현재 재시도 횟수 (1부터)
     * @return 요청을 게시할 채널
     */
    Channel requestChannel(Stage stage, int retryCount);
}
