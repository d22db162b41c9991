/**
 * 판단 규칙과 재시도 라우팅 정책.
 *
 * <p>{@link com.ryuqq.fleetflow.application.policy.DecisionPolicy}는 단계 결과를 전이로 바꾸고,
 * {@link com.ryuqq.fleetflow.application.policy.FallbackRouter}는 재발행 요청의 채널을 고릅니다.
 * 둘 다 오케스트레이터 생성 시 주입합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.fleetflow.application.policy;
