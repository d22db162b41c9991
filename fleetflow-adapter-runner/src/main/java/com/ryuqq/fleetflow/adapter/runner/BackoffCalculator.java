package com.ryuqq.fleetflow.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 재시도 재시작 지연 계산기 (Exponential Backoff with Jitter).
 *
 * <p>ERROR에서 IDLE로 재진입한 워크플로가 분석 단계를 다시 요청하기 전까지의 대기 시간을
 * 계산합니다. Jitter로 여러 워크플로가 동시에 재시작하는 것을 분산시킵니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(retryCount-1), maxDelay)
 * delay = min(exponential + random(0, exponential * jitterFactor), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>retryCount=1: 1000-1100ms</li>
 *   <li>retryCount=2: 2000-2200ms</li>
 *   <li>retryCount=3: 4000-4400ms</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=1000ms, maxDelay=30000ms, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(1_000, 30_000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 첫 재시도 지연 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자 지정 생성 (테스트용).
     *
     * @param random [0.0, 1.0) 범위 난수 공급자
     */
    BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시작 지연 계산.
     *
     * @param retryCount 워크플로의 현재 재시도 횟수 (1부터 시작)
     * @return 재시작 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException retryCount가 양수가 아닌 경우
     */
    public long delayBeforeRetry(int retryCount) {
        if (retryCount <= 0) {
            throw new IllegalArgumentException(
                "retryCount must be positive (current: " + retryCount + ")"
            );
        }
        // 시프트 overflow 방지: 62 이상이면 어차피 maxDelay
        int shift = Math.min(retryCount - 1, 62);
        long exponential = baseDelayMs > (maxDelayMs >> shift)
            ? maxDelayMs
            : Math.min(baseDelayMs << shift, maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
