package com.ryuqq.fleetflow.adapter.runner;

/**
 * StalenessReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 점검 주기 (기본 1000ms)</li>
 *   <li>timeoutThresholdMs: 워크플로 정체 임계값 (기본 300000ms = 5분)</li>
 *   <li>batchSize: 한 번의 점검에서 실패 처리할 최대 워크플로 수 (기본 100)</li>
 * </ul>
 *
 * <p><strong>임계값 설정 가이드:</strong> 가장 긴 단계 데드라인보다 길게 잡아야 합니다.
 * 그렇지 않으면 데드라인 만료보다 정체 점검이 먼저 워크플로를 실패 처리합니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 * @param scanIntervalMs 점검 주기 (밀리초, 양수여야 함)
 * @param timeoutThresholdMs 정체 임계값 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record ReaperConfig(
    long scanIntervalMs,
    long timeoutThresholdMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=1000ms, timeoutThresholdMs=300000ms (5분), batchSize=100</p>
     */
    public ReaperConfig() {
        this(1_000, 300_000, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (timeoutThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutThresholdMs must be positive (current: " + timeoutThresholdMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReaperConfig(scanIntervalMs, timeoutThresholdMs, batchSize);
    }

    /**
     * timeoutThresholdMs만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withTimeoutThresholdMs(long timeoutThresholdMs) {
        return new ReaperConfig(scanIntervalMs, timeoutThresholdMs, batchSize);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withBatchSize(int batchSize) {
        return new ReaperConfig(scanIntervalMs, timeoutThresholdMs, batchSize);
    }
}
