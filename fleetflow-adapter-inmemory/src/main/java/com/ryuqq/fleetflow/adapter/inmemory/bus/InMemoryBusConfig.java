package com.ryuqq.fleetflow.adapter.inmemory.bus;

/**
 * InMemoryMessageBus 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>dispatchThreads: 디스패치 스레드 수 (기본 4)</li>
 *   <li>maxQueueDepth: 구독자별 메일박스 최대 크기 (기본 10000)</li>
 *   <li>auditLogCapacity: 감사 로그 최대 보관 건수 (기본 100000, 초과 시 절반으로 정리)</li>
 *   <li>stopTimeoutMs: 정지 시 버퍼된 메시지 전달 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 * @param dispatchThreads 디스패치 스레드 수 (1 이상)
 * @param maxQueueDepth 메일박스 최대 크기 (1 이상)
 * @param auditLogCapacity 감사 로그 최대 건수 (2 이상)
 * @param stopTimeoutMs 정지 대기 시간 (밀리초, 0 이상)
 */
public record InMemoryBusConfig(
    int dispatchThreads,
    int maxQueueDepth,
    int auditLogCapacity,
    long stopTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     */
    public InMemoryBusConfig() {
        this(4, 10_000, 100_000, 5_000L);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public InMemoryBusConfig {
        if (dispatchThreads <= 0) {
            throw new IllegalArgumentException(
                "dispatchThreads must be positive (current: " + dispatchThreads + ")"
            );
        }
        if (maxQueueDepth <= 0) {
            throw new IllegalArgumentException(
                "maxQueueDepth must be positive (current: " + maxQueueDepth + ")"
            );
        }
        if (auditLogCapacity < 2) {
            throw new IllegalArgumentException(
                "auditLogCapacity must be at least 2 (current: " + auditLogCapacity + ")"
            );
        }
        if (stopTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "stopTimeoutMs must be non-negative (current: " + stopTimeoutMs + ")"
            );
        }
    }

    public InMemoryBusConfig withDispatchThreads(int dispatchThreads) {
        return new InMemoryBusConfig(dispatchThreads, maxQueueDepth, auditLogCapacity, stopTimeoutMs);
    }

    public InMemoryBusConfig withMaxQueueDepth(int maxQueueDepth) {
        return new InMemoryBusConfig(dispatchThreads, maxQueueDepth, auditLogCapacity, stopTimeoutMs);
    }

    public InMemoryBusConfig withAuditLogCapacity(int auditLogCapacity) {
        return new InMemoryBusConfig(dispatchThreads, maxQueueDepth, auditLogCapacity, stopTimeoutMs);
    }

    public InMemoryBusConfig withStopTimeoutMs(long stopTimeoutMs) {
        return new InMemoryBusConfig(dispatchThreads, maxQueueDepth, auditLogCapacity, stopTimeoutMs);
    }
}
