package com.ryuqq.fleetflow.adapter.runner;

import com.ryuqq.fleetflow.core.contract.Stage;

/**
 * OrchestrationLoop 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>ingestionIntervalMs: 입력 수집 주기 (기본 1000ms)</li>
 *   <li>ingestionBatchSize: 한 번에 가져올 최대 입력 수 (기본 100)</li>
 *   <li>maxRetries: 워크플로당 최대 재시도 횟수 (기본 3)</li>
 *   <li>analysisDeadlineMs: 분석 응답 데드라인 (기본 60000ms)</li>
 *   <li>engagementDeadlineMs: 응대 응답 데드라인 (기본 30000ms)</li>
 *   <li>schedulingDeadlineMs: 예약 응답 데드라인 (기본 45000ms)</li>
 *   <li>defaultDeadlineMs: 그 밖의 단계 데드라인 (기본 30000ms)</li>
 *   <li>retiredHistoryCapacity: 상태 조회용으로 보관할 종료 워크플로 수 (기본 1000)</li>
 *   <li>senderName: 발행 메시지의 sender (기본 "orchestrator")</li>
 *   <li>reaper: 정체 점검 설정</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 * @param ingestionIntervalMs 수집 주기 (밀리초, 양수)
 * @param ingestionBatchSize 수집 배치 크기 (1 이상)
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param analysisDeadlineMs 분석 데드라인 (밀리초, 양수)
 * @param engagementDeadlineMs 응대 데드라인 (밀리초, 양수)
 * @param schedulingDeadlineMs 예약 데드라인 (밀리초, 양수)
 * @param defaultDeadlineMs 기본 데드라인 (밀리초, 양수)
 * @param retiredHistoryCapacity 종료 워크플로 보관 수 (0 이상)
 * @param senderName 발신자 이름 (공백 불가)
 * @param reaper 정체 점검 설정 (null 불가)
 */
public record OrchestratorConfig(
    long ingestionIntervalMs,
    int ingestionBatchSize,
    int maxRetries,
    long analysisDeadlineMs,
    long engagementDeadlineMs,
    long schedulingDeadlineMs,
    long defaultDeadlineMs,
    int retiredHistoryCapacity,
    String senderName,
    ReaperConfig reaper
) {

    /**
     * 기본 설정 생성자.
     */
    public OrchestratorConfig() {
        this(1_000, 100, 3, 60_000, 30_000, 45_000, 30_000, 1_000, "orchestrator", new ReaperConfig());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        requirePositive("ingestionIntervalMs", ingestionIntervalMs);
        requirePositive("ingestionBatchSize", ingestionBatchSize);
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        requirePositive("analysisDeadlineMs", analysisDeadlineMs);
        requirePositive("engagementDeadlineMs", engagementDeadlineMs);
        requirePositive("schedulingDeadlineMs", schedulingDeadlineMs);
        requirePositive("defaultDeadlineMs", defaultDeadlineMs);
        if (retiredHistoryCapacity < 0) {
            throw new IllegalArgumentException(
                "retiredHistoryCapacity must be non-negative (current: " + retiredHistoryCapacity + ")");
        }
        if (senderName == null || senderName.isBlank()) {
            throw new IllegalArgumentException("senderName cannot be null or blank");
        }
        if (reaper == null) {
            throw new IllegalArgumentException("reaper cannot be null");
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    /**
     * 단계별 응답 데드라인.
     *
     * @param stage 단계
     * @return 데드라인 (밀리초)
     */
    public long deadlineFor(Stage stage) {
        return switch (stage) {
            case ANALYSIS -> analysisDeadlineMs;
            case ENGAGEMENT -> engagementDeadlineMs;
            case SCHEDULING -> schedulingDeadlineMs;
            case FEEDBACK -> defaultDeadlineMs;
        };
    }

    public OrchestratorConfig withIngestionIntervalMs(long ingestionIntervalMs) {
        return new OrchestratorConfig(ingestionIntervalMs, ingestionBatchSize, maxRetries, analysisDeadlineMs,
            engagementDeadlineMs, schedulingDeadlineMs, defaultDeadlineMs, retiredHistoryCapacity, senderName, reaper);
    }

    public OrchestratorConfig withIngestionBatchSize(int ingestionBatchSize) {
        return new OrchestratorConfig(ingestionIntervalMs, ingestionBatchSize, maxRetries, analysisDeadlineMs,
            engagementDeadlineMs, schedulingDeadlineMs, defaultDeadlineMs, retiredHistoryCapacity, senderName, reaper);
    }

    public OrchestratorConfig withMaxRetries(int maxRetries) {
        return new OrchestratorConfig(ingestionIntervalMs, ingestionBatchSize, maxRetries, analysisDeadlineMs,
            engagementDeadlineMs, schedulingDeadlineMs, defaultDeadlineMs, retiredHistoryCapacity, senderName, reaper);
    }

    /**
     * 모든 단계 데드라인을 같은 값으로 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withAllDeadlinesMs(long deadlineMs) {
        return new OrchestratorConfig(ingestionIntervalMs, ingestionBatchSize, maxRetries, deadlineMs,
            deadlineMs, deadlineMs, deadlineMs, retiredHistoryCapacity, senderName, reaper);
    }

    public OrchestratorConfig withSchedulingDeadlineMs(long schedulingDeadlineMs) {
        return new OrchestratorConfig(ingestionIntervalMs, ingestionBatchSize, maxRetries, analysisDeadlineMs,
            engagementDeadlineMs, schedulingDeadlineMs, defaultDeadlineMs, retiredHistoryCapacity, senderName, reaper);
    }

    public OrchestratorConfig withRetiredHistoryCapacity(int retiredHistoryCapacity) {
        return new OrchestratorConfig(ingestionIntervalMs, ingestionBatchSize, maxRetries, analysisDeadlineMs,
            engagementDeadlineMs, schedulingDeadlineMs, defaultDeadlineMs, retiredHistoryCapacity, senderName, reaper);
    }

    public OrchestratorConfig withReaper(ReaperConfig reaper) {
        return new OrchestratorConfig(ingestionIntervalMs, ingestionBatchSize, maxRetries, analysisDeadlineMs,
            engagementDeadlineMs, schedulingDeadlineMs, defaultDeadlineMs, retiredHistoryCapacity, senderName, reaper);
    }
}
