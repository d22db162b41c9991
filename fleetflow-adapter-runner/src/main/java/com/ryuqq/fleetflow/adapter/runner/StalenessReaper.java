package com.ryuqq.fleetflow.adapter.runner;

import com.ryuqq.fleetflow.core.spi.MessageBusUnavailableException;
import com.ryuqq.fleetflow.core.workflow.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.LongSupplier;

/**
 * 정체 워크플로 점검.
 *
 * <p>마지막 갱신 이후 timeoutThreshold가 지난 진행 중 워크플로를 찾아 실패 경로로 보냅니다.
 * 데드라인이 없는 AWAITING_EXTERNAL 상태도 점검 대상입니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 라이브 워크플로 스냅샷에서 정체 후보 선별 (최대 batchSize)
 * 2. 각 후보를 락 안에서 재확인 후 실패 처리
 * 3. 개별 실패는 로깅 후 계속 진행
 * </pre>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class StalenessReaper {

    private static final Logger log = LoggerFactory.getLogger(StalenessReaper.class);

    private final WorkflowRegistry registry;
    private final WorkflowCoordinator coordinator;
    private final ReaperConfig config;
    private final LongSupplier clock;

    /**
     * 생성자.
     *
     * @param registry 워크플로 집합
     * @param coordinator 워크플로 조정자
     * @param config 설정
     * @param clock 현재 시각 공급자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StalenessReaper(WorkflowRegistry registry, WorkflowCoordinator coordinator,
                           ReaperConfig config, LongSupplier clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.coordinator = coordinator;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 정체 워크플로 점검 1회 실행.
     *
     * @return 실패 처리된 워크플로 수
     * @throws MessageBusUnavailableException 버스가 메시지를 받지 못한 경우
     */
    public int scan() {
        long now = clock.getAsLong();
        List<Workflow> stale = registry.liveWorkflows().stream()
            .filter(workflow -> workflow.getState().isActive())
            .filter(workflow -> now - workflow.getLastUpdate() > config.timeoutThresholdMs())
            .limit(config.batchSize())
            .toList();
        if (stale.isEmpty()) {
            return 0;
        }

        int reaped = 0;
        for (Workflow workflow : stale) {
            if (tryReap(workflow)) {
                reaped++;
            }
        }
        log.info("Staleness sweep completed: {} failed out of {} stale", reaped, stale.size());
        return reaped;
    }

    private boolean tryReap(Workflow workflow) {
        try {
            return coordinator.failIfStale(workflow, config.timeoutThresholdMs());
        } catch (MessageBusUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to reap stale workflow {}", workflow.getEntityId(), e);
            return false;
        }
    }
}
