package com.ryuqq.fleetflow.adapter.runner;

import com.ryuqq.fleetflow.core.model.IngestionRecord;
import com.ryuqq.fleetflow.core.spi.IngestionException;
import com.ryuqq.fleetflow.core.spi.IngestionSource;
import com.ryuqq.fleetflow.core.spi.MessageBusUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 입력 수집 작업.
 *
 * <p>한 주기마다 수집 원천에서 최대 batchSize개의 입력을 가져와 {@link WorkflowCoordinator}에 전달합니다.</p>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>수집 원천 오류: 로깅 후 집계하고 다음 주기에 다시 시도</li>
 *   <li>개별 입력 처리 오류: 로깅 후 나머지 입력 계속 처리</li>
 *   <li>{@link MessageBusUnavailableException}: 치명적 오류이므로 호출자에게 전파</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class IngestionWorker {

    private static final Logger log = LoggerFactory.getLogger(IngestionWorker.class);

    private final IngestionSource source;
    private final WorkflowCoordinator coordinator;
    private final WorkflowRegistry registry;
    private final int batchSize;

    /**
     * 생성자.
     *
     * @param source 수집 원천
     * @param coordinator 워크플로 조정자
     * @param registry 통계 집계용 워크플로 집합
     * @param batchSize 주기당 최대 입력 수
     * @throws IllegalArgumentException 의존성이 null이거나 batchSize가 양수가 아닌 경우
     */
    public IngestionWorker(IngestionSource source, WorkflowCoordinator coordinator,
                           WorkflowRegistry registry, int batchSize) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        this.source = source;
        this.coordinator = coordinator;
        this.registry = registry;
        this.batchSize = batchSize;
    }

    /**
     * 수집 1주기 실행.
     *
     * @return 반영된 입력 수
     * @throws MessageBusUnavailableException 버스가 요청을 받지 못한 경우
     */
    public int runCycle() {
        List<IngestionRecord> batch;
        try {
            batch = source.poll(batchSize);
        } catch (IngestionException e) {
            registry.recordIngestionFailure();
            log.warn("Ingestion source failed, retrying next cycle: {}", e.getMessage(), e);
            return 0;
        } catch (RuntimeException e) {
            registry.recordIngestionFailure();
            log.error("Unexpected ingestion source failure, retrying next cycle", e);
            return 0;
        }
        if (batch == null || batch.isEmpty()) {
            return 0;
        }

        int admitted = 0;
        for (IngestionRecord record : batch) {
            if (tryAdmit(record)) {
                admitted++;
            }
        }
        log.debug("Ingestion cycle admitted {} of {} records", admitted, batch.size());
        return admitted;
    }

    private boolean tryAdmit(IngestionRecord record) {
        try {
            coordinator.admit(record);
            return true;
        } catch (MessageBusUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to admit input for {}", record == null ? null : record.entityId(), e);
            return false;
        }
    }
}
