package com.ryuqq.fleetflow.adapter.runner;

import com.ryuqq.fleetflow.application.orchestrator.OrchestratorStatistics;
import com.ryuqq.fleetflow.application.orchestrator.WorkflowStatus;
import com.ryuqq.fleetflow.core.model.CorrelationId;
import com.ryuqq.fleetflow.core.model.EntityId;
import com.ryuqq.fleetflow.core.statemachine.WorkflowState;
import com.ryuqq.fleetflow.core.workflow.Workflow;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 라이브 워크플로 집합과 처리 통계.
 *
 * <p><strong>불변식:</strong> 엔티티당 라이브 워크플로는 최대 1개입니다.
 * 생성과 제거는 {@link ConcurrentHashMap}의 원자 연산으로만 이루어지므로
 * 서로 다른 엔티티의 처리는 서로를 막지 않습니다.</p>
 *
 * <p>종료된 워크플로는 라이브 집합에서 제거된 뒤 상태 조회를 위해
 * 최근 {@code retiredCapacity}개까지 보관됩니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class WorkflowRegistry {

    private final int maxRetries;
    private final int retiredCapacity;

    private final ConcurrentHashMap<EntityId, Workflow> live = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CorrelationId, Workflow> byCorrelation = new ConcurrentHashMap<>();
    private final Map<EntityId, Workflow> retired;

    private final AtomicLong ingested = new AtomicLong();
    private final AtomicLong created = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong errored = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong staleDropped = new AtomicLong();
    private final AtomicLong ingestionFailures = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();

    /**
     * 생성자.
     *
     * @param maxRetries 새 워크플로의 최대 재시도 횟수
     * @param retiredCapacity 보관할 종료 워크플로 수
     */
    public WorkflowRegistry(int maxRetries, int retiredCapacity) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        if (retiredCapacity < 0) {
            throw new IllegalArgumentException(
                "retiredCapacity must be non-negative (current: " + retiredCapacity + ")");
        }
        this.maxRetries = maxRetries;
        this.retiredCapacity = retiredCapacity;
        this.retired = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<EntityId, Workflow> eldest) {
                return size() > WorkflowRegistry.this.retiredCapacity;
            }
        };
    }

    /**
     * 엔티티의 라이브 워크플로 조회, 없으면 생성.
     *
     * @param entityId 엔티티 ID
     * @param now 생성 시각
     * @return 라이브 워크플로
     */
    public Workflow getOrCreate(EntityId entityId, long now) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        AtomicBoolean fresh = new AtomicBoolean(false);
        Workflow workflow = live.computeIfAbsent(entityId, id -> {
            fresh.set(true);
            return Workflow.create(id, maxRetries, now);
        });
        if (fresh.get()) {
            byCorrelation.put(workflow.getCorrelationId(), workflow);
            created.incrementAndGet();
        }
        return workflow;
    }

    public Optional<Workflow> findLive(EntityId entityId) {
        return Optional.ofNullable(live.get(entityId));
    }

    public Optional<Workflow> findByCorrelation(CorrelationId correlationId) {
        if (correlationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byCorrelation.get(correlationId));
    }

    /**
     * 종료된 워크플로를 라이브 집합에서 제거하고 보관.
     *
     * <p>호출자는 워크플로 락을 잡은 상태여야 합니다.</p>
     *
     * @param workflow 종료 상태의 워크플로
     * @throws IllegalStateException 워크플로가 종료 상태가 아닌 경우
     */
    public void retire(Workflow workflow) {
        workflow.retire();
        live.remove(workflow.getEntityId(), workflow);
        byCorrelation.remove(workflow.getCorrelationId(), workflow);
        if (retiredCapacity > 0) {
            synchronized (retired) {
                retired.remove(workflow.getEntityId());
                retired.put(workflow.getEntityId(), workflow);
            }
        }
    }

    /**
     * 상태 조회 (라이브 우선, 없으면 보관된 종료 워크플로).
     */
    public Optional<WorkflowStatus> status(EntityId entityId) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        Workflow workflow = live.get(entityId);
        if (workflow == null) {
            synchronized (retired) {
                workflow = retired.get(entityId);
            }
        }
        return Optional.ofNullable(workflow).map(WorkflowStatus::from);
    }

    /**
     * 라이브 워크플로 스냅샷 (약한 일관성).
     */
    public List<Workflow> liveWorkflows() {
        return new ArrayList<>(live.values());
    }

    public int liveCount() {
        return live.size();
    }

    public OrchestratorStatistics statistics() {
        Map<WorkflowState, Integer> counts = new EnumMap<>(WorkflowState.class);
        for (Workflow workflow : live.values()) {
            counts.merge(workflow.getState(), 1, Integer::sum);
        }
        return new OrchestratorStatistics(
            counts,
            ingested.get(),
            completed.get(),
            errored.get(),
            created.get(),
            retries.get(),
            staleDropped.get(),
            ingestionFailures.get(),
            timeouts.get()
        );
    }

    void recordIngested() {
        ingested.incrementAndGet();
    }

    void recordCompleted() {
        completed.incrementAndGet();
    }

    void recordErrored() {
        errored.incrementAndGet();
    }

    void recordRetry() {
        retries.incrementAndGet();
    }

    void recordStaleDropped() {
        staleDropped.incrementAndGet();
    }

    void recordIngestionFailure() {
        ingestionFailures.incrementAndGet();
    }

    void recordTimeout() {
        timeouts.incrementAndGet();
    }
}
