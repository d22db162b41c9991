package com.ryuqq.fleetflow.adapter.runner;

import com.ryuqq.fleetflow.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.fleetflow.adapter.inmemory.concurrent.NamedThreadFactory;
import com.ryuqq.fleetflow.adapter.inmemory.timeout.ScheduledDeadlineManager;
import com.ryuqq.fleetflow.application.orchestrator.OrchestratorStatistics;
import com.ryuqq.fleetflow.application.orchestrator.WorkflowOrchestrator;
import com.ryuqq.fleetflow.application.orchestrator.WorkflowStatus;
import com.ryuqq.fleetflow.application.policy.DecisionPolicy;
import com.ryuqq.fleetflow.application.policy.FallbackRouter;
import com.ryuqq.fleetflow.application.policy.SameChannelFallbackRouter;
import com.ryuqq.fleetflow.core.model.EntityId;
import com.ryuqq.fleetflow.core.spi.DeadlineManager;
import com.ryuqq.fleetflow.core.spi.IngestionSource;
import com.ryuqq.fleetflow.core.spi.MessageBus;
import com.ryuqq.fleetflow.core.spi.MessageBusUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestration Loop 구현체.
 *
 * <p>메시지 버스, 데드라인 관리자, 워크플로 집합을 묶어 하나의 오케스트레이터로 동작합니다.</p>
 *
 * <p><strong>작업 구성:</strong></p>
 * <ul>
 *   <li>입력 수집: ingestionIntervalMs 주기로 {@link IngestionWorker#runCycle()}</li>
 *   <li>결과 처리: 버스 전달 스레드에서 {@link ResultProcessor}</li>
 *   <li>정체 점검: reaper.scanIntervalMs 주기로 {@link StalenessReaper#scan()}</li>
 *   <li>재시도 재시작: backoff 지연 후 스케줄러에서 실행</li>
 * </ul>
 *
 * <p><strong>생명주기:</strong> NEW → RUNNING → STOPPED. 정지 후 재시작은 허용되지 않습니다.
 * {@link #create(IngestionSource, DecisionPolicy, OrchestratorConfig)}로 생성한 경우
 * 버스와 데드라인 관리자를 소유하므로 start/stop 시 함께 시작/정지합니다.</p>
 *
 * <p><strong>치명적 오류:</strong> 버스가 메시지를 받지 못하면
 * ({@link MessageBusUnavailableException}) ERROR 로그를 남기고 모든 주기 작업을 중단합니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class OrchestrationLoop implements WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationLoop.class);
    private static final long STOP_TIMEOUT_MS = 5_000;

    private enum Lifecycle { NEW, RUNNING, STOPPED }

    private final MessageBus bus;
    private final DeadlineManager deadlines;
    private final boolean ownsInfrastructure;
    private final OrchestratorConfig config;
    private final WorkflowRegistry registry;
    private final WorkflowCoordinator coordinator;
    private final IngestionWorker ingestion;
    private final ResultProcessor results;
    private final StalenessReaper reaper;
    private final ScheduledExecutorService scheduler;

    private final AtomicReference<Lifecycle> lifecycle = new AtomicReference<>(Lifecycle.NEW);
    private final AtomicBoolean halted = new AtomicBoolean(false);
    private final List<ScheduledFuture<?>> duties = new ArrayList<>();

    /**
     * 생성자 (외부 버스/데드라인 관리자 주입).
     *
     * <p>주입된 버스는 호출자가 시작/정지합니다.</p>
     *
     * @param bus 메시지 버스
     * @param deadlines 데드라인 관리자
     * @param source 수집 원천
     * @param policy 결정 정책
     * @param router 재요청 채널 라우터
     * @param config 설정
     * @param backoff 재시작 지연 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OrchestrationLoop(MessageBus bus, DeadlineManager deadlines, IngestionSource source,
                             DecisionPolicy policy, FallbackRouter router, OrchestratorConfig config,
                             BackoffCalculator backoff) {
        this(bus, deadlines, source, policy, router, config, backoff, false);
    }

    private OrchestrationLoop(MessageBus bus, DeadlineManager deadlines, IngestionSource source,
                              DecisionPolicy policy, FallbackRouter router, OrchestratorConfig config,
                              BackoffCalculator backoff, boolean ownsInfrastructure) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (deadlines == null) {
            throw new IllegalArgumentException("deadlines cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.bus = bus;
        this.deadlines = deadlines;
        this.ownsInfrastructure = ownsInfrastructure;
        this.config = config;
        this.scheduler = newScheduler();
        this.registry = new WorkflowRegistry(config.maxRetries(), config.retiredHistoryCapacity());
        this.coordinator = new WorkflowCoordinator(bus, deadlines, registry, policy, router, config, backoff,
            scheduler, System::currentTimeMillis, this::halt);
        this.ingestion = new IngestionWorker(source, coordinator, registry, config.ingestionBatchSize());
        this.results = new ResultProcessor(bus, coordinator, config.senderName());
        this.reaper = new StalenessReaper(registry, coordinator, config.reaper(), System::currentTimeMillis);
    }

    /**
     * 주기 작업과 재시작 타이머용 스케줄러. 종료 시 대기 중인 재시작은 실행하지 않습니다.
     */
    private static ScheduledExecutorService newScheduler() {
        ScheduledThreadPoolExecutor executor =
            new ScheduledThreadPoolExecutor(3, new NamedThreadFactory("fleetflow-orchestrator"));
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * 인메모리 버스와 데드라인 관리자를 소유하는 오케스트레이터 생성.
     *
     * @param source 수집 원천
     * @param policy 결정 정책
     * @param config 설정
     * @return 시작 전 상태의 오케스트레이터
     */
    public static OrchestrationLoop create(IngestionSource source, DecisionPolicy policy, OrchestratorConfig config) {
        return new OrchestrationLoop(new InMemoryMessageBus(), new ScheduledDeadlineManager(), source, policy,
            new SameChannelFallbackRouter(), config, new BackoffCalculator(), true);
    }

    @Override
    public void start() {
        if (!lifecycle.compareAndSet(Lifecycle.NEW, Lifecycle.RUNNING)) {
            throw new IllegalStateException("OrchestrationLoop cannot be started (state: " + lifecycle.get() + ")");
        }
        if (ownsInfrastructure) {
            bus.start();
        }
        results.subscribe();
        synchronized (duties) {
            duties.add(scheduler.scheduleWithFixedDelay(this::runIngestionCycle,
                0, config.ingestionIntervalMs(), TimeUnit.MILLISECONDS));
            duties.add(scheduler.scheduleWithFixedDelay(this::runStalenessSweep,
                config.reaper().scanIntervalMs(), config.reaper().scanIntervalMs(), TimeUnit.MILLISECONDS));
        }
        log.info("OrchestrationLoop started (ingestion every {}ms, sweep every {}ms)",
            config.ingestionIntervalMs(), config.reaper().scanIntervalMs());
    }

    /**
     * 정지.
     *
     * <p>주기 작업을 취소하고 구독을 해제한 뒤 진행 중인 작업이 끝나기를 기다립니다.
     * 시작 전이면 정지 상태로만 전환합니다.</p>
     */
    @Override
    public void stop() {
        Lifecycle previous = lifecycle.getAndSet(Lifecycle.STOPPED);
        if (previous == Lifecycle.STOPPED) {
            return;
        }
        cancelDuties();
        coordinator.deactivate();
        results.unsubscribe();

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        if (ownsInfrastructure) {
            if (previous == Lifecycle.RUNNING) {
                bus.stop();
            }
            deadlines.shutdown();
        }
        log.info("OrchestrationLoop stopped ({} live workflows)", registry.liveCount());
    }

    /**
     * 입력 수집 1주기 실행.
     *
     * @return 반영된 입력 수
     */
    public int runIngestionCycle() {
        if (halted.get()) {
            return 0;
        }
        try {
            return ingestion.runCycle();
        } catch (MessageBusUnavailableException e) {
            halt(e);
        } catch (RuntimeException e) {
            log.error("Ingestion cycle failed", e);
        }
        return 0;
    }

    /**
     * 정체 점검 1회 실행.
     *
     * @return 실패 처리된 워크플로 수
     */
    public int runStalenessSweep() {
        if (halted.get()) {
            return 0;
        }
        try {
            return reaper.scan();
        } catch (MessageBusUnavailableException e) {
            halt(e);
        } catch (RuntimeException e) {
            log.error("Staleness sweep failed", e);
        }
        return 0;
    }

    private void halt(MessageBusUnavailableException cause) {
        if (!halted.compareAndSet(false, true)) {
            return;
        }
        log.error("Message bus unavailable on {}, halting orchestration duties", cause.getChannel(), cause);
        cancelDuties();
        coordinator.deactivate();
    }

    private void cancelDuties() {
        synchronized (duties) {
            for (ScheduledFuture<?> duty : duties) {
                duty.cancel(false);
            }
            duties.clear();
        }
    }

    public boolean isHalted() {
        return halted.get();
    }

    public boolean isRunning() {
        return lifecycle.get() == Lifecycle.RUNNING && !halted.get();
    }

    /**
     * 이 오케스트레이터가 사용하는 메시지 버스.
     *
     * <p>협력 컴포넌트와 모니터링 sink를 연결할 때 사용합니다.</p>
     */
    public MessageBus bus() {
        return bus;
    }

    @Override
    public Optional<WorkflowStatus> getWorkflowStatus(EntityId entityId) {
        return registry.status(entityId);
    }

    @Override
    public OrchestratorStatistics getStatistics() {
        return registry.statistics();
    }
}
