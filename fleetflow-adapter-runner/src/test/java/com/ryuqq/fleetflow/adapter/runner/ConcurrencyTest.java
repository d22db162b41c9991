package com.ryuqq.fleetflow.adapter.runner;

import com.ryuqq.fleetflow.application.policy.SameChannelFallbackRouter;
import com.ryuqq.fleetflow.application.policy.ThresholdDecisionPolicy;
import com.ryuqq.fleetflow.core.contract.Channel;
import com.ryuqq.fleetflow.core.contract.Message;
import com.ryuqq.fleetflow.core.contract.Stage;
import com.ryuqq.fleetflow.core.model.EntityId;
import com.ryuqq.fleetflow.core.model.IngestionRecord;
import com.ryuqq.fleetflow.core.model.MessageType;
import com.ryuqq.fleetflow.core.model.Payload;
import com.ryuqq.fleetflow.core.spi.DeadlineManager;
import com.ryuqq.fleetflow.core.spi.MessageBus;
import com.ryuqq.fleetflow.core.statemachine.WorkflowState;
import com.ryuqq.fleetflow.core.workflow.Workflow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 동시성 통합 테스트.
 *
 * <p>WorkflowCoordinator의 동시 접근 처리를 검증합니다:</p>
 * <ul>
 *   <li>같은 엔티티 동시 입력 시 라이브 워크플로 1개</li>
 *   <li>서로 다른 엔티티의 동시 입력은 각각 독립 워크플로</li>
 *   <li>같은 결과의 동시 전달 시 한 번만 적용</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ConcurrencyTest {

    private static final int THREADS = 16;

    @Mock
    private MessageBus bus;

    @Mock
    private DeadlineManager deadlines;

    @Mock
    private ScheduledExecutorService restartScheduler;

    private WorkflowRegistry registry;
    private WorkflowCoordinator coordinator;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        registry = new WorkflowRegistry(3, 100);
        coordinator = new WorkflowCoordinator(bus, deadlines, registry, new ThresholdDecisionPolicy(),
            new SameChannelFallbackRouter(), new OrchestratorConfig(), new BackoffCalculator(),
            restartScheduler, System::currentTimeMillis, e -> { });
        when(bus.publish(any(), any())).thenReturn(true);
        pool = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private void runConcurrently(List<Runnable> tasks) throws Exception {
        CountDownLatch ready = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (Runnable task : tasks) {
            futures.add(pool.submit(() -> {
                ready.await();
                task.run();
                return null;
            }));
        }
        ready.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void 같은_엔티티_동시_입력시_라이브_워크플로는_하나() throws Exception {
        // given
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            int seq = i;
            tasks.add(() -> coordinator.admit(IngestionRecord.of("vehicle-1", Payload.of(Map.of("seq", seq)))));
        }

        // when
        runConcurrently(tasks);

        // then
        assertThat(registry.liveCount()).isEqualTo(1);
        assertThat(registry.statistics().workflowsCreated()).isEqualTo(1);
        verify(bus, times(1)).publish(eq(Channel.ANALYSIS_REQUEST), any());

        Workflow workflow = registry.findLive(EntityId.of("vehicle-1")).orElseThrow();
        assertThat(workflow.getMergedInputCount()).isEqualTo(THREADS - 1);
        assertThat(workflow.getState()).isEqualTo(WorkflowState.ANALYZING);
    }

    @Test
    void 서로_다른_엔티티_동시_입력은_각각_워크플로_생성() throws Exception {
        // given
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            String entityId = "vehicle-" + i;
            tasks.add(() -> coordinator.admit(IngestionRecord.of(entityId, Payload.empty())));
        }

        // when
        runConcurrently(tasks);

        // then
        assertThat(registry.liveCount()).isEqualTo(THREADS);
        assertThat(registry.statistics().countIn(WorkflowState.ANALYZING)).isEqualTo(THREADS);
        verify(bus, times(THREADS)).publish(eq(Channel.ANALYSIS_REQUEST), any());
    }

    @Test
    void 같은_결과_동시_전달시_한_번만_적용() throws Exception {
        // given
        coordinator.admit(IngestionRecord.of("vehicle-1", Payload.empty()));
        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(bus, atLeastOnce()).publish(eq(Channel.ANALYSIS_REQUEST), captor.capture());
        Message request = captor.getValue();
        when(deadlines.acknowledge(request.messageId())).thenReturn(true);

        Message reply = Message.reply(request, "analysis_agent", MessageType.ANALYSIS_RESULT,
            Payload.of(Map.of(ThresholdDecisionPolicy.DAYS_TO_FAILURE_KEY, 0.5)));
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            tasks.add(() -> coordinator.onResult(reply, Stage.ANALYSIS));
        }

        // when
        runConcurrently(tasks);

        // then
        verify(bus, times(1)).publish(eq(Channel.ENGAGEMENT_REQUEST), any());
        assertThat(registry.statistics().staleResultsDropped()).isEqualTo(THREADS - 1);
        assertThat(registry.findLive(EntityId.of("vehicle-1")).orElseThrow().getState())
            .isEqualTo(WorkflowState.ENGAGING);
    }
}
