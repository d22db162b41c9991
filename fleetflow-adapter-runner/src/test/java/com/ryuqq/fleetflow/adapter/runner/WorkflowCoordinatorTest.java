package com.ryuqq.fleetflow.adapter.runner;

import com.ryuqq.fleetflow.application.orchestrator.WorkflowStatus;
import com.ryuqq.fleetflow.application.policy.FallbackRouter;
import com.ryuqq.fleetflow.application.policy.ThresholdDecisionPolicy;
import com.ryuqq.fleetflow.core.contract.Channel;
import com.ryuqq.fleetflow.core.contract.Message;
import com.ryuqq.fleetflow.core.contract.Stage;
import com.ryuqq.fleetflow.core.model.EntityId;
import com.ryuqq.fleetflow.core.model.IngestionRecord;
import com.ryuqq.fleetflow.core.model.MessageId;
import com.ryuqq.fleetflow.core.model.MessageType;
import com.ryuqq.fleetflow.core.model.Payload;
import com.ryuqq.fleetflow.core.model.Priority;
import com.ryuqq.fleetflow.core.spi.DeadlineManager;
import com.ryuqq.fleetflow.core.spi.ExpiryCallback;
import com.ryuqq.fleetflow.core.spi.MessageBus;
import com.ryuqq.fleetflow.core.spi.MessageBusUnavailableException;
import com.ryuqq.fleetflow.core.statemachine.WorkflowState;
import com.ryuqq.fleetflow.core.workflow.Workflow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * WorkflowCoordinator 유닛 테스트.
 *
 * <p>버스, 데드라인 관리자, 재시작 스케줄러를 mock으로 두고 전이 규칙과 발행 순서를 검증합니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class WorkflowCoordinatorTest {

    private static final long NOW = 1_700_000_000_000L;
    private static final EntityId VEHICLE = EntityId.of("vehicle-7");

    @Mock
    private MessageBus bus;

    @Mock
    private DeadlineManager deadlines;

    @Mock
    private ScheduledExecutorService restartScheduler;

    @Mock
    private FallbackRouter router;

    private WorkflowRegistry registry;
    private WorkflowCoordinator coordinator;
    private final List<MessageBusUnavailableException> halts = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new WorkflowRegistry(3, 10);
        coordinator = new WorkflowCoordinator(bus, deadlines, registry, new ThresholdDecisionPolicy(), router,
            new OrchestratorConfig(), new BackoffCalculator(100, 1_000, 0.0), restartScheduler,
            () -> NOW, halts::add);
        lenient().when(bus.publish(any(), any())).thenReturn(true);
    }

    private Message publishedOn(Channel channel) {
        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(bus).publish(eq(channel), captor.capture());
        return captor.getValue();
    }

    private ExpiryCallback registeredCallback(int times) {
        ArgumentCaptor<ExpiryCallback> captor = ArgumentCaptor.forClass(ExpiryCallback.class);
        verify(deadlines, times(times)).register(any(), anyLong(), captor.capture());
        return captor.getValue();
    }

    @Test
    void admit_IDLE_워크플로면_분석_요청_발행_및_데드라인_등록() {
        // when
        coordinator.admit(new IngestionRecord(VEHICLE, Payload.of(Map.of("mileage", 10))));

        // then
        Message request = publishedOn(Channel.ANALYSIS_REQUEST);
        assertThat(request.type()).isEqualTo(MessageType.ANALYSIS_REQUEST);
        assertThat(request.priority()).isEqualTo(Priority.NORMAL);
        assertThat(request.receiver()).isEqualTo("analysis_agent");
        assertThat(request.sender()).isEqualTo("orchestrator");
        assertThat(request.payload().getString("entity_id")).contains("vehicle-7");
        verify(deadlines).register(eq(request.messageId()), eq(NOW + 60_000), any());

        Workflow workflow = registry.findLive(VEHICLE).orElseThrow();
        assertThat(workflow.getState()).isEqualTo(WorkflowState.ANALYZING);
        assertThat(workflow.isAwaiting(request.messageId())).isTrue();
        assertThat(workflow.getCorrelationId()).isEqualTo(request.correlationId());
    }

    @Test
    void admit_진행_중_워크플로면_병합만_수행() {
        // given
        coordinator.admit(new IngestionRecord(VEHICLE, Payload.of(Map.of("a", 1))));

        // when
        coordinator.admit(new IngestionRecord(VEHICLE, Payload.of(Map.of("b", 2))));

        // then
        verify(bus, times(1)).publish(any(), any());
        Workflow workflow = registry.findLive(VEHICLE).orElseThrow();
        assertThat(workflow.getMergedInputCount()).isEqualTo(1);
        assertThat(workflow.getContext().get(Workflow.INPUT_CONTEXT_KEY).asMap())
            .containsEntry("a", 1)
            .containsEntry("b", 2);
        assertThat(registry.statistics().totalIngested()).isEqualTo(2);
    }

    @Test
    void 발행_거부시_데드라인_취소_후_중단_핸들러_호출() {
        // given
        when(bus.publish(eq(Channel.ANALYSIS_REQUEST), any())).thenReturn(false);

        // when & then
        assertThatThrownBy(() -> coordinator.admit(new IngestionRecord(VEHICLE, Payload.empty())))
            .isInstanceOf(MessageBusUnavailableException.class);

        assertThat(halts).hasSize(1);
        assertThat(halts.get(0).getChannel()).isEqualTo(Channel.ANALYSIS_REQUEST);
        verify(deadlines).acknowledge(any(MessageId.class));
        assertThat(registry.findLive(VEHICLE).orElseThrow().getOutstanding()).isEmpty();
    }

    @Test
    void 데드라인_만료시_타임아웃_발행_후_재시작_예약() {
        // given
        coordinator.admit(new IngestionRecord(VEHICLE, Payload.empty()));
        Message request = publishedOn(Channel.ANALYSIS_REQUEST);
        ExpiryCallback callback = registeredCallback(1);

        // when
        callback.onExpired(request.messageId());

        // then
        Message timeout = publishedOn(Channel.SYSTEM_TIMEOUT);
        assertThat(timeout.type()).isEqualTo(MessageType.TIMEOUT);
        assertThat(timeout.correlationId()).isEqualTo(request.correlationId());
        Message error = publishedOn(Channel.SYSTEM_ERROR);
        assertThat(error.payload().getString("error_type")).contains("timeout");
        assertThat(error.isBroadcast()).isTrue();

        Workflow workflow = registry.findLive(VEHICLE).orElseThrow();
        assertThat(workflow.getState()).isEqualTo(WorkflowState.IDLE);
        assertThat(workflow.getRetryCount()).isEqualTo(1);
        verify(restartScheduler).schedule(any(Runnable.class), eq(100L), eq(TimeUnit.MILLISECONDS));
        assertThat(registry.statistics().timeouts()).isEqualTo(1);
    }

    @Test
    void 재시작은_라우터가_고른_채널로_같은_correlationId_재발행() {
        // given
        Channel fallback = Channel.of("analysis.fallback.request");
        when(router.requestChannel(Stage.ANALYSIS, 1)).thenReturn(fallback);
        coordinator.admit(new IngestionRecord(VEHICLE, Payload.empty()));
        Message first = publishedOn(Channel.ANALYSIS_REQUEST);
        registeredCallback(1).onExpired(first.messageId());

        ArgumentCaptor<Runnable> restart = ArgumentCaptor.forClass(Runnable.class);
        verify(restartScheduler).schedule(restart.capture(), anyLong(), any());

        // when
        restart.getValue().run();

        // then
        Message retried = publishedOn(fallback);
        assertThat(retried.correlationId()).isEqualTo(first.correlationId());
        assertThat(retried.messageId()).isNotEqualTo(first.messageId());
        assertThat(registry.findLive(VEHICLE).orElseThrow().getState()).isEqualTo(WorkflowState.ANALYZING);
    }

    @Test
    void 대기_중이_아닌_요청의_만료는_무시() {
        // given
        coordinator.admit(new IngestionRecord(VEHICLE, Payload.empty()));
        ExpiryCallback callback = registeredCallback(1);

        // when
        callback.onExpired(MessageId.generate());

        // then
        verify(bus, never()).publish(eq(Channel.SYSTEM_TIMEOUT), any());
        assertThat(registry.findLive(VEHICLE).orElseThrow().getState()).isEqualTo(WorkflowState.ANALYZING);
    }

    @Test
    void 데드라인_해제에_실패한_결과는_stale로_버림() {
        // given
        coordinator.admit(new IngestionRecord(VEHICLE, Payload.empty()));
        Message request = publishedOn(Channel.ANALYSIS_REQUEST);
        when(deadlines.acknowledge(request.messageId())).thenReturn(false);

        // when
        coordinator.onResult(Message.reply(request, "analysis_agent", MessageType.ANALYSIS_RESULT,
            Payload.empty()), Stage.ANALYSIS);

        // then
        assertThat(registry.statistics().staleResultsDropped()).isEqualTo(1);
        assertThat(registry.findLive(VEHICLE).orElseThrow().getState()).isEqualTo(WorkflowState.ANALYZING);
    }

    @Test
    void 다른_단계_채널로_온_결과는_stale로_버림() {
        // given
        coordinator.admit(new IngestionRecord(VEHICLE, Payload.empty()));
        Message request = publishedOn(Channel.ANALYSIS_REQUEST);

        // when
        coordinator.onResult(Message.reply(request, "engagement_agent", MessageType.ENGAGEMENT_RESULT,
            Payload.empty()), Stage.ENGAGEMENT);

        // then
        verify(deadlines, never()).acknowledge(any());
        assertThat(registry.statistics().staleResultsDropped()).isEqualTo(1);
    }

    @Test
    void 긴급_분석_결과면_응대_요청을_평가된_우선순위로_발행() {
        // given
        coordinator.admit(new IngestionRecord(VEHICLE, Payload.empty()));
        Message request = publishedOn(Channel.ANALYSIS_REQUEST);
        when(deadlines.acknowledge(request.messageId())).thenReturn(true);

        // when
        coordinator.onResult(Message.reply(request, "analysis_agent", MessageType.ANALYSIS_RESULT,
            Payload.of(Map.of(ThresholdDecisionPolicy.DAYS_TO_FAILURE_KEY, 5))), Stage.ANALYSIS);

        // then
        Message engagement = publishedOn(Channel.ENGAGEMENT_REQUEST);
        assertThat(engagement.priority()).isEqualTo(Priority.HIGH);
        verify(deadlines).register(eq(engagement.messageId()), eq(NOW + 30_000), any());

        Workflow workflow = registry.findLive(VEHICLE).orElseThrow();
        assertThat(workflow.getState()).isEqualTo(WorkflowState.ENGAGING);
        assertThat(workflow.getUrgency()).contains("HIGH");
        assertThat(workflow.getContext()).containsKey("analysis");
    }

    @Test
    void 다음_요청_데드라인_등록_실패시_오류_경로로_재시도_예약() {
        // given
        coordinator.admit(new IngestionRecord(VEHICLE, Payload.empty()));
        Message request = publishedOn(Channel.ANALYSIS_REQUEST);
        lenient().when(deadlines.acknowledge(request.messageId())).thenReturn(true);
        when(deadlines.register(any(), eq(NOW + 30_000), any()))
            .thenThrow(new IllegalStateException("timer rejected"));

        // when
        coordinator.onResult(Message.reply(request, "analysis_agent", MessageType.ANALYSIS_RESULT,
            Payload.of(Map.of(ThresholdDecisionPolicy.DAYS_TO_FAILURE_KEY, 5))), Stage.ANALYSIS);

        // then
        verify(bus, never()).publish(eq(Channel.ENGAGEMENT_REQUEST), any());
        Message error = publishedOn(Channel.SYSTEM_ERROR);
        assertThat(error.payload().getString("error_type")).contains("processing_error");
        assertThat(error.payload().getString("workflow_state")).contains("ENGAGING");
        assertThat(error.payload().getString("error_message")).contains("analysis processing failed: timer rejected");

        Workflow workflow = registry.findLive(VEHICLE).orElseThrow();
        assertThat(workflow.getState()).isEqualTo(WorkflowState.IDLE);
        assertThat(workflow.getOutstanding()).isEmpty();
        assertThat(workflow.getRetryCount()).isEqualTo(1);
        verify(restartScheduler).schedule(any(Runnable.class), eq(100L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void 재시도_소진시_실패_사유와_함께_완료() {
        // given
        registry = new WorkflowRegistry(0, 10);
        coordinator = new WorkflowCoordinator(bus, deadlines, registry, new ThresholdDecisionPolicy(), router,
            new OrchestratorConfig().withMaxRetries(0), new BackoffCalculator(), restartScheduler,
            () -> NOW, halts::add);
        coordinator.admit(new IngestionRecord(VEHICLE, Payload.empty()));
        Message request = publishedOn(Channel.ANALYSIS_REQUEST);

        // when
        registeredCallback(1).onExpired(request.messageId());

        // then
        assertThat(registry.findLive(VEHICLE)).isEmpty();
        WorkflowStatus status = registry.status(VEHICLE).orElseThrow();
        assertThat(status.state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(status.retired()).isTrue();
        Message insight = publishedOn(Channel.QUALITY_INSIGHT);
        assertThat(insight.payload().getString("outcome")).contains("FAILED");
        verify(restartScheduler, never()).schedule(any(Runnable.class), anyLong(), any());
    }

    @Test
    void 비활성화_후_결과_무시() {
        // given
        coordinator.admit(new IngestionRecord(VEHICLE, Payload.empty()));
        Message request = publishedOn(Channel.ANALYSIS_REQUEST);
        coordinator.deactivate();

        // when
        coordinator.onResult(Message.reply(request, "analysis_agent", MessageType.ANALYSIS_RESULT,
            Payload.empty()), Stage.ANALYSIS);

        // then
        verify(deadlines, never()).acknowledge(any());
        assertThat(coordinator.isActive()).isFalse();
    }
}
