package com.ryuqq.fleetflow.adapter.runner;

import com.ryuqq.fleetflow.application.policy.DecisionPolicy;
import com.ryuqq.fleetflow.application.policy.FallbackRouter;
import com.ryuqq.fleetflow.application.policy.UrgencyAssessment;
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
import com.ryuqq.fleetflow.core.spi.MessageBus;
import com.ryuqq.fleetflow.core.spi.MessageBusUnavailableException;
import com.ryuqq.fleetflow.core.statemachine.WorkflowState;
import com.ryuqq.fleetflow.core.statemachine.WorkflowTrigger;
import com.ryuqq.fleetflow.core.workflow.PendingRequest;
import com.ryuqq.fleetflow.core.workflow.Workflow;
import com.ryuqq.fleetflow.core.workflow.WorkflowOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * 워크플로 전이 조정자.
 *
 * <p>수집된 입력, 협력 컴포넌트의 결과, 데드라인 만료, 정체 점검을 받아
 * 워크플로 상태를 전이시키고 다음 요청을 발행합니다. 모든 워크플로 변경은
 * 해당 워크플로의 락 안에서만 일어납니다.</p>
 *
 * <p><strong>단계 체인:</strong></p>
 * <pre>
 * IDLE ──입력──▶ ANALYZING ──analysis.result──▶ ASSESSING
 *   ASSESSING ──긴급──▶ ENGAGING ──수락──▶ SCHEDULING ──예약 확정──▶ AWAITING_EXTERNAL
 *   AWAITING_EXTERNAL ──service.completion──▶ COLLECTING_OUTCOME ──feedback.result──▶ COMPLETED
 *   ASSESSING ──조치 불필요──▶ COMPLETED,  ENGAGING ──거절──▶ COMPLETED
 * </pre>
 *
 * <p><strong>실패 경로:</strong> 데드라인 만료, 협력 컴포넌트 오류, 예약 미확정, 정체는
 * 모두 ERROR로 전이합니다. 재시도 여유가 있으면 IDLE로 재진입하고 backoff 후
 * 분석 단계부터 다시 시작하며, 없으면 실패 사유와 함께 COMPLETED로 종료합니다.</p>
 *
 * <p><strong>결과 매칭:</strong> 결과는 correlationId로 워크플로를 찾고, 현재 대기 중인
 * 요청의 messageId에 대한 응답이어야 하며, 데드라인 acknowledge에 성공해야 적용됩니다.
 * 그 외의 결과는 stale로 버리고 집계합니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class WorkflowCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    static final String ENTITY_ID_KEY = "entity_id";
    static final String ERROR_TYPE_KEY = "error_type";
    static final String ERROR_MESSAGE_KEY = "error_message";
    private static final String PROCESSING_ERROR = "processing_error";
    private static final String SERVICE_CONTEXT_KEY = "service";
    private static final String UNKNOWN = "UNKNOWN";

    private final MessageBus bus;
    private final DeadlineManager deadlines;
    private final WorkflowRegistry registry;
    private final DecisionPolicy policy;
    private final FallbackRouter router;
    private final OrchestratorConfig config;
    private final BackoffCalculator backoff;
    private final ScheduledExecutorService restartScheduler;
    private final LongSupplier clock;
    private final Consumer<MessageBusUnavailableException> haltHandler;

    private volatile boolean active = true;

    /**
     * 생성자.
     *
     * @param bus 메시지 버스
     * @param deadlines 데드라인 관리자
     * @param registry 워크플로 집합
     * @param policy 결정 정책
     * @param router 재요청 채널 라우터
     * @param config 설정
     * @param backoff 재시작 지연 계산기
     * @param restartScheduler 재시작 예약 스케줄러
     * @param clock 현재 시각 공급자 (epoch millis)
     * @param haltHandler 버스 사용 불가 시 호출되는 핸들러
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkflowCoordinator(MessageBus bus, DeadlineManager deadlines, WorkflowRegistry registry,
                               DecisionPolicy policy, FallbackRouter router, OrchestratorConfig config,
                               BackoffCalculator backoff, ScheduledExecutorService restartScheduler,
                               LongSupplier clock, Consumer<MessageBusUnavailableException> haltHandler) {
        requireNonNull(bus, "bus");
        requireNonNull(deadlines, "deadlines");
        requireNonNull(registry, "registry");
        requireNonNull(policy, "policy");
        requireNonNull(router, "router");
        requireNonNull(config, "config");
        requireNonNull(backoff, "backoff");
        requireNonNull(restartScheduler, "restartScheduler");
        requireNonNull(clock, "clock");
        requireNonNull(haltHandler, "haltHandler");
        this.bus = bus;
        this.deadlines = deadlines;
        this.registry = registry;
        this.policy = policy;
        this.router = router;
        this.config = config;
        this.backoff = backoff;
        this.restartScheduler = restartScheduler;
        this.clock = clock;
        this.haltHandler = haltHandler;
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    /**
     * 이후 도착하는 결과, 만료, 재시작을 무시하도록 전환.
     */
    void deactivate() {
        active = false;
    }

    boolean isActive() {
        return active;
    }

    // ========================================
    // 입력 수집
    // ========================================

    /**
     * 수집된 입력 반영.
     *
     * <p>엔티티의 라이브 워크플로에 입력을 병합하고, 워크플로가 IDLE이면 분석 요청을 발행합니다.
     * 병합 직전에 워크플로가 종료되었다면 새 워크플로로 다시 시도합니다.</p>
     *
     * @param record 수집된 입력
     * @throws MessageBusUnavailableException 버스가 요청을 받지 못한 경우
     */
    public void admit(IngestionRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        registry.recordIngested();
        while (true) {
            long now = clock.getAsLong();
            Workflow workflow = registry.getOrCreate(record.entityId(), now);
            workflow.lock();
            try {
                if (workflow.isRetired()) {
                    continue;
                }
                workflow.mergeInput(record.payload(), now);
                if (workflow.getState() == WorkflowState.IDLE) {
                    startAnalysis(workflow, "new input");
                } else {
                    log.debug("Merged input into active workflow {} (state: {})",
                        workflow.getEntityId(), workflow.getState());
                }
                return;
            } finally {
                workflow.unlock();
            }
        }
    }

    // ========================================
    // 결과 처리
    // ========================================

    /**
     * 단계 결과 처리.
     *
     * @param message 결과 메시지
     * @param stage 결과 단계
     */
    public void onResult(Message message, Stage stage) {
        if (!active) {
            return;
        }
        Optional<Workflow> found = registry.findByCorrelation(message.correlationId());
        if (found.isEmpty()) {
            dropStale(message, "unknown correlation");
            return;
        }
        Workflow workflow = found.get();
        workflow.lock();
        try {
            if (!claimReply(workflow, message, stage)) {
                return;
            }
            workflow.recordResult(stage, message.payload());
            try {
                switch (stage) {
                    case ANALYSIS -> onAnalysis(workflow, message.payload());
                    case ENGAGEMENT -> onEngagement(workflow, message.payload());
                    case SCHEDULING -> onScheduling(workflow, message.payload());
                    case FEEDBACK -> onFeedback(workflow);
                }
            } catch (MessageBusUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                failOnProcessingError(workflow, stage.contextKey(), e);
            }
        } finally {
            workflow.unlock();
        }
    }

    /**
     * 협력 컴포넌트가 보고한 오류 처리.
     *
     * <p>대기 중인 요청에 대한 응답인 경우에만 워크플로를 실패 처리하며,
     * 데드라인 만료와 같은 재시도 경로를 따릅니다.</p>
     *
     * @param message ERROR 타입 메시지
     */
    public void onCollaboratorError(Message message) {
        if (!active || message.replyTo() == null) {
            return;
        }
        Optional<Workflow> found = registry.findByCorrelation(message.correlationId());
        if (found.isEmpty()) {
            dropStale(message, "unknown correlation");
            return;
        }
        Workflow workflow = found.get();
        workflow.lock();
        try {
            Optional<PendingRequest> pending = workflow.getOutstanding();
            if (pending.isEmpty() || !claimReply(workflow, message, pending.get().stage())) {
                return;
            }
            Payload payload = message.payload();
            String errorMessage = payload.getString(ERROR_MESSAGE_KEY).orElse("unspecified error");
            String errorType = payload.getString(ERROR_TYPE_KEY).orElse("collaborator_error");
            log.warn("Collaborator {} reported error for workflow {}: {}",
                message.sender(), workflow.getEntityId(), errorMessage);
            fail(workflow, pending.get().stage().contextKey() + " failed: " + errorMessage, errorType);
        } finally {
            workflow.unlock();
        }
    }

    /**
     * 외부 서비스 완료 신호 처리.
     *
     * <p>correlationId로 워크플로를 찾고, 없으면 payload의 {@code entity_id}로 찾습니다.</p>
     *
     * @param message service.completion 메시지
     */
    public void onServiceCompletion(Message message) {
        if (!active) {
            return;
        }
        Optional<Workflow> found = registry.findByCorrelation(message.correlationId())
            .or(() -> message.payload().getString(ENTITY_ID_KEY)
                .flatMap(this::parseEntityId)
                .flatMap(registry::findLive));
        if (found.isEmpty()) {
            dropStale(message, "no workflow awaiting service completion");
            return;
        }
        Workflow workflow = found.get();
        workflow.lock();
        try {
            if (workflow.isRetired() || workflow.getState() != WorkflowState.AWAITING_EXTERNAL) {
                dropStale(message, "workflow " + workflow.getEntityId() + " is in " + workflow.getState());
                return;
            }
            workflow.putContext(SERVICE_CONTEXT_KEY, message.payload());
            try {
                if (transition(workflow, WorkflowTrigger.EXTERNAL_COMPLETION, "service completed")) {
                    issue(workflow, Stage.FEEDBACK, Priority.NORMAL, stagePayload(workflow)
                        .with(SERVICE_CONTEXT_KEY, message.payload().asMap()));
                }
            } catch (MessageBusUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                failOnProcessingError(workflow, SERVICE_CONTEXT_KEY, e);
            }
        } finally {
            workflow.unlock();
        }
    }

    private Optional<EntityId> parseEntityId(String value) {
        try {
            return Optional.of(EntityId.of(value));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed entity id in service completion: {}", value);
            return Optional.empty();
        }
    }

    /**
     * 응답이 현재 대기 중인 요청에 대한 것인지 확인하고, 데드라인을 해제하여 소유권을 얻습니다.
     *
     * @return 응답을 적용해야 하면 true
     */
    private boolean claimReply(Workflow workflow, Message message, Stage stage) {
        MessageId replyTo = message.replyTo();
        Optional<PendingRequest> pending = workflow.getOutstanding();
        if (workflow.isRetired() || replyTo == null || pending.isEmpty()
            || !pending.get().messageId().equals(replyTo) || pending.get().stage() != stage) {
            dropStale(message, "not the outstanding request of " + workflow.getEntityId());
            return false;
        }
        if (!deadlines.acknowledge(replyTo)) {
            // 만료 콜백이 먼저 소유권을 가져감
            dropStale(message, "deadline already expired");
            return false;
        }
        workflow.resolveReply(replyTo);
        return true;
    }

    private void onAnalysis(Workflow workflow, Payload analysis) {
        if (!transition(workflow, WorkflowTrigger.ANALYSIS_RESULT, "analysis result received")) {
            return;
        }
        UrgencyAssessment assessment = policy.assessUrgency(workflow.getEntityId(), analysis);
        workflow.setUrgency(assessment.level().name());

        if (assessment.engagementRequired()) {
            if (transition(workflow, WorkflowTrigger.ENGAGEMENT_REQUIRED,
                "urgency " + assessment.level() + ": " + assessment.reason())) {
                issue(workflow, Stage.ENGAGEMENT, assessment.engagementPriority(), stagePayload(workflow)
                    .with("urgency", assessment.level().name())
                    .with(Stage.ANALYSIS.contextKey(), analysis.asMap()));
            }
            return;
        }
        if (transition(workflow, WorkflowTrigger.NO_ACTION_REQUIRED, "no action required: " + assessment.reason())) {
            workflow.setOutcome(WorkflowOutcome.NO_ACTION);
            complete(workflow);
        }
    }

    private void onEngagement(Workflow workflow, Payload engagement) {
        if (!policy.isEngagementAccepted(engagement)) {
            if (transition(workflow, WorkflowTrigger.ENGAGEMENT_DECLINED, "engagement declined")) {
                workflow.setOutcome(WorkflowOutcome.DECLINED);
                complete(workflow);
            }
            return;
        }
        if (transition(workflow, WorkflowTrigger.ENGAGEMENT_ACCEPTED, "engagement accepted")) {
            Payload analysis = workflow.getContext().getOrDefault(Stage.ANALYSIS.contextKey(), Payload.empty());
            Priority priority = policy.assessUrgency(workflow.getEntityId(), analysis).schedulingPriority();
            issue(workflow, Stage.SCHEDULING, priority, stagePayload(workflow)
                .with("urgency", workflow.getUrgency().orElse(UNKNOWN))
                .with(Stage.ENGAGEMENT.contextKey(), engagement.asMap()));
        }
    }

    private void onScheduling(Workflow workflow, Payload scheduling) {
        if (policy.isBookingConfirmed(scheduling)) {
            transition(workflow, WorkflowTrigger.BOOKING_CONFIRMED, "booking confirmed");
            return;
        }
        fail(workflow, "booking not confirmed", "booking_failed");
    }

    private void onFeedback(Workflow workflow) {
        if (transition(workflow, WorkflowTrigger.OUTCOME_RECORDED, "outcome recorded")) {
            workflow.setOutcome(WorkflowOutcome.SUCCEEDED);
            complete(workflow);
        }
    }

    // ========================================
    // 데드라인 만료 / 정체 점검
    // ========================================

    /**
     * 데드라인 만료 처리.
     *
     * <p>워크플로가 여전히 해당 요청을 기다리고 있을 때만 system.timeout을 1건 발행하고
     * 실패 경로로 보냅니다.</p>
     *
     * @param workflow 요청을 발행한 워크플로
     * @param messageId 만료된 요청 ID
     */
    void onDeadlineExpired(Workflow workflow, MessageId messageId) {
        if (!active) {
            return;
        }
        workflow.lock();
        try {
            Optional<PendingRequest> pending = workflow.getOutstanding();
            if (workflow.isRetired() || pending.isEmpty() || !pending.get().messageId().equals(messageId)) {
                log.debug("Ignoring expiry of {} for workflow {}", messageId, workflow.getEntityId());
                return;
            }
            Stage stage = pending.get().stage();
            registry.recordTimeout();
            log.warn("Deadline expired for {} request {} of workflow {}",
                stage.contextKey(), messageId, workflow.getEntityId());

            Payload timeout = Payload.empty()
                .with(ENTITY_ID_KEY, workflow.getEntityId().getValue())
                .with("message_id", messageId.getValue())
                .with("stage", stage.contextKey())
                .with("workflow_state", workflow.getState().name());
            publish(Channel.SYSTEM_TIMEOUT, Message.create(workflow.getCorrelationId(), config.senderName(),
                null, MessageType.TIMEOUT, Priority.HIGH, timeout));

            fail(workflow, stage.contextKey() + " deadline expired", "timeout");
        } finally {
            workflow.unlock();
        }
    }

    /**
     * 정체된 워크플로 실패 처리.
     *
     * <p>락을 잡은 뒤 다시 확인하므로 점검 시점과 처리 시점 사이에 진행된 워크플로는 건너뜁니다.</p>
     *
     * @param workflow 대상 워크플로
     * @param thresholdMs 정체 임계값
     * @return 실패 처리했으면 true
     */
    public boolean failIfStale(Workflow workflow, long thresholdMs) {
        if (!active) {
            return false;
        }
        workflow.lock();
        try {
            long idleFor = clock.getAsLong() - workflow.getLastUpdate();
            if (workflow.isRetired() || !workflow.getState().isActive() || idleFor <= thresholdMs) {
                return false;
            }
            fail(workflow, "workflow timeout after " + idleFor + "ms in " + workflow.getState(), "workflow_timeout");
            return true;
        } finally {
            workflow.unlock();
        }
    }

    // ========================================
    // 실패 / 재시도 / 종료
    // ========================================

    private void fail(Workflow workflow, String reason, String errorType) {
        long now = clock.getAsLong();
        WorkflowState failedIn = workflow.getState();
        workflow.getOutstanding().ifPresent(pending -> deadlines.acknowledge(pending.messageId()));
        if (!workflow.fire(WorkflowTrigger.FAILURE, reason, now)) {
            log.warn("Workflow {} cannot fail from {} ({})", workflow.getEntityId(), failedIn, reason);
            return;
        }
        registry.recordErrored();

        Payload error = Payload.empty()
            .with(ERROR_TYPE_KEY, errorType)
            .with(ENTITY_ID_KEY, workflow.getEntityId().getValue())
            .with("workflow_state", failedIn.name())
            .with(ERROR_MESSAGE_KEY, reason)
            .with("error_count", workflow.getErrorCount());

        if (workflow.canRetry()) {
            workflow.fire(WorkflowTrigger.RETRY,
                "retry " + (workflow.getRetryCount() + 1) + "/" + workflow.getMaxRetries(), now);
            registry.recordRetry();
            log.warn("Workflow {} failed in {}: {} (retry {}/{})", workflow.getEntityId(), failedIn, reason,
                workflow.getRetryCount(), workflow.getMaxRetries());
            publish(Channel.SYSTEM_ERROR, Message.create(workflow.getCorrelationId(), config.senderName(),
                null, MessageType.ERROR, Priority.HIGH, error));
            scheduleRestart(workflow);
            return;
        }

        workflow.fire(WorkflowTrigger.RETRIES_EXHAUSTED, "retries exhausted: " + reason, now);
        log.error("Workflow {} failed in {} with retries exhausted: {}", workflow.getEntityId(), failedIn, reason);
        publish(Channel.SYSTEM_ERROR, Message.create(workflow.getCorrelationId(), config.senderName(),
            null, MessageType.ERROR, Priority.HIGH, error));
        complete(workflow);
    }

    /**
     * 결과 적용 중 발생한 예외를 워크플로 실패로 전환.
     *
     * <p>결정 정책이나 데드라인 등록이 실패해도 워크플로는 ERROR를 거쳐 재시도되거나 종료됩니다.</p>
     */
    private void failOnProcessingError(Workflow workflow, String step, RuntimeException e) {
        log.error("Processing {} for workflow {} failed in {}",
            step, workflow.getEntityId(), workflow.getState(), e);
        fail(workflow, step + " processing failed: " + e.getMessage(), PROCESSING_ERROR);
    }

    private void scheduleRestart(Workflow workflow) {
        long delayMs = backoff.delayBeforeRetry(workflow.getRetryCount());
        try {
            restartScheduler.schedule(() -> restart(workflow), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Restart of workflow {} not scheduled, orchestrator is stopping", workflow.getEntityId());
        }
    }

    private void restart(Workflow workflow) {
        if (!active) {
            return;
        }
        workflow.lock();
        try {
            if (workflow.isRetired() || workflow.getState() != WorkflowState.IDLE) {
                return;
            }
            startAnalysis(workflow, "retry restart");
        } catch (MessageBusUnavailableException e) {
            // publish()가 이미 haltHandler에 전달함
            log.debug("Restart of workflow {} aborted: bus unavailable", workflow.getEntityId());
        } catch (RuntimeException e) {
            failOnProcessingError(workflow, Stage.ANALYSIS.contextKey(), e);
        } finally {
            workflow.unlock();
        }
    }

    private void complete(Workflow workflow) {
        registry.retire(workflow);
        registry.recordCompleted();
        String outcome = workflow.getOutcome().map(Enum::name).orElse(UNKNOWN);
        log.info("Workflow {} completed with outcome {}", workflow.getEntityId(), outcome);

        Map<String, Object> context = new LinkedHashMap<>();
        workflow.getContext().forEach((key, value) -> context.put(key, value.asMap()));
        Payload insight = Payload.empty()
            .with(ENTITY_ID_KEY, workflow.getEntityId().getValue())
            .with("outcome", outcome)
            .with("urgency", workflow.getUrgency().orElse(UNKNOWN))
            .with("retry_count", workflow.getRetryCount())
            .with("error_count", workflow.getErrorCount())
            .with("context", context);
        publish(Channel.QUALITY_INSIGHT, Message.create(workflow.getCorrelationId(), config.senderName(),
            null, MessageType.QUALITY_INSIGHT, Priority.LOW, insight));
    }

    // ========================================
    // 요청 발행
    // ========================================

    private void startAnalysis(Workflow workflow, String reason) {
        if (transition(workflow, WorkflowTrigger.NEW_INPUT, reason)) {
            issue(workflow, Stage.ANALYSIS, Priority.NORMAL, stagePayload(workflow)
                .with("input", workflow.getContext()
                    .getOrDefault(Workflow.INPUT_CONTEXT_KEY, Payload.empty()).asMap()));
        }
    }

    private Payload stagePayload(Workflow workflow) {
        return Payload.empty()
            .with(ENTITY_ID_KEY, workflow.getEntityId().getValue())
            .with("retry_count", workflow.getRetryCount());
    }

    /**
     * 단계 요청 발행.
     *
     * <p>데드라인을 먼저 등록한 뒤 발행합니다. 발행이 거부되면 등록을 취소하고
     * {@link MessageBusUnavailableException}을 던집니다.</p>
     */
    private void issue(Workflow workflow, Stage stage, Priority priority, Payload payload) {
        long now = clock.getAsLong();
        Channel channel = workflow.getRetryCount() > 0
            ? router.requestChannel(stage, workflow.getRetryCount())
            : stage.requestChannel();
        Message request = Message.create(workflow.getCorrelationId(), config.senderName(),
            stage.collaborator(), stage.requestType(), priority, payload);

        workflow.awaitReply(new PendingRequest(request.messageId(), stage, now));
        deadlines.register(request.messageId(), now + config.deadlineFor(stage),
            expired -> onDeadlineExpired(workflow, expired));

        if (!bus.publish(channel, request)) {
            deadlines.acknowledge(request.messageId());
            workflow.resolveReply(request.messageId());
            unavailable(channel);
        }
        log.debug("Issued {} request {} for workflow {} on {} ({})",
            stage.contextKey(), request.messageId(), workflow.getEntityId(), channel, priority);
    }

    private void publish(Channel channel, Message message) {
        if (!bus.publish(channel, message)) {
            unavailable(channel);
        }
    }

    private void unavailable(Channel channel) {
        MessageBusUnavailableException e = new MessageBusUnavailableException(channel);
        haltHandler.accept(e);
        throw e;
    }

    private boolean transition(Workflow workflow, WorkflowTrigger trigger, String reason) {
        if (workflow.fire(trigger, reason, clock.getAsLong())) {
            return true;
        }
        log.warn("Rejected transition {} for workflow {} in state {}",
            trigger, workflow.getEntityId(), workflow.getState());
        return false;
    }

    private void dropStale(Message message, String reason) {
        registry.recordStaleDropped();
        log.debug("Dropped stale {} message {} (correlation: {}): {}",
            message.type(), message.messageId(), message.correlationId(), reason);
    }
}
