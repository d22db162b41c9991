package com.ryuqq.fleetflow.core.workflow;

import com.ryuqq.fleetflow.core.contract.Stage;
import com.ryuqq.fleetflow.core.model.CorrelationId;
import com.ryuqq.fleetflow.core.model.EntityId;
import com.ryuqq.fleetflow.core.model.MessageId;
import com.ryuqq.fleetflow.core.model.Payload;
import com.ryuqq.fleetflow.core.statemachine.WorkflowState;
import com.ryuqq.fleetflow.core.statemachine.WorkflowTransition;
import com.ryuqq.fleetflow.core.statemachine.WorkflowTrigger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 엔티티 하나의 처리 흐름.
 *
 * <p>Workflow는 엔티티당 하나만 살아있으며, 오케스트레이션 루프만이 변경합니다.
 * 모든 변경은 워크플로별 {@link ReentrantLock}으로 직렬화됩니다. 여러 단계를 묶어
 * 원자적으로 처리하려면 {@link #lock()}/{@link #unlock()}으로 감싸면 됩니다
 * (재진입 가능).</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>상태는 {@link WorkflowTransition} 표를 통해서만 바뀜</li>
 *   <li>거부된 전이는 상태와 이력을 바꾸지 않음</li>
 *   <li>retryCount는 maxRetries를 넘지 않음</li>
 *   <li>lastUpdate는 모든 전이에서 갱신됨</li>
 *   <li>correlationId는 생명주기 동안 불변</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class Workflow {

    /**
     * 수집된 입력이 저장되는 컨텍스트 키.
     */
    public static final String INPUT_CONTEXT_KEY = "input";

    private final ReentrantLock lock = new ReentrantLock();

    private final EntityId entityId;
    private final CorrelationId correlationId;
    private final int maxRetries;
    private final long createdAt;

    private final Map<String, Payload> context = new LinkedHashMap<>();
    private final List<TransitionRecord> history = new ArrayList<>();

    private WorkflowState state = WorkflowState.IDLE;
    private Payload latestInput = Payload.empty();
    private int mergedInputCount;
    private int retryCount;
    private int errorCount;
    private long lastUpdate;
    private PendingRequest outstanding;
    private String urgency;
    private WorkflowOutcome outcome;
    private String failureReason;
    private boolean retired;

    /**
     * Workflow 생성.
     *
     * @param entityId 엔티티 ID
     * @param correlationId 상관관계 ID
     * @param maxRetries 최대 재시도 횟수 (0 이상)
     * @param now 생성 시각 (epoch millis)
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public Workflow(EntityId entityId, CorrelationId correlationId, int maxRetries, long now) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        this.entityId = entityId;
        this.correlationId = correlationId;
        this.maxRetries = maxRetries;
        this.createdAt = now;
        this.lastUpdate = now;
    }

    /**
     * 새 상관관계 ID를 발급하여 Workflow 생성.
     */
    public static Workflow create(EntityId entityId, int maxRetries, long now) {
        return new Workflow(entityId, CorrelationId.newFor(entityId), maxRetries, now);
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    /**
     * 트리거를 적용하여 상태 전이.
     *
     * <p>허용되지 않은 전이는 아무것도 바꾸지 않고 false를 반환합니다.
     * 추가로 다음 규칙이 적용됩니다.</p>
     * <ul>
     *   <li>FAILURE: errorCount 증가, 대기 중인 요청 해제</li>
     *   <li>RETRY: retryCount가 maxRetries 미만일 때만 허용되며 retryCount 증가</li>
     *   <li>RETRIES_EXHAUSTED: retryCount가 maxRetries에 도달했을 때만 허용</li>
     * </ul>
     *
     * @param trigger 트리거
     * @param reason 전이 사유 (이력에 기록)
     * @param now 전이 시각 (epoch millis)
     * @return 전이되었으면 true
     * @throws IllegalArgumentException trigger가 null인 경우
     */
    public boolean fire(WorkflowTrigger trigger, String reason, long now) {
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null");
        }
        lock.lock();
        try {
            if (!WorkflowTransition.isAllowed(state, trigger)) {
                return false;
            }
            if (trigger == WorkflowTrigger.RETRY && !canRetry()) {
                return false;
            }
            if (trigger == WorkflowTrigger.RETRIES_EXHAUSTED && canRetry()) {
                return false;
            }

            WorkflowState from = state;
            state = WorkflowTransition.next(from, trigger);
            history.add(new TransitionRecord(from, state, now, reason));
            lastUpdate = now;

            switch (trigger) {
                case FAILURE -> {
                    errorCount++;
                    outstanding = null;
                }
                case RETRY -> retryCount++;
                case RETRIES_EXHAUSTED -> {
                    failureReason = reason;
                    outcome = WorkflowOutcome.FAILED;
                }
                default -> {
                    // 추가 처리 없음
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 트리거가 현재 상태에서 허용되는지 확인 (상태 변경 없음).
     */
    public boolean canFire(WorkflowTrigger trigger) {
        lock.lock();
        try {
            return WorkflowTransition.isAllowed(state, trigger);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 재시도 가능 여부.
     *
     * @return retryCount가 maxRetries 미만이면 true
     */
    public boolean canRetry() {
        lock.lock();
        try {
            return retryCount < maxRetries;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 새 입력 병합.
     *
     * <p>최신 입력을 교체하고, 컨텍스트의 입력 항목에는 키 단위로 덮어씁니다.
     * 워크플로 생성 후 첫 입력이 아닌 경우 병합 횟수를 증가시킵니다.</p>
     *
     * @param input 수집된 입력
     * @param now 병합 시각
     */
    public void mergeInput(Payload input, long now) {
        Payload safe = input == null ? Payload.empty() : input;
        lock.lock();
        try {
            if (context.containsKey(INPUT_CONTEXT_KEY)) {
                mergedInputCount++;
            }
            Map<String, Object> merged = new LinkedHashMap<>(
                context.getOrDefault(INPUT_CONTEXT_KEY, Payload.empty()).asMap());
            merged.putAll(safe.asMap());
            context.put(INPUT_CONTEXT_KEY, Payload.of(merged));
            latestInput = safe;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 단계 결과를 컨텍스트에 저장.
     *
     * @param stage 결과 단계
     * @param result 결과 payload
     */
    public void recordResult(Stage stage, Payload result) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        putContext(stage.contextKey(), result);
    }

    /**
     * 컨텍스트 항목 저장 (기존 값 교체).
     *
     * @param key 컨텍스트 키
     * @param value 저장할 payload (null이면 빈 payload)
     */
    public void putContext(String key, Payload value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        lock.lock();
        try {
            context.put(key, value == null ? Payload.empty() : value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 대기 중인 요청 설정.
     *
     * @param request 발행된 요청
     * @throws IllegalStateException 이미 다른 요청을 기다리는 중인 경우
     */
    public void awaitReply(PendingRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        lock.lock();
        try {
            if (outstanding != null) {
                throw new IllegalStateException(
                    "Workflow " + entityId.getValue() + " already awaits " + outstanding.messageId());
            }
            outstanding = request;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 응답 대상이 현재 대기 중인 요청이면 해제하고 반환.
     *
     * @param replyTo 응답 메시지의 replyTo
     * @return 해제된 요청 (일치하지 않으면 empty)
     */
    public Optional<PendingRequest> resolveReply(MessageId replyTo) {
        lock.lock();
        try {
            if (outstanding == null || replyTo == null || !outstanding.messageId().equals(replyTo)) {
                return Optional.empty();
            }
            PendingRequest resolved = outstanding;
            outstanding = null;
            return Optional.of(resolved);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 특정 요청을 기다리는 중인지 확인.
     */
    public boolean isAwaiting(MessageId messageId) {
        lock.lock();
        try {
            return outstanding != null && outstanding.messageId().equals(messageId);
        } finally {
            lock.unlock();
        }
    }

    public void setUrgency(String urgency) {
        lock.lock();
        try {
            this.urgency = urgency;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 결과 태그 기록. 실패 결과는 {@link WorkflowTrigger#RETRIES_EXHAUSTED}가 기록합니다.
     */
    public void setOutcome(WorkflowOutcome outcome) {
        lock.lock();
        try {
            this.outcome = outcome;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 라이브 집합에서 제거되었음을 표시. 이후 입력은 새 워크플로로 시작해야 합니다.
     */
    public void retire() {
        lock.lock();
        try {
            if (!state.isTerminal()) {
                throw new IllegalStateException(
                    "Cannot retire non-terminal workflow " + entityId.getValue() + " (state: " + state + ")");
            }
            retired = true;
        } finally {
            lock.unlock();
        }
    }

    public EntityId getEntityId() {
        return entityId;
    }

    public CorrelationId getCorrelationId() {
        return correlationId;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public WorkflowState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getRetryCount() {
        lock.lock();
        try {
            return retryCount;
        } finally {
            lock.unlock();
        }
    }

    public int getErrorCount() {
        lock.lock();
        try {
            return errorCount;
        } finally {
            lock.unlock();
        }
    }

    public long getLastUpdate() {
        lock.lock();
        try {
            return lastUpdate;
        } finally {
            lock.unlock();
        }
    }

    public int getMergedInputCount() {
        lock.lock();
        try {
            return mergedInputCount;
        } finally {
            lock.unlock();
        }
    }

    public Payload getLatestInput() {
        lock.lock();
        try {
            return latestInput;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 단계별 컨텍스트 스냅샷.
     *
     * @return 변경 불가능한 복사본
     */
    public Map<String, Payload> getContext() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(context));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 전이 이력 스냅샷 (시간순).
     */
    public List<TransitionRecord> getHistory() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    public Optional<PendingRequest> getOutstanding() {
        lock.lock();
        try {
            return Optional.ofNullable(outstanding);
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> getUrgency() {
        lock.lock();
        try {
            return Optional.ofNullable(urgency);
        } finally {
            lock.unlock();
        }
    }

    public Optional<WorkflowOutcome> getOutcome() {
        lock.lock();
        try {
            return Optional.ofNullable(outcome);
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> getFailureReason() {
        lock.lock();
        try {
            return Optional.ofNullable(failureReason);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRetired() {
        lock.lock();
        try {
            return retired;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Workflow{" + entityId.getValue() + ", " + getState() + ", " + correlationId.getValue() + '}';
    }
}
