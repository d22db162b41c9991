package com.ryuqq.fleetflow.adapter.runner;

import com.ryuqq.fleetflow.core.contract.Channel;
import com.ryuqq.fleetflow.core.contract.Message;
import com.ryuqq.fleetflow.core.contract.Stage;
import com.ryuqq.fleetflow.core.spi.MessageBus;
import com.ryuqq.fleetflow.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 결과 채널 구독과 메시지 타입별 분기.
 *
 * <p>모든 단계의 결과 채널, service.completion, system.error를 구독하고
 * 메시지 타입에 따라 {@link WorkflowCoordinator}로 전달합니다.
 * 자신이 발행한 메시지(sender가 자신의 이름)는 무시합니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class ResultProcessor {

    private static final Logger log = LoggerFactory.getLogger(ResultProcessor.class);

    private final MessageBus bus;
    private final WorkflowCoordinator coordinator;
    private final String selfName;
    private final List<Subscription> subscriptions = new ArrayList<>();

    public ResultProcessor(MessageBus bus, WorkflowCoordinator coordinator, String selfName) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (selfName == null || selfName.isBlank()) {
            throw new IllegalArgumentException("selfName cannot be null or blank");
        }
        this.bus = bus;
        this.coordinator = coordinator;
        this.selfName = selfName;
    }

    /**
     * 구독 시작.
     *
     * @throws IllegalStateException 이미 구독 중인 경우
     */
    public synchronized void subscribe() {
        if (!subscriptions.isEmpty()) {
            throw new IllegalStateException("ResultProcessor already subscribed");
        }
        for (Stage stage : Stage.values()) {
            subscriptions.add(bus.subscribe(stage.resultChannel(), this::route));
        }
        subscriptions.add(bus.subscribe(Channel.SERVICE_COMPLETION, this::route));
        subscriptions.add(bus.subscribe(Channel.SYSTEM_ERROR, this::route));
        log.debug("ResultProcessor subscribed to {} channels", subscriptions.size());
    }

    /**
     * 구독 해제. 이미 버퍼에 있는 메시지는 계속 전달됩니다.
     */
    public synchronized void unsubscribe() {
        for (Subscription subscription : subscriptions) {
            bus.unsubscribe(subscription);
        }
        subscriptions.clear();
    }

    void route(Message message) {
        if (selfName.equals(message.sender())) {
            return;
        }
        switch (message.type()) {
            case ANALYSIS_RESULT -> coordinator.onResult(message, Stage.ANALYSIS);
            case ENGAGEMENT_RESULT -> coordinator.onResult(message, Stage.ENGAGEMENT);
            case SCHEDULING_RESULT -> coordinator.onResult(message, Stage.SCHEDULING);
            case FEEDBACK_RESULT -> coordinator.onResult(message, Stage.FEEDBACK);
            case SERVICE_COMPLETION -> coordinator.onServiceCompletion(message);
            case ERROR -> coordinator.onCollaboratorError(message);
            case ANALYSIS_REQUEST, ENGAGEMENT_REQUEST, SCHEDULING_REQUEST, FEEDBACK_REQUEST,
                QUALITY_INSIGHT, TIMEOUT -> log.debug("Ignoring {} message {} from {}",
                    message.type(), message.messageId(), message.sender());
        }
    }
}
