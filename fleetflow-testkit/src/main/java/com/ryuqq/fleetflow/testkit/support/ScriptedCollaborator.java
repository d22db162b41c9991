package com.ryuqq.fleetflow.testkit.support;

import com.ryuqq.fleetflow.core.contract.Message;
import com.ryuqq.fleetflow.core.contract.Stage;
import com.ryuqq.fleetflow.core.model.MessageType;
import com.ryuqq.fleetflow.core.model.Payload;
import com.ryuqq.fleetflow.core.spi.MessageBus;
import com.ryuqq.fleetflow.core.spi.Subscription;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 단계 요청에 각본대로 응답하는 테스트용 협력 컴포넌트.
 *
 * <p>응답 함수가 null을 반환하면 응답하지 않습니다 (데드라인 만료 시나리오).</p>
 *
 * <pre>
 * ScriptedCollaborator analysis = ScriptedCollaborator.replying(bus, Stage.ANALYSIS,
 *     request -&gt; Payload.of(Map.of("predicted_days_to_failure", 0.5)));
 * analysis.start();
 * </pre>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public class ScriptedCollaborator {

    private final MessageBus bus;
    private final Stage stage;
    private final MessageType replyType;
    private final Function<Message, Payload> responder;
    private final List<Message> requests = new CopyOnWriteArrayList<>();
    private Subscription subscription;

    private ScriptedCollaborator(MessageBus bus, Stage stage, MessageType replyType, Function<Message, Payload> responder) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        this.bus = bus;
        this.stage = stage;
        this.replyType = replyType;
        this.responder = responder;
    }

    /**
     * 응답 함수 결과를 단계 결과 타입으로 회신.
     */
    public static ScriptedCollaborator replying(MessageBus bus, Stage stage, Function<Message, Payload> responder) {
        return new ScriptedCollaborator(bus, stage, stage.resultType(), responder);
    }

    /**
     * 항상 같은 payload로 회신.
     */
    public static ScriptedCollaborator replyingWith(MessageBus bus, Stage stage, Payload payload) {
        return replying(bus, stage, request -> payload);
    }

    /**
     * 요청을 기록만 하고 회신하지 않음.
     */
    public static ScriptedCollaborator silent(MessageBus bus, Stage stage) {
        return new ScriptedCollaborator(bus, stage, stage.resultType(), request -> null);
    }

    /**
     * ERROR 타입 메시지로 회신.
     */
    public static ScriptedCollaborator failing(MessageBus bus, Stage stage, String errorMessage) {
        return new ScriptedCollaborator(bus, stage, MessageType.ERROR,
            request -> Payload.of(Map.of("error_message", errorMessage)));
    }

    public ScriptedCollaborator start() {
        subscription = bus.subscribe(stage.requestChannel(), this::onRequest);
        return this;
    }

    public void stop() {
        if (subscription != null) {
            bus.unsubscribe(subscription);
            subscription = null;
        }
    }

    private void onRequest(Message request) {
        requests.add(request);
        Payload payload = responder.apply(request);
        if (payload == null) {
            return;
        }
        bus.publish(stage.resultChannel(), Message.reply(request, stage.collaborator(), replyType, payload));
    }

    public List<Message> requests() {
        return List.copyOf(requests);
    }

    public int requestCount() {
        return requests.size();
    }

    /**
     * 지정한 개수 이상의 요청을 받을 때까지 대기.
     */
    public List<Message> awaitRequests(int expected) {
        Awaits.until(() -> requests.size() >= expected, expected + " " + stage + " requests");
        return requests();
    }
}
