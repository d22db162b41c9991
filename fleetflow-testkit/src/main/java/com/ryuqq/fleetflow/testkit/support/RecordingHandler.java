package com.ryuqq.fleetflow.testkit.support;

import com.ryuqq.fleetflow.core.contract.Message;
import com.ryuqq.fleetflow.core.spi.MessageHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * 전달받은 메시지를 순서대로 기록하는 핸들러.
 *
 * <p>{@link #blockUntilReleased()}로 만들면 첫 전달에서 {@link #release()} 호출까지 멈춥니다.
 * 구독자를 바쁘게 만들어 메일박스에 메시지를 쌓을 때 사용합니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public class RecordingHandler implements MessageHandler {

    private final List<Message> received = new ArrayList<>();
    private final CountDownLatch gate;
    private final AtomicInteger concurrent = new AtomicInteger();
    private final AtomicInteger maxConcurrent = new AtomicInteger();
    private volatile RuntimeException failure;

    public RecordingHandler() {
        this.gate = new CountDownLatch(0);
    }

    private RecordingHandler(CountDownLatch gate) {
        this.gate = gate;
    }

    /**
     * 첫 메시지 전달에서 멈추는 핸들러 생성.
     */
    public static RecordingHandler blockUntilReleased() {
        return new RecordingHandler(new CountDownLatch(1));
    }

    /**
     * 이후 모든 전달에서 예외를 던지도록 설정 (기록은 계속됨).
     */
    public RecordingHandler failingWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    public void release() {
        gate.countDown();
    }

    @Override
    public void onMessage(Message message) {
        int now = concurrent.incrementAndGet();
        maxConcurrent.accumulateAndGet(now, Math::max);
        try {
            synchronized (received) {
                received.add(message);
            }
            try {
                if (!gate.await(10, TimeUnit.SECONDS)) {
                    fail("RecordingHandler gate was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            RuntimeException toThrow = failure;
            if (toThrow != null) {
                throw toThrow;
            }
        } finally {
            concurrent.decrementAndGet();
        }
    }

    public List<Message> received() {
        synchronized (received) {
            return List.copyOf(received);
        }
    }

    public int count() {
        synchronized (received) {
            return received.size();
        }
    }

    /**
     * 지정한 개수 이상 전달될 때까지 대기.
     */
    public List<Message> awaitCount(int expected) {
        Awaits.until(() -> count() >= expected, "at least " + expected + " deliveries");
        return received();
    }

    /**
     * 동시에 실행된 onMessage 호출의 최대 개수.
     */
    public int maxConcurrentDeliveries() {
        return maxConcurrent.get();
    }
}
