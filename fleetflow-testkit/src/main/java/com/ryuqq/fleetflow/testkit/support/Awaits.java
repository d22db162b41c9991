package com.ryuqq.fleetflow.testkit.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * 비동기 조건 대기 유틸리티.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class Awaits {

    private static final long POLL_INTERVAL_MS = 10L;

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private Awaits() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 조건이 참이 될 때까지 대기. 시간 안에 참이 되지 않으면 테스트 실패.
     *
     * @param condition 조건
     * @param timeout 최대 대기 시간
     * @param description 실패 메시지에 쓰일 설명
     */
    public static void until(BooleanSupplier condition, Duration timeout, String description) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out after " + timeout.toMillis() + "ms waiting for: " + description);
            }
            sleep(POLL_INTERVAL_MS);
        }
    }

    public static void until(BooleanSupplier condition, String description) {
        until(condition, DEFAULT_TIMEOUT, description);
    }

    /**
     * 주어진 시간 동안 조건이 계속 거짓인지 확인. 참이 되는 순간 테스트 실패.
     *
     * @param condition 일어나면 안 되는 조건
     * @param period 관찰 시간
     * @param description 실패 메시지에 쓰일 설명
     */
    public static void never(BooleanSupplier condition, Duration period, String description) {
        long end = System.nanoTime() + period.toNanos();
        while (System.nanoTime() < end) {
            if (condition.getAsBoolean()) {
                fail("Unexpectedly observed: " + description);
            }
            sleep(POLL_INTERVAL_MS);
        }
    }

    public static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("Interrupted while waiting", e);
        }
    }
}
