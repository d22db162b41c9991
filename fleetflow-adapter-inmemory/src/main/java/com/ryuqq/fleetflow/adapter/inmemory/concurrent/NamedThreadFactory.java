package com.ryuqq.fleetflow.adapter.inmemory.concurrent;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 이름 접두사를 붙인 daemon 스레드 생성기.
 *
 * <p>버스 디스패처, 데드라인 타이머, 오케스트레이터 주기 작업 스레드에 사용합니다.
 * daemon 스레드이므로 정지 호출 없이 JVM이 종료되어도 막히지 않습니다.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class NamedThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger();

    public NamedThreadFactory(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + "-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}
