package com.ryuqq.fleetflow.testkit.support;

import com.ryuqq.fleetflow.core.model.IngestionRecord;
import com.ryuqq.fleetflow.core.model.Payload;
import com.ryuqq.fleetflow.core.spi.IngestionException;
import com.ryuqq.fleetflow.core.spi.IngestionSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 큐 기반 테스트용 입력 소스.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public class QueueIngestionSource implements IngestionSource {

    private final Queue<IngestionRecord> records = new ConcurrentLinkedQueue<>();
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private final AtomicInteger polls = new AtomicInteger();

    public QueueIngestionSource offer(IngestionRecord record) {
        records.add(record);
        return this;
    }

    public QueueIngestionSource offer(String entityId, Payload payload) {
        return offer(IngestionRecord.of(entityId, payload));
    }

    /**
     * 다음 n번의 조회가 {@link IngestionException}으로 실패하도록 설정.
     */
    public QueueIngestionSource failNext(int times) {
        failuresRemaining.set(times);
        return this;
    }

    @Override
    public List<IngestionRecord> poll(int maxRecords) {
        polls.incrementAndGet();
        if (failuresRemaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new IngestionException("scripted ingestion failure");
        }
        List<IngestionRecord> batch = new ArrayList<>();
        IngestionRecord next;
        while (batch.size() < maxRecords && (next = records.poll()) != null) {
            batch.add(next);
        }
        return batch;
    }

    public int pollCount() {
        return polls.get();
    }

    public int remaining() {
        return records.size();
    }
}
