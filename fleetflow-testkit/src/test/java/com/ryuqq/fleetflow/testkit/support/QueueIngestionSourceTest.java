package com.ryuqq.fleetflow.testkit.support;

import com.ryuqq.fleetflow.core.model.IngestionRecord;
import com.ryuqq.fleetflow.core.model.Payload;
import com.ryuqq.fleetflow.core.spi.IngestionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueIngestionSourceTest {

    @Test
    void poll_RespectsMaxRecords() {
        // Given
        QueueIngestionSource source = new QueueIngestionSource()
            .offer("vehicle-1", Payload.empty())
            .offer("vehicle-2", Payload.empty())
            .offer("vehicle-3", Payload.empty());

        // When
        List<IngestionRecord> batch = source.poll(2);

        // Then
        assertEquals(2, batch.size());
        assertEquals("vehicle-1", batch.get(0).entityId().getValue());
        assertEquals(1, source.remaining());
    }

    @Test
    void poll_ScriptedFailures_ThenRecovers() {
        // Given
        QueueIngestionSource source = new QueueIngestionSource()
            .offer("vehicle-1", Payload.empty())
            .failNext(2);

        // When & Then
        assertThrows(IngestionException.class, () -> source.poll(10));
        assertThrows(IngestionException.class, () -> source.poll(10));
        assertEquals(1, source.poll(10).size());
        assertEquals(3, source.pollCount());
    }

    @Test
    void poll_Empty_ReturnsEmptyBatch() {
        assertTrue(new QueueIngestionSource().poll(5).isEmpty());
    }
}
