package com.ryuqq.fleetflow.core.spi;

import com.ryuqq.fleetflow.core.model.IngestionRecord;

import java.util.List;

/**
 * Source of work units, polled by the orchestration loop.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public interface IngestionSource {

    /**
     * Pulls the next batch of records.
     *
     * @param maxRecords upper bound on the batch size
     * @return records, possibly empty, never null
     * @throws IngestionException if the source cannot be read; the caller retries next cycle
     */
    List<IngestionRecord> poll(int maxRecords);
}
