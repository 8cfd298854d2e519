package com.purchasingpower.etlinsight.catalog;

import com.purchasingpower.etlinsight.knowledge.IndexStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of an ingest, refresh or clear.
 *
 * <p>{@code success} refers to the catalog swap. A successful swap followed by a
 * failed index rebuild is still a success; {@code indexStatus} and {@code error}
 * then describe the index problem.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class IngestionResult {

    boolean success;
    int setCount;
    int recordCount;
    int indexedDocuments;
    IndexStatus indexStatus;
    long durationMs;
    String error;

    public static IngestionResult failed(String error, long durationMs) {
        return IngestionResult.builder()
            .success(false)
            .error(error)
            .durationMs(durationMs)
            .build();
    }
}
