package com.purchasingpower.etlinsight.search;

import com.purchasingpower.etlinsight.knowledge.IndexStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of catalog and index health.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class CatalogStatistics {

    int recordCount;
    int setCount;

    @Singular
    List<String> setIds;

    IndexStatus indexStatus;
    int indexedDocuments;

    /**
     * Semantic index calls that failed or timed out since startup.
     */
    long indexUnavailableCount;

    int searchHistorySize;

    @Singular
    List<String> archetypeNames;

    /**
     * {@code null} until the first successful ingest.
     */
    Instant lastIngestAt;
}
