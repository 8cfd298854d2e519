package com.purchasingpower.etlinsight.catalog;

import com.purchasingpower.etlinsight.core.WorkflowRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative store of workflow records grouped by source set.
 *
 * <p>Reads never block. Writes build a complete new snapshot and publish it atomically.
 *
 * @since 1.0.0
 */
public interface WorkflowRepository {

    /**
     * Atomically replace every record of one set. Other sets are untouched.
     *
     * @param setId   owning set, e.g. "set30"
     * @param records complete record list for that set; every record must carry {@code setId}
     * @throws IllegalArgumentException for a blank set id, a foreign record or a duplicate name
     */
    void replace(String setId, List<WorkflowRecord> records);

    /**
     * Atomically replace the whole catalog.
     *
     * @param recordsBySet complete catalog keyed by set id
     * @throws IllegalArgumentException under the same rules as {@link #replace}
     */
    void replaceAll(Map<String, List<WorkflowRecord>> recordsBySet);

    /**
     * Exact (case-sensitive) existence check.
     */
    boolean exists(String setId, String name);

    /**
     * Exact (case-sensitive) lookup.
     */
    Optional<WorkflowRecord> lookup(String setId, String name);

    /**
     * Case-insensitive name scan over every set, in set then record order.
     */
    List<WorkflowRecord> findByNameIgnoreCase(String name);

    List<String> allSets();

    List<WorkflowRecord> allRecords();

    int recordCount();

    /**
     * Current immutable snapshot, for callers that need several consistent reads.
     */
    CatalogSnapshot snapshot();

    void clear();
}
