package com.purchasingpower.etlinsight.catalog;

import com.purchasingpower.etlinsight.core.WorkflowRecord;

import java.util.List;
import java.util.Map;

/**
 * Single writer for the catalog: swaps repository contents, then rebuilds the
 * semantic index from the new snapshot.
 *
 * <p>Calls are serialized. Readers are never blocked.
 *
 * @since 1.0.0
 */
public interface CatalogIngestionService {

    /**
     * Replace one set and rebuild the index.
     *
     * @return failed result, with the catalog untouched, when the records are malformed
     */
    IngestionResult ingest(String setId, List<WorkflowRecord> records);

    /**
     * Replace the whole catalog and rebuild the index.
     */
    IngestionResult refresh(Map<String, List<WorkflowRecord>> recordsBySet);

    /**
     * Empty the catalog, the index and the search history.
     */
    IngestionResult clear();
}
