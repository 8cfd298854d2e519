package com.purchasingpower.etlinsight.knowledge;

import com.purchasingpower.etlinsight.core.SearchCandidate;
import com.purchasingpower.etlinsight.core.WorkflowRecord;

import java.util.List;

/**
 * Nearest-neighbour index over workflow and component descriptions.
 *
 * <p>No correctness guarantee is attached to query results: they may reference
 * records that have since left the repository, and their similarity says nothing
 * about exact identifiers.
 *
 * @since 1.0.0
 */
public interface SemanticIndex {

    /**
     * Full rebuild from the given records. Idempotent: the same input twice yields
     * an index that answers every query the same way as after one call.
     *
     * @param records every record that should be searchable afterwards
     * @throws com.purchasingpower.etlinsight.exception.SemanticIndexException if the rebuild fails
     */
    void index(List<WorkflowRecord> records);

    /**
     * Nearest candidates for {@code text}, best first.
     *
     * @param text  query text
     * @param topK  maximum number of candidates
     * @param scope which documents may be returned
     * @return candidates with raw distances
     * @throws com.purchasingpower.etlinsight.exception.SemanticIndexException if the index cannot answer
     */
    List<SearchCandidate> query(String text, int topK, IndexScope scope);

    void clear();

    IndexStatus status();

    /**
     * Number of documents in the generation currently served.
     */
    int documentCount();
}
