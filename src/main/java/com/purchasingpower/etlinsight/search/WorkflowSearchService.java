package com.purchasingpower.etlinsight.search;

import com.purchasingpower.etlinsight.core.ComponentKind;
import com.purchasingpower.etlinsight.core.SearchOutcome;
import com.purchasingpower.etlinsight.core.WorkflowRecord;

import java.util.List;
import java.util.Optional;

/**
 * Validated workflow search.
 *
 * <p>None of these methods throws for missing data, a blank query or an unavailable
 * semantic index; the condition is reported through {@link SearchOutcome#getStatus()}.
 * Results are always sorted by confidence, best first.
 *
 * @since 1.0.0
 */
public interface WorkflowSearchService {

    /**
     * Exact scan first, then verified semantic candidates.
     *
     * @param name          workflow name or fragment
     * @param exactRequired when true and an exact (case-insensitive) hit exists,
     *                      return only exact hits without consulting the index
     * @return ranked outcome
     */
    SearchOutcome searchByName(String name, boolean exactRequired);

    /**
     * Workflows that read or write the table, each proven by the repository.
     */
    SearchOutcome searchTableWorkflows(String tableName);

    /**
     * Components semantically close to {@code componentName}, kept only if the
     * component really exists in its workflow with the reported kind.
     *
     * @param kind restricts the search to one kind; {@code null} searches all indexed kinds
     */
    SearchOutcome searchComponents(String componentName, ComponentKind kind);

    /**
     * Fuzzy name search narrowed by filters that must all hold. A blank query
     * applies the filters to the whole catalog.
     */
    SearchOutcome searchWithFilters(String query, List<WorkflowFilter> filters);

    /**
     * Exact lookup. Without a set id, the first set holding that exact name wins.
     */
    Optional<WorkflowRecord> getWorkflowDetails(String name, String setId);

    /**
     * Workflows that depend on {@code workflowName}, by declaration or by reading a
     * table it writes.
     */
    List<WorkflowRecord> findDependents(String workflowName);

    CatalogStatistics getStatistics();

    List<SearchHistoryEntry> getHistory();

    void clearHistory();
}
