package com.purchasingpower.etlinsight.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Ranked, verified results plus the outcome kind and a guidance message for the caller.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class SearchOutcome {

    String query;
    SearchStatus status;

    @Singular
    List<SearchResult> results;

    String guidance;

    public static SearchOutcome of(String query, List<SearchResult> results) {
        if (results.isEmpty()) {
            return notFound(query);
        }
        return SearchOutcome.builder()
            .query(query)
            .status(SearchStatus.OK)
            .results(results)
            .build();
    }

    public static SearchOutcome notFound(String query) {
        return SearchOutcome.builder()
            .query(query)
            .status(SearchStatus.NOT_FOUND)
            .guidance("No verified workflow matches '" + query + "'. Check the spelling or search by table name.")
            .build();
    }

    public static SearchOutcome malformed(String query, String reason) {
        return SearchOutcome.builder()
            .query(query)
            .status(SearchStatus.MALFORMED_QUERY)
            .guidance(reason)
            .build();
    }

    /**
     * Repository-backed results only (possibly none) because the index could not be consulted.
     */
    public static SearchOutcome indexUnavailable(String query, List<SearchResult> fallback) {
        return SearchOutcome.builder()
            .query(query)
            .status(SearchStatus.INDEX_UNAVAILABLE)
            .results(fallback)
            .guidance("Semantic index unavailable; only exact repository matches were considered.")
            .build();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public int size() {
        return results.size();
    }
}
