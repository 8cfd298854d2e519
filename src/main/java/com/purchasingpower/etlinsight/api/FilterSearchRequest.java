package com.purchasingpower.etlinsight.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filtered search request. Every non-null field adds one filter.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterSearchRequest {

    private String query;
    private String status;
    private String setId;
    private String sourceTable;
    private String targetTable;
    private Integer minSessions;
    private Integer maxSessions;
}
