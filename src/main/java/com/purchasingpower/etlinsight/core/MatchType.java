package com.purchasingpower.etlinsight.core;

/**
 * How a search result was obtained.
 *
 * @since 1.0.0
 */
public enum MatchType {
    /**
     * Case-insensitive exact name match against the repository.
     */
    EXACT,

    /**
     * Semantic candidate that passed existence and name checks.
     */
    SEMANTIC,

    /**
     * Semantic table candidate whose workflow really reads or writes the table.
     */
    TABLE,

    /**
     * Semantic component candidate whose component really exists in the workflow.
     */
    COMPONENT,

    /**
     * Repository record selected by filters alone.
     */
    FILTER
}
