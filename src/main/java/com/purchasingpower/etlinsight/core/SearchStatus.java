package com.purchasingpower.etlinsight.core;

/**
 * Outcome kind of a search or diagnosis. None of these is an error for the caller.
 *
 * @since 1.0.0
 */
public enum SearchStatus {

    /**
     * At least one verified result.
     */
    OK,

    /**
     * Nothing exact and nothing that survived validation.
     */
    NOT_FOUND,

    /**
     * The semantic index failed or timed out for this call; only repository-backed
     * answers (if any) are returned.
     */
    INDEX_UNAVAILABLE,

    /**
     * Blank or missing input.
     */
    MALFORMED_QUERY
}
