package com.purchasingpower.etlinsight.knowledge;

/**
 * Health of the semantic index as reported in statistics.
 *
 * @since 1.0.0
 */
public enum IndexStatus {

    /**
     * Never built since startup or since the last clear.
     */
    EMPTY,

    READY,

    /**
     * The last rebuild failed; the previous generation is still being served.
     */
    STALE,

    /**
     * No generation can be served.
     */
    UNAVAILABLE;

    public boolean isQueryable() {
        return this == READY || this == STALE;
    }
}
