package com.purchasingpower.etlinsight.search;

import java.time.Instant;

/**
 * One name search, as kept in the bounded search history.
 *
 * @since 1.0.0
 */
public record SearchHistoryEntry(String query, Instant timestamp, int resultCount, boolean exactRequired) {
}
