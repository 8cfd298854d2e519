package com.purchasingpower.etlinsight.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Table written by a workflow. Identity is scoped to the owning workflow.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TargetTable {
    String name;
    String schema;
    String database;
    String connection;

    @Singular
    List<ColumnDescriptor> columns;

    /**
     * insert, update, upsert, truncate-insert, ...
     */
    String loadType;
}
