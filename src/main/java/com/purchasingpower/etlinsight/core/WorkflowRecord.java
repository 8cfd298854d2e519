package com.purchasingpower.etlinsight.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Canonical workflow definition ingested from a metadata set (e.g. "set30").
 *
 * <p>Identity is ({@code setId}, {@code name}). Instances are immutable; all
 * collections are unmodifiable copies made by the builder.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class WorkflowRecord {

    String setId;
    String name;
    String description;

    @Builder.Default
    ComponentStatus status = ComponentStatus.UNKNOWN;

    LocalDateTime createdAt;
    LocalDateTime modifiedAt;

    @Singular
    List<Session> sessions;

    @Singular
    List<SourceTable> sourceTables;

    @Singular
    List<TargetTable> targetTables;

    @Singular
    List<Transformation> transformations;

    @Singular("metadataEntry")
    Map<String, String> metadata;

    /**
     * Names of workflows this one declares it depends on.
     */
    @Singular
    List<String> dependencies;

    public WorkflowKey key() {
        return new WorkflowKey(setId, name);
    }

    public boolean isActive() {
        return status == ComponentStatus.ACTIVE;
    }

    public boolean readsTable(String tableName) {
        return tableName != null && sourceTables.stream()
            .anyMatch(t -> tableName.equalsIgnoreCase(t.getName()));
    }

    public boolean writesTable(String tableName) {
        return tableName != null && targetTables.stream()
            .anyMatch(t -> tableName.equalsIgnoreCase(t.getName()));
    }

    /**
     * Whether the table appears among the source or target tables (case-insensitive).
     */
    public boolean touchesTable(String tableName) {
        return readsTable(tableName) || writesTable(tableName);
    }

    /**
     * Whether a component of the given kind and name (case-insensitive) exists in this workflow.
     */
    public boolean hasComponent(ComponentKind kind, String componentName) {
        if (kind == null || componentName == null) {
            return false;
        }
        return switch (kind) {
            case SOURCE_TABLE -> readsTable(componentName);
            case TARGET_TABLE -> writesTable(componentName);
            case TRANSFORMATION -> transformations.stream()
                .anyMatch(t -> componentName.equalsIgnoreCase(t.getName()));
            case SESSION -> sessions.stream()
                .anyMatch(s -> componentName.equalsIgnoreCase(s.getName()));
        };
    }
}
