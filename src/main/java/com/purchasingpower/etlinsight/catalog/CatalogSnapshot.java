package com.purchasingpower.etlinsight.catalog;

import com.google.common.base.Preconditions;
import com.purchasingpower.etlinsight.core.ComponentStatus;
import com.purchasingpower.etlinsight.core.WorkflowRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the whole catalog at one point in time.
 *
 * <p>Thread Safety: instances are never modified after construction.
 *
 * @since 1.0.0
 */
public final class CatalogSnapshot {

    private static final CatalogSnapshot EMPTY = new CatalogSnapshot(Map.of(), null);

    private final Map<String, Map<String, WorkflowRecord>> recordsBySet;
    private final List<WorkflowRecord> allRecords;
    private final Instant publishedAt;

    private CatalogSnapshot(Map<String, Map<String, WorkflowRecord>> recordsBySet, Instant publishedAt) {
        this.recordsBySet = recordsBySet;
        List<WorkflowRecord> flat = new ArrayList<>();
        recordsBySet.values().forEach(byName -> flat.addAll(byName.values()));
        this.allRecords = Collections.unmodifiableList(flat);
        this.publishedAt = publishedAt;
    }

    public static CatalogSnapshot empty() {
        return EMPTY;
    }

    /**
     * Builds a snapshot from raw record lists, validating set ownership, name uniqueness
     * and component lists. A missing status becomes {@link ComponentStatus#UNKNOWN}.
     */
    public static CatalogSnapshot of(Map<String, List<WorkflowRecord>> recordsBySet) {
        Map<String, Map<String, WorkflowRecord>> copy = new LinkedHashMap<>();
        recordsBySet.forEach((setId, records) -> copy.put(setId, index(setId, records)));
        return new CatalogSnapshot(Collections.unmodifiableMap(copy), Instant.now());
    }

    /**
     * New snapshot equal to this one with {@code setId} replaced by {@code records}.
     */
    public CatalogSnapshot withSet(String setId, List<WorkflowRecord> records) {
        Map<String, Map<String, WorkflowRecord>> copy = new LinkedHashMap<>(recordsBySet);
        copy.put(setId, index(setId, records));
        return new CatalogSnapshot(Collections.unmodifiableMap(copy), Instant.now());
    }

    public Optional<WorkflowRecord> lookup(String setId, String name) {
        Map<String, WorkflowRecord> byName = recordsBySet.get(setId);
        return byName == null ? Optional.empty() : Optional.ofNullable(byName.get(name));
    }

    public boolean exists(String setId, String name) {
        return lookup(setId, name).isPresent();
    }

    public List<String> setIds() {
        return List.copyOf(recordsBySet.keySet());
    }

    public List<WorkflowRecord> records() {
        return allRecords;
    }

    public int recordCount() {
        return allRecords.size();
    }

    public int setCount() {
        return recordsBySet.size();
    }

    public boolean isEmpty() {
        return allRecords.isEmpty();
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    private static Map<String, WorkflowRecord> index(String setId, List<WorkflowRecord> records) {
        Preconditions.checkArgument(setId != null && !setId.isBlank(), "Set id is required");
        Preconditions.checkNotNull(records, "Records for set %s cannot be null", setId);

        Map<String, WorkflowRecord> byName = new LinkedHashMap<>();
        for (WorkflowRecord record : records) {
            Preconditions.checkNotNull(record, "Null record in set %s", setId);
            Preconditions.checkArgument(record.getName() != null && !record.getName().isBlank(),
                "Workflow without a name in set %s", setId);
            Preconditions.checkArgument(setId.equals(record.getSetId()),
                "Workflow %s belongs to set %s, not %s", record.getName(), record.getSetId(), setId);
            checkComponents(setId, record);
            if (record.getStatus() == null) {
                record = record.toBuilder().status(ComponentStatus.UNKNOWN).build();
            }
            WorkflowRecord previous = byName.putIfAbsent(record.getName(), record);
            Preconditions.checkArgument(previous == null,
                "Duplicate workflow %s in set %s", record.getName(), setId);
        }
        return Collections.unmodifiableMap(byName);
    }

    private static void checkComponents(String setId, WorkflowRecord record) {
        Preconditions.checkArgument(!record.getSessions().contains(null),
            "Workflow %s in set %s has a null session", record.getName(), setId);
        Preconditions.checkArgument(!record.getSourceTables().contains(null),
            "Workflow %s in set %s has a null source table", record.getName(), setId);
        Preconditions.checkArgument(!record.getTargetTables().contains(null),
            "Workflow %s in set %s has a null target table", record.getName(), setId);
        Preconditions.checkArgument(!record.getTransformations().contains(null),
            "Workflow %s in set %s has a null transformation", record.getName(), setId);
    }
}
