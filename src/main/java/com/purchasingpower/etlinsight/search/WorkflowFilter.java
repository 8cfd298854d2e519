package com.purchasingpower.etlinsight.search;

import com.google.common.base.Preconditions;
import com.purchasingpower.etlinsight.core.ComponentStatus;
import com.purchasingpower.etlinsight.core.WorkflowRecord;

/**
 * One constraint of a filtered search. Every filter has a known kind and a value of
 * the right type; the factories below are the usual way to build one.
 *
 * <p>Example:
 * <pre>
 * List.of(WorkflowFilter.statusEquals(ComponentStatus.ACTIVE),
 *         WorkflowFilter.hasTargetTable("CUSTOMERS"),
 *         WorkflowFilter.minSessions(1));
 * </pre>
 *
 * @since 1.0.0
 */
public record WorkflowFilter(Kind kind, ComponentStatus status, String text, int count) {

    public enum Kind {
        STATUS_EQUALS,
        SET_EQUALS,
        HAS_SOURCE_TABLE,
        HAS_TARGET_TABLE,
        MIN_SESSIONS,
        MAX_SESSIONS
    }

    public WorkflowFilter {
        Preconditions.checkNotNull(kind, "Filter kind is required");
        switch (kind) {
            case STATUS_EQUALS -> Preconditions.checkArgument(status != null, "Status is required");
            case SET_EQUALS, HAS_SOURCE_TABLE, HAS_TARGET_TABLE ->
                Preconditions.checkArgument(text != null && !text.isBlank(), "%s filter needs a value", kind);
            case MIN_SESSIONS, MAX_SESSIONS ->
                Preconditions.checkArgument(count >= 0, "Session bound must be non-negative");
        }
    }

    public static WorkflowFilter statusEquals(ComponentStatus status) {
        Preconditions.checkNotNull(status, "Status is required");
        return new WorkflowFilter(Kind.STATUS_EQUALS, status, null, 0);
    }

    public static WorkflowFilter setEquals(String setId) {
        return new WorkflowFilter(Kind.SET_EQUALS, null, requireText(setId, "Set id"), 0);
    }

    public static WorkflowFilter hasSourceTable(String tableName) {
        return new WorkflowFilter(Kind.HAS_SOURCE_TABLE, null, requireText(tableName, "Source table"), 0);
    }

    public static WorkflowFilter hasTargetTable(String tableName) {
        return new WorkflowFilter(Kind.HAS_TARGET_TABLE, null, requireText(tableName, "Target table"), 0);
    }

    public static WorkflowFilter minSessions(int count) {
        Preconditions.checkArgument(count >= 0, "Session bound must be non-negative");
        return new WorkflowFilter(Kind.MIN_SESSIONS, null, null, count);
    }

    public static WorkflowFilter maxSessions(int count) {
        Preconditions.checkArgument(count >= 0, "Session bound must be non-negative");
        return new WorkflowFilter(Kind.MAX_SESSIONS, null, null, count);
    }

    public boolean matches(WorkflowRecord workflow) {
        return switch (kind) {
            case STATUS_EQUALS -> workflow.getStatus() == status;
            case SET_EQUALS -> text.equals(workflow.getSetId());
            case HAS_SOURCE_TABLE -> workflow.readsTable(text);
            case HAS_TARGET_TABLE -> workflow.writesTable(text);
            case MIN_SESSIONS -> workflow.getSessions().size() >= count;
            case MAX_SESSIONS -> workflow.getSessions().size() <= count;
        };
    }

    private static String requireText(String value, String what) {
        Preconditions.checkArgument(value != null && !value.isBlank(), "%s is required", what);
        return value.trim();
    }
}
