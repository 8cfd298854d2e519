package com.purchasingpower.etlinsight.core;

/**
 * Role of a component inside a workflow.
 *
 * @since 1.0.0
 */
public enum ComponentKind {
    SOURCE_TABLE("source_table"),
    TARGET_TABLE("target_table"),
    TRANSFORMATION("transformation"),
    SESSION("session");

    private final String tag;

    ComponentKind(String tag) {
        this.tag = tag;
    }

    /**
     * Stable lower-case tag used in index metadata and match reasons.
     */
    public String tag() {
        return tag;
    }
}
