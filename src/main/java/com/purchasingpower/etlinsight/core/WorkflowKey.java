package com.purchasingpower.etlinsight.core;

/**
 * Catalog-wide identity of a workflow: the owning set plus the exact workflow name.
 *
 * @since 1.0.0
 */
public record WorkflowKey(String setId, String name) {

    @Override
    public String toString() {
        return setId + "/" + name;
    }
}
