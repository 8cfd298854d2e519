package com.purchasingpower.etlinsight.core;

/**
 * Unverified nearest-neighbour hit produced by the semantic index.
 *
 * <p>Never persisted and never returned to callers as-is; the search service
 * resolves it against the repository first.
 *
 * @param setId         set the indexed document claimed to belong to
 * @param workflowName  workflow the indexed document claimed to describe
 * @param componentName component name for component documents, {@code null} for workflow documents
 * @param componentKind component kind for component documents, {@code null} for workflow documents
 * @param distance      raw similarity distance reported by the index
 * @param provenance    which index collection produced the hit
 * @since 1.0.0
 */
public record SearchCandidate(
    String setId,
    String workflowName,
    String componentName,
    ComponentKind componentKind,
    double distance,
    String provenance
) {

    public static SearchCandidate forWorkflow(String setId, String workflowName, double distance) {
        return new SearchCandidate(setId, workflowName, null, null, distance, "workflow");
    }

    public static SearchCandidate forComponent(String setId, String workflowName, String componentName,
                                               ComponentKind kind, double distance) {
        return new SearchCandidate(setId, workflowName, componentName, kind, distance, kind.tag());
    }

    public WorkflowKey workflowKey() {
        return new WorkflowKey(setId, workflowName);
    }

    /**
     * {@code max(0, 1 - distance)}, capped at 1.
     */
    public double rawScore() {
        return Math.min(1.0, Math.max(0.0, 1.0 - distance));
    }
}
