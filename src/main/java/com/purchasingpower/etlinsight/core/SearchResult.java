package com.purchasingpower.etlinsight.core;

import lombok.Builder;
import lombok.Value;

/**
 * Workflow that was verified against the repository at validation time.
 *
 * <p>Immutable and thread-safe. Confidence is always clamped to [0,1].
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class SearchResult {

    WorkflowRecord workflow;
    double confidence;
    String matchReason;
    String setId;
    MatchType matchType;

    /**
     * Component that matched, for component searches. {@code null} otherwise.
     */
    String componentName;
    ComponentKind componentKind;

    public static SearchResult exact(WorkflowRecord workflow) {
        return SearchResult.builder()
            .workflow(workflow)
            .confidence(1.0)
            .matchReason("Exact name match in " + workflow.getSetId())
            .setId(workflow.getSetId())
            .matchType(MatchType.EXACT)
            .build();
    }

    public WorkflowKey key() {
        return workflow.key();
    }

    public String getWorkflowName() {
        return workflow.getName();
    }

    public SearchResult withConfidence(double value) {
        return toBuilder().confidence(value).build();
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static class SearchResultBuilder {
        private double confidence;

        public SearchResultBuilder confidence(double confidence) {
            this.confidence = clamp(confidence);
            return this;
        }
    }
}
