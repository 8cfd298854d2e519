package com.purchasingpower.etlinsight.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Structural issues and ranked recommendations for a table or a workflow.
 *
 * <p>The report is a value for downstream summarisation; it carries no prose
 * beyond the issue and recommendation strings.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class DiagnosticReport {

    String targetEntity;
    TargetKind targetKind;
    boolean found;
    SearchStatus status;

    @Singular
    List<SearchResult> responsibleWorkflows;

    @Singular
    List<String> issues;

    @Singular
    List<String> recommendations;

    @Singular
    List<String> matchedArchetypes;

    double confidence;

    public enum TargetKind {
        TABLE,
        WORKFLOW
    }

    public static class DiagnosticReportBuilder {
        private double confidence;

        public DiagnosticReportBuilder confidence(double confidence) {
            this.confidence = SearchResult.clamp(confidence);
            return this;
        }
    }
}
