package com.purchasingpower.etlinsight.api;

import com.purchasingpower.etlinsight.core.SearchOutcome;
import com.purchasingpower.etlinsight.core.SearchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Search response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    private boolean success;
    private String error;
    private String query;
    private String status;
    private String guidance;

    @Builder.Default
    private List<Result> results = new ArrayList<>();

    public static SearchResponse success(SearchOutcome outcome) {
        return SearchResponse.builder()
            .success(true)
            .query(outcome.getQuery())
            .status(outcome.getStatus().name())
            .guidance(outcome.getGuidance())
            .results(outcome.getResults().stream().map(Result::from).toList())
            .build();
    }

    public static SearchResponse error(String error) {
        return SearchResponse.builder()
            .success(false)
            .error(error)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Result {
        private String workflowName;
        private String setId;
        private double confidence;
        private String matchReason;
        private String matchType;
        private String componentName;
        private String componentKind;
        private String workflowStatus;

        static Result from(SearchResult result) {
            return Result.builder()
                .workflowName(result.getWorkflowName())
                .setId(result.getSetId())
                .confidence(result.getConfidence())
                .matchReason(result.getMatchReason())
                .matchType(result.getMatchType() != null ? result.getMatchType().name() : null)
                .componentName(result.getComponentName())
                .componentKind(result.getComponentKind() != null ? result.getComponentKind().tag() : null)
                .workflowStatus(result.getWorkflow().getStatus().label())
                .build();
        }
    }
}
