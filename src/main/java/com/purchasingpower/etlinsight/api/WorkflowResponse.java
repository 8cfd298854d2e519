package com.purchasingpower.etlinsight.api;

import com.purchasingpower.etlinsight.core.WorkflowRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Workflow details or dependents.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowResponse {

    private boolean success;
    private String error;

    @Builder.Default
    private List<WorkflowRecord> workflows = new ArrayList<>();

    public static WorkflowResponse success(List<WorkflowRecord> workflows) {
        return WorkflowResponse.builder()
            .success(true)
            .workflows(workflows)
            .build();
    }

    public static WorkflowResponse error(String error) {
        return WorkflowResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
