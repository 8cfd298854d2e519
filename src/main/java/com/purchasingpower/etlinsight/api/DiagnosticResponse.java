package com.purchasingpower.etlinsight.api;

import com.purchasingpower.etlinsight.core.DiagnosticReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Diagnosis response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosticResponse {

    private boolean success;
    private DiagnosticReport report;
    private String error;

    public static DiagnosticResponse success(DiagnosticReport report) {
        return DiagnosticResponse.builder()
            .success(true)
            .report(report)
            .build();
    }

    public static DiagnosticResponse error(String error) {
        return DiagnosticResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
