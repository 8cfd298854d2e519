package com.purchasingpower.etlinsight.diagnostic;

import com.purchasingpower.etlinsight.core.DiagnosticReport;

/**
 * Explains why a table may be empty or a workflow may be failing.
 *
 * <p>Never throws for unknown entities; a report with {@code found=false}, zero
 * confidence and guidance recommendations is returned instead.
 *
 * @since 1.0.0
 */
public interface DiagnosticService {

    /**
     * Diagnose a table through the workflows that read or write it.
     *
     * @param tableName   table to diagnose
     * @param description free-text symptom, may be empty
     */
    DiagnosticReport analyzeTable(String tableName, String description);

    /**
     * Diagnose the best name match for {@code workflowName}, exact hits preferred.
     */
    DiagnosticReport diagnoseWorkflow(String workflowName, String description);
}
