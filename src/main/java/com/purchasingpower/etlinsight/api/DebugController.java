package com.purchasingpower.etlinsight.api;

import com.purchasingpower.etlinsight.diagnostic.DiagnosticService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Table and workflow diagnosis.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/debug")
@RequiredArgsConstructor
public class DebugController {

    private final DiagnosticService diagnosticService;

    /**
     * Why is this table empty or failing?
     *
     * POST /api/v1/debug/table
     */
    @PostMapping("/table")
    public ResponseEntity<DiagnosticResponse> debugTable(@RequestBody DebugRequest request) {
        if (request.getTarget() == null || request.getTarget().isBlank()) {
            return ResponseEntity.badRequest().body(DiagnosticResponse.error("Table name is required"));
        }
        try {
            String description = request.getDescription() != null ? request.getDescription() : "";
            return ResponseEntity.ok(DiagnosticResponse.success(
                diagnosticService.analyzeTable(request.getTarget(), description)));
        } catch (Exception e) {
            log.error("Table diagnosis failed for {}", request.getTarget(), e);
            return ResponseEntity.internalServerError()
                .body(DiagnosticResponse.error("Diagnosis failed: " + e.getMessage()));
        }
    }

    /**
     * POST /api/v1/debug/workflow
     */
    @PostMapping("/workflow")
    public ResponseEntity<DiagnosticResponse> debugWorkflow(@RequestBody DebugRequest request) {
        if (request.getTarget() == null || request.getTarget().isBlank()) {
            return ResponseEntity.badRequest().body(DiagnosticResponse.error("Workflow name is required"));
        }
        try {
            String description = request.getDescription() != null ? request.getDescription() : "";
            return ResponseEntity.ok(DiagnosticResponse.success(
                diagnosticService.diagnoseWorkflow(request.getTarget(), description)));
        } catch (Exception e) {
            log.error("Workflow diagnosis failed for {}", request.getTarget(), e);
            return ResponseEntity.internalServerError()
                .body(DiagnosticResponse.error("Diagnosis failed: " + e.getMessage()));
        }
    }
}
