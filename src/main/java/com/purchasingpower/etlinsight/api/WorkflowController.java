package com.purchasingpower.etlinsight.api;

import com.purchasingpower.etlinsight.search.WorkflowSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Workflow details and dependents.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowSearchService searchService;

    /**
     * GET /api/v1/workflows/{name}?setId=set30
     */
    @GetMapping("/{name}")
    public ResponseEntity<WorkflowResponse> getDetails(@PathVariable String name,
                                                       @RequestParam(required = false) String setId) {
        try {
            return searchService.getWorkflowDetails(name, setId)
                .map(workflow -> ResponseEntity.ok(WorkflowResponse.success(List.of(workflow))))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(WorkflowResponse.error("Workflow not found: " + name)));
        } catch (Exception e) {
            log.error("Failed to load workflow {}", name, e);
            return ResponseEntity.internalServerError()
                .body(WorkflowResponse.error("Lookup failed: " + e.getMessage()));
        }
    }

    /**
     * GET /api/v1/workflows/{name}/dependents
     */
    @GetMapping("/{name}/dependents")
    public ResponseEntity<WorkflowResponse> getDependents(@PathVariable String name) {
        try {
            return ResponseEntity.ok(WorkflowResponse.success(searchService.findDependents(name)));
        } catch (Exception e) {
            log.error("Failed to resolve dependents of {}", name, e);
            return ResponseEntity.internalServerError()
                .body(WorkflowResponse.error("Dependency lookup failed: " + e.getMessage()));
        }
    }
}
