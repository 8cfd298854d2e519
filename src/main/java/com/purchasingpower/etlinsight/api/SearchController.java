package com.purchasingpower.etlinsight.api;

import com.purchasingpower.etlinsight.core.ComponentKind;
import com.purchasingpower.etlinsight.core.ComponentStatus;
import com.purchasingpower.etlinsight.core.SearchOutcome;
import com.purchasingpower.etlinsight.search.WorkflowFilter;
import com.purchasingpower.etlinsight.search.WorkflowSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

/**
 * REST controller for search API.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
public class SearchController {

    private final WorkflowSearchService searchService;

    /**
     * Workflow name search.
     *
     * GET /api/v1/search/workflows?name=LOAD_CUSTOMERS&exact=true
     */
    @GetMapping("/workflows")
    public ResponseEntity<SearchResponse> searchByName(@RequestParam(required = false) String name,
                                                       @RequestParam(defaultValue = "false") boolean exact) {
        if (name == null || name.isBlank()) {
            return ResponseEntity.badRequest().body(SearchResponse.error("Workflow name is required"));
        }
        try {
            log.info("Name search: {} (exact={})", name, exact);
            return ResponseEntity.ok(SearchResponse.success(searchService.searchByName(name, exact)));
        } catch (Exception e) {
            log.error("Name search failed", e);
            return ResponseEntity.internalServerError()
                .body(SearchResponse.error("Search failed: " + e.getMessage()));
        }
    }

    /**
     * Workflows reading or writing a table.
     *
     * GET /api/v1/search/tables/{tableName}
     */
    @GetMapping("/tables/{tableName}")
    public ResponseEntity<SearchResponse> searchTable(@PathVariable String tableName) {
        try {
            log.info("Table search: {}", tableName);
            return ResponseEntity.ok(SearchResponse.success(searchService.searchTableWorkflows(tableName)));
        } catch (Exception e) {
            log.error("Table search failed", e);
            return ResponseEntity.internalServerError()
                .body(SearchResponse.error("Search failed: " + e.getMessage()));
        }
    }

    /**
     * Component search.
     *
     * GET /api/v1/search/components?name=EXP_CLEAN&kind=transformation
     */
    @GetMapping("/components")
    public ResponseEntity<SearchResponse> searchComponents(@RequestParam(required = false) String name,
                                                           @RequestParam(required = false) String kind) {
        if (name == null || name.isBlank()) {
            return ResponseEntity.badRequest().body(SearchResponse.error("Component name is required"));
        }
        try {
            ComponentKind componentKind = kind == null || kind.isBlank() ? null : parseKind(kind);
            log.info("Component search: {} ({})", name, componentKind);
            return ResponseEntity.ok(SearchResponse.success(searchService.searchComponents(name, componentKind)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(SearchResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Component search failed", e);
            return ResponseEntity.internalServerError()
                .body(SearchResponse.error("Search failed: " + e.getMessage()));
        }
    }

    /**
     * Name search narrowed by filters.
     *
     * POST /api/v1/search/filters
     */
    @PostMapping("/filters")
    public ResponseEntity<SearchResponse> searchWithFilters(@RequestBody FilterSearchRequest request) {
        try {
            List<WorkflowFilter> filters = toFilters(request);
            log.info("Filtered search: '{}' with {} filters", request.getQuery(), filters.size());
            SearchOutcome outcome = searchService.searchWithFilters(request.getQuery(), filters);
            return ResponseEntity.ok(SearchResponse.success(outcome));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(SearchResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Filtered search failed", e);
            return ResponseEntity.internalServerError()
                .body(SearchResponse.error("Search failed: " + e.getMessage()));
        }
    }

    private List<WorkflowFilter> toFilters(FilterSearchRequest request) {
        List<WorkflowFilter> filters = new ArrayList<>();
        if (request.getStatus() != null) {
            filters.add(WorkflowFilter.statusEquals(ComponentStatus.fromValue(request.getStatus())));
        }
        if (request.getSetId() != null) {
            filters.add(WorkflowFilter.setEquals(request.getSetId()));
        }
        if (request.getSourceTable() != null) {
            filters.add(WorkflowFilter.hasSourceTable(request.getSourceTable()));
        }
        if (request.getTargetTable() != null) {
            filters.add(WorkflowFilter.hasTargetTable(request.getTargetTable()));
        }
        if (request.getMinSessions() != null) {
            filters.add(WorkflowFilter.minSessions(request.getMinSessions()));
        }
        if (request.getMaxSessions() != null) {
            filters.add(WorkflowFilter.maxSessions(request.getMaxSessions()));
        }
        return filters;
    }

    private ComponentKind parseKind(String kind) {
        String wanted = kind.trim();
        for (ComponentKind candidate : ComponentKind.values()) {
            if (candidate.tag().equalsIgnoreCase(wanted) || candidate.name().equalsIgnoreCase(wanted)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown component kind: " + kind);
    }
}
