package com.purchasingpower.etlinsight.api;

import com.purchasingpower.etlinsight.catalog.CatalogIngestionService;
import com.purchasingpower.etlinsight.catalog.IngestionResult;
import com.purchasingpower.etlinsight.core.WorkflowRecord;
import com.purchasingpower.etlinsight.search.WorkflowSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Catalog writes and statistics.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/catalog")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogIngestionService ingestionService;
    private final WorkflowSearchService searchService;

    /**
     * Replace one set.
     *
     * POST /api/v1/catalog/sets/{setId}
     */
    @PostMapping("/sets/{setId}")
    public ResponseEntity<CatalogResponse> ingest(@PathVariable String setId,
                                                  @RequestBody List<WorkflowRecord> records) {
        try {
            return toResponse(ingestionService.ingest(setId, records));
        } catch (Exception e) {
            log.error("Ingest of {} failed", setId, e);
            return ResponseEntity.internalServerError()
                .body(CatalogResponse.error("Ingest failed: " + e.getMessage()));
        }
    }

    /**
     * Replace the whole catalog.
     *
     * PUT /api/v1/catalog
     */
    @PutMapping
    public ResponseEntity<CatalogResponse> refresh(@RequestBody Map<String, List<WorkflowRecord>> recordsBySet) {
        try {
            return toResponse(ingestionService.refresh(recordsBySet));
        } catch (Exception e) {
            log.error("Refresh failed", e);
            return ResponseEntity.internalServerError()
                .body(CatalogResponse.error("Refresh failed: " + e.getMessage()));
        }
    }

    /**
     * DELETE /api/v1/catalog
     */
    @DeleteMapping
    public ResponseEntity<CatalogResponse> clear() {
        try {
            return toResponse(ingestionService.clear());
        } catch (Exception e) {
            log.error("Clear failed", e);
            return ResponseEntity.internalServerError()
                .body(CatalogResponse.error("Clear failed: " + e.getMessage()));
        }
    }

    /**
     * GET /api/v1/catalog/statistics
     */
    @GetMapping("/statistics")
    public ResponseEntity<CatalogResponse> statistics() {
        try {
            return ResponseEntity.ok(CatalogResponse.statistics(searchService.getStatistics()));
        } catch (Exception e) {
            log.error("Failed to collect statistics", e);
            return ResponseEntity.internalServerError()
                .body(CatalogResponse.error("Statistics failed: " + e.getMessage()));
        }
    }

    private ResponseEntity<CatalogResponse> toResponse(IngestionResult result) {
        if (!result.isSuccess()) {
            return ResponseEntity.badRequest().body(CatalogResponse.ingested(result));
        }
        return ResponseEntity.ok(CatalogResponse.ingested(result));
    }
}
