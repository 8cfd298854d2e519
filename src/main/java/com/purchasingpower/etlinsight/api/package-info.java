/**
 * REST API layer: controllers and DTOs.
 *
 * <p>Exposes the catalog through REST endpoints under {@code /api/v1}:
 * <ul>
 *   <li>Search API - name, table, component and filtered search</li>
 *   <li>Workflow API - details and dependents of one workflow</li>
 *   <li>Debug API - table and workflow diagnosis</li>
 *   <li>Catalog API - ingest, refresh, clear and statistics</li>
 * </ul>
 *
 * <p>Every response carries {@code success} and, on failure, {@code error}.
 *
 * @since 1.0.0
 */
package com.purchasingpower.etlinsight.api;
