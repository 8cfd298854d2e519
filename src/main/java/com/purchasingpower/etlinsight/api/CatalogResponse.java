package com.purchasingpower.etlinsight.api;

import com.purchasingpower.etlinsight.catalog.IngestionResult;
import com.purchasingpower.etlinsight.search.CatalogStatistics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalog write or statistics response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogResponse {

    private boolean success;
    private IngestionResult ingestion;
    private CatalogStatistics statistics;
    private String error;

    public static CatalogResponse ingested(IngestionResult result) {
        return CatalogResponse.builder()
            .success(result.isSuccess())
            .ingestion(result)
            .error(result.getError())
            .build();
    }

    public static CatalogResponse statistics(CatalogStatistics statistics) {
        return CatalogResponse.builder()
            .success(true)
            .statistics(statistics)
            .build();
    }

    public static CatalogResponse error(String error) {
        return CatalogResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
