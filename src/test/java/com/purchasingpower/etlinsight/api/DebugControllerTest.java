package com.purchasingpower.etlinsight.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.etlinsight.catalog.CatalogIngestionService;
import com.purchasingpower.etlinsight.catalog.IngestionResult;
import com.purchasingpower.etlinsight.core.ComponentStatus;
import com.purchasingpower.etlinsight.core.DiagnosticReport;
import com.purchasingpower.etlinsight.core.SearchStatus;
import com.purchasingpower.etlinsight.core.WorkflowRecord;
import com.purchasingpower.etlinsight.diagnostic.DiagnosticService;
import com.purchasingpower.etlinsight.knowledge.IndexStatus;
import com.purchasingpower.etlinsight.search.CatalogStatistics;
import com.purchasingpower.etlinsight.search.WorkflowSearchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {DebugController.class, CatalogController.class})
@DisplayName("Debug and catalog endpoints")
class DebugControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private DiagnosticService diagnosticService;

    @MockBean
    private CatalogIngestionService ingestionService;

    @MockBean
    private WorkflowSearchService searchService;

    @Test
    @DisplayName("Table diagnosis returns the report")
    void debugTable() throws Exception {
        // Given
        when(diagnosticService.analyzeTable("CUSTOMERS", "")).thenReturn(DiagnosticReport.builder()
            .targetEntity("CUSTOMERS")
            .targetKind(DiagnosticReport.TargetKind.TABLE)
            .found(true)
            .status(SearchStatus.OK)
            .issue("Target table CUSTOMERS has no load type specified")
            .recommendation("Check session logs for detailed error messages")
            .confidence(0.4)
            .build());

        // When/Then
        mockMvc.perform(post("/api/v1/debug/table")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(DebugRequest.builder().target("CUSTOMERS").build())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.report.targetEntity").value("CUSTOMERS"))
            .andExpect(jsonPath("$.report.found").value(true))
            .andExpect(jsonPath("$.report.issues[0]").value("Target table CUSTOMERS has no load type specified"))
            .andExpect(jsonPath("$.report.confidence").value(0.4));
    }

    @Test
    @DisplayName("Blank workflow name is a bad request")
    void blankWorkflow() throws Exception {
        mockMvc.perform(post("/api/v1/debug/workflow")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\":\"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Workflow name is required"));
    }

    @Test
    @DisplayName("Unexpected failures become an error envelope")
    void unexpectedFailure() throws Exception {
        when(diagnosticService.diagnoseWorkflow(any(), any())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/v1/debug/workflow")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\":\"LOAD_CUSTOMERS\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Diagnosis failed: boom"));
    }

    @Test
    @DisplayName("Rejected ingest is a bad request carrying the reason")
    void rejectedIngest() throws Exception {
        when(ingestionService.ingest(eq("set30"), anyList()))
            .thenReturn(IngestionResult.failed("Duplicate workflow A in set set30", 3));

        mockMvc.perform(post("/api/v1/catalog/sets/set30")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"setId\":\"set30\",\"name\":\"A\"},{\"setId\":\"set30\",\"name\":\"A\"}]"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Duplicate workflow A in set set30"));
    }

    @Test
    @DisplayName("Ingest binds lower-case metadata status values")
    @SuppressWarnings("unchecked")
    void ingestLowerCaseStatus() throws Exception {
        // Given
        when(ingestionService.ingest(eq("set30"), anyList())).thenReturn(IngestionResult.builder()
            .success(true)
            .setCount(1)
            .recordCount(1)
            .indexStatus(IndexStatus.READY)
            .build());

        // When
        mockMvc.perform(post("/api/v1/catalog/sets/set30")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"setId\":\"set30\",\"name\":\"LOAD_CUSTOMERS\",\"status\":\"active\"}]"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));

        // Then
        ArgumentCaptor<List<WorkflowRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(ingestionService).ingest(eq("set30"), captor.capture());
        assertThat(captor.getValue()).extracting(WorkflowRecord::getStatus).containsExactly(ComponentStatus.ACTIVE);
    }

    @Test
    @DisplayName("Statistics expose catalog and index health")
    void statistics() throws Exception {
        when(searchService.getStatistics()).thenReturn(CatalogStatistics.builder()
            .recordCount(2)
            .setCount(1)
            .setId("set30")
            .indexStatus(IndexStatus.READY)
            .indexedDocuments(8)
            .archetypeName("empty table")
            .build());

        mockMvc.perform(get("/api/v1/catalog/statistics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.statistics.recordCount").value(2))
            .andExpect(jsonPath("$.statistics.indexStatus").value("READY"))
            .andExpect(jsonPath("$.statistics.archetypeNames[0]").value("empty table"));
    }
}
