package com.purchasingpower.etlinsight.search.impl;

import com.purchasingpower.etlinsight.catalog.impl.InMemoryWorkflowRepository;
import com.purchasingpower.etlinsight.configuration.SearchProperties;
import com.purchasingpower.etlinsight.core.ComponentKind;
import com.purchasingpower.etlinsight.core.MatchType;
import com.purchasingpower.etlinsight.core.SearchOutcome;
import com.purchasingpower.etlinsight.core.SearchResult;
import com.purchasingpower.etlinsight.core.SearchStatus;
import com.purchasingpower.etlinsight.core.WorkflowRecord;
import com.purchasingpower.etlinsight.diagnostic.ArchetypeCatalog;
import com.purchasingpower.etlinsight.knowledge.IndexScope;
import com.purchasingpower.etlinsight.knowledge.IndexStatus;
import com.purchasingpower.etlinsight.search.CatalogStatistics;
import com.purchasingpower.etlinsight.search.NameMatchHeuristics;
import com.purchasingpower.etlinsight.search.WorkflowFilter;
import com.purchasingpower.etlinsight.support.StubSemanticIndex;
import com.purchasingpower.etlinsight.support.WorkflowFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.purchasingpower.etlinsight.core.SearchCandidate.forComponent;
import static com.purchasingpower.etlinsight.core.SearchCandidate.forWorkflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Workflow search validator")
class WorkflowSearchServiceImplTest {

    private InMemoryWorkflowRepository repository;
    private StubSemanticIndex index;
    private SearchProperties properties;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        repository = new InMemoryWorkflowRepository();
        repository.replace("set30", List.of(
            WorkflowFixtures.loadCustomers(),
            WorkflowFixtures.healthy("set30", "LOAD_ORDERS", "STG_ORDERS", "ORDERS")));
        repository.replace("set31", List.of(
            WorkflowFixtures.healthy("set31", "LOAD_CUSTOMERS_HIST", "CUSTOMERS", "CUSTOMERS_HIST"),
            WorkflowFixtures.named("set31", "AUDIT_LOADS").toBuilder().dependency("load_customers").build()));

        index = new StubSemanticIndex();
        properties = new SearchProperties();
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private WorkflowSearchServiceImpl service() {
        return new WorkflowSearchServiceImpl(repository, index,
            new GuardedSemanticIndex(index, executor, properties),
            new NameMatchHeuristics(properties), new ArchetypeCatalog(), properties);
    }

    private static void assertSortedAndBounded(SearchOutcome outcome) {
        List<Double> confidences = outcome.getResults().stream().map(SearchResult::getConfidence).toList();
        assertThat(confidences).allSatisfy(c -> assertThat(c).isBetween(0.0, 1.0));
        assertThat(confidences).isSortedAccordingTo((a, b) -> Double.compare(b, a));
    }

    private void assertAllExist(SearchOutcome outcome) {
        assertThat(outcome.getResults())
            .allSatisfy(r -> assertThat(repository.exists(r.getSetId(), r.getWorkflowName())).isTrue());
    }

    @Nested
    @DisplayName("Search by name")
    class SearchByName {

        @Test
        @DisplayName("Exact hit with exact required returns it at 1.0 without consulting the index")
        void exactRequiredSkipsIndex() {
            // Given
            index.answer(IndexScope.WORKFLOWS, forWorkflow("set30", "LOAD_ORDERS", 0.0));

            // When
            SearchOutcome outcome = service().searchByName("load_customers", true);

            // Then
            assertThat(outcome.getStatus()).isEqualTo(SearchStatus.OK);
            assertThat(outcome.getResults()).singleElement().satisfies(r -> {
                assertThat(r.getWorkflowName()).isEqualTo("LOAD_CUSTOMERS");
                assertThat(r.getSetId()).isEqualTo("set30");
                assertThat(r.getConfidence()).isEqualTo(1.0);
                assertThat(r.getMatchType()).isEqualTo(MatchType.EXACT);
                assertThat(r.getMatchReason()).isEqualTo("Exact name match in set30");
            });
            assertThat(index.queryCount()).isZero();
        }

        @Test
        @DisplayName("Stale, questionable and weak candidates are dropped or down-weighted")
        void validatesSemanticCandidates() {
            // Given: the index still knows OLD_WF, which has left the repository
            index.answer(IndexScope.WORKFLOWS,
                forWorkflow("set30", "OLD_WF", 0.05),
                forWorkflow("set30", "LOAD_CUSTOMERS", 0.2),
                forWorkflow("set30", "LOAD_ORDERS", 0.3),
                forWorkflow("set31", "LOAD_CUSTOMERS_HIST", 0.1),
                forWorkflow("set31", "AUDIT_LOADS", 0.45));

            // When
            SearchOutcome outcome = service().searchByName("customers", false);

            // Then
            assertThat(outcome.getResults())
                .extracting(SearchResult::getWorkflowName)
                .containsExactly("LOAD_CUSTOMERS_HIST", "LOAD_CUSTOMERS", "LOAD_ORDERS");
            assertThat(outcome.getResults().get(0).getConfidence()).isEqualTo(0.9, within(1e-9));
            assertThat(outcome.getResults().get(2).getConfidence()).isEqualTo(0.35, within(1e-9));
            assertThat(outcome.getResults().get(2).getMatchReason()).isEqualTo("Semantic match in set30 (questionable name match)");
            assertSortedAndBounded(outcome);
            assertAllExist(outcome);
        }

        @Test
        @DisplayName("Candidates at or below the threshold are dropped even when the name looks right")
        void thresholdAppliesToEveryCandidate() {
            index.answer(IndexScope.WORKFLOWS,
                forWorkflow("set30", "LOAD_CUSTOMERS", 0.75),
                forWorkflow("set31", "LOAD_CUSTOMERS_HIST", 0.2));

            SearchOutcome outcome = service().searchByName("customers", false);

            assertThat(outcome.getResults()).extracting(SearchResult::getWorkflowName)
                .containsExactly("LOAD_CUSTOMERS_HIST");
        }

        @Test
        @DisplayName("Without exact required, exact hits win over their semantic duplicates")
        void exactHitsMergeWithSemanticResults() {
            index.answer(IndexScope.WORKFLOWS,
                forWorkflow("set30", "LOAD_CUSTOMERS", 0.4),
                forWorkflow("set31", "LOAD_CUSTOMERS_HIST", 0.15));

            SearchOutcome outcome = service().searchByName("LOAD_CUSTOMERS", false);

            assertThat(outcome.getResults()).hasSize(2);
            assertThat(outcome.getResults().get(0).getMatchType()).isEqualTo(MatchType.EXACT);
            assertThat(outcome.getResults().get(0).getConfidence()).isEqualTo(1.0);
            assertThat(outcome.getResults().get(1).getWorkflowName()).isEqualTo("LOAD_CUSTOMERS_HIST");
            assertThat(index.queryCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Out-of-range distances still yield confidences within [0,1]")
        void confidenceBounds() {
            index.answer(IndexScope.WORKFLOWS,
                forWorkflow("set30", "LOAD_CUSTOMERS", -3.0),
                forWorkflow("set31", "LOAD_CUSTOMERS_HIST", 7.0));

            SearchOutcome outcome = service().searchByName("customers", false);

            assertThat(outcome.getResults()).singleElement()
                .extracting(SearchResult::getConfidence).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Blank name is a malformed query, not an exception")
        void blankNameIsMalformed() {
            SearchOutcome outcome = service().searchByName("   ", false);

            assertThat(outcome.getStatus()).isEqualTo(SearchStatus.MALFORMED_QUERY);
            assertThat(outcome.getResults()).isEmpty();
            assertThat(outcome.getGuidance()).isNotBlank();
            assertThat(index.queryCount()).isZero();
        }

        @Test
        @DisplayName("No hits at all is reported as not found with guidance")
        void nothingFound() {
            SearchOutcome outcome = service().searchByName("payroll", false);

            assertThat(outcome.getStatus()).isEqualTo(SearchStatus.NOT_FOUND);
            assertThat(outcome.getGuidance()).contains("payroll");
        }

        @Test
        @DisplayName("Unavailable index degrades to the exact scan")
        void unavailableIndexFallsBackToExactScan() {
            index.failing();

            SearchOutcome exact = service().searchByName("LOAD_CUSTOMERS", false);
            SearchOutcome fuzzy = service().searchByName("customers", false);

            assertThat(exact.getStatus()).isEqualTo(SearchStatus.INDEX_UNAVAILABLE);
            assertThat(exact.getResults()).extracting(SearchResult::getConfidence).containsExactly(1.0);
            assertThat(fuzzy.getStatus()).isEqualTo(SearchStatus.INDEX_UNAVAILABLE);
            assertThat(fuzzy.getResults()).isEmpty();
        }

        @Test
        @DisplayName("A timed-out index call counts as unavailable")
        void timeoutCountsAsUnavailable() {
            properties.setIndexTimeoutMs(100);
            index.delayed(3_000).answer(IndexScope.WORKFLOWS, forWorkflow("set30", "LOAD_CUSTOMERS", 0.1));
            WorkflowSearchServiceImpl service = service();

            SearchOutcome outcome = service.searchByName("customers", false);

            assertThat(outcome.getStatus()).isEqualTo(SearchStatus.INDEX_UNAVAILABLE);
            assertThat(service.getStatistics().getIndexUnavailableCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Search by table")
    class SearchByTable {

        @Test
        @DisplayName("Keeps the best candidate per workflow and only workflows that really touch the table")
        void tableContainment() {
            // Given
            index.answer(IndexScope.TARGET_TABLES,
                forComponent("set30", "LOAD_CUSTOMERS", "CUSTOMERS", ComponentKind.TARGET_TABLE, 0.1),
                forComponent("set30", "LOAD_ORDERS", "ORDERS", ComponentKind.TARGET_TABLE, 0.2),
                forComponent("set30", "OLD_WF", "CUSTOMERS", ComponentKind.TARGET_TABLE, 0.05));
            index.answer(IndexScope.SOURCE_TABLES,
                forComponent("set31", "LOAD_CUSTOMERS_HIST", "CUSTOMERS", ComponentKind.SOURCE_TABLE, 0.3),
                forComponent("set30", "LOAD_CUSTOMERS", "STG_CUSTOMERS", ComponentKind.SOURCE_TABLE, 0.5));

            // When
            SearchOutcome outcome = service().searchTableWorkflows("customers");

            // Then
            assertThat(outcome.getResults()).extracting(SearchResult::getWorkflowName)
                .containsExactly("LOAD_CUSTOMERS", "LOAD_CUSTOMERS_HIST");
            assertThat(outcome.getResults().get(0).getConfidence()).isEqualTo(0.9, within(1e-9));
            assertThat(outcome.getResults().get(0).getMatchReason()).isEqualTo("Table 'customers' is a target table in set30");
            assertThat(outcome.getResults()).allSatisfy(r -> {
                assertThat(r.getWorkflow().touchesTable("CUSTOMERS")).isTrue();
                assertThat(r.getMatchType()).isEqualTo(MatchType.TABLE);
            });
            assertSortedAndBounded(outcome);
            assertAllExist(outcome);
        }

        @Test
        @DisplayName("Unavailable index yields an honest empty answer")
        void unavailableIndex() {
            index.failing();

            SearchOutcome outcome = service().searchTableWorkflows("CUSTOMERS");

            assertThat(outcome.getStatus()).isEqualTo(SearchStatus.INDEX_UNAVAILABLE);
            assertThat(outcome.getResults()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Components, filters, details and dependents")
    class CatalogQueries {

        @Test
        @DisplayName("Component candidates must exist in their workflow")
        void componentSearch() {
            index.answer(IndexScope.TRANSFORMATIONS,
                forComponent("set30", "LOAD_ORDERS", "EXP_GHOST", ComponentKind.TRANSFORMATION, 0.1),
                forComponent("set30", "LOAD_CUSTOMERS", "EXP_CUSTOMERS", ComponentKind.TRANSFORMATION, 0.2));

            SearchOutcome outcome = service().searchComponents("EXP_CUSTOMERS", ComponentKind.TRANSFORMATION);

            assertThat(outcome.getResults()).singleElement().satisfies(r -> {
                assertThat(r.getWorkflowName()).isEqualTo("LOAD_CUSTOMERS");
                assertThat(r.getComponentName()).isEqualTo("EXP_CUSTOMERS");
                assertThat(r.getComponentKind()).isEqualTo(ComponentKind.TRANSFORMATION);
            });
        }

        @Test
        @DisplayName("Sessions are not a searchable component kind")
        void sessionsAreMalformed() {
            assertThat(service().searchComponents("s_LOAD", ComponentKind.SESSION).getStatus())
                .isEqualTo(SearchStatus.MALFORMED_QUERY);
        }

        @Test
        @DisplayName("Filters narrow the fuzzy search and can run on their own")
        void filteredSearch() {
            index.answer(IndexScope.WORKFLOWS,
                forWorkflow("set30", "LOAD_CUSTOMERS", 0.2),
                forWorkflow("set31", "LOAD_CUSTOMERS_HIST", 0.1));

            SearchOutcome narrowed = service().searchWithFilters("customers", List.of(WorkflowFilter.setEquals("set31")));
            SearchOutcome filtersOnly = service().searchWithFilters(" ", List.of(WorkflowFilter.hasTargetTable("customers")));

            assertThat(narrowed.getResults()).extracting(SearchResult::getWorkflowName)
                .containsExactly("LOAD_CUSTOMERS_HIST");
            assertThat(filtersOnly.getResults()).singleElement().satisfies(r -> {
                assertThat(r.getWorkflowName()).isEqualTo("LOAD_CUSTOMERS");
                assertThat(r.getMatchType()).isEqualTo(MatchType.FILTER);
            });
        }

        @Test
        @DisplayName("Details lookup is exact, optionally scoped to a set")
        void workflowDetails() {
            assertThat(service().getWorkflowDetails("LOAD_CUSTOMERS", null)).get()
                .extracting(WorkflowRecord::getSetId).isEqualTo("set30");
            assertThat(service().getWorkflowDetails("LOAD_CUSTOMERS", "set31")).isEmpty();
            assertThat(service().getWorkflowDetails("load_customers", null)).isEmpty();
        }

        @Test
        @DisplayName("Dependents come from declared dependencies and from reading produced tables")
        void dependents() {
            List<WorkflowRecord> dependents = service().findDependents("LOAD_CUSTOMERS");

            assertThat(dependents).extracting(WorkflowRecord::getName)
                .containsExactlyInAnyOrder("LOAD_CUSTOMERS_HIST", "AUDIT_LOADS");
        }
    }

    @Nested
    @DisplayName("Statistics and history")
    class StatisticsAndHistory {

        @Test
        @DisplayName("Statistics reflect the catalog, the index and the history")
        void statistics() {
            WorkflowSearchServiceImpl service = service();
            service.searchByName("LOAD_CUSTOMERS", true);

            CatalogStatistics statistics = service.getStatistics();

            assertThat(statistics.getRecordCount()).isEqualTo(4);
            assertThat(statistics.getSetCount()).isEqualTo(2);
            assertThat(statistics.getSetIds()).containsExactly("set30", "set31");
            assertThat(statistics.getIndexStatus()).isEqualTo(IndexStatus.READY);
            assertThat(statistics.getSearchHistorySize()).isEqualTo(1);
            assertThat(statistics.getArchetypeNames()).hasSize(5);
            assertThat(statistics.getLastIngestAt()).isNotNull();
        }

        @Test
        @DisplayName("History is bounded and can be cleared")
        void boundedHistory() {
            properties.setHistoryLimit(2);
            WorkflowSearchServiceImpl service = service();

            service.searchByName("LOAD_CUSTOMERS", true);
            service.searchByName("LOAD_ORDERS", true);
            service.searchByName("AUDIT_LOADS", true);

            assertThat(service.getHistory()).extracting(h -> h.query())
                .containsExactly("LOAD_ORDERS", "AUDIT_LOADS");

            service.clearHistory();
            assertThat(service.getHistory()).isEmpty();
        }
    }
}
