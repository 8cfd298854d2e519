package com.purchasingpower.etlinsight.search.impl;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.Queues;
import com.purchasingpower.etlinsight.catalog.CatalogSnapshot;
import com.purchasingpower.etlinsight.catalog.WorkflowRepository;
import com.purchasingpower.etlinsight.configuration.SearchProperties;
import com.purchasingpower.etlinsight.core.ComponentKind;
import com.purchasingpower.etlinsight.core.MatchType;
import com.purchasingpower.etlinsight.core.SearchCandidate;
import com.purchasingpower.etlinsight.core.SearchOutcome;
import com.purchasingpower.etlinsight.core.SearchResult;
import com.purchasingpower.etlinsight.core.SearchStatus;
import com.purchasingpower.etlinsight.core.WorkflowKey;
import com.purchasingpower.etlinsight.core.WorkflowRecord;
import com.purchasingpower.etlinsight.diagnostic.ArchetypeCatalog;
import com.purchasingpower.etlinsight.knowledge.IndexScope;
import com.purchasingpower.etlinsight.knowledge.SemanticIndex;
import com.purchasingpower.etlinsight.search.CatalogStatistics;
import com.purchasingpower.etlinsight.search.NameMatchHeuristics;
import com.purchasingpower.etlinsight.search.SearchHistoryEntry;
import com.purchasingpower.etlinsight.search.WorkflowFilter;
import com.purchasingpower.etlinsight.search.WorkflowSearchService;
import com.purchasingpower.etlinsight.search.impl.GuardedSemanticIndex.IndexAnswer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Search validator: reconciles exact repository lookups with semantic candidates.
 *
 * <p>Invariant: every returned result references a workflow found in the repository
 * while the result was built. Semantic candidates are dropped when their workflow is
 * gone, halved when their name is not a reasonable match for the query, and dropped
 * when they end up at or below the minimum confidence.
 *
 * <p>Thread Safety: stateless apart from the synchronized history queue.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class WorkflowSearchServiceImpl implements WorkflowSearchService {

    private static final Comparator<SearchResult> BY_CONFIDENCE_DESC =
        Comparator.comparingDouble(SearchResult::getConfidence).reversed();

    private final WorkflowRepository repository;
    private final SemanticIndex semanticIndex;
    private final GuardedSemanticIndex guardedIndex;
    private final NameMatchHeuristics heuristics;
    private final ArchetypeCatalog archetypeCatalog;
    private final SearchProperties properties;
    private final Queue<SearchHistoryEntry> history;

    public WorkflowSearchServiceImpl(WorkflowRepository repository,
                                     SemanticIndex semanticIndex,
                                     GuardedSemanticIndex guardedIndex,
                                     NameMatchHeuristics heuristics,
                                     ArchetypeCatalog archetypeCatalog,
                                     SearchProperties properties) {
        this.repository = repository;
        this.semanticIndex = semanticIndex;
        this.guardedIndex = guardedIndex;
        this.heuristics = heuristics;
        this.archetypeCatalog = archetypeCatalog;
        this.properties = properties;
        this.history = Queues.synchronizedQueue(EvictingQueue.create(properties.getHistoryLimit()));
    }

    @Override
    public SearchOutcome searchByName(String name, boolean exactRequired) {
        if (name == null || name.isBlank()) {
            return SearchOutcome.malformed(name, "Workflow name is required");
        }
        String query = name.trim();

        // Step 1: exact scan, cannot hallucinate
        List<SearchResult> exact = repository.findByNameIgnoreCase(query).stream()
            .map(SearchResult::exact)
            .toList();

        if (exactRequired && !exact.isEmpty()) {
            log.debug("Exact hit for '{}' in {} set(s), semantic path skipped", query, exact.size());
            return record(query, exactRequired, SearchOutcome.of(query, exact));
        }

        // Step 2: semantic candidates, verified one by one
        IndexAnswer answer = guardedIndex.query(query, properties.getNameSearchTopK(), IndexScope.WORKFLOWS);
        if (!answer.available()) {
            return record(query, exactRequired, SearchOutcome.indexUnavailable(query, exact));
        }

        Map<WorkflowKey, SearchResult> merged = new LinkedHashMap<>();
        exact.forEach(result -> merged.put(result.key(), result));
        for (SearchResult result : validateNameCandidates(query, answer.candidates())) {
            merged.putIfAbsent(result.key(), result);
        }

        List<SearchResult> ranked = new ArrayList<>(merged.values());
        ranked.sort(BY_CONFIDENCE_DESC);
        log.info("Name search '{}' (exact={}): {} exact, {} candidates, {} returned",
            query, exactRequired, exact.size(), answer.candidates().size(), ranked.size());
        return record(query, exactRequired, SearchOutcome.of(query, ranked));
    }

    List<SearchResult> validateNameCandidates(String query, List<SearchCandidate> candidates) {
        List<SearchResult> accepted = new ArrayList<>();
        for (SearchCandidate candidate : candidates) {
            Optional<WorkflowRecord> workflow = repository.lookup(candidate.setId(), candidate.workflowName());
            if (workflow.isEmpty()) {
                log.debug("Dropped stale candidate {}", candidate.workflowKey());
                continue;
            }

            double confidence = candidate.rawScore();
            boolean reasonable = heuristics.isReasonableMatch(query, candidate.workflowName());
            if (!reasonable) {
                confidence *= properties.getQuestionableMatchPenalty();
                log.debug("Halved confidence of {} for '{}': {}", candidate.workflowKey(), query, confidence);
            }
            if (confidence <= properties.getMinConfidence()) {
                log.debug("Rejected {} for '{}' at confidence {}", candidate.workflowKey(), query, confidence);
                continue;
            }

            accepted.add(SearchResult.builder()
                .workflow(workflow.get())
                .confidence(confidence)
                .matchReason("Semantic match in " + candidate.setId()
                    + (reasonable ? "" : " (questionable name match)"))
                .setId(candidate.setId())
                .matchType(MatchType.SEMANTIC)
                .build());
        }
        return accepted;
    }

    @Override
    public SearchOutcome searchTableWorkflows(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            return SearchOutcome.malformed(tableName, "Table name is required");
        }
        String table = tableName.trim();
        int topK = properties.getTableSearchTopK();

        IndexAnswer targets = guardedIndex.query("target table " + table, topK, IndexScope.TARGET_TABLES);
        IndexAnswer sources = guardedIndex.query("source table " + table, topK, IndexScope.SOURCE_TABLES);
        if (!targets.available() || !sources.available()) {
            return SearchOutcome.indexUnavailable(table, List.of());
        }

        Map<WorkflowKey, SearchCandidate> best = new LinkedHashMap<>();
        for (SearchCandidate candidate : concat(targets.candidates(), sources.candidates())) {
            best.merge(candidate.workflowKey(), candidate,
                (kept, next) -> next.rawScore() > kept.rawScore() ? next : kept);
        }

        List<SearchResult> results = new ArrayList<>();
        for (SearchCandidate candidate : best.values()) {
            Optional<WorkflowRecord> workflow = repository.lookup(candidate.setId(), candidate.workflowName());
            if (workflow.isEmpty()) {
                log.debug("Dropped stale table candidate {}", candidate.workflowKey());
                continue;
            }
            if (!workflow.get().touchesTable(table)) {
                log.debug("Dropped {}: does not read or write {}", candidate.workflowKey(), table);
                continue;
            }
            results.add(SearchResult.builder()
                .workflow(workflow.get())
                .confidence(candidate.rawScore())
                .matchReason("Table '" + table + "' is " + roleOf(workflow.get(), table) + " in " + candidate.setId())
                .setId(candidate.setId())
                .matchType(MatchType.TABLE)
                .componentName(table)
                .componentKind(workflow.get().writesTable(table) ? ComponentKind.TARGET_TABLE : ComponentKind.SOURCE_TABLE)
                .build());
        }

        results.sort(BY_CONFIDENCE_DESC);
        log.info("Table search '{}': {} candidates, {} verified", table, best.size(), results.size());
        return SearchOutcome.of(table, results);
    }

    @Override
    public SearchOutcome searchComponents(String componentName, ComponentKind kind) {
        if (componentName == null || componentName.isBlank()) {
            return SearchOutcome.malformed(componentName, "Component name is required");
        }
        if (kind == ComponentKind.SESSION) {
            return SearchOutcome.malformed(componentName, "Sessions are not searchable as components");
        }
        String query = componentName.trim();

        IndexAnswer answer = guardedIndex.query(query, properties.getComponentSearchTopK(), IndexScope.of(kind));
        if (!answer.available()) {
            return SearchOutcome.indexUnavailable(query, List.of());
        }

        Map<String, SearchResult> verified = new LinkedHashMap<>();
        for (SearchCandidate candidate : answer.candidates()) {
            if (candidate.componentKind() == null || (kind != null && candidate.componentKind() != kind)) {
                continue;
            }
            Optional<WorkflowRecord> workflow = repository.lookup(candidate.setId(), candidate.workflowName());
            if (workflow.isEmpty() || !workflow.get().hasComponent(candidate.componentKind(), candidate.componentName())) {
                log.debug("Dropped unverifiable component {} in {}", candidate.componentName(), candidate.workflowKey());
                continue;
            }
            String identity = candidate.workflowKey() + "/" + candidate.componentKind().tag() + "/" + candidate.componentName();
            verified.putIfAbsent(identity, SearchResult.builder()
                .workflow(workflow.get())
                .confidence(candidate.rawScore())
                .matchReason("Component '" + candidate.componentName() + "' (" + candidate.componentKind().tag()
                    + ") in " + candidate.setId())
                .setId(candidate.setId())
                .matchType(MatchType.COMPONENT)
                .componentName(candidate.componentName())
                .componentKind(candidate.componentKind())
                .build());
        }

        List<SearchResult> results = new ArrayList<>(verified.values());
        results.sort(BY_CONFIDENCE_DESC);
        return SearchOutcome.of(query, results);
    }

    @Override
    public SearchOutcome searchWithFilters(String query, List<WorkflowFilter> filters) {
        List<WorkflowFilter> constraints = filters != null ? filters : List.of();

        if (query == null || query.isBlank()) {
            List<SearchResult> results = repository.allRecords().stream()
                .filter(workflow -> matchesAll(workflow, constraints))
                .map(workflow -> SearchResult.builder()
                    .workflow(workflow)
                    .confidence(1.0)
                    .matchReason("Matches " + constraints.size() + " filter(s) in " + workflow.getSetId())
                    .setId(workflow.getSetId())
                    .matchType(MatchType.FILTER)
                    .build())
                .toList();
            return SearchOutcome.of("", results);
        }

        SearchOutcome outcome = searchByName(query, false);
        if (outcome.getStatus() == SearchStatus.MALFORMED_QUERY) {
            return outcome;
        }
        List<SearchResult> filtered = outcome.getResults().stream()
            .filter(result -> matchesAll(result.getWorkflow(), constraints))
            .toList();

        if (outcome.getStatus() == SearchStatus.INDEX_UNAVAILABLE) {
            return SearchOutcome.indexUnavailable(outcome.getQuery(), filtered);
        }
        return SearchOutcome.of(outcome.getQuery(), filtered);
    }

    @Override
    public Optional<WorkflowRecord> getWorkflowDetails(String name, String setId) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String workflowName = name.trim();
        if (setId != null && !setId.isBlank()) {
            return repository.lookup(setId.trim(), workflowName);
        }

        CatalogSnapshot snapshot = repository.snapshot();
        return snapshot.setIds().stream()
            .map(set -> snapshot.lookup(set, workflowName))
            .flatMap(Optional::stream)
            .findFirst();
    }

    @Override
    public List<WorkflowRecord> findDependents(String workflowName) {
        if (workflowName == null || workflowName.isBlank()) {
            return List.of();
        }
        String name = workflowName.trim();
        List<WorkflowRecord> records = repository.snapshot().records();

        Set<String> producedTables = records.stream()
            .filter(workflow -> workflow.getName().equals(name))
            .flatMap(workflow -> workflow.getTargetTables().stream())
            .map(table -> table.getName())
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());

        List<WorkflowRecord> dependents = records.stream()
            .filter(workflow -> !workflow.getName().equals(name))
            .filter(workflow -> declaresDependency(workflow, name)
                || producedTables.stream().anyMatch(workflow::readsTable))
            .toList();

        log.debug("{} dependents of {}", dependents.size(), name);
        return dependents;
    }

    @Override
    public CatalogStatistics getStatistics() {
        CatalogSnapshot snapshot = repository.snapshot();
        return CatalogStatistics.builder()
            .recordCount(snapshot.recordCount())
            .setCount(snapshot.setCount())
            .setIds(snapshot.setIds())
            .indexStatus(semanticIndex.status())
            .indexedDocuments(semanticIndex.documentCount())
            .indexUnavailableCount(guardedIndex.getUnavailableCount())
            .searchHistorySize(history.size())
            .archetypeNames(archetypeCatalog.names())
            .lastIngestAt(snapshot.getPublishedAt())
            .build();
    }

    @Override
    public List<SearchHistoryEntry> getHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    @Override
    public void clearHistory() {
        history.clear();
        log.info("Search history cleared");
    }

    private SearchOutcome record(String query, boolean exactRequired, SearchOutcome outcome) {
        history.add(new SearchHistoryEntry(query, Instant.now(), outcome.size(), exactRequired));
        return outcome;
    }

    private static boolean matchesAll(WorkflowRecord workflow, List<WorkflowFilter> filters) {
        return filters.stream().allMatch(filter -> filter.matches(workflow));
    }

    private static boolean declaresDependency(WorkflowRecord workflow, String name) {
        return workflow.getDependencies().stream().anyMatch(name::equalsIgnoreCase);
    }

    private static String roleOf(WorkflowRecord workflow, String table) {
        boolean reads = workflow.readsTable(table);
        boolean writes = workflow.writesTable(table);
        if (reads && writes) {
            return "a source and target table";
        }
        return writes ? "a target table" : "a source table";
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        List<T> all = new ArrayList<>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return all;
    }
}
