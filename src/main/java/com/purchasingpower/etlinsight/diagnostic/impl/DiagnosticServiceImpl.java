package com.purchasingpower.etlinsight.diagnostic.impl;

import com.purchasingpower.etlinsight.configuration.DiagnosticProperties;
import com.purchasingpower.etlinsight.core.DiagnosticReport;
import com.purchasingpower.etlinsight.core.DiagnosticReport.TargetKind;
import com.purchasingpower.etlinsight.core.SearchOutcome;
import com.purchasingpower.etlinsight.core.SearchResult;
import com.purchasingpower.etlinsight.core.SearchStatus;
import com.purchasingpower.etlinsight.diagnostic.ArchetypeCatalog;
import com.purchasingpower.etlinsight.diagnostic.DiagnosticService;
import com.purchasingpower.etlinsight.diagnostic.IssueArchetype;
import com.purchasingpower.etlinsight.diagnostic.StructuralAnalyzers;
import com.purchasingpower.etlinsight.search.WorkflowSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Diagnostic pipeline: resolve the entity, run structural analyzers, match
 * archetypes, then synthesize recommendations and a confidence score.
 *
 * <p>Stateless; each call is a function of the current catalog and its input.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagnosticServiceImpl implements DiagnosticService {

    static final List<String> GENERAL_ADVICE = List.of(
        "Check session logs for detailed error messages",
        "Verify source data availability and quality",
        "Test database connections manually",
        "Review workflow schedule and dependencies",
        "Check system resources and performance"
    );

    static final List<String> TABLE_NOT_FOUND_ADVICE = List.of(
        "Verify the table name is correct",
        "Check if workflows exist in other sets",
        "Confirm the table is actually a target table in any workflow"
    );

    private final WorkflowSearchService searchService;
    private final StructuralAnalyzers analyzers;
    private final ArchetypeCatalog archetypeCatalog;
    private final DiagnosticProperties properties;

    @Override
    public DiagnosticReport analyzeTable(String tableName, String description) {
        if (tableName == null || tableName.isBlank()) {
            return malformed(tableName, TargetKind.TABLE, "Table name is required");
        }
        String table = tableName.trim();
        log.info("Analyzing table: {}", table);

        SearchOutcome outcome = searchService.searchTableWorkflows(table);
        if (outcome.isEmpty()) {
            log.info("No responsible workflows for table {} ({})", table, outcome.getStatus());
            return DiagnosticReport.builder()
                .targetEntity(table)
                .targetKind(TargetKind.TABLE)
                .found(false)
                .status(outcome.getStatus())
                .issue(outcome.getStatus() == SearchStatus.INDEX_UNAVAILABLE
                    ? "Responsible workflows could not be resolved because the semantic index is unavailable"
                    : "No workflows found that load this table")
                .recommendations(TABLE_NOT_FOUND_ADVICE)
                .confidence(0.0)
                .build();
        }

        return diagnose(table, TargetKind.TABLE, outcome.getStatus(), outcome.getResults(), description);
    }

    @Override
    public DiagnosticReport diagnoseWorkflow(String workflowName, String description) {
        if (workflowName == null || workflowName.isBlank()) {
            return malformed(workflowName, TargetKind.WORKFLOW, "Workflow name is required");
        }
        String name = workflowName.trim();
        log.info("Diagnosing workflow: {}", name);

        SearchOutcome outcome = searchService.searchByName(name, true);
        if (outcome.isEmpty()) {
            return DiagnosticReport.builder()
                .targetEntity(name)
                .targetKind(TargetKind.WORKFLOW)
                .found(false)
                .status(outcome.getStatus())
                .issue("Workflow not found")
                .recommendation("Verify workflow name and check if it exists")
                .confidence(0.0)
                .build();
        }

        SearchResult best = outcome.getResults().get(0);
        log.debug("Best match for '{}' is {} ({})", name, best.key(), best.getConfidence());
        return diagnose(name, TargetKind.WORKFLOW, outcome.getStatus(), List.of(best), description);
    }

    private DiagnosticReport diagnose(String target, TargetKind kind, SearchStatus status,
                                      List<SearchResult> workflows, String description) {
        Set<String> issueSet = new LinkedHashSet<>();
        for (SearchResult result : workflows) {
            issueSet.addAll(analyzers.analyzeWorkflow(result.getWorkflow()));
        }
        List<String> issues = new ArrayList<>(issueSet);

        List<IssueArchetype> matched = archetypeCatalog.match(description, issues);
        List<String> recommendations = recommendations(matched, issues);
        double confidence = confidence(!workflows.isEmpty(), issues.size(), matched.size());

        log.info("Diagnosis of {} {}: {} workflows, {} issues, {} archetype matches, confidence {}",
            kind, target, workflows.size(), issues.size(), matched.size(), String.format("%.2f", confidence));

        return DiagnosticReport.builder()
            .targetEntity(target)
            .targetKind(kind)
            .found(true)
            .status(status)
            .responsibleWorkflows(workflows)
            .issues(issues)
            .recommendations(recommendations)
            .matchedArchetypes(matched.stream().map(IssueArchetype::name).toList())
            .confidence(confidence)
            .build();
    }

    /**
     * Archetype solutions, then category advice for each issue, then general advice;
     * deduplicated in first-seen order and capped.
     */
    List<String> recommendations(List<IssueArchetype> matched, List<String> issues) {
        Set<String> recommendations = new LinkedHashSet<>();
        matched.forEach(archetype -> recommendations.addAll(archetype.solutions()));
        issues.forEach(issue -> recommendations.addAll(categoryAdvice(issue)));
        recommendations.addAll(GENERAL_ADVICE);

        return recommendations.stream()
            .limit(properties.getMaxRecommendations())
            .toList();
    }

    static List<String> categoryAdvice(String issue) {
        String lower = issue.toLowerCase(Locale.ROOT);
        List<String> advice = new ArrayList<>();
        if (lower.contains("connection")) {
            advice.add("Check and fix database connections");
        }
        if (lower.contains("status")) {
            advice.add("Verify workflow and session status");
        }
        if (lower.contains("filter")) {
            advice.add("Review and correct filter expressions");
        }
        if (lower.contains("transformation")) {
            advice.add("Check transformation logic and expressions");
        }
        if (lower.contains("schema") || lower.contains("database")) {
            advice.add("Verify schema and database configurations");
        }
        return advice;
    }

    double confidence(boolean workflowFound, int issueCount, int archetypeMatches) {
        double score = workflowFound ? properties.getBaseConfidence() : 0.0;
        score += Math.min(properties.getIssueCap(), issueCount * properties.getIssueWeight());
        score += Math.min(properties.getArchetypeCap(), archetypeMatches * properties.getArchetypeWeight());
        return SearchResult.clamp(score);
    }

    private DiagnosticReport malformed(String target, TargetKind kind, String reason) {
        return DiagnosticReport.builder()
            .targetEntity(target)
            .targetKind(kind)
            .found(false)
            .status(SearchStatus.MALFORMED_QUERY)
            .issue(reason)
            .confidence(0.0)
            .build();
    }
}
