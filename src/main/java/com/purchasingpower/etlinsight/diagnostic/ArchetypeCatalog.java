package com.purchasingpower.etlinsight.diagnostic;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Static catalog of issue archetypes, plus the keyword test that selects them.
 *
 * <p>The catalog is heuristic and not exhaustive. Order matters: recommendations
 * are emitted in archetype order.
 *
 * @since 1.0.0
 */
@Component
public class ArchetypeCatalog {

    private final List<IssueArchetype> archetypes = List.of(
        new IssueArchetype(
            "empty table",
            "Table is empty or has no data",
            List.of("empty", "no data", "no rows", "zero rows", "not loaded", "excludes all data"),
            List.of(
                "Source data is empty or not available",
                "Session failed during execution",
                "Transformation filters out all records",
                "Target connection issues",
                "Workflow not scheduled or not running",
                "Source query returns no results"),
            List.of(
                "Check session logs for errors",
                "Verify source data availability",
                "Check transformation logic and filters",
                "Verify target database connection",
                "Check workflow schedule and status",
                "Review source query conditions"),
            List.of(
                "Fix source data issues",
                "Correct transformation logic",
                "Resolve connection problems",
                "Update workflow schedule",
                "Modify source query if needed")),
        new IssueArchetype(
            "session failure",
            "Workflow session fails to execute",
            List.of("session failed", "last run status", "stop_on_error", "error_threshold", "permission"),
            List.of(
                "Source connection timeout",
                "Target connection issues",
                "Insufficient memory or resources",
                "Transformation errors",
                "Data type mismatches",
                "Permission issues"),
            List.of(
                "Check session logs for specific error messages",
                "Verify all connections are working",
                "Check system resources and memory",
                "Review transformation expressions",
                "Validate data types and mappings",
                "Check user permissions"),
            List.of(
                "Fix connection configurations",
                "Increase memory allocation",
                "Correct transformation logic",
                "Resolve data type issues",
                "Update user permissions")),
        new IssueArchetype(
            "data quality issues",
            "Data quality problems in target tables",
            List.of("data quality", "invalid", "duplicate", "problematic expression", "null"),
            List.of(
                "Source data contains invalid values",
                "Transformation logic errors",
                "Missing data validation rules",
                "Incorrect data type conversions",
                "Null value handling issues"),
            List.of(
                "Analyze source data quality",
                "Review transformation expressions",
                "Check data validation rules",
                "Verify data type mappings",
                "Test null value handling"),
            List.of(
                "Implement data validation rules",
                "Fix transformation logic",
                "Add data cleansing steps",
                "Improve error handling",
                "Update data type mappings")),
        new IssueArchetype(
            "performance issues",
            "Workflow runs slowly or times out",
            List.of("slow", "performance", "timed out", "long running", "out of memory"),
            List.of(
                "Large data volumes",
                "Inefficient transformations",
                "Poor connection performance",
                "Resource constraints",
                "Suboptimal query design"),
            List.of(
                "Analyze data volumes",
                "Review transformation performance",
                "Check connection performance",
                "Monitor system resources",
                "Analyze query execution plans"),
            List.of(
                "Optimize transformation logic",
                "Improve connection performance",
                "Increase system resources",
                "Optimize source queries",
                "Implement data partitioning")),
        new IssueArchetype(
            "dependency issues",
            "Workflow dependencies not met",
            List.of("dependency", "dependencies", "upstream", "workflow status is", "schedule"),
            List.of(
                "Upstream workflow failed",
                "Source table not updated",
                "File not available",
                "Database connection issues",
                "Schedule conflicts"),
            List.of(
                "Check upstream workflow status",
                "Verify source table updates",
                "Check file availability",
                "Test database connections",
                "Review workflow schedules"),
            List.of(
                "Fix upstream workflow issues",
                "Update source data",
                "Resolve file access issues",
                "Fix connection problems",
                "Adjust workflow schedules"))
    );

    public List<IssueArchetype> archetypes() {
        return archetypes;
    }

    public List<String> names() {
        return archetypes.stream().map(IssueArchetype::name).toList();
    }

    /**
     * Whether the lower-cased text contains the archetype name, one of its common
     * causes or one of its trigger keywords.
     */
    public static boolean matchesArchetype(String text, IssueArchetype archetype) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains(archetype.name())) {
            return true;
        }
        return archetype.commonCauses().stream().anyMatch(cause -> lower.contains(cause.toLowerCase(Locale.ROOT)))
            || archetype.triggerKeywords().stream().anyMatch(lower::contains);
    }

    /**
     * Archetypes selected by the description and by the issues. Each archetype is
     * counted at most once for the description and at most once for all issues, so
     * one archetype may appear twice.
     */
    public List<IssueArchetype> match(String description, List<String> issues) {
        List<IssueArchetype> matches = new ArrayList<>();
        for (IssueArchetype archetype : archetypes) {
            if (matchesArchetype(description, archetype)) {
                matches.add(archetype);
            }
            if (issues.stream().anyMatch(issue -> matchesArchetype(issue, archetype))) {
                matches.add(archetype);
            }
        }
        return matches;
    }
}
