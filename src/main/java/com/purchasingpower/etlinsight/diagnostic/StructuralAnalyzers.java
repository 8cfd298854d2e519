package com.purchasingpower.etlinsight.diagnostic;

import com.purchasingpower.etlinsight.core.ComponentStatus;
import com.purchasingpower.etlinsight.core.Session;
import com.purchasingpower.etlinsight.core.SourceTable;
import com.purchasingpower.etlinsight.core.TargetTable;
import com.purchasingpower.etlinsight.core.Transformation;
import com.purchasingpower.etlinsight.core.WorkflowRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Pure per-entity checks that turn structural defects into issue strings.
 *
 * <p>{@link #analyzeWorkflow(WorkflowRecord)} runs every check over every component
 * and skips a component whose check throws, so one malformed component never hides
 * the issues of the others.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class StructuralAnalyzers {

    /**
     * {@code 1=0}, {@code 0=1} or a bare {@code false} literal, not part of a longer token.
     */
    static final Pattern ALWAYS_FALSE = Pattern.compile("(?i)(?<![\\w.])(1\\s*=\\s*0|0\\s*=\\s*1|false)(?![\\w.])");

    private static final Set<String> FAILED_RUN_STATUSES = Set.of("failed", "error");
    private static final Set<String> GUARD_PROPERTIES = Set.of("error_threshold", "stop_on_error");
    private static final Set<String> ENABLED_VALUES = Set.of("true", "yes", "y", "1");

    public List<String> analyzeWorkflow(WorkflowRecord workflow) {
        List<String> issues = new ArrayList<>();
        String owner = workflow.getName();
        guarded(issues, owner, "workflow", workflow, WorkflowRecord::getName, this::analyzeWorkflowStatus);
        workflow.getSessions().forEach(s ->
            guarded(issues, owner, "session", s, Session::getName, this::analyzeSession));
        workflow.getSourceTables().forEach(t ->
            guarded(issues, owner, "source table", t, SourceTable::getName, this::analyzeSourceTable));
        workflow.getTargetTables().forEach(t ->
            guarded(issues, owner, "target table", t, TargetTable::getName, this::analyzeTargetTable));
        workflow.getTransformations().forEach(t ->
            guarded(issues, owner, "transformation", t, Transformation::getName, this::analyzeTransformation));
        return issues;
    }

    public List<String> analyzeWorkflowStatus(WorkflowRecord workflow) {
        if (workflow.isActive()) {
            return List.of();
        }
        ComponentStatus status = workflow.getStatus() != null ? workflow.getStatus() : ComponentStatus.UNKNOWN;
        return List.of("Workflow status is " + status.label());
    }

    public List<String> analyzeSession(Session session) {
        List<String> issues = new ArrayList<>();

        if (session.getSourceConnections().isEmpty()) {
            issues.add("Session " + session.getName() + " has no source connections");
        }
        if (session.getTargetConnections().isEmpty()) {
            issues.add("Session " + session.getName() + " has no target connections");
        }

        String lastRun = session.getLastRunStatus();
        if (lastRun != null && FAILED_RUN_STATUSES.contains(lastRun.trim().toLowerCase(Locale.ROOT))) {
            issues.add("Session " + session.getName() + " last run status: " + lastRun);
        }

        for (Map.Entry<String, String> property : session.getProperties().entrySet()) {
            if (GUARD_PROPERTIES.contains(normalizeKey(property.getKey())) && isEnabled(property.getValue())) {
                issues.add("Session " + session.getName() + " has " + property.getKey()
                    + " set to " + property.getValue());
            }
        }
        return issues;
    }

    public List<String> analyzeSourceTable(SourceTable table) {
        List<String> issues = new ArrayList<>();

        if (isBlank(table.getConnection())) {
            issues.add("Source table " + table.getName() + " has no connection specified");
        }
        if (isBlank(table.getSchema()) && isBlank(table.getDatabase())) {
            issues.add("Source table " + table.getName() + " has no schema or database specified");
        }
        for (String filter : table.getFilters()) {
            if (isAlwaysFalse(filter)) {
                issues.add("Source table " + table.getName() + " has filter that excludes all data: " + filter);
            }
        }
        return issues;
    }

    public List<String> analyzeTargetTable(TargetTable table) {
        List<String> issues = new ArrayList<>();

        if (isBlank(table.getConnection())) {
            issues.add("Target table " + table.getName() + " has no connection specified");
        }
        if (isBlank(table.getSchema()) && isBlank(table.getDatabase())) {
            issues.add("Target table " + table.getName() + " has no schema or database specified");
        }
        if (isBlank(table.getLoadType())) {
            issues.add("Target table " + table.getName() + " has no load type specified");
        }
        return issues;
    }

    public List<String> analyzeTransformation(Transformation transformation) {
        List<String> issues = new ArrayList<>();
        String expression = transformation.getExpression();

        if ("filter".equalsIgnoreCase(trimmed(transformation.getType())) && isAlwaysFalse(expression)) {
            issues.add("Filter transformation " + transformation.getName() + " has expression that excludes all data");
        }
        if (expression != null) {
            String lower = expression.toLowerCase(Locale.ROOT);
            if (lower.contains("error") || lower.contains("null")) {
                issues.add("Transformation " + transformation.getName() + " has potentially problematic expression");
            }
        }
        if (transformation.getInputPorts().isEmpty()) {
            issues.add("Transformation " + transformation.getName() + " has no input ports");
        }
        if (transformation.getOutputPorts().isEmpty()) {
            issues.add("Transformation " + transformation.getName() + " has no output ports");
        }
        return issues;
    }

    static boolean isAlwaysFalse(String expression) {
        return expression != null && ALWAYS_FALSE.matcher(expression).find();
    }

    private <T> void guarded(List<String> issues, String owner, String kind, T entity,
                             Function<T, String> name, Function<T, List<String>> analyzer) {
        if (entity == null) {
            log.warn("Skipping null {} in workflow '{}'", kind, owner);
            return;
        }
        try {
            issues.addAll(analyzer.apply(entity));
        } catch (RuntimeException e) {
            log.warn("Skipping malformed {} '{}' in workflow '{}': {}", kind, name.apply(entity), owner, e.toString());
        }
    }

    private static String normalizeKey(String key) {
        return key == null ? "" : key.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }

    private static boolean isEnabled(String value) {
        return value != null && ENABLED_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }
}
