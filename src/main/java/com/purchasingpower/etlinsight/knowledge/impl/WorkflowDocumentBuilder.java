package com.purchasingpower.etlinsight.knowledge.impl;

import com.purchasingpower.etlinsight.core.ColumnDescriptor;
import com.purchasingpower.etlinsight.core.ComponentKind;
import com.purchasingpower.etlinsight.core.SourceTable;
import com.purchasingpower.etlinsight.core.TargetTable;
import com.purchasingpower.etlinsight.core.Transformation;
import com.purchasingpower.etlinsight.core.WorkflowRecord;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Turns workflow records into embeddable text segments.
 *
 * <p>One segment per workflow plus one per source table, target table and
 * transformation. Segment metadata carries the identity needed to map a hit back
 * to the repository: {@code set_id}, {@code workflow_name}, {@code component_name}
 * and {@code doc_kind}.
 *
 * @since 1.0.0
 */
@Component
public class WorkflowDocumentBuilder {

    static final String SET_ID = "set_id";
    static final String WORKFLOW_NAME = "workflow_name";
    static final String COMPONENT_NAME = "component_name";
    static final String DOC_KIND = "doc_kind";
    static final String WORKFLOW_KIND = "workflow";

    public List<TextSegment> build(List<WorkflowRecord> records) {
        List<TextSegment> segments = new ArrayList<>();
        for (WorkflowRecord workflow : records) {
            segments.add(workflowSegment(workflow));
            workflow.getSourceTables().forEach(t -> segments.add(sourceSegment(t, workflow)));
            workflow.getTargetTables().forEach(t -> segments.add(targetSegment(t, workflow)));
            workflow.getTransformations().forEach(t -> segments.add(transformationSegment(t, workflow)));
        }
        return segments;
    }

    TextSegment workflowSegment(WorkflowRecord workflow) {
        StringJoiner doc = new StringJoiner(" ");
        doc.add("Workflow: " + workflow.getName());
        doc.add("Description: " + (workflow.getDescription() != null ? workflow.getDescription() : "No description"));
        doc.add("Status: " + workflow.getStatus().label());
        doc.add("Set: " + workflow.getSetId());

        if (!workflow.getSessions().isEmpty()) {
            doc.add("Sessions:");
            workflow.getSessions().forEach(s -> doc.add("- " + s.getName() + " (mapping: " + s.getMappingName() + ")"));
        }
        if (!workflow.getSourceTables().isEmpty()) {
            doc.add("Source tables:");
            workflow.getSourceTables().forEach(t -> doc.add("- " + tableLabel(t.getName(), t.getSchema(), t.getDatabase())));
        }
        if (!workflow.getTargetTables().isEmpty()) {
            doc.add("Target tables:");
            workflow.getTargetTables().forEach(t -> {
                String label = "- " + tableLabel(t.getName(), t.getSchema(), t.getDatabase());
                doc.add(t.getLoadType() != null ? label + " (load type: " + t.getLoadType() + ")" : label);
            });
        }
        if (!workflow.getTransformations().isEmpty()) {
            doc.add("Transformations:");
            workflow.getTransformations().forEach(t -> doc.add("- " + t.getName() + " (type: " + t.getType() + ")"));
        }

        return TextSegment.from(doc.toString(), metadata(workflow, null, WORKFLOW_KIND));
    }

    TextSegment sourceSegment(SourceTable table, WorkflowRecord workflow) {
        StringJoiner doc = componentHeader("Source table: " + table.getName(), workflow);
        appendLocation(doc, table.getSchema(), table.getDatabase(), table.getConnection());
        appendColumns(doc, table.getColumns());
        return TextSegment.from(doc.toString(),
            metadata(workflow, table.getName(), ComponentKind.SOURCE_TABLE.tag()));
    }

    TextSegment targetSegment(TargetTable table, WorkflowRecord workflow) {
        StringJoiner doc = componentHeader("Target table: " + table.getName(), workflow);
        appendLocation(doc, table.getSchema(), table.getDatabase(), table.getConnection());
        if (table.getLoadType() != null) {
            doc.add("Load type: " + table.getLoadType());
        }
        appendColumns(doc, table.getColumns());
        return TextSegment.from(doc.toString(),
            metadata(workflow, table.getName(), ComponentKind.TARGET_TABLE.tag()));
    }

    TextSegment transformationSegment(Transformation transformation, WorkflowRecord workflow) {
        StringJoiner doc = componentHeader("Transformation: " + transformation.getName(), workflow);
        doc.add("Type: " + transformation.getType());
        if (!transformation.getInputPorts().isEmpty()) {
            doc.add("Input ports: " + String.join(", ", transformation.getInputPorts()));
        }
        if (!transformation.getOutputPorts().isEmpty()) {
            doc.add("Output ports: " + String.join(", ", transformation.getOutputPorts()));
        }
        if (transformation.getExpression() != null) {
            doc.add("Expression: " + transformation.getExpression());
        }
        return TextSegment.from(doc.toString(),
            metadata(workflow, transformation.getName(), ComponentKind.TRANSFORMATION.tag()));
    }

    private StringJoiner componentHeader(String title, WorkflowRecord workflow) {
        StringJoiner doc = new StringJoiner(" ");
        doc.add(title);
        doc.add("Workflow: " + workflow.getName());
        doc.add("Set: " + workflow.getSetId());
        return doc;
    }

    private void appendLocation(StringJoiner doc, String schema, String database, String connection) {
        if (schema != null) {
            doc.add("Schema: " + schema);
        }
        if (database != null) {
            doc.add("Database: " + database);
        }
        if (connection != null) {
            doc.add("Connection: " + connection);
        }
    }

    private void appendColumns(StringJoiner doc, List<ColumnDescriptor> columns) {
        if (columns.isEmpty()) {
            return;
        }
        doc.add("Columns:");
        for (ColumnDescriptor column : columns) {
            String name = column.getName() != null ? column.getName() : "unknown";
            doc.add(column.getDataType() != null ? "- " + name + " (" + column.getDataType() + ")" : "- " + name);
        }
    }

    private String tableLabel(String name, String schema, String database) {
        String label = name;
        if (schema != null) {
            label += " (" + schema + ")";
        }
        if (database != null) {
            label += " in " + database;
        }
        return label;
    }

    private Metadata metadata(WorkflowRecord workflow, String componentName, String kind) {
        Metadata metadata = new Metadata()
            .put(SET_ID, workflow.getSetId())
            .put(WORKFLOW_NAME, workflow.getName())
            .put(DOC_KIND, kind);
        if (componentName != null) {
            metadata.put(COMPONENT_NAME, componentName);
        }
        return metadata;
    }
}
