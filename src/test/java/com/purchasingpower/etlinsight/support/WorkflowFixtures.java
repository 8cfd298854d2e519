package com.purchasingpower.etlinsight.support;

import com.purchasingpower.etlinsight.core.ComponentStatus;
import com.purchasingpower.etlinsight.core.Session;
import com.purchasingpower.etlinsight.core.SourceTable;
import com.purchasingpower.etlinsight.core.TargetTable;
import com.purchasingpower.etlinsight.core.Transformation;
import com.purchasingpower.etlinsight.core.WorkflowRecord;

/**
 * Workflow records shared by tests.
 */
public final class WorkflowFixtures {

    private WorkflowFixtures() {
    }

    /**
     * set30/LOAD_CUSTOMERS writing CUSTOMERS with neither connection nor load type.
     */
    public static WorkflowRecord loadCustomers() {
        return WorkflowRecord.builder()
            .setId("set30")
            .name("LOAD_CUSTOMERS")
            .description("Loads the customer dimension from staging")
            .status(ComponentStatus.ACTIVE)
            .session(healthySession("s_LOAD_CUSTOMERS", "LOAD_CUSTOMERS"))
            .sourceTable(healthySource("STG_CUSTOMERS"))
            .targetTable(TargetTable.builder()
                .name("CUSTOMERS")
                .schema("DW")
                .build())
            .transformation(healthyTransformation("EXP_CUSTOMERS"))
            .build();
    }

    /**
     * Active workflow with no structural defects.
     */
    public static WorkflowRecord healthy(String setId, String name, String sourceTable, String targetTable) {
        return WorkflowRecord.builder()
            .setId(setId)
            .name(name)
            .status(ComponentStatus.ACTIVE)
            .session(healthySession("s_" + name, name))
            .sourceTable(healthySource(sourceTable))
            .targetTable(healthyTarget(targetTable))
            .transformation(healthyTransformation("EXP_" + name))
            .build();
    }

    public static WorkflowRecord named(String setId, String name) {
        return WorkflowRecord.builder()
            .setId(setId)
            .name(name)
            .status(ComponentStatus.ACTIVE)
            .build();
    }

    public static Session healthySession(String name, String workflowName) {
        return Session.builder()
            .name(name)
            .workflowName(workflowName)
            .mappingName("m_" + workflowName)
            .sourceConnection("ORA_STAGE")
            .targetConnection("ORA_DW")
            .lastRunStatus("succeeded")
            .build();
    }

    public static SourceTable healthySource(String name) {
        return SourceTable.builder()
            .name(name)
            .schema("STAGE")
            .connection("ORA_STAGE")
            .build();
    }

    public static TargetTable healthyTarget(String name) {
        return TargetTable.builder()
            .name(name)
            .schema("DW")
            .connection("ORA_DW")
            .loadType("insert")
            .build();
    }

    public static Transformation healthyTransformation(String name) {
        return Transformation.builder()
            .name(name)
            .type("expression")
            .inputPort("IN_ID")
            .outputPort("OUT_ID")
            .expression("UPPER(NAME)")
            .build();
    }
}
