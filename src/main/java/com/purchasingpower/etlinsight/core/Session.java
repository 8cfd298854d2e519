package com.purchasingpower.etlinsight.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Session that runs one mapping inside a workflow.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Session {
    String name;
    String workflowName;
    String mappingName;

    @Singular
    List<String> sourceConnections;

    @Singular
    List<String> targetConnections;

    String lastRunStatus;
    LocalDateTime lastRunTime;

    @Singular
    Map<String, String> properties;
}
