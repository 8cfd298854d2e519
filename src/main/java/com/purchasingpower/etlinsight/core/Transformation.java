package com.purchasingpower.etlinsight.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Transformation step of a mapping (filter, expression, lookup, joiner, ...).
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Transformation {
    String name;
    String type;

    @Singular
    List<String> inputPorts;

    @Singular
    List<String> outputPorts;

    String expression;

    @Singular
    Map<String, String> properties;
}
