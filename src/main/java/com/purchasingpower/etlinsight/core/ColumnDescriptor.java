package com.purchasingpower.etlinsight.core;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Column of a source or target table.
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class ColumnDescriptor {
    String name;
    String dataType;
    boolean nullable;
}
