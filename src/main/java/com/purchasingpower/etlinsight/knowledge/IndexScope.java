package com.purchasingpower.etlinsight.knowledge;

import com.purchasingpower.etlinsight.core.ComponentKind;

/**
 * Which indexed documents a query may return.
 *
 * @since 1.0.0
 */
public enum IndexScope {
    WORKFLOWS,
    SOURCE_TABLES,
    TARGET_TABLES,
    TRANSFORMATIONS,
    ALL_COMPONENTS;

    public static IndexScope of(ComponentKind kind) {
        if (kind == null) {
            return ALL_COMPONENTS;
        }
        return switch (kind) {
            case SOURCE_TABLE -> SOURCE_TABLES;
            case TARGET_TABLE -> TARGET_TABLES;
            case TRANSFORMATION -> TRANSFORMATIONS;
            case SESSION -> throw new IllegalArgumentException("Sessions are not indexed as components");
        };
    }
}
