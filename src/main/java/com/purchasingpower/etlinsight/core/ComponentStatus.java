package com.purchasingpower.etlinsight.core;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Lifecycle status of a workflow as declared in its metadata.
 *
 * @since 1.0.0
 */
public enum ComponentStatus {
    ACTIVE,
    INACTIVE,
    ERROR,
    UNKNOWN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive parse, so metadata values like {@code "active"} bind.
     *
     * @throws IllegalArgumentException for blank or unknown values
     */
    @JsonCreator
    public static ComponentStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Status is required");
        }
        String wanted = value.trim();
        for (ComponentStatus candidate : values()) {
            if (candidate.name().equalsIgnoreCase(wanted)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown workflow status: " + value);
    }
}
