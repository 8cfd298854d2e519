package com.purchasingpower.etlinsight.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Table or workflow diagnosis request.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DebugRequest {

    /**
     * Table name or workflow name, depending on the endpoint.
     */
    private String target;

    private String description;
}
