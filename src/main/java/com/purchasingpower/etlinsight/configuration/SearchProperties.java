package com.purchasingpower.etlinsight.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the validated search path.
 *
 * <p>Properties are loaded from the {@code catalog.search} namespace in application.yml:
 * <pre>
 * catalog:
 *   search:
 *     min-confidence: 0.3
 *     questionable-match-penalty: 0.5
 *     name-search-top-k: 10
 *     index-timeout-ms: 2000
 *     strip-prefixes: [wf_, workflow_, mapping_]
 * </pre>
 *
 * <p>The threshold and penalty are heuristics with no derivation behind them; they
 * only express "some minimum bar" and are meant to be tuned per catalog.
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "catalog.search")
public class SearchProperties {

    /**
     * Semantic candidates at or below this confidence are dropped.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.3;

    /**
     * Multiplier applied to candidates whose name fails the reasonable-match check.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double questionableMatchPenalty = 0.5;

    @Min(1)
    private int nameSearchTopK = 10;

    @Min(1)
    private int tableSearchTopK = 20;

    @Min(1)
    private int componentSearchTopK = 20;

    /**
     * Upper bound for one semantic index call; slower calls count as unavailable.
     */
    @Min(1)
    private long indexTimeoutMs = 2000;

    /**
     * Name prefixes removed (once, from the start) before comparing names.
     */
    @NotNull
    private List<String> stripPrefixes = new ArrayList<>(List.of("wf_", "workflow_", "mapping_"));

    /**
     * A stripped query shorter than this never counts as a significant part of a name.
     */
    @Min(1)
    private int significantPartMinLength = 4;

    @Min(0)
    private int historyLimit = 500;
}
