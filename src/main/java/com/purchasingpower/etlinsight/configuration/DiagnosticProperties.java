package com.purchasingpower.etlinsight.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Scoring and output limits of the diagnostic engine ({@code catalog.diagnostic}).
 *
 * <p>Confidence = base (when a workflow was found)
 * + min(issueCap, issues * issueWeight)
 * + min(archetypeCap, archetypeMatches * archetypeWeight), clamped to [0,1].
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "catalog.diagnostic")
public class DiagnosticProperties {

    @Min(1)
    private int maxRecommendations = 10;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double baseConfidence = 0.3;

    @DecimalMin("0.0")
    private double issueWeight = 0.1;

    @DecimalMin("0.0")
    private double issueCap = 0.4;

    @DecimalMin("0.0")
    private double archetypeWeight = 0.1;

    @DecimalMin("0.0")
    private double archetypeCap = 0.3;
}
