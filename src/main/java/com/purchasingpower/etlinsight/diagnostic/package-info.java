/**
 * Rule-based diagnosis of empty or failing tables and workflows.
 *
 * <p>Structural analyzers turn component defects into issue strings, the archetype
 * catalog maps issues and free text to known problem patterns, and the diagnostic
 * service combines both into ranked, deduplicated recommendations with a confidence.
 * Nothing here keeps state between calls.
 *
 * @since 1.0.0
 */
package com.purchasingpower.etlinsight.diagnostic;
