/**
 * Validated search over the workflow catalog.
 *
 * <p>Every result leaving this package references a workflow that existed in the
 * repository when the result was built. Semantic candidates are verified, and
 * down-weighted or dropped when they cannot be justified.
 *
 * @since 1.0.0
 */
package com.purchasingpower.etlinsight.search;
