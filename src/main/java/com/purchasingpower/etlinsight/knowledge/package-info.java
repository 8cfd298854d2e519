/**
 * Semantic (embedding) index over the workflow catalog.
 *
 * <p>The index is a derived, rebuildable cache. Its answers are candidates only;
 * the search package verifies every candidate against the repository before use.
 *
 * @since 1.0.0
 */
package com.purchasingpower.etlinsight.knowledge;
