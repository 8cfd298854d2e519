/**
 * Authoritative workflow catalog and its ingestion.
 *
 * <p>The repository is the only existence oracle in the system. Its contents are
 * an immutable snapshot replaced by a single pointer swap, so readers always see
 * either the whole old catalog or the whole new one.
 *
 * @since 1.0.0
 */
package com.purchasingpower.etlinsight.catalog;
