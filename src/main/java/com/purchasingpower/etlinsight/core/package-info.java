/**
 * Canonical workflow catalog model.
 *
 * <p>Records in this package are produced by the metadata ingestion side and are
 * immutable once built. A refresh replaces whole records, never fields of a record.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code WorkflowRecord} - one workflow with its sessions, tables and transformations</li>
 *   <li>{@code SearchResult} - a workflow proven to exist, with a confidence in [0,1]</li>
 *   <li>{@code DiagnosticReport} - issues and ranked recommendations for a table or workflow</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.etlinsight.core;
