/**
 * Domain model of the nightly risk pipeline.
 *
 * <ul>
 * <li>{@link com.aerarisk.core.model.VulnerabilityProfile}: stored household
 * profile, the pipeline's input</li>
 * <li>{@link com.aerarisk.core.model.ScoredProfile}: run-scoped profile plus
 * cluster and outlier labels</li>
 * <li>{@link com.aerarisk.core.model.RegionSnapshot}: per-region summary,
 * upserted on its natural key</li>
 * <li>{@link com.aerarisk.core.model.AuditRecord}: append-only stage
 * audit row</li>
 * </ul>
 *
 * <p>
 * Persisted types carry Jackson annotations with the store's snake_case
 * column names; the core module itself never serializes them.
 * </p>
 *
 * @since 1.0.0
 */
package com.aerarisk.core.model;
