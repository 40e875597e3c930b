/**
 * Orchestration of the nightly run.
 *
 * <p>
 * {@link com.aerarisk.core.pipeline.RiskPipeline} drives the stages against
 * three seams implemented outside the core:
 * {@link com.aerarisk.core.pipeline.PopulationStore},
 * {@link com.aerarisk.core.pipeline.SnapshotStore} and
 * {@link com.aerarisk.core.pipeline.AuditSink}. All calls are synchronous and
 * a failed call aborts the run with an
 * {@link com.aerarisk.core.pipeline.UpstreamException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.aerarisk.core.pipeline;
