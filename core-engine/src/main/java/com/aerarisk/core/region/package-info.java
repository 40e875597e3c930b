/**
 * Region aggregation and 30-day drift.
 *
 * <p>
 * {@link com.aerarisk.core.region.RegionAggregator} turns the labelled
 * population into one {@link com.aerarisk.core.model.RegionSnapshot} per
 * (county, state, organization), comparing each region with the prior window
 * held in a {@link com.aerarisk.core.region.PriorSnapshotIndex}.
 * </p>
 *
 * @since 1.0.0
 */
package com.aerarisk.core.region;
