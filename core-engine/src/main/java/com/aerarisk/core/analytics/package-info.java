/**
 * Per-profile scoring and population models.
 *
 * <ul>
 * <li>{@link com.aerarisk.core.analytics.RiskScorer}: weighted risk score</li>
 * <li>{@link com.aerarisk.core.analytics.FeatureStandardizer}: z-score
 * feature matrix</li>
 * <li>{@link com.aerarisk.core.analytics.KMeansClusterAssigner}: centroid
 * clusters</li>
 * <li>{@link com.aerarisk.core.analytics.DensityClusterDetector}: density
 * clusters and noise</li>
 * <li>{@link com.aerarisk.core.analytics.OutlierScorer}: isolation forest
 * outlier flags</li>
 * </ul>
 *
 * <p>
 * All models are refitted on the full population every run and seeded from
 * configuration, so identical input yields identical labels.
 * </p>
 *
 * @since 1.0.0
 */
package com.aerarisk.core.analytics;
