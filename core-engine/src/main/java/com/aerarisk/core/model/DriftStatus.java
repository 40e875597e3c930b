package com.aerarisk.core.model;

/**
 * Trend class of a region's average risk versus the prior window.
 *
 * @since 1.0.0
 */
public enum DriftStatus {
    STABLE,
    ESCALATING,
    ACCELERATING
}
