package com.aerarisk.core.model;

/**
 * Outcome of one audited pipeline stage.
 *
 * @since 1.0.0
 */
public enum StageStatus {
    SUCCESS,
    FAILED
}
