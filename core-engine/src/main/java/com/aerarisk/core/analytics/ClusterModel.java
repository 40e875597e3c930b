package com.aerarisk.core.analytics;

/**
 * Contract for the clustering models fitted on the standardized matrix.
 *
 * <p>
 * Implementations are fitted fresh on every call and keep no state between
 * runs. Repeated calls on identical input must yield identical labels.
 * </p>
 */
public interface ClusterModel {

    /**
     * Fit the model and label every row.
     *
     * @param rows standardized feature rows; must not be empty
     * @return one label per row, in row order
     */
    int[] fitPredict(double[][] rows);

    /**
     * @return short model name used in logs
     */
    String getModelName();
}
