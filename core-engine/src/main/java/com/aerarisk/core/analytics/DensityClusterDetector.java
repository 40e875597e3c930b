package com.aerarisk.core.analytics;

import com.aerarisk.core.config.ModelConfig;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Density-based clustering (DBSCAN) with noise detection.
 *
 * <p>
 * A point is a core point when at least {@code minSamples} points, itself
 * included, lie within {@code eps} (Euclidean). Points density-reachable from
 * a core point share its cluster; everything else is labelled
 * {@value #NOISE}.
 * </p>
 *
 * <h3>Parameters</h3>
 * <ul>
 * <li>{@code eps}: fixed radius, 1.25 by default</li>
 * <li>{@code minSamples = clamp(floor(n / 20), 3, 8)}</li>
 * </ul>
 *
 * <p>
 * Cluster ids start at 0 and follow discovery order over the input rows.
 * </p>
 *
 * @since 1.0.0
 */
public class DensityClusterDetector implements ClusterModel {

    private static final Logger LOG = LoggerFactory.getLogger(DensityClusterDetector.class);

    /** Label of points that belong to no dense cluster. */
    public static final int NOISE = -1;

    private final ModelConfig.Dbscan params;

    public DensityClusterDetector(ModelConfig.Dbscan params) {
        this.params = Objects.requireNonNull(params, "DBSCAN parameters must not be null");
    }

    /**
     * @param n population size
     * @return minimum neighbourhood size (self included) of a core point
     */
    public int minSamples(int n) {
        int scaled = n / params.getMinSamplesDivisor();
        return Math.max(params.getMinSamplesFloor(), Math.min(params.getMinSamplesCap(), scaled));
    }

    @Override
    public int[] fitPredict(double[][] rows) {
        Objects.requireNonNull(rows, "Rows must not be null");
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot cluster an empty matrix");
        }

        int minSamples = minSamples(rows.length);

        // commons-math counts neighbours excluding the point itself
        DBSCANClusterer<IndexedPoint> clusterer =
                new DBSCANClusterer<>(params.getEps(), minSamples - 1);
        List<Cluster<IndexedPoint>> clusters = clusterer.cluster(Arrays.asList(IndexedPoint.wrap(rows)));

        int[] labels = new int[rows.length];
        Arrays.fill(labels, NOISE);
        for (int clusterId = 0; clusterId < clusters.size(); clusterId++) {
            for (IndexedPoint point : clusters.get(clusterId).getPoints()) {
                labels[point.getIndex()] = clusterId;
            }
        }

        LOG.debug("DBSCAN: n={} eps={} minSamples={} clusters={}",
                rows.length, params.getEps(), minSamples, clusters.size());
        return labels;
    }

    /**
     * @param labels labels returned by {@link #fitPredict(double[][])}
     * @return the number of noise points
     */
    public static int countNoise(int[] labels) {
        int noise = 0;
        for (int label : labels) {
            if (label == NOISE) {
                noise++;
            }
        }
        return noise;
    }

    @Override
    public String getModelName() {
        return "dbscan";
    }
}
