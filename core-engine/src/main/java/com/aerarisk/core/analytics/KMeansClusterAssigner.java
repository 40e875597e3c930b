package com.aerarisk.core.analytics;

import com.aerarisk.core.config.ModelConfig;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Centroid clustering (Lloyd's k-means with k-means++ seeding).
 *
 * <h3>Cluster count</h3>
 * <p>
 * {@code k = clamp(round(sqrt(n)), minClusters, maxClusters)}, i.e. between 2
 * and 6 with the default configuration.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * Seeding and empty-cluster recovery draw from a {@link Well19937c} created
 * from the configured seed on every call.
 * </p>
 *
 * @since 1.0.0
 */
public class KMeansClusterAssigner implements ClusterModel {

    private static final Logger LOG = LoggerFactory.getLogger(KMeansClusterAssigner.class);

    private final ModelConfig.KMeans params;

    public KMeansClusterAssigner(ModelConfig.KMeans params) {
        this.params = Objects.requireNonNull(params, "KMeans parameters must not be null");
    }

    /**
     * @param n population size, at least 1
     * @return the number of clusters to fit
     */
    public int clusterCount(int n) {
        long k = Math.round(Math.sqrt(n));
        return (int) Math.max(params.getMinClusters(), Math.min(params.getMaxClusters(), k));
    }

    @Override
    public int[] fitPredict(double[][] rows) {
        Objects.requireNonNull(rows, "Rows must not be null");
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot cluster an empty matrix");
        }

        int k = clusterCount(rows.length);
        int[] labels = new int[rows.length];

        if (rows.length < k) {
            // Fewer points than clusters: every point is its own centroid
            for (int i = 0; i < rows.length; i++) {
                labels[i] = i;
            }
            LOG.debug("k-means: n={} < k={}, one cluster per point", rows.length, k);
            return labels;
        }

        KMeansPlusPlusClusterer<IndexedPoint> clusterer = new KMeansPlusPlusClusterer<>(
                k,
                params.getMaxIterations(),
                new EuclideanDistance(),
                new Well19937c(params.getSeed()),
                KMeansPlusPlusClusterer.EmptyClusterStrategy.LARGEST_VARIANCE);

        List<CentroidCluster<IndexedPoint>> clusters =
                clusterer.cluster(Arrays.asList(IndexedPoint.wrap(rows)));

        for (int clusterId = 0; clusterId < clusters.size(); clusterId++) {
            for (IndexedPoint point : clusters.get(clusterId).getPoints()) {
                labels[point.getIndex()] = clusterId;
            }
        }

        LOG.debug("k-means: n={} k={}", rows.length, k);
        return labels;
    }

    @Override
    public String getModelName() {
        return "kmeans";
    }
}
