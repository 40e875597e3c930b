package com.aerarisk.core.analytics;

import com.aerarisk.core.config.ModelConfig;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

import java.util.Objects;

/**
 * Isolation forest outlier flags.
 *
 * <h3>Model</h3>
 * <p>
 * A Smile {@link IsolationForest} of {@code trees} trees, each grown on
 * {@code min(maxSamples, n)} rows with height limit
 * {@code ceil(log2(sampleSize))}. Smile's RNG is reseeded before every fit.
 * A row's anomaly score is {@code 2^(-E[pathLength] / c(sampleSize))}, close
 * to 1 for rows that are isolated quickly.
 * </p>
 *
 * <h3>Threshold</h3>
 * <p>
 * The decision offset is the {@code contamination} quantile of the negated
 * scores on the fitted rows (linear interpolation). A row is an outlier when
 * its negated score is strictly below the offset, so roughly
 * {@code contamination × n} rows are flagged, and none when every row scores
 * the same.
 * </p>
 *
 * @since 1.0.0
 */
public class OutlierScorer {

    private static final Logger LOG = LoggerFactory.getLogger(OutlierScorer.class);

    private final ModelConfig.IsolationForest params;

    public OutlierScorer(ModelConfig.IsolationForest params) {
        this.params = Objects.requireNonNull(params, "Isolation forest parameters must not be null");
    }

    /**
     * Fit a fresh forest on {@code rows} and flag the outliers among them.
     *
     * @param rows standardized feature rows; must not be empty
     * @return one flag per row, in row order
     */
    public boolean[] fitPredict(double[][] rows) {
        Objects.requireNonNull(rows, "Rows must not be null");
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot score an empty matrix");
        }

        boolean[] outliers = new boolean[rows.length];
        if (rows.length < 2) {
            return outliers;
        }

        double[] scores = anomalyScores(rows);

        double[] negated = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            negated[i] = -scores[i];
        }
        double offset = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(negated, params.getContamination() * 100.0);

        int flagged = 0;
        for (int i = 0; i < negated.length; i++) {
            if (negated[i] < offset) {
                outliers[i] = true;
                flagged++;
            }
        }

        LOG.debug("Isolation forest: n={} trees={} offset={} outliers={}",
                rows.length, params.getTrees(), offset, flagged);
        return outliers;
    }

    /**
     * @param rows at least two rows
     * @return anomaly score in (0, 1] per row
     */
    double[] anomalyScores(double[][] rows) {
        int sampleSize = Math.min(params.getMaxSamples(), rows.length);
        int heightLimit = Math.max(1, (int) Math.ceil(Math.log(sampleSize) / Math.log(2)));
        double subsample = (double) sampleSize / rows.length;

        MathEx.setSeed(params.getSeed());
        IsolationForest forest = IsolationForest.fit(rows, params.getTrees(), heightLimit, subsample, 0);
        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            scores[i] = forest.score(rows[i]);
        }
        return scores;
    }

    /**
     * @param flags flags returned by {@link #fitPredict(double[][])}
     * @return the number of flagged rows
     */
    public static int countOutliers(boolean[] flags) {
        int count = 0;
        for (boolean flag : flags) {
            if (flag) {
                count++;
            }
        }
        return count;
    }
}
