package com.aerarisk.core.analytics;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.List;
import java.util.Objects;

/**
 * Column-wise z-score standardization of a feature matrix.
 *
 * <p>
 * Each column is centred on its mean and divided by its <em>population</em>
 * standard deviation. A constant column has no spread to divide by and is
 * emitted as zeros. Row order is preserved.
 * </p>
 *
 * @since 1.0.0
 */
public class FeatureStandardizer {

    /**
     * @param vectors one feature vector per profile; must not be empty
     * @return standardized rows, one per input vector, in input order
     * @throws IllegalArgumentException if {@code vectors} is empty
     */
    public double[][] standardize(List<FeatureVector> vectors) {
        Objects.requireNonNull(vectors, "Feature vectors must not be null");
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot standardize an empty feature matrix");
        }

        int rows = vectors.size();
        int columns = FeatureVector.dimension();
        double[][] result = new double[rows][columns];

        Mean mean = new Mean();
        StandardDeviation populationStd = new StandardDeviation(false);

        for (int c = 0; c < columns; c++) {
            double[] column = new double[rows];
            for (int r = 0; r < rows; r++) {
                column[r] = vectors.get(r).get(c);
            }

            if (isConstant(column)) {
                continue; // result column stays 0
            }

            double mu = mean.evaluate(column);
            double sigma = populationStd.evaluate(column);
            if (sigma == 0) {
                continue;
            }
            for (int r = 0; r < rows; r++) {
                result[r][c] = (column[r] - mu) / sigma;
            }
        }
        return result;
    }

    private static boolean isConstant(double[] column) {
        for (int i = 1; i < column.length; i++) {
            if (Double.compare(column[i], column[0]) != 0) {
                return false;
            }
        }
        return true;
    }
}
