package com.aerarisk.core.analytics;

import org.apache.commons.math3.ml.clustering.Clusterable;

/**
 * A matrix row that remembers its position.
 *
 * <p>
 * Uses identity equality on purpose: commons-math clusterers track visited
 * points in hash maps, and value equality would merge duplicate rows.
 * </p>
 */
final class IndexedPoint implements Clusterable {

    private final int index;
    private final double[] point;

    IndexedPoint(int index, double[] point) {
        this.index = index;
        this.point = point;
    }

    static IndexedPoint[] wrap(double[][] rows) {
        IndexedPoint[] points = new IndexedPoint[rows.length];
        for (int i = 0; i < rows.length; i++) {
            points[i] = new IndexedPoint(i, rows[i]);
        }
        return points;
    }

    int getIndex() {
        return index;
    }

    @Override
    public double[] getPoint() {
        return point;
    }
}
