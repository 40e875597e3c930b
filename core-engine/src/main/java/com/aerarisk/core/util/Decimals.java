package com.aerarisk.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal rounding shared by scoring and aggregation.
 *
 * <p>
 * Rounds the exact binary value of the double half-to-even, so that
 * {@code 0.8 + 2.2} (stored as {@code 3.0000000000000004}) becomes {@code 3.0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Decimals {

    /** Scale of every persisted score, average and drift value. */
    public static final int SCORE_SCALE = 4;

    private Decimals() {
        // utility class
    }

    /**
     * @param value a finite value
     * @return {@code value} rounded to {@value #SCORE_SCALE} decimal places
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public static double round4(double value) {
        return round(value, SCORE_SCALE);
    }

    public static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot round non-finite value: " + value);
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }
}
