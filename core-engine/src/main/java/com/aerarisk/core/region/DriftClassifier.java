package com.aerarisk.core.region;

import com.aerarisk.core.config.ModelConfig;
import com.aerarisk.core.model.DriftStatus;

import java.util.Objects;

/**
 * Maps a drift value onto a {@link DriftStatus}.
 *
 * <p>
 * Thresholds are strict and checked from the top: above 0.25 is
 * {@code ACCELERATING}, above 0.15 is {@code ESCALATING}, anything else
 * (including both boundaries and negative drift) is {@code STABLE}.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftClassifier {

    private final double acceleratingThreshold;
    private final double escalatingThreshold;

    public DriftClassifier(ModelConfig.Drift params) {
        Objects.requireNonNull(params, "Drift parameters must not be null");
        this.acceleratingThreshold = params.getAcceleratingThreshold();
        this.escalatingThreshold = params.getEscalatingThreshold();
    }

    public DriftStatus classify(double drift) {
        if (drift > acceleratingThreshold) {
            return DriftStatus.ACCELERATING;
        }
        if (drift > escalatingThreshold) {
            return DriftStatus.ESCALATING;
        }
        return DriftStatus.STABLE;
    }
}
