package com.aerarisk.core.region;

import com.aerarisk.core.config.ModelConfig;
import com.aerarisk.core.model.DriftStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DriftClassifier}.
 */
class DriftClassifierTest {

    private final DriftClassifier classifier = new DriftClassifier(ModelConfig.defaults().getDrift());

    @Test
    @DisplayName("Drift above 0.25 is ACCELERATING")
    void shouldClassifyAccelerating() {
        assertThat(classifier.classify(0.30)).isEqualTo(DriftStatus.ACCELERATING);
    }

    @Test
    @DisplayName("Drift above 0.15 up to 0.25 is ESCALATING")
    void shouldClassifyEscalating() {
        assertThat(classifier.classify(0.20)).isEqualTo(DriftStatus.ESCALATING);
        assertThat(classifier.classify(0.25)).isEqualTo(DriftStatus.ESCALATING);
    }

    @Test
    @DisplayName("Thresholds are strict: exactly 0.15 is STABLE")
    void shouldUseStrictThresholds() {
        assertThat(classifier.classify(0.15)).isEqualTo(DriftStatus.STABLE);
        assertThat(classifier.classify(0.10)).isEqualTo(DriftStatus.STABLE);
        assertThat(classifier.classify(-0.40)).isEqualTo(DriftStatus.STABLE);
    }
}
