package com.company.errorbudget.engine;

import com.company.errorbudget.domain.SloTarget;
import com.company.errorbudget.domain.enums.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RiskClassifier")
class RiskClassifierTest {

    private final RiskClassifier classifier = new RiskClassifier();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "0.0, SAFE",
            "0.999, SAFE",
            "1.0, OBSERVE",
            "1.499, OBSERVE",
            "1.5, DANGER",
            "1.999, DANGER",
            "2.0, FREEZE",
            "1000000.0, FREEZE"
    })
    @DisplayName("default bands are inclusive on the lower edge")
    void defaultBands(double composite, RiskLevel expected) {
        assertThat(classifier.classify(composite)).isEqualTo(expected);
    }

    @Nested
    @DisplayName("thresholds from an SLO target")
    class TargetThresholds {

        @Test
        @DisplayName("keeps DANGER at 1.5 when it lies between the target's edges")
        void keepsDefaultDanger() {
            RiskThresholds thresholds = classifier.thresholdsFor(target(1.2, 3.0));

            assertThat(thresholds.getObserve()).isEqualTo(1.2);
            assertThat(thresholds.getDanger()).isEqualTo(1.5);
            assertThat(thresholds.getFreeze()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("uses the midpoint when 1.5 falls outside the target's edges")
        void midpointDanger() {
            RiskThresholds thresholds = classifier.thresholdsFor(target(2.0, 4.0));

            assertThat(thresholds.getDanger()).isEqualTo(3.0);
            assertThat(classifier.classify(2.5, thresholds)).isEqualTo(RiskLevel.OBSERVE);
            assertThat(classifier.classify(3.0, thresholds)).isEqualTo(RiskLevel.DANGER);
        }

        @Test
        @DisplayName("falls back to defaults for missing values")
        void defaultsForMissing() {
            assertThat(classifier.thresholdsFor(target(null, null))).isEqualTo(RiskThresholds.DEFAULT);
            assertThat(classifier.thresholdsFor(null)).isEqualTo(RiskThresholds.DEFAULT);
        }
    }

    private static SloTarget target(Double observe, Double freeze) {
        return SloTarget.builder().burnRateThreshold(observe).criticalBurnRate(freeze).build();
    }
}
