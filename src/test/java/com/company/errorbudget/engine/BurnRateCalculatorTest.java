package com.company.errorbudget.engine;

import com.company.errorbudget.domain.TrafficSample;
import com.company.errorbudget.domain.enums.EvaluationWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("BurnRateCalculator")
class BurnRateCalculatorTest {

    private static final double ALLOWED = 0.001; // 99.9% target

    private final BurnRateCalculator calculator = new BurnRateCalculator();

    @Nested
    @DisplayName("single window")
    class SingleWindow {

        @Test
        @DisplayName("is the error rate divided by the allowed error rate")
        void ratioOfErrorRates() {
            assertThat(calculator.burnRate(WindowRate.of(10_000, 20), ALLOWED)).isCloseTo(2.0, within(1e-9));
        }

        @Test
        @DisplayName("is zero without traffic")
        void zeroWithoutTraffic() {
            assertThat(calculator.burnRate(WindowRate.EMPTY, ALLOWED)).isZero();
            assertThat(calculator.burnRate(null, ALLOWED)).isZero();
        }

        @Test
        @DisplayName("saturates when the target allows no errors")
        void saturatesForPerfectTarget() {
            assertThat(calculator.burnRate(WindowRate.of(100, 1), 0.0))
                    .isEqualTo(BurnRateCalculator.SATURATED_BURN_RATE);
            assertThat(calculator.burnRate(WindowRate.of(100, 0), 0.0)).isZero();
        }
    }

    @Test
    @DisplayName("composite uses fixed weights 0.40 / 0.35 / 0.25")
    void compositeWeights() {
        Map<EvaluationWindow, WindowRate> rates = new EnumMap<>(EvaluationWindow.class);
        rates.put(EvaluationWindow.FIVE_MINUTES, WindowRate.of(1000, 4));   // 4.0
        rates.put(EvaluationWindow.ONE_HOUR, WindowRate.of(1000, 2));       // 2.0
        rates.put(EvaluationWindow.TWENTY_FOUR_HOURS, WindowRate.of(1000, 1)); // 1.0

        BurnRateBreakdown burn = calculator.calculate(rates, ALLOWED);

        assertThat(burn.getBurnRate5m()).isCloseTo(4.0, within(1e-9));
        assertThat(burn.getBurnRate1h()).isCloseTo(2.0, within(1e-9));
        assertThat(burn.getBurnRate24h()).isCloseTo(1.0, within(1e-9));
        assertThat(burn.getComposite()).isCloseTo(0.40 * 4 + 0.35 * 2 + 0.25 * 1, within(1e-9));
    }

    @Test
    @DisplayName("an empty window still counts at its weight instead of being renormalized")
    void emptyWindowIsNotRenormalized() {
        Map<EvaluationWindow, WindowRate> rates = new EnumMap<>(EvaluationWindow.class);
        rates.put(EvaluationWindow.FIVE_MINUTES, WindowRate.EMPTY);
        rates.put(EvaluationWindow.ONE_HOUR, WindowRate.of(1000, 2));
        rates.put(EvaluationWindow.TWENTY_FOUR_HOURS, WindowRate.of(1000, 2));

        BurnRateBreakdown burn = calculator.calculate(rates, ALLOWED);

        assertThat(burn.getComposite()).isCloseTo(0.60 * 2.0, within(1e-9));
    }

    @Test
    @DisplayName("evaluating the same samples twice gives the same burn rates")
    void idempotentOverSameSamples() {
        Instant now = Instant.parse("2024-03-01T12:00:00Z");
        List<TrafficSample> samples = new ArrayList<>();
        long[] errors = {0, 7, 2, 40, 0, 13};
        for (int i = 0; i < errors.length; i++) {
            samples.add(TrafficSample.builder().serviceId(1L)
                    .timestamp(now.minusSeconds(97L * i * i + 30))
                    .successCount(2000 - errors[i]).errorCount(errors[i]).build());
        }
        WindowAggregator aggregator = new WindowAggregator();

        BurnRateBreakdown first = calculator.calculate(aggregator.aggregate(samples, now), ALLOWED);
        Collections.reverse(samples);
        BurnRateBreakdown second = calculator.calculate(aggregator.aggregate(samples, now), ALLOWED);

        assertThat(second).isEqualTo(first);
        assertThat(first.getComposite()).isPositive();
    }
}
