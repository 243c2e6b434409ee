package com.company.errorbudget.engine;

import com.company.errorbudget.domain.enums.EvaluationWindow;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Converts window error rates into burn-rate multiples of the allowed error rate.
 * 1.0 means the budget is consumed exactly at the sustainable pace.
 */
@Component
public class BurnRateCalculator {

    /**
     * Stand-in for an infinite burn rate when the SLO allows no errors at all.
     */
    public static final double SATURATED_BURN_RATE = 1_000_000.0;

    public double burnRate(WindowRate rate, double allowedErrorRate) {
        if (rate == null || !rate.hasTraffic() || rate.getErrorRate() <= 0.0) {
            return 0.0;
        }
        if (allowedErrorRate <= 0.0) {
            return SATURATED_BURN_RATE;
        }
        return rate.getErrorRate() / allowedErrorRate;
    }

    /**
     * Per-window burn rates and their fixed-weight composite. A window without data
     * contributes zero at its assigned weight.
     */
    public BurnRateBreakdown calculate(Map<EvaluationWindow, WindowRate> rates, double allowedErrorRate) {
        double burn5m = burnRate(rates.get(EvaluationWindow.FIVE_MINUTES), allowedErrorRate);
        double burn1h = burnRate(rates.get(EvaluationWindow.ONE_HOUR), allowedErrorRate);
        double burn24h = burnRate(rates.get(EvaluationWindow.TWENTY_FOUR_HOURS), allowedErrorRate);

        double composite = EvaluationWindow.FIVE_MINUTES.getWeight() * burn5m
                + EvaluationWindow.ONE_HOUR.getWeight() * burn1h
                + EvaluationWindow.TWENTY_FOUR_HOURS.getWeight() * burn24h;

        return new BurnRateBreakdown(burn5m, burn1h, burn24h, composite);
    }
}
