package com.company.errorbudget.engine;

import com.company.errorbudget.domain.SloTarget;
import com.company.errorbudget.domain.enums.RiskLevel;
import org.springframework.stereotype.Component;

/**
 * Maps a composite burn rate to a risk level. Bands are inclusive on the lower
 * edge and exclusive on the upper one. No hysteresis.
 */
@Component
public class RiskClassifier {

    public RiskLevel classify(double compositeBurnRate) {
        return classify(compositeBurnRate, RiskThresholds.DEFAULT);
    }

    public RiskLevel classify(double compositeBurnRate, RiskThresholds thresholds) {
        if (compositeBurnRate >= thresholds.getFreeze()) {
            return RiskLevel.FREEZE;
        }
        if (compositeBurnRate >= thresholds.getDanger()) {
            return RiskLevel.DANGER;
        }
        if (compositeBurnRate >= thresholds.getObserve()) {
            return RiskLevel.OBSERVE;
        }
        return RiskLevel.SAFE;
    }

    /**
     * OBSERVE and FREEZE edges come from the target when set. DANGER stays at 1.5
     * while that lies strictly between them, otherwise it is their midpoint.
     */
    public RiskThresholds thresholdsFor(SloTarget target) {
        if (target == null) {
            return RiskThresholds.DEFAULT;
        }
        double observe = positiveOr(target.getBurnRateThreshold(), RiskThresholds.DEFAULT_OBSERVE);
        double freeze = positiveOr(target.getCriticalBurnRate(), RiskThresholds.DEFAULT_FREEZE);
        if (freeze < observe) {
            freeze = observe;
        }

        double danger = RiskThresholds.DEFAULT_DANGER;
        if (danger <= observe || danger >= freeze) {
            danger = (observe + freeze) / 2.0;
        }
        return new RiskThresholds(observe, danger, freeze);
    }

    private static double positiveOr(Double value, double fallback) {
        return value != null && value > 0.0 ? value : fallback;
    }
}
