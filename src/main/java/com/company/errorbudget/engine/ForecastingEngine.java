package com.company.errorbudget.engine;

import com.company.errorbudget.domain.Forecast;
import com.company.errorbudget.domain.enums.BurnRateTrend;
import com.company.errorbudget.domain.enums.ForecastConfidence;
import com.company.errorbudget.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Linear-trend projection of budget remaining.
 *
 * <p>Fits {@code remaining = m * hours + b} by ordinary least squares, with hours
 * measured from the oldest point. A falling line projects exhaustion where it
 * crosses zero; the time to exhaustion is counted from now, or from the newest
 * point if that is later. A crossing already in the past counts as zero hours.
 */
@Component
@Slf4j
public class ForecastingEngine {

    /** Percent per hour below which a slope counts as flat. */
    public static final double TREND_THRESHOLD = 0.1;

    public static final int HIGH_CONFIDENCE_MIN_POINTS = 20;
    public static final int MEDIUM_CONFIDENCE_MIN_POINTS = 6;
    public static final double HIGH_CONFIDENCE_MIN_R_SQUARED = 0.7;
    public static final double MEDIUM_CONFIDENCE_MIN_R_SQUARED = 0.4;

    /** Projections further out than ten years are reported as no exhaustion. */
    static final double MAX_HORIZON_HOURS = 87_600.0;


    public Forecast forecast(String serviceName, List<BudgetPoint> history,
                             double currentBurnRate, Instant now) {
        List<BudgetPoint> points = new ArrayList<>(history);
        points.sort(Comparator.comparing(BudgetPoint::getTimestamp));

        double remaining = points.isEmpty() ? 100.0 : points.get(points.size() - 1).getRemaining();
        int n = points.size();

        double slope = 0.0;
        double rSquared = 0.0;
        Double timeToExhaustion = null;
        Instant exhaustionTime = null;
        BurnRateTrend trend = BurnRateTrend.STABLE;
        ForecastConfidence confidence = ForecastConfidence.LOW;

        Fit fit = n >= 2 ? fit(points) : null;
        if (fit != null) {
            slope = fit.slope;
            rSquared = fit.rSquared;
            trend = trendOf(slope);
            confidence = confidenceOf(n, rSquared);

            if (slope < 0.0 && remaining > 0.0) {
                Instant newest = points.get(n - 1).getTimestamp();
                Instant anchor = now.isBefore(newest) ? newest : now;
                double crossing = -fit.intercept / slope;
                double hours = crossing - TimeUtils.hoursBetween(points.get(0).getTimestamp(), anchor);
                if (hours <= MAX_HORIZON_HOURS) {
                    timeToExhaustion = Math.max(hours, 0.0);
                    exhaustionTime = TimeUtils.plusHours(anchor, timeToExhaustion);
                }
            }
        }

        log.debug("Forecast for {}: n={}, slope={}, r2={}, tte={}",
                serviceName, n, slope, rSquared, timeToExhaustion);

        return Forecast.builder()
                .serviceName(serviceName)
                .computedAt(now)
                .dataPoints(n)
                .trendSlope(slope)
                .rSquared(rSquared)
                .burnRateTrend(trend)
                .timeToExhaustionHours(timeToExhaustion)
                .projectedExhaustionTime(exhaustionTime)
                .confidenceLevel(confidence)
                .currentBurnRate(currentBurnRate)
                .errorBudgetRemaining(remaining)
                .forecastMessage(message(serviceName, currentBurnRate, remaining, timeToExhaustion, trend))
                .build();
    }

    public BurnRateTrend trendOf(double slope) {
        if (slope < -TREND_THRESHOLD) {
            return BurnRateTrend.INCREASING;
        }
        if (slope > TREND_THRESHOLD) {
            return BurnRateTrend.DECREASING;
        }
        return BurnRateTrend.STABLE;
    }

    public ForecastConfidence confidenceOf(int n, double rSquared) {
        if (n >= HIGH_CONFIDENCE_MIN_POINTS && rSquared >= HIGH_CONFIDENCE_MIN_R_SQUARED) {
            return ForecastConfidence.HIGH;
        }
        if (n >= HIGH_CONFIDENCE_MIN_POINTS
                || (n >= MEDIUM_CONFIDENCE_MIN_POINTS && rSquared >= MEDIUM_CONFIDENCE_MIN_R_SQUARED)) {
            return ForecastConfidence.MEDIUM;
        }
        return ForecastConfidence.LOW;
    }

    private Fit fit(List<BudgetPoint> points) {
        Instant origin = points.get(0).getTimestamp();
        int n = points.size();
        double[] xs = new double[n];
        double[] ys = new double[n];
        double sumX = 0.0;
        double sumY = 0.0;
        for (int i = 0; i < n; i++) {
            xs[i] = TimeUtils.hoursBetween(origin, points.get(i).getTimestamp());
            ys[i] = points.get(i).getRemaining();
            sumX += xs[i];
            sumY += ys[i];
        }
        double meanX = sumX / n;
        double meanY = sumY / n;

        double sxx = 0.0;
        double sxy = 0.0;
        double syy = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = xs[i] - meanX;
            double dy = ys[i] - meanY;
            sxx += dx * dx;
            sxy += dx * dy;
            syy += dy * dy;
        }

        // All points share one timestamp
        if (sxx == 0.0) {
            return null;
        }

        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;

        double rSquared;
        if (syy == 0.0) {
            rSquared = 1.0;
        } else {
            double ssRes = 0.0;
            for (int i = 0; i < n; i++) {
                double residual = ys[i] - (slope * xs[i] + intercept);
                ssRes += residual * residual;
            }
            rSquared = Math.max(0.0, 1.0 - ssRes / syy);
        }
        return new Fit(slope, intercept, rSquared);
    }

    String message(String serviceName, double burnRate, double remaining,
                   Double hoursToExhaustion, BurnRateTrend trend) {
        if (remaining <= 0.0) {
            return serviceName + " has exhausted its error budget. Immediate action required.";
        }
        if (hoursToExhaustion == null) {
            return String.format(Locale.ROOT,
                    "%s error budget is not projected to exhaust; %.1f%% remaining.", serviceName, remaining);
        }

        String pace;
        String urgency;
        if (burnRate >= 3.0) {
            pace = "critically fast";
            urgency = "Immediate intervention required.";
        } else if (burnRate >= 2.0) {
            pace = String.format(Locale.ROOT, "%.1fx faster than allowed", burnRate);
            urgency = "Action recommended within the hour.";
        } else if (burnRate >= 1.5) {
            pace = String.format(Locale.ROOT, "at %.1fx the sustainable rate", burnRate);
            urgency = "Monitor closely.";
        } else if (burnRate >= 1.0) {
            pace = "at the allowed rate";
            urgency = "Consider investigation.";
        } else {
            pace = "below the allowed rate";
            urgency = "Budget is healthy.";
        }

        String trendNote = switch (trend) {
            case INCREASING -> " Budget is draining.";
            case DECREASING -> " Budget is recovering.";
            case STABLE -> "";
        };

        return String.format(Locale.ROOT, "%s is burning error budget %s. Exhaustion projected in ~%s.%s %s",
                serviceName, pace, TimeUtils.formatHours(hoursToExhaustion), trendNote, urgency);
    }

    private static final class Fit {
        final double slope;
        final double intercept;
        final double rSquared;

        Fit(double slope, double intercept, double rSquared) {
            this.slope = slope;
            this.intercept = intercept;
            this.rSquared = rSquared;
        }
    }
}
