package com.company.errorbudget.engine;

import com.company.errorbudget.domain.ErrorBudgetLedgerEntry;
import com.company.errorbudget.domain.SloTarget;
import com.company.errorbudget.domain.TrafficSample;
import com.company.errorbudget.domain.enums.EvaluationWindow;
import com.company.errorbudget.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.TreeSet;

/**
 * Error budget bookkeeping over fixed compliance windows.
 *
 * <p>The total budget of a window is {@code allowedErrorRate * windowDays * 24}
 * error-rate-hours. Each accrual integrates the trailing five-minute error rate
 * over the time elapsed since the previous accrual. A sample that arrives after
 * the stretch it covers was already integrated is charged for that stretch on
 * the next accrual; the ledger tracks the highest sample id it has seen to tell
 * such samples apart. Consumption never decreases within a window and is capped
 * at the total budget. It resets only when a new compliance window starts.
 *
 * <p>Windows are back-to-back, anchored at the SLO target's creation instant.
 * Callers hold the ledger lock of the (service, SLO) pair around
 * read-accrue-write.
 */
@Component
@RequiredArgsConstructor
public class ErrorBudgetLedger {

    static final Duration SHORT_WINDOW = EvaluationWindow.FIVE_MINUTES.getDuration();

    private final WindowAggregator windowAggregator;

    public double totalBudgetErrorHours(SloTarget target) {
        return target.allowedErrorRate() * target.getWindowDays() * 24.0;
    }

    public Instant windowStartFor(SloTarget target, Instant at) {
        Instant anchor = target.getCreatedAt() != null ? target.getCreatedAt() : Instant.EPOCH;
        if (!at.isAfter(anchor)) {
            return anchor;
        }
        long windowSeconds = target.complianceWindow().getSeconds();
        long elapsed = Duration.between(anchor, at).getSeconds();
        long completedWindows = elapsed / windowSeconds;
        return anchor.plusSeconds(completedWindows * windowSeconds);
    }

    /**
     * Instant from which the next accrual integrates, given the persisted state.
     */
    public Instant accrualStart(ErrorBudgetLedgerEntry prior, SloTarget target, Instant at) {
        Instant windowStart = windowStartFor(target, at);
        if (prior == null || prior.getWindowStart().isBefore(windowStart) || prior.getLastAccruedAt() == null) {
            return windowStart;
        }
        return prior.getLastAccruedAt().isAfter(windowStart) ? prior.getLastAccruedAt() : windowStart;
    }

    public LedgerAccrual accrue(ErrorBudgetLedgerEntry prior, SloTarget target,
                                Collection<TrafficSample> samples, Instant at) {
        Instant windowStart = windowStartFor(target, at);
        Instant windowEnd = windowStart.plus(target.complianceWindow());
        boolean rolledOver = prior != null && prior.getWindowStart() != null
                && prior.getWindowStart().isBefore(windowStart);

        double consumed = (prior == null || rolledOver) ? 0.0 : prior.getConsumedErrorHours();
        Instant from = accrualStart(prior, target, at);
        Instant lastAccruedAt = from;

        double accrued = 0.0;
        if (at.isAfter(from)) {
            accrued += integrateShortWindowRate(samples, from, at);
            lastAccruedAt = at;
        }
        if (prior != null && !rolledOver && prior.getLastAccruedAt() != null && prior.getLastSampleId() != null) {
            accrued += lateSampleErrorHours(samples, prior.getLastSampleId(), windowStart, from);
        }

        double total = totalBudgetErrorHours(target);
        consumed = total > 0.0 ? Math.min(consumed + accrued, total) : consumed + accrued;

        ErrorBudgetLedgerEntry.ErrorBudgetLedgerEntryBuilder next = prior == null
                ? ErrorBudgetLedgerEntry.builder()
                        .serviceId(target.getServiceId())
                        .sloTargetId(target.getTargetId())
                : prior.toBuilder();

        ErrorBudgetLedgerEntry entry = next
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .consumedErrorHours(consumed)
                .lastAccruedAt(lastAccruedAt)
                .lastSampleId(highestSampleId(prior, samples))
                .updatedAt(at)
                .build();

        double consumedPct = consumedPercentage(consumed, total);
        return new LedgerAccrual(entry, accrued, consumedPct, remainingPercentage(consumedPct), rolledOver);
    }

    /**
     * Exact integral of the trailing five-minute error rate over {@code (from, to]}.
     * The rate only changes where a sample enters or leaves the trailing window, so
     * each sample effectively covers {@code [timestamp, timestamp + 5m)}.
     */
    double integrateShortWindowRate(Collection<TrafficSample> samples, Instant from, Instant to) {
        TreeSet<Instant> breakpoints = new TreeSet<>();
        breakpoints.add(from);
        breakpoints.add(to);
        for (TrafficSample sample : samples) {
            addIfInside(breakpoints, sample.getTimestamp(), from, to);
            addIfInside(breakpoints, sample.getTimestamp().plus(SHORT_WINDOW), from, to);
        }

        SampleTimeline timeline = windowAggregator.timeline(samples);
        double errorHours = 0.0;
        Instant segmentStart = null;
        for (Instant point : breakpoints) {
            if (segmentStart != null) {
                WindowRate rate = timeline.between(segmentStart.minus(SHORT_WINDOW), segmentStart);
                errorHours += rate.getErrorRate() * TimeUtils.hoursBetween(segmentStart, point);
            }
            segmentStart = point;
        }
        return errorHours;
    }

    private static void addIfInside(TreeSet<Instant> points, Instant point, Instant from, Instant to) {
        if (point.isAfter(from) && point.isBefore(to)) {
            points.add(point);
        }
    }

    /**
     * Charges samples not seen by earlier accruals for the part of their five
     * minutes that lies before {@code accruedUntil} and inside the window.
     */
    double lateSampleErrorHours(Collection<TrafficSample> samples, long seenUpToId,
                                Instant windowStart, Instant accruedUntil) {
        double errorHours = 0.0;
        for (TrafficSample sample : samples) {
            if (sample.getSampleId() == null || sample.getSampleId() <= seenUpToId
                    || sample.getTotalRequests() == 0) {
                continue;
            }
            Instant ts = sample.getTimestamp();
            if (ts.isAfter(accruedUntil)) {
                continue;
            }
            Instant coveredFrom = ts.isBefore(windowStart) ? windowStart : ts;
            Instant coveredTo = ts.plus(SHORT_WINDOW);
            if (coveredTo.isAfter(accruedUntil)) {
                coveredTo = accruedUntil;
            }
            if (!coveredTo.isAfter(coveredFrom)) {
                continue;
            }
            double errorRate = (double) sample.getErrorCount() / sample.getTotalRequests();
            errorHours += errorRate * TimeUtils.hoursBetween(coveredFrom, coveredTo);
        }
        return errorHours;
    }

    private static Long highestSampleId(ErrorBudgetLedgerEntry prior, Collection<TrafficSample> samples) {
        Long highest = prior != null ? prior.getLastSampleId() : null;
        for (TrafficSample sample : samples) {
            Long id = sample.getSampleId();
            if (id != null && (highest == null || id > highest)) {
                highest = id;
            }
        }
        return highest;
    }

    public double consumedPercentage(double consumedErrorHours, double totalBudget) {
        if (totalBudget <= 0.0) {
            return consumedErrorHours > 0.0 ? 100.0 : 0.0;
        }
        return Math.min(100.0, consumedErrorHours / totalBudget * 100.0);
    }

    public double remainingPercentage(double consumedPercentage) {
        return Math.max(0.0, 100.0 - consumedPercentage);
    }
}
