package com.deals.collector.analysis;

import com.deals.collector.config.ScoringConfig;
import com.deals.collector.history.PricePoint;
import com.deals.collector.history.PriceSeries;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Trailing-window price statistics: current price, median, discount against the median,
 * stability and unavailability gaps.
 */
@Component
@RequiredArgsConstructor
public class StatisticsEngine {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final ScoringConfig config;

    public PriceStatistics compute(PriceSeries series, LocalDateTime asOf) {
        ScoringConfig.Statistics cfg = config.getStatistics();
        LocalDateTime windowStart = asOf.minusDays(cfg.getWindowDays());

        Optional<PricePoint> latest = series.latestAvailable();
        BigDecimal current = latest.map(PricePoint::price).orElse(null);
        LocalDateTime latestAt = latest.map(PricePoint::timestamp).orElse(null);
        boolean stale = latestAt == null || latestAt.isBefore(asOf.minusHours(cfg.getFreshnessHours()));

        List<BigDecimal> window = new ArrayList<>();
        for (PricePoint point : series.points()) {
            if (point.isAvailable() && !point.timestamp().isBefore(windowStart)) {
                window.add(point.price());
            }
        }

        BigDecimal median = median(window, cfg.getMinSamples());

        Double discount = null;
        if (median != null && median.signum() > 0 && current != null) {
            discount = Math.min(1.0, median.subtract(current).divide(median, MC).doubleValue());
        }

        double stability = cfg.getNeutralStability();
        boolean stabilityDefined = false;
        Double measured = stability(window);
        if (measured != null) {
            stability = measured;
            stabilityDefined = true;
        }

        return PriceStatistics.builder()
                .priceCurrent(current)
                .priceMedian90d(median)
                .discountPct90d(discount)
                .stability(stability)
                .stabilityDefined(stabilityDefined)
                .sampleCount(window.size())
                .stale(stale)
                .latestSampleAt(latestAt)
                .gapFraction(gapFraction(series, windowStart, asOf))
                .build();
    }

    /**
     * Median of the window. A single sample stands for itself; otherwise at least
     * {@code minSamples} are required.
     */
    static BigDecimal median(List<BigDecimal> values, int minSamples) {
        if (values.isEmpty() || (values.size() > 1 && values.size() < minSamples)) {
            return null;
        }
        List<BigDecimal> sorted = new ArrayList<>(values);
        sorted.sort(null);

        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return sorted.get(mid - 1).add(sorted.get(mid)).divide(TWO);
    }

    /**
     * 1 - stddev / mean clamped to [0, 1]; null when fewer than two samples or a non-positive mean.
     */
    static Double stability(List<BigDecimal> values) {
        if (values.size() < 2) {
            return null;
        }
        double sum = 0;
        for (BigDecimal value : values) {
            sum += value.doubleValue();
        }
        double mean = sum / values.size();
        if (mean <= 0) {
            return null;
        }

        double squares = 0;
        for (BigDecimal value : values) {
            double diff = value.doubleValue() - mean;
            squares += diff * diff;
        }
        double cv = Math.sqrt(squares / values.size()) / mean;
        return Math.max(0.0, Math.min(1.0, 1.0 - cv));
    }

    /**
     * An unavailable sample opens a gap lasting until the next sample, or until {@code asOf}
     * for the last one.
     */
    static double gapFraction(PriceSeries series, LocalDateTime windowStart, LocalDateTime asOf) {
        long windowMinutes = Duration.between(windowStart, asOf).toMinutes();
        if (windowMinutes <= 0) {
            return 0.0;
        }

        List<PricePoint> points = series.points();
        long gapMinutes = 0;
        for (int i = 0; i < points.size(); i++) {
            if (points.get(i).isAvailable()) {
                continue;
            }
            LocalDateTime start = max(points.get(i).timestamp(), windowStart);
            LocalDateTime end = i + 1 < points.size() ? points.get(i + 1).timestamp() : asOf;
            end = end.isAfter(asOf) ? asOf : end;
            if (end.isAfter(start)) {
                gapMinutes += Duration.between(start, end).toMinutes();
            }
        }
        return Math.min(1.0, (double) gapMinutes / windowMinutes);
    }

    private static LocalDateTime max(LocalDateTime a, LocalDateTime b) {
        return a.isAfter(b) ? a : b;
    }
}
