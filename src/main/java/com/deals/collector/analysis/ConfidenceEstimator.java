package com.deals.collector.analysis;

import com.deals.collector.config.ScoringConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * How far a price history can be trusted, on a 0-100 scale.
 *
 * confidence = 100 * coverage * freshness * completeness * steadiness
 *   coverage     = min(1, ln(1 + n) / ln(1 + sampleSaturation))
 *   freshness    = 1 - stalePenalty when stale, else 1
 *   completeness = 1 - gapWeight * gapFraction
 *   steadiness   = 1 - varianceWeight * (1 - stability)
 *
 * An undefined median pins the result to the floor.
 */
@Component
@RequiredArgsConstructor
public class ConfidenceEstimator {

    public static final double MAX_CONFIDENCE = 100.0;

    private final ScoringConfig config;

    public double estimate(PriceStatistics stats) {
        return estimate(stats.getSampleCount(), stats.isStale(), stats.getGapFraction(),
                stats.getStability(), stats.isMedianDefined());
    }

    public double estimate(int sampleCount, boolean stale, double gapFraction,
                           double stability, boolean medianDefined) {
        ScoringConfig.Confidence cfg = config.getConfidence();
        if (!medianDefined || sampleCount <= 0) {
            return cfg.getFloor();
        }

        double saturation = Math.max(1, cfg.getSampleSaturation());
        double coverage = Math.min(1.0, Math.log1p(sampleCount) / Math.log1p(saturation));
        double freshness = stale ? 1.0 - clamp01(cfg.getStalePenalty()) : 1.0;
        double completeness = 1.0 - clamp01(cfg.getGapWeight()) * clamp01(gapFraction);
        double steadiness = 1.0 - clamp01(cfg.getVarianceWeight()) * (1.0 - clamp01(stability));

        double confidence = MAX_CONFIDENCE * coverage * freshness * completeness * steadiness;
        return Math.max(cfg.getFloor(), Math.min(MAX_CONFIDENCE, confidence));
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
