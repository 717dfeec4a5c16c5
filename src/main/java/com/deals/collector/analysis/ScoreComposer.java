package com.deals.collector.analysis;

import com.deals.collector.config.ScoringConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Combines discount, stability, confidence and demand into the two ranking scores.
 * Pure functions of their arguments.
 */
@Component
@RequiredArgsConstructor
public class ScoreComposer {

    private final ScoringConfig config;

    public DealScores compose(PriceStatistics stats, double confidence, Double demandScore) {
        double score = dealScore(stats.getDiscountPct90d(), stats.getStability(), confidence);
        return new DealScores(score, hotScore(score, demandScore));
    }

    /**
     * Weighted discount and stability, pulled towards the neutral midpoint as confidence drops.
     * An undefined discount scores the floor.
     */
    public double dealScore(Double discountPct, double stability, double confidence) {
        ScoringConfig.Score cfg = config.getScore();
        if (discountPct == null) {
            return cfg.getFloor();
        }

        double discountPart = clamp(discountPct, 0.0, 1.0) * 100.0;
        double stabilityPart = clamp(stability, 0.0, 1.0) * 100.0;
        double raw = cfg.getDiscountWeight() * discountPart + cfg.getStabilityWeight() * stabilityPart;

        double trust = clamp(confidence / ConfidenceEstimator.MAX_CONFIDENCE, 0.0, 1.0);
        double score = cfg.getNeutral() + (raw - cfg.getNeutral()) * trust;
        return clamp(score, 0.0, 100.0);
    }

    public double hotScore(double score, Double demandScore) {
        if (demandScore == null) {
            return score;
        }
        double weight = clamp(config.getScore().getDemandWeight(), 0.0, 1.0);
        return clamp((1.0 - weight) * score + weight * demandScore, 0.0, 100.0);
    }

    private static double clamp(double value, double lo, double hi) {
        return Math.max(lo, Math.min(hi, value));
    }
}
