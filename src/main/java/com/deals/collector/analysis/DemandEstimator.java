package com.deals.collector.analysis;

import com.deals.collector.config.ScoringConfig;
import com.deals.collector.history.DemandSignal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Popularity on a 0-100 scale from sales rank, rating and review count, independent of price.
 * Missing fields drop out and the remaining weights are renormalized.
 */
@Component
@RequiredArgsConstructor
public class DemandEstimator {

    private final ScoringConfig config;

    /**
     * @return demand score, or null when the signal carries no field at all
     */
    public Double estimate(DemandSignal signal) {
        if (signal == null || signal.isEmpty()) {
            return null;
        }
        ScoringConfig.Demand cfg = config.getDemand();

        double weighted = 0.0;
        double weights = 0.0;

        if (signal.salesRank() != null) {
            weighted += cfg.getRankWeight() * rankComponent(signal.salesRank());
            weights += cfg.getRankWeight();
        }
        if (signal.rating() != null) {
            weighted += cfg.getRatingWeight() * ratingComponent(signal.rating(), signal.reviewCount(), cfg);
            weights += cfg.getRatingWeight();
        }
        if (signal.reviewCount() != null) {
            weighted += cfg.getReviewsWeight() * reviewsComponent(signal.reviewCount());
            weights += cfg.getReviewsWeight();
        }

        if (weights <= 0) {
            return 0.0;
        }
        return clamp(weighted / weights);
    }

    /**
     * Log scale: rank 1 -> 94, 100 -> 60, 10k -> 20, 100k and worse -> 0.
     */
    static double rankComponent(long rank) {
        return clamp(100.0 - 20.0 * Math.log10(rank + 1.0));
    }

    /**
     * Stars above the floor, scaled by how many reviews back them up.
     */
    static double ratingComponent(double rating, Integer reviewCount, ScoringConfig.Demand cfg) {
        double span = 5.0 - cfg.getRatingFloor();
        double stars = span <= 0 ? 0.0 : clamp((rating - cfg.getRatingFloor()) / span * 100.0);
        return stars * reviewWeight(reviewCount, cfg);
    }

    static double reviewWeight(Integer reviewCount, ScoringConfig.Demand cfg) {
        if (reviewCount == null) {
            return cfg.getUnknownReviewWeight();
        }
        double saturation = Math.max(1, cfg.getReviewSaturation());
        return reviewCount / (reviewCount + saturation);
    }

    /**
     * Log scale: 10 reviews -> 21, 1k -> 60, 100k -> 100.
     */
    static double reviewsComponent(int reviewCount) {
        return clamp(20.0 * Math.log10(reviewCount + 1.0));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
