package com.deals.collector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Named constants of the scoring formulas. Every weight used by the statistics, confidence,
 * demand and score calculators comes from here.
 */
@Data
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private Statistics statistics = new Statistics();
    private Confidence confidence = new Confidence();
    private Demand demand = new Demand();
    private Score score = new Score();

    @Data
    public static class Statistics {
        private int windowDays = 90;
        private int minSamples = 3;
        private int freshnessHours = 48;
        private double neutralStability = 0.5;
    }

    @Data
    public static class Confidence {
        /**
         * Sample count at which coverage reaches 1.0.
         */
        private int sampleSaturation = 20;
        private double stalePenalty = 0.4;
        private double gapWeight = 0.5;
        private double varianceWeight = 0.25;
        private double floor = 0.0;
    }

    @Data
    public static class Demand {
        private double rankWeight = 0.5;
        private double ratingWeight = 0.3;
        private double reviewsWeight = 0.2;

        /**
         * Review count at which a rating carries half of its weight.
         */
        private int reviewSaturation = 50;

        /**
         * Weight of a rating whose review count is unknown.
         */
        private double unknownReviewWeight = 0.5;

        /**
         * Ratings at or below this many stars contribute nothing.
         */
        private double ratingFloor = 3.5;
    }

    @Data
    public static class Score {
        private double discountWeight = 0.7;
        private double stabilityWeight = 0.3;
        private double neutral = 50.0;
        private double floor = 0.0;
        private double demandWeight = 0.4;
    }
}
