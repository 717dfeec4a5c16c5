package com.deals.collector.analysis;

import com.deals.collector.config.KeepaProperties;
import com.deals.collector.history.ProductHistory;
import com.deals.collector.service.Candidate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Runs the statistics, confidence, demand and score calculators for one product and assembles
 * the resulting {@link DealRecord}. No shared mutable state: safe to call from parallel workers.
 */
@Service
@RequiredArgsConstructor
public class DealScorer {

    private final StatisticsEngine statisticsEngine;
    private final ConfidenceEstimator confidenceEstimator;
    private final DemandEstimator demandEstimator;
    private final ScoreComposer scoreComposer;
    private final KeepaProperties keepaProperties;
    private final Clock clock;

    /**
     * @param asOf reference time of the cycle; the trailing window ends here
     */
    public DealRecord score(Candidate candidate, ProductHistory history, LocalDateTime asOf) {
        PriceStatistics stats = statisticsEngine.compute(history.getPriceSeries(), asOf);
        double confidence = confidenceEstimator.estimate(stats);
        Double demandScore = demandEstimator.estimate(history.getDemand());
        DealScores scores = scoreComposer.compose(stats, confidence, demandScore);

        Long salesRank = history.getDemand().salesRank();

        return DealRecord.builder()
                .asin(candidate.asin())
                .category(candidate.category())
                .title(history.getTitle())
                .brand(history.getBrand())
                .imageUrl(history.getImageUrl())
                .amazonUrl(amazonUrl(candidate.asin()))
                .priceCurrent(stats.getPriceCurrent())
                .priceMedian90d(stats.getPriceMedian90d())
                .discountPct90d(stats.getDiscountPct90d())
                .priceStability(stats.getStability())
                .sampleCount(stats.getSampleCount())
                .stale(stats.isStale())
                .confidence(confidence)
                .score(scores.score())
                .salesRankCurrent(salesRank)
                .salesRankTrend30d(RankTrendCalculator.trend30d(history.getRankHistory(), salesRank, asOf))
                .rankDrops7d(RankTrendCalculator.drops7d(history.getRankHistory(), asOf))
                .rating(history.getDemand().rating())
                .reviewCount(history.getDemand().reviewCount())
                .demandScore(demandScore)
                .hotScore(scores.hotScore())
                .ingestedAt(LocalDateTime.now(clock))
                .build();
    }

    String amazonUrl(String asin) {
        String url = keepaProperties.getMarketplaceUrl() + "/dp/" + asin;
        String tag = keepaProperties.getAffiliateTag();
        return tag == null || tag.isBlank() ? url : url + "?tag=" + tag;
    }
}
