package com.deals.collector.api;

import com.deals.collector.persistence.DealRecordEntity;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One active deal as served by the read API.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DealResponse(
        String asin,
        String category,
        String title,
        String brand,
        String imageUrl,
        String amazonUrl,
        BigDecimal priceCurrent,
        @JsonProperty("price_median_90d") BigDecimal priceMedian90d,
        @JsonProperty("discount_pct_90d") Double discountPct90d,
        double priceStability,
        int sampleCount,
        boolean stale,
        double confidence,
        double score,
        Double demandScore,
        double hotScore,
        Long salesRankCurrent,
        @JsonProperty("sales_rank_trend_30d") Double salesRankTrend30d,
        @JsonProperty("rank_drops_7d") Integer rankDrops7d,
        Double rating,
        Integer reviewCount,
        String generationId,
        LocalDateTime publishedAt,
        LocalDateTime ingestedAt) {

    public static DealResponse from(DealRecordEntity entity) {
        return new DealResponse(
                entity.getAsin(),
                entity.getCategory().getSlug(),
                entity.getTitle(),
                entity.getBrand(),
                entity.getImageUrl(),
                entity.getAmazonUrl(),
                entity.getPriceCurrent(),
                entity.getPriceMedian90d(),
                entity.getDiscountPct90d(),
                entity.getPriceStability(),
                entity.getSampleCount(),
                Boolean.TRUE.equals(entity.getStale()),
                entity.getConfidence(),
                entity.getScore(),
                entity.getDemandScore(),
                entity.getHotScore(),
                entity.getSalesRankCurrent(),
                entity.getSalesRankTrend30d(),
                entity.getRankDrops7d(),
                entity.getRating(),
                entity.getReviewCount(),
                entity.getGenerationId(),
                entity.getPublishedAt(),
                entity.getIngestedAt());
    }
}
