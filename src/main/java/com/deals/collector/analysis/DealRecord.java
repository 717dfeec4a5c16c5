package com.deals.collector.analysis;

import com.deals.collector.service.DealCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Scored product computed by one ingestion cycle, before it is committed as part of a generation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DealRecord {

    private String asin;
    private DealCategory category;

    private String title;
    private String brand;
    private String imageUrl;
    private String amazonUrl;

    // Price-centric
    private BigDecimal priceCurrent;
    private BigDecimal priceMedian90d;
    private Double discountPct90d;
    private double priceStability;
    private int sampleCount;
    private boolean stale;
    private double confidence;
    private double score;

    // Demand-centric
    private Long salesRankCurrent;
    private Double salesRankTrend30d;
    private Integer rankDrops7d;
    private Double rating;
    private Integer reviewCount;
    private Double demandScore;
    private double hotScore;

    private LocalDateTime ingestedAt;
}
