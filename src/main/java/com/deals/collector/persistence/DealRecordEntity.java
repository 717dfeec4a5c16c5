package com.deals.collector.persistence;

import com.deals.collector.service.DealCategory;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Persisted deal of one generation. Value columns are written once; only {@code active} is
 * flipped when a later generation supersedes the row.
 */
@Entity
@Table(name = "deal_record", indexes = {
    @Index(name = "idx_deal_active_cat_score", columnList = "active, category, score"),
    @Index(name = "idx_deal_active_cat_hot", columnList = "active, category, hot_score"),
    @Index(name = "idx_deal_asin", columnList = "asin"),
    @Index(name = "idx_deal_generation", columnList = "generation_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DealRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "generation_id", nullable = false, length = 36)
    private String generationId;

    @Column(name = "asin", nullable = false, length = 10)
    private String asin;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private DealCategory category;

    @Column(name = "title", length = 600)
    private String title;

    @Column(name = "brand", length = 200)
    private String brand;

    @Column(name = "image_url", length = 600)
    private String imageUrl;

    @Column(name = "amazon_url", length = 300)
    private String amazonUrl;

    // ==================== Price ====================

    @Column(name = "price_current", precision = 12, scale = 2)
    private BigDecimal priceCurrent;

    /**
     * Median over the trailing window. Can carry half a minor unit for even sample counts.
     */
    @Column(name = "price_median_90d", precision = 13, scale = 3)
    private BigDecimal priceMedian90d;

    @Column(name = "discount_pct_90d")
    private Double discountPct90d;

    @Column(name = "price_stability", nullable = false)
    private Double priceStability;

    @Column(name = "sample_count", nullable = false)
    private Integer sampleCount;

    @Column(name = "stale", nullable = false)
    private Boolean stale;

    /**
     * Confidence score (0 - 100).
     */
    @Column(name = "confidence", nullable = false)
    private Double confidence;

    @Column(name = "score", nullable = false)
    private Double score;

    // ==================== Demand ====================

    @Column(name = "sales_rank_current")
    private Long salesRankCurrent;

    @Column(name = "sales_rank_trend_30d")
    private Double salesRankTrend30d;

    @Column(name = "rank_drops_7d")
    private Integer rankDrops7d;

    @Column(name = "rating")
    private Double rating;

    @Column(name = "review_count")
    private Integer reviewCount;

    @Column(name = "demand_score")
    private Double demandScore;

    @Column(name = "hot_score", nullable = false)
    private Double hotScore;

    // ==================== Lifecycle ====================

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "ingested_at", nullable = false, updatable = false)
    private LocalDateTime ingestedAt;

    /**
     * First time this asin + category became active without interruption.
     */
    @Column(name = "published_at", nullable = false, updatable = false)
    private LocalDateTime publishedAt;
}
