package com.deals.collector.service;

import com.deals.collector.analysis.DealRecord;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Fixture records for store tests.
 */
final class TestDeals {

    private TestDeals() {}

    static DealRecord deal(String asin, DealCategory category, double score) {
        return DealRecord.builder()
                .asin(asin)
                .category(category)
                .title("Product " + asin)
                .amazonUrl("https://www.amazon.co.uk/dp/" + asin)
                .priceCurrent(new BigDecimal("19.99"))
                .priceMedian90d(new BigDecimal("24.99"))
                .discountPct90d(0.2)
                .priceStability(0.9)
                .sampleCount(12)
                .stale(false)
                .confidence(75.0)
                .score(score)
                .hotScore(score)
                .ingestedAt(LocalDateTime.of(2024, 6, 1, 12, 0))
                .build();
    }

    static GenerationCommit generation(String id, DealRecord... records) {
        return GenerationCommit.builder()
                .generationId(id)
                .startedAt(LocalDateTime.of(2024, 6, 1, 12, 0))
                .records(List.of(records))
                .stats(new CycleStats(records.length, 0, 0, 0, 0))
                .build();
    }
}
