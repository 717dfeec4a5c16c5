package com.deals.collector.analysis;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Summary of one price series over the trailing window. {@code null} fields mean there was not
 * enough data, never zero.
 */
@Value
@Builder
public class PriceStatistics {

    BigDecimal priceCurrent;
    BigDecimal priceMedian90d;
    Double discountPct90d;

    /**
     * 1 - coefficient of variation, in [0, 1]. Neutral midpoint when {@link #stabilityDefined} is false.
     */
    double stability;
    boolean stabilityDefined;

    /**
     * Available samples inside the window.
     */
    int sampleCount;

    /**
     * True when the latest available sample is older than the freshness threshold, or missing.
     */
    boolean stale;
    LocalDateTime latestSampleAt;

    /**
     * Share of the window the product spent unavailable, in [0, 1].
     */
    double gapFraction;

    public boolean isMedianDefined() {
        return priceMedian90d != null;
    }
}
