package com.deals.collector.history;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Normalized provider payload for one product.
 */
@Value
@Builder
public class ProductHistory {

    String asin;
    String title;
    String brand;
    String imageUrl;

    @Builder.Default
    PriceSeries priceSeries = PriceSeries.empty();

    @Builder.Default
    DemandSignal demand = DemandSignal.NONE;

    /**
     * Sales rank history, oldest first. Empty when the provider has none.
     */
    @Builder.Default
    List<RankPoint> rankHistory = List.of();
}
