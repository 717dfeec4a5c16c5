package com.deals.collector.history;

import com.deals.collector.service.DealCategory;

/**
 * Narrow fetch contract towards the analytics provider.
 */
public interface HistoryFetcher {

    /**
     * Fetch the bounded price, rank and rating history of one product.
     *
     * @throws UpstreamUnavailableException transient failure, the product is retried next cycle
     * @throws UnknownProductException      the provider does not know the product
     */
    ProductHistory fetchHistory(String asin, DealCategory category)
            throws UpstreamUnavailableException, UnknownProductException;
}
