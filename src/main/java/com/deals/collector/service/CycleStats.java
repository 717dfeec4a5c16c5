package com.deals.collector.service;

/**
 * Per-product bookkeeping of one cycle.
 *
 * @param candidates   distinct (asin, category) pairs considered
 * @param unavailable  products skipped after a transient upstream failure or timeout
 * @param unknown      products the provider does not know
 * @param quotaSkipped products not fetched because the upstream quota ran out
 * @param filtered     scored products left out by the per-category minimum discount
 */
public record CycleStats(int candidates, int unavailable, int unknown, int quotaSkipped, int filtered) {

    public static final CycleStats EMPTY = new CycleStats(0, 0, 0, 0, 0);
}
