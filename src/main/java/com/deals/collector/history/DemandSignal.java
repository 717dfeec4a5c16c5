package com.deals.collector.history;

/**
 * Popularity fields reported by the provider. Any of them may be absent.
 *
 * @param salesRank   sales rank, lower is more popular
 * @param rating      star rating in [0, 5]
 * @param reviewCount number of reviews
 */
public record DemandSignal(Long salesRank, Double rating, Integer reviewCount) {

    public static final DemandSignal NONE = new DemandSignal(null, null, null);

    public DemandSignal {
        if (salesRank != null && salesRank < 0) {
            throw new IllegalArgumentException("salesRank must be >= 0: " + salesRank);
        }
        if (rating != null && (rating < 0.0 || rating > 5.0)) {
            throw new IllegalArgumentException("rating must be within [0, 5]: " + rating);
        }
        if (reviewCount != null && reviewCount < 0) {
            throw new IllegalArgumentException("reviewCount must be >= 0: " + reviewCount);
        }
    }

    public boolean isEmpty() {
        return salesRank == null && rating == null && reviewCount == null;
    }
}
