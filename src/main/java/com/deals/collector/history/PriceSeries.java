package com.deals.collector.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Price history of one product, ordered by strictly increasing timestamp.
 */
public final class PriceSeries {

    private static final PriceSeries EMPTY = new PriceSeries(List.of());

    private final List<PricePoint> points;

    private PriceSeries(List<PricePoint> points) {
        this.points = points;
    }

    public static PriceSeries empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException if timestamps are not strictly increasing
     */
    public static PriceSeries of(List<PricePoint> points) {
        if (points == null || points.isEmpty()) {
            return EMPTY;
        }
        for (int i = 1; i < points.size(); i++) {
            if (!points.get(i).timestamp().isAfter(points.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("timestamps must be strictly increasing at index " + i);
            }
        }
        return new PriceSeries(Collections.unmodifiableList(new ArrayList<>(points)));
    }

    public List<PricePoint> points() {
        return points;
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }

    public Optional<PricePoint> latestAvailable() {
        for (int i = points.size() - 1; i >= 0; i--) {
            if (points.get(i).isAvailable()) {
                return Optional.of(points.get(i));
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "PriceSeries{size=" + points.size() + "}";
    }
}
