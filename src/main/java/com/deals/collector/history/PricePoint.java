package com.deals.collector.history;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One price observation. A {@code null} price marks a period in which the product was unavailable.
 */
public record PricePoint(LocalDateTime timestamp, BigDecimal price) {

    public PricePoint {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
        if (price != null && price.signum() < 0) {
            throw new IllegalArgumentException("price must be non-negative: " + price);
        }
    }

    public static PricePoint unavailable(LocalDateTime timestamp) {
        return new PricePoint(timestamp, null);
    }

    public boolean isAvailable() {
        return price != null;
    }
}
