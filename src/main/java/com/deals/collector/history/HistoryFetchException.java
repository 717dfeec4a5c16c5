package com.deals.collector.history;

import lombok.Getter;

/**
 * Per-product fetch failure. Never aborts an ingestion cycle.
 */
@Getter
public abstract class HistoryFetchException extends Exception {

    private final String asin;

    protected HistoryFetchException(String asin, String message, Throwable cause) {
        super(message, cause);
        this.asin = asin;
    }
}
