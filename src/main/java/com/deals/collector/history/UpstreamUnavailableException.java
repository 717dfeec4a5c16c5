package com.deals.collector.history;

public class UpstreamUnavailableException extends HistoryFetchException {

    public UpstreamUnavailableException(String asin, String message) {
        super(asin, message, null);
    }

    public UpstreamUnavailableException(String asin, String message, Throwable cause) {
        super(asin, message, cause);
    }
}
