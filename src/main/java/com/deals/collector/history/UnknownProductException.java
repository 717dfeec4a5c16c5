package com.deals.collector.history;

public class UnknownProductException extends HistoryFetchException {

    public UnknownProductException(String asin, String message) {
        super(asin, message, null);
    }
}
