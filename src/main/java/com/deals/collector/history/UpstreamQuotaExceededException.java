package com.deals.collector.history;

/**
 * The provider refused the call because the token quota is spent. The cycle stops
 * fetching and skips its remaining candidates.
 */
public class UpstreamQuotaExceededException extends UpstreamUnavailableException {

    public UpstreamQuotaExceededException(String asin, String message) {
        super(asin, message);
    }
}
