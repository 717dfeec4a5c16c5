package com.deals.collector.keepa;

import com.deals.collector.config.KeepaProperties;
import com.deals.collector.history.HistoryFetcher;
import com.deals.collector.history.ProductHistory;
import com.deals.collector.history.UnknownProductException;
import com.deals.collector.history.UpstreamUnavailableException;
import com.deals.collector.service.DealCategory;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link HistoryFetcher} backed by the Keepa product endpoint.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KeepaHistoryFetcher implements HistoryFetcher {

    private static final Pattern ASIN_PATTERN = Pattern.compile("[A-Z0-9]{10}");

    private final KeepaClient keepaClient;
    private final KeepaProperties properties;
    private final Clock clock;

    @Override
    public ProductHistory fetchHistory(String asin, DealCategory category)
            throws UpstreamUnavailableException, UnknownProductException {
        if (asin == null || !ASIN_PATTERN.matcher(asin).matches()) {
            throw new UnknownProductException(asin, "Malformed ASIN");
        }

        Optional<JsonNode> product = keepaClient.fetchProduct(asin);
        if (product.isEmpty() || !KeepaProductParser.isKnownProduct(product.get())) {
            throw new UnknownProductException(asin, "Keepa has no data for " + asin);
        }

        LocalDateTime since = LocalDateTime.now(clock).minusDays(properties.getHistoryDays());
        ProductHistory history = KeepaProductParser.parse(asin, product.get(), since);

        log.debug("Fetched {} ({}): {} price samples, {} rank samples",
                asin, category.getSlug(), history.getPriceSeries().size(), history.getRankHistory().size());
        return history;
    }
}
