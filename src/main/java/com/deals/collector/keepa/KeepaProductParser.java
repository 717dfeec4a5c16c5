package com.deals.collector.keepa;

import com.deals.collector.history.DemandSignal;
import com.deals.collector.history.PricePoint;
import com.deals.collector.history.PriceSeries;
import com.deals.collector.history.ProductHistory;
import com.deals.collector.history.RankPoint;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decodes Keepa product objects.
 *
 * Keepa history arrays ({@code csv[type]}) are flat {@code [time, value, time, value, ...]} lists,
 * where time is in Keepa minutes (minutes since 2011-01-01 UTC) and {@code -1} means "no offer".
 */
public final class KeepaProductParser {

    static final long KEEPA_EPOCH_OFFSET_MINUTES = 21_564_000L;

    static final int CSV_AMAZON = 0;
    static final int CSV_NEW = 1;
    static final int CSV_SALES = 3;
    static final int CSV_RATING = 16;
    static final int CSV_COUNT_REVIEWS = 17;

    private static final int MAX_TITLE_LENGTH = 600;
    private static final int MAX_BRAND_LENGTH = 200;
    private static final String IMAGE_BASE_URL = "https://m.media-amazon.com/images/I/";

    private KeepaProductParser() {}

    /**
     * A product entry without title and without any history is how Keepa answers for an ASIN
     * it does not track.
     */
    public static boolean isKnownProduct(JsonNode product) {
        if (product == null || product.isMissingNode() || product.isNull()) {
            return false;
        }
        if (!product.path("title").asText("").isBlank()) {
            return true;
        }
        for (JsonNode history : product.path("csv")) {
            if (history.isArray() && history.size() > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param since samples older than this are dropped
     */
    public static ProductHistory parse(String asin, JsonNode product, LocalDateTime since) {
        JsonNode csv = product.path("csv");

        return ProductHistory.builder()
                .asin(asin)
                .title(truncate(textOrNull(product.path("title")), MAX_TITLE_LENGTH))
                .brand(truncate(textOrNull(product.path("brand")), MAX_BRAND_LENGTH))
                .imageUrl(imageUrl(product))
                .priceSeries(parsePriceSeries(csv, since))
                .demand(parseDemand(csv))
                .rankHistory(parseRankHistory(csv, since))
                .build();
    }

    public static LocalDateTime keepaMinutesToDateTime(long keepaMinutes) {
        long epochSeconds = (keepaMinutes + KEEPA_EPOCH_OFFSET_MINUTES) * 60L;
        return LocalDateTime.ofEpochSecond(epochSeconds, 0, ZoneOffset.UTC);
    }

    static PriceSeries parsePriceSeries(JsonNode csv, LocalDateTime since) {
        JsonNode history = csv.path(CSV_NEW);
        if (!hasSamples(history)) {
            history = csv.path(CSV_AMAZON);
        }
        if (!hasSamples(history)) {
            return PriceSeries.empty();
        }

        // Keyed by time: sorts the samples and keeps the last value for a repeated minute
        TreeMap<LocalDateTime, BigDecimal> byTime = new TreeMap<>();
        for (int i = 0; i + 1 < history.size(); i += 2) {
            LocalDateTime time = keepaMinutesToDateTime(history.get(i).asLong());
            if (time.isBefore(since)) {
                continue;
            }
            long cents = history.get(i + 1).asLong();
            byTime.put(time, cents < 0 ? null : BigDecimal.valueOf(cents, 2));
        }

        List<PricePoint> points = new ArrayList<>(byTime.size());
        for (Map.Entry<LocalDateTime, BigDecimal> entry : byTime.entrySet()) {
            points.add(new PricePoint(entry.getKey(), entry.getValue()));
        }
        return PriceSeries.of(points);
    }

    static DemandSignal parseDemand(JsonNode csv) {
        Long rank = lastValue(csv.path(CSV_SALES), 1);

        Long ratingRaw = lastValue(csv.path(CSV_RATING), 1);
        Double rating = ratingRaw == null ? null : Math.min(5.0, ratingRaw / 10.0);

        Long reviewsRaw = lastValue(csv.path(CSV_COUNT_REVIEWS), 0);
        Integer reviews = reviewsRaw == null ? null : (int) Math.min(Integer.MAX_VALUE, reviewsRaw);

        return new DemandSignal(rank, rating, reviews);
    }

    static List<RankPoint> parseRankHistory(JsonNode csv, LocalDateTime since) {
        JsonNode history = csv.path(CSV_SALES);
        if (!hasSamples(history)) {
            return List.of();
        }

        TreeMap<LocalDateTime, Long> byTime = new TreeMap<>();
        for (int i = 0; i + 1 < history.size(); i += 2) {
            long rank = history.get(i + 1).asLong();
            LocalDateTime time = keepaMinutesToDateTime(history.get(i).asLong());
            if (rank > 0 && !time.isBefore(since)) {
                byTime.put(time, rank);
            }
        }

        List<RankPoint> points = new ArrayList<>(byTime.size());
        byTime.forEach((time, rank) -> points.add(new RankPoint(time, rank)));
        return points;
    }

    /**
     * Latest value in a history array that is at least {@code minValid}.
     */
    private static Long lastValue(JsonNode history, long minValid) {
        if (!hasSamples(history)) {
            return null;
        }
        for (int i = history.size() - 1; i >= 1; i -= 2) {
            long value = history.get(i).asLong();
            if (value >= minValid) {
                return value;
            }
        }
        return null;
    }

    private static boolean hasSamples(JsonNode history) {
        return history != null && history.isArray() && history.size() >= 2;
    }

    private static String imageUrl(JsonNode product) {
        String imagesCsv = product.path("imagesCSV").asText("");
        if (!imagesCsv.isBlank()) {
            String first = imagesCsv.split(",")[0].trim();
            if (!first.isEmpty()) {
                return IMAGE_BASE_URL + first;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
