package com.deals.collector.keepa;

import com.deals.collector.config.KeepaProperties;
import com.deals.collector.history.UpstreamQuotaExceededException;
import com.deals.collector.history.UpstreamUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Collection;
import java.util.Optional;

/**
 * Thin HTTP client for the Keepa REST API. Returns raw JSON trees; decoding lives in
 * {@link KeepaProductParser}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KeepaClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final KeepaProperties properties;
    private final KeepaQuota quota;

    /**
     * Fetch one product with price, rank and rating history.
     *
     * @return the product node, or empty when the response holds no entry for the ASIN
     */
    public Optional<JsonNode> fetchProduct(String asin) throws UpstreamUnavailableException {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl() + "/product")
                .queryParam("key", properties.getApiKey())
                .queryParam("domain", properties.getDomain())
                .queryParam("asin", asin)
                .queryParam("stats", properties.getStatsDays())
                .queryParam("history", 1)
                .queryParam("rating", 1)
                .queryParam("days", properties.getHistoryDays())
                .toUriString();

        log.debug("Fetching product {} from Keepa", asin);
        quota.acquire(asin);
        JsonNode root = readTree(get(url, asin), asin);

        for (JsonNode product : root.path("products")) {
            if (asin.equalsIgnoreCase(product.path("asin").asText())) {
                return Optional.of(product);
            }
        }
        return Optional.empty();
    }

    /**
     * Root categories of the configured marketplace, keyed by category id.
     */
    public JsonNode fetchRootCategories() throws UpstreamUnavailableException {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl() + "/category")
                .queryParam("key", properties.getApiKey())
                .queryParam("domain", properties.getDomain())
                .queryParam("category", 0)
                .queryParam("parents", 0)
                .toUriString();

        quota.acquire(null);
        return readTree(get(url, null), null).path("categories");
    }

    /**
     * One page of the Keepa deal browser restricted to the given root categories.
     *
     * @return the deal rows ({@code deals.dr}), possibly an empty array
     */
    public JsonNode fetchDeals(Collection<Long> rootCategoryIds, int page) throws UpstreamUnavailableException {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl() + "/deal")
                .queryParam("key", properties.getApiKey())
                .toUriString();

        ObjectNode selection = objectMapper.createObjectNode();
        selection.put("page", page);
        selection.put("domainId", properties.getDomain());
        selection.put("isFilterEnabled", true);
        selection.put("filterErotic", true);
        rootCategoryIds.forEach(selection.putArray("includeCategories")::add);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        quota.acquire(null);
        String response;
        try {
            response = restTemplate.postForObject(url,
                    new HttpEntity<>(selection.toString(), headers), String.class);
        } catch (RestClientException e) {
            throw translate(e, null);
        }

        return readTree(response, null).path("deals").path("dr");
    }

    private String get(String url, String asin) throws UpstreamUnavailableException {
        try {
            return restTemplate.getForObject(url, String.class);
        } catch (RestClientException e) {
            throw translate(e, asin);
        }
    }

    private UpstreamUnavailableException translate(RestClientException e, String asin) {
        if (e instanceof HttpStatusCodeException statusException
                && statusException.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            log.warn("Keepa token quota exhausted");
            quota.exhaust();
            return new UpstreamQuotaExceededException(asin, "Keepa token quota exhausted");
        }
        return new UpstreamUnavailableException(asin, "Keepa request failed: " + e.getMessage(), e);
    }

    private JsonNode readTree(String response, String asin) throws UpstreamUnavailableException {
        if (response == null || response.isBlank()) {
            throw new UpstreamUnavailableException(asin, "Empty response from Keepa");
        }
        try {
            return objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new UpstreamUnavailableException(asin, "Unreadable Keepa response", e);
        }
    }
}
