package com.deals.collector.keepa;

import com.deals.collector.config.IngestionProperties;
import com.deals.collector.config.KeepaProperties;
import com.deals.collector.history.UpstreamQuotaExceededException;
import com.deals.collector.history.UpstreamUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("KeepaClient Tests")
class KeepaClientTest {

    private MockRestServiceServer server;
    private RestTemplate restTemplate;
    private KeepaQuota quota;
    private KeepaClient client;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        IngestionProperties ingestion = new IngestionProperties();
        ingestion.setRequestsPerSecond(1000);
        ingestion.setPermitTimeout(Duration.ofSeconds(1));
        ingestion.setMaxCallsPerCycle(3);
        quota = new KeepaQuota(ingestion);
        client = clientWith(quota);
    }

    private KeepaClient clientWith(KeepaQuota keepaQuota) {
        KeepaProperties properties = new KeepaProperties();
        properties.setApiKey("secret");
        return new KeepaClient(restTemplate, new ObjectMapper(), properties, keepaQuota);
    }

    @Test
    @DisplayName("Returns the product entry matching the ASIN")
    void fetchProduct() throws Exception {
        server.expect(requestTo(startsWith("https://api.keepa.com/product")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("asin", "B0TEST0001"))
                .andExpect(queryParam("domain", "2"))
                .andExpect(queryParam("key", "secret"))
                .andRespond(withSuccess("{\"products\":[{\"asin\":\"B0TEST0001\",\"title\":\"Kettle\"}]}",
                        MediaType.APPLICATION_JSON));

        Optional<JsonNode> product = client.fetchProduct("B0TEST0001");

        assertThat(product).isPresent();
        assertThat(product.get().path("title").asText()).isEqualTo("Kettle");
        server.verify();
    }

    @Test
    @DisplayName("No matching entry gives empty")
    void productMissing() throws Exception {
        server.expect(requestTo(startsWith("https://api.keepa.com/product")))
                .andRespond(withSuccess("{\"products\":[]}", MediaType.APPLICATION_JSON));

        assertThat(client.fetchProduct("B0TEST0001")).isEmpty();
    }

    @Test
    @DisplayName("HTTP 429 means the token quota is exhausted")
    void quotaExceeded() {
        server.expect(requestTo(startsWith("https://api.keepa.com/product")))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.fetchProduct("B0TEST0001"))
                .isInstanceOf(UpstreamQuotaExceededException.class);
        assertThat(quota.isExhausted()).isTrue();

        // No further request reaches Keepa until the next cycle
        assertThatThrownBy(() -> client.fetchDeals(List.of(1L), 0))
                .isInstanceOf(UpstreamQuotaExceededException.class);
        server.verify();
    }

    @Test
    @DisplayName("Server errors are transient")
    void serverError() {
        server.expect(requestTo(startsWith("https://api.keepa.com/product")))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchProduct("B0TEST0001"))
                .isInstanceOf(UpstreamUnavailableException.class)
                .isNotInstanceOf(UpstreamQuotaExceededException.class);
    }

    @Test
    @DisplayName("Unreadable body is transient")
    void unreadableBody() {
        server.expect(requestTo(startsWith("https://api.keepa.com/product")))
                .andRespond(withSuccess("not json {", MediaType.TEXT_PLAIN));

        assertThatThrownBy(() -> client.fetchProduct("B0TEST0001"))
                .isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    @DisplayName("Deal browsing posts the selection and returns the rows")
    void fetchDeals() throws Exception {
        server.expect(requestTo(startsWith("https://api.keepa.com/deal")))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.page").value(1))
                .andExpect(jsonPath("$.domainId").value(2))
                .andExpect(jsonPath("$.includeCategories[0]").value(11052681))
                .andRespond(withSuccess("{\"deals\":{\"dr\":[{\"asin\":\"B0TEST0001\"},{\"asin\":\"B0TEST0002\"}]}}",
                        MediaType.APPLICATION_JSON));

        JsonNode rows = client.fetchDeals(List.of(11052681L), 1);

        assertThat(rows.size()).isEqualTo(2);
        server.verify();
    }

    @Test
    @DisplayName("Root categories come back keyed by id")
    void fetchRootCategories() throws Exception {
        server.expect(requestTo(startsWith("https://api.keepa.com/category")))
                .andExpect(queryParam("category", "0"))
                .andRespond(withSuccess("{\"categories\":{\"11052681\":{\"catId\":11052681,\"name\":\"Home & Kitchen\"}}}",
                        MediaType.APPLICATION_JSON));

        JsonNode roots = client.fetchRootCategories();

        assertThat(roots.path("11052681").path("name").asText()).isEqualTo("Home & Kitchen");
    }

    @Test
    @DisplayName("Category and deal browsing count against the cycle call budget")
    void browsingCountsAgainstBudget() throws Exception {
        server.expect(requestTo(startsWith("https://api.keepa.com/category")))
                .andRespond(withSuccess("{\"categories\":{}}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith("https://api.keepa.com/deal")))
                .andRespond(withSuccess("{\"deals\":{\"dr\":[]}}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith("https://api.keepa.com/deal")))
                .andRespond(withSuccess("{\"deals\":{\"dr\":[]}}", MediaType.APPLICATION_JSON));

        client.fetchRootCategories();
        client.fetchDeals(List.of(1L), 0);
        client.fetchDeals(List.of(1L), 1);

        assertThat(quota.getCallsThisCycle()).isEqualTo(3);
        assertThatThrownBy(() -> client.fetchProduct("B0TEST0001"))
                .isInstanceOf(UpstreamQuotaExceededException.class);
        assertThat(quota.isExhausted()).isTrue();
        server.verify();

        quota.startCycle();
        assertThat(quota.isExhausted()).isFalse();
        assertThat(quota.getCallsThisCycle()).isZero();
    }

    @Test
    @DisplayName("Deal browsing takes a rate permit")
    void browsingTakesRatePermit() throws Exception {
        IngestionProperties slow = new IngestionProperties();
        slow.setRequestsPerSecond(0.001);
        slow.setPermitTimeout(Duration.ZERO);
        KeepaClient throttled = clientWith(new KeepaQuota(slow));

        server.expect(requestTo(startsWith("https://api.keepa.com/deal")))
                .andRespond(withSuccess("{\"deals\":{\"dr\":[]}}", MediaType.APPLICATION_JSON));

        throttled.fetchDeals(List.of(1L), 0);

        assertThatThrownBy(() -> throttled.fetchDeals(List.of(1L), 1))
                .isInstanceOf(UpstreamQuotaExceededException.class);
        server.verify();
    }
}
