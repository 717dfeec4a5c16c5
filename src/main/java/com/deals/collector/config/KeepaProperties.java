package com.deals.collector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the Keepa API.
 */
@Data
@ConfigurationProperties(prefix = "keepa")
public class KeepaProperties {

    private String baseUrl = "https://api.keepa.com";
    private String apiKey = "";

    /**
     * Keepa domain id, 2 = amazon.co.uk.
     */
    private int domain = 2;

    /**
     * Days of history requested per product; must cover the scoring window.
     */
    private int historyDays = 120;

    /**
     * Days used for the provider side stats block.
     */
    private int statsDays = 90;

    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(60);

    private String marketplaceUrl = "https://www.amazon.co.uk";
    private String affiliateTag = "";
}
