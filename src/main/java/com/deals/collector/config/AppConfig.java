package com.deals.collector.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class AppConfig {

    /**
     * Client for Keepa calls, bounded by the configured connect/read timeouts.
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, KeepaProperties keepaProperties) {
        return builder
                .setConnectTimeout(keepaProperties.getConnectTimeout())
                .setReadTimeout(keepaProperties.getReadTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
