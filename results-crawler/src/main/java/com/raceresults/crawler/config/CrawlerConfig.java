package com.raceresults.crawler.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class CrawlerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Used only by the Gemini adapter; timeouts bound the extraction call. */
    @Bean
    public RestTemplate extractionRestTemplate(RestTemplateBuilder builder, CrawlerProperties properties) {
        CrawlerProperties.Extraction extraction = properties.getExtraction();
        return builder
                .setConnectTimeout(Duration.ofSeconds(extraction.getConnectTimeoutSeconds()))
                .setReadTimeout(Duration.ofSeconds(extraction.getReadTimeoutSeconds()))
                .build();
    }
}
