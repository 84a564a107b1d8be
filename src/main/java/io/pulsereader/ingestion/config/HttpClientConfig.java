package io.pulsereader.ingestion.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    /**
     * RestTemplate for the enrichment provider. The read timeout is the
     * provider timeout; connection setup gets a short fixed window.
     */
    @Bean
    public RestTemplate enrichmentRestTemplate(RestTemplateBuilder builder, IngestionConfig config) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(config.enrichment().timeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
