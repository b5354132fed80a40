package io.crimeradar.pipeline.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class ClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(ClientConfig.class);

    @Bean
    public RestTemplate geocodingRestTemplate(RestTemplateBuilder builder, PipelineConfig pipelineConfig) {
        GeocodingConfig geocoding = pipelineConfig.geocoding();
        logger.info("Creating geocoding client for {} (timeout {})", geocoding.baseUrl(), geocoding.timeout());

        return builder
                .rootUri(geocoding.baseUrl())
                .setConnectTimeout(geocoding.timeout())
                .setReadTimeout(geocoding.timeout())
                .defaultHeader("User-Agent", geocoding.userAgent())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
