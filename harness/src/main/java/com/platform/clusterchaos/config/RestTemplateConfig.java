package com.platform.clusterchaos.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * REST client used to poll node metrics endpoints.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, HarnessProperties properties) {
        return builder
            .setConnectTimeout(properties.health().connectTimeout())
            .setReadTimeout(properties.health().readTimeout())
            .build();
    }
}
