package com.example.sniper.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@RequiredArgsConstructor
public class RestTemplateConfig {

    private final SniperConfig config;

    @Bean
    public RestTemplate resyRestTemplate(RestTemplateBuilder builder) {
        return builder
                .rootUri(config.getApiBaseUrl())
                .setConnectTimeout(config.getConnectTimeout())
                .setReadTimeout(config.getReadTimeout())
                .build();
    }
}
