package com.demo.altcredit.config;

import com.demo.altcredit.service.risk.ScoringBackendClient;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, CollectionProperties props) {
        var backend = props.getBackend();
        return builder
                .requestFactory(HttpComponentsClientHttpRequestFactory.class)
                .setConnectTimeout(backend.getConnectTimeout())
                .setReadTimeout(backend.getReadTimeout())
                .build();
    }

    @Bean
    public ScoringBackendClient scoringBackendClient(RestTemplate restTemplate, CollectionProperties props) {
        return new ScoringBackendClient(restTemplate, props.getBackend().getBaseUrl());
    }
}
