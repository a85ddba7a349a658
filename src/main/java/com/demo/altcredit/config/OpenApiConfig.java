package com.demo.altcredit.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI altCreditOpenAPI() {
        return new OpenAPI().info(new Info()
                .title("Alternative Credit Data API")
                .description("Sessions, consent, data collection and risk assessment")
                .version("v1"));
    }
}
