package com.demo.altcredit;

import com.demo.altcredit.config.CollectionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CollectionProperties.class)
public class AltCreditApplication {

    public static void main(String[] args) {
        SpringApplication.run(AltCreditApplication.class, args);
    }
}
