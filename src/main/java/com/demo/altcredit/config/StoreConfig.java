package com.demo.altcredit.config;

import com.demo.altcredit.repository.InMemoryKeyValueStore;
import com.demo.altcredit.repository.JdbcKeyValueStore;
import com.demo.altcredit.repository.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/** {@code altcredit.store.type=jdbc} (default) persists to SQL Server; {@code memory} keeps state per process. */
@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "altcredit.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
    public KeyValueStore jdbcKeyValueStore(JdbcTemplate jdbcTemplate, Clock clock) {
        return new JdbcKeyValueStore(jdbcTemplate, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "altcredit.store", name = "type", havingValue = "memory")
    public KeyValueStore inMemoryKeyValueStore() {
        log.warn("Using in-memory key-value store; consent and results are lost on restart");
        return new InMemoryKeyValueStore();
    }
}
