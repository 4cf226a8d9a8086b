package com.errorengine.config;

import com.errorengine.store.InMemoryMonitorStore;
import com.errorengine.store.JdbcMonitorStore;
import com.errorengine.store.MonitorStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the state store from {@code errorengine.store.type}: {@code jdbc} (default) or
 * {@code memory}.
 */
@Slf4j
@Configuration
public class StoreConfiguration {

    @Configuration
    @ConditionalOnProperty(prefix = "errorengine.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
    static class JdbcStore {

        @Bean(destroyMethod = "close")
        HikariDataSource stateDataSource(ErrorEngineProperties properties) {
            ErrorEngineProperties.Store store = properties.getStore();
            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(store.getUrl());
            config.setUsername(store.getUsername());
            config.setPassword(store.getPassword());
            config.setMaximumPoolSize(store.getMaxPoolSize());
            config.setPoolName("errorengine-state");
            log.info("State store: type=jdbc, url={}", store.getUrl());
            return new HikariDataSource(config);
        }

        @Bean
        MonitorStore monitorStore(HikariDataSource stateDataSource, ObjectMapper objectMapper,
                                  ErrorEngineProperties properties) {
            JdbcMonitorStore store = new JdbcMonitorStore(stateDataSource, objectMapper);
            if (properties.getStore().isInitializeSchema()) {
                store.initializeSchema();
            }
            return store;
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "errorengine.store", name = "type", havingValue = "memory")
    static class MemoryStore {

        @Bean
        MonitorStore monitorStore() {
            log.warn("State store: type=memory, nothing survives a restart");
            return new InMemoryMonitorStore();
        }
    }
}
