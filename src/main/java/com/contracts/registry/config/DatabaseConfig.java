package com.contracts.registry.config;

import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Database configuration.
 *
 * Builds the HikariCP pool from {@code spring.datasource.*} (overridable with
 * DATABASE_URL, DATABASE_USER, DATABASE_PASSWORD) and the pool sizing under
 * {@code contracts.registry.pool}.
 *
 * Auto-commit is disabled: every write runs inside a Spring-managed
 * transaction, so a constraint failure rolls back the whole statement.
 */
@Slf4j
@Configuration
public class DatabaseConfig {

    @Bean
    @Primary
    public HikariDataSource dataSource(
            DataSourceProperties properties,
            RegistryProperties registryProperties,
            MeterRegistry meterRegistry) {

        RegistryProperties.Pool pool = registryProperties.getPool();

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(properties.determineUrl());
        config.setUsername(properties.determineUsername());
        config.setPassword(properties.determinePassword());
        config.setDriverClassName(properties.determineDriverClassName());

        config.setMaximumPoolSize(pool.getMaximumPoolSize());
        config.setMinimumIdle(pool.getMinimumIdle());
        config.setConnectionTimeout(pool.getConnectionTimeoutMs());
        config.setIdleTimeout(pool.getIdleTimeoutMs());
        config.setMaxLifetime(pool.getMaxLifetimeMs());
        config.setLeakDetectionThreshold(pool.getLeakDetectionThresholdMs());

        config.setAutoCommit(false);
        config.setPoolName("ContractsHikariPool");

        config.addDataSourceProperty("cachePrepStmts", "true");
        config.addDataSourceProperty("prepStmtCacheSize", "250");

        config.setMetricRegistry(meterRegistry);

        HikariDataSource dataSource = new HikariDataSource(config);

        log.info("HikariCP DataSource configured: pool={}, max={}, minIdle={}",
                config.getPoolName(),
                config.getMaximumPoolSize(),
                config.getMinimumIdle());

        return dataSource;
    }
}
