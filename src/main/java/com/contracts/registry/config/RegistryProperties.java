package com.contracts.registry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * Typed settings under {@code contracts.registry} in application.yml.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "contracts.registry")
public class RegistryProperties {

    /**
     * Page size used when a lookup does not ask for one.
     */
    private int defaultPageSize = 10;

    /**
     * Upper bound for requested page sizes.
     */
    private int maxPageSize = 100;

    /**
     * jOOQ statements slower than this are logged at WARN.
     */
    private long slowQueryThresholdMs = 50;

    private Pool pool = new Pool();

    @Getter
    @Setter
    public static class Pool {

        private int maximumPoolSize = 10;

        private int minimumIdle = 2;

        private long connectionTimeoutMs = 5000;

        private long idleTimeoutMs = 600000;

        private long maxLifetimeMs = 1800000;

        private long leakDetectionThresholdMs = 60000;
    }
}
