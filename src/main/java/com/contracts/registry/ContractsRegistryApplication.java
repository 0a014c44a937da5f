package com.contracts.registry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the contracts registry.
 *
 * Owns the {@code contracts} table definition (applied by Flyway at startup)
 * and the data-access layer built on it:
 * - Contract persistence with storage-engine constraint enforcement
 * - Translation of constraint failures into unique/check/foreign-key/not-null violations
 * - Filtered, sorted and paged contract lookups backed by the table's indexes
 *
 * No domain endpoints are exposed; the web stack only serves actuator.
 */
@SpringBootApplication
@EnableTransactionManagement
@ConfigurationPropertiesScan
public class ContractsRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContractsRegistryApplication.class, args);
    }
}
