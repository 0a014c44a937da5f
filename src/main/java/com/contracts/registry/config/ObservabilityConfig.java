package com.contracts.registry.config;

import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Metrics configuration.
 *
 * Adds the application/environment tags to every meter and enables
 * {@code @Timed} on service methods. Everything is scraped from
 * /actuator/prometheus.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ObservabilityConfig {

    private final Environment environment;

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        String appName = environment.getProperty("spring.application.name", "contracts-registry");
        String env = environment.getProperty("ENVIRONMENT", "dev");

        log.info("Configuring metrics with tags: application={}, environment={}", appName, env);

        return registry -> registry.config()
            .commonTags(
                "application", appName,
                "environment", env
            )
            .meterFilter(MeterFilter.maximumAllowableMetrics(10000));
    }

    /**
     * Enables {@code @Timed} on {@link com.contracts.registry.service.ContractService}.
     *
     * @param registry MeterRegistry for metric recording
     * @return TimedAspect for AOP-based timing
     */
    @Bean
    public TimedAspect timedAspect(MeterRegistry registry) {
        return new TimedAspect(registry);
    }
}
