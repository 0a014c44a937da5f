package com.contracts.registry.config;

import javax.sql.DataSource;

import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.conf.Settings;
import org.jooq.impl.DataSourceConnectionProvider;
import org.jooq.impl.DefaultConfiguration;
import org.jooq.impl.DefaultDSLContext;
import org.jooq.impl.DefaultExecuteListenerProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.TransactionAwareDataSourceProxy;

import com.contracts.registry.util.MetricsHelper;
import com.contracts.registry.util.SlowQueryListener;

/**
 * jOOQ configuration for the contract lookup queries.
 *
 * The DSLContext runs on the same pool as JPA, through a transaction-aware
 * proxy so queries join the surrounding {@code @Transactional} scope.
 * Every statement passes through {@link SlowQueryListener}.
 */
@Configuration
public class JooqConfig {

    @Bean
    public DSLContext dslContext(
            DataSource dataSource,
            MetricsHelper metricsHelper,
            RegistryProperties registryProperties) {

        TransactionAwareDataSourceProxy proxy = new TransactionAwareDataSourceProxy(dataSource);

        DefaultConfiguration configuration = new DefaultConfiguration();
        configuration.setSQLDialect(SQLDialect.POSTGRES);
        configuration.setConnectionProvider(new DataSourceConnectionProvider(proxy));
        configuration.setSettings(new Settings().withExecuteLogging(false));
        configuration.setExecuteListenerProvider(new DefaultExecuteListenerProvider(
            new SlowQueryListener(metricsHelper, registryProperties.getSlowQueryThresholdMs())));

        return new DefaultDSLContext(configuration);
    }
}
