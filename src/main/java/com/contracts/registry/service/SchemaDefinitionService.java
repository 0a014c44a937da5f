package com.contracts.registry.service;

import java.util.List;

import javax.sql.DataSource;

import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies and inspects the contracts table definition.
 *
 * Flyway runs the definition once at startup. The same script can be
 * re-applied at any time: every statement in it is guarded with IF NOT EXISTS,
 * so repeated runs neither fail nor duplicate the table, its constraints or
 * its indexes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaDefinitionService {

    static final String CONTRACTS_DEFINITION = "db/migration/V2__create_contracts_table.sql";

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Runs the contracts table definition in one transaction.
     *
     * Requires the clients table to exist.
     */
    @Transactional
    public void applyContractsDefinition() {
        log.info("Applying contracts table definition: {}", CONTRACTS_DEFINITION);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(CONTRACTS_DEFINITION));
        populator.setSqlScriptEncoding("UTF-8");
        populator.setContinueOnError(false);
        populator.execute(dataSource);

        log.info("Contracts table definition applied");
    }

    @Transactional(readOnly = true)
    public boolean contractsTableExists() {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM information_schema.tables "
                + "WHERE table_schema = current_schema() AND table_name = 'contracts')",
            Boolean.class);
        return Boolean.TRUE.equals(exists);
    }

    /**
     * Names of all indexes on the contracts table, including the ones
     * backing the primary key and the unique number.
     *
     * @return index names, sorted
     */
    @Transactional(readOnly = true)
    public List<String> contractsIndexNames() {
        return jdbcTemplate.queryForList(
            "SELECT indexname FROM pg_indexes "
                + "WHERE schemaname = current_schema() AND tablename = 'contracts' ORDER BY indexname",
            String.class);
    }

    /**
     * Names of the primary key, unique, foreign key and check constraints
     * on the contracts table.
     *
     * @return constraint names, sorted
     */
    @Transactional(readOnly = true)
    public List<String> contractsConstraintNames() {
        return jdbcTemplate.queryForList(
            "SELECT conname FROM pg_constraint "
                + "WHERE conrelid = 'contracts'::regclass ORDER BY conname",
            String.class);
    }
}
