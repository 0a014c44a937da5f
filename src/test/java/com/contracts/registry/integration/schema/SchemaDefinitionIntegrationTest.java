package com.contracts.registry.integration.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import com.contracts.registry.domain.Client;
import com.contracts.registry.domain.ContractDraft;
import com.contracts.registry.domain.ContractStatus;
import com.contracts.registry.integration.BaseIntegrationTest;
import com.contracts.registry.integration.TestClients;
import com.contracts.registry.repository.ClientRepository;
import com.contracts.registry.repository.ContractRepository;
import com.contracts.registry.service.ContractService;
import com.contracts.registry.service.SchemaDefinitionService;

/**
 * Integration tests for the contracts table definition.
 *
 * Flyway has already applied the definition when the context starts,
 * so every explicit apply here is a repeat.
 */
class SchemaDefinitionIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private SchemaDefinitionService schemaDefinitionService;

    @Autowired
    private ContractService contractService;

    @Autowired
    private ContractRepository contractRepository;

    @Autowired
    private ClientRepository clientRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        contractRepository.deleteAllInBatch();
        clientRepository.deleteAllInBatch();
    }

    @Test
    void applyContractsDefinition_Twice_ShouldSucceedBothTimes() {
        assertThatCode(() -> schemaDefinitionService.applyContractsDefinition()).doesNotThrowAnyException();
        assertThatCode(() -> schemaDefinitionService.applyContractsDefinition()).doesNotThrowAnyException();

        assertThat(schemaDefinitionService.contractsTableExists()).isTrue();
    }

    @Test
    void applyContractsDefinition_Repeated_ShouldNotDuplicateIndexes() {
        schemaDefinitionService.applyContractsDefinition();
        schemaDefinitionService.applyContractsDefinition();

        assertThat(schemaDefinitionService.contractsIndexNames()).containsExactly(
            "contracts_number_key",
            "contracts_pkey",
            "idx_contracts_client",
            "idx_contracts_end_date",
            "idx_contracts_status");
    }

    @Test
    void applyContractsDefinition_Repeated_ShouldNotDuplicateConstraints() {
        schemaDefinitionService.applyContractsDefinition();

        assertThat(schemaDefinitionService.contractsConstraintNames())
            .hasSize(6)
            .contains(
                "contracts_pkey",
                "contracts_number_key",
                "contracts_client_id_fkey",
                "contracts_principal_check",
                "contracts_status_check");
    }

    @Test
    void applyContractsDefinition_WithExistingRows_ShouldKeepData() {
        // Given
        Client client = clientRepository.save(TestClients.client());
        contractService.createContract(new ContractDraft(
            "C-KEEP", client.getId(), new BigDecimal("250.50"), ContractStatus.DRAFT,
            LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 30)));

        // When
        schemaDefinitionService.applyContractsDefinition();

        // Then
        assertThat(contractRepository.findByNumber("C-KEEP")).isPresent();
        assertThat(contractRepository.count()).isEqualTo(1);
    }

    @Test
    void contractsTable_ShouldHaveDeclaredColumnTypes() {
        String numberType = jdbcTemplate.queryForObject(
            "SELECT data_type || '(' || character_maximum_length || ')' FROM information_schema.columns "
                + "WHERE table_name = 'contracts' AND column_name = 'number'",
            String.class);
        String statusType = jdbcTemplate.queryForObject(
            "SELECT data_type || '(' || character_maximum_length || ')' FROM information_schema.columns "
                + "WHERE table_name = 'contracts' AND column_name = 'status'",
            String.class);
        String principalType = jdbcTemplate.queryForObject(
            "SELECT data_type || '(' || numeric_precision || ',' || numeric_scale || ')' FROM information_schema.columns "
                + "WHERE table_name = 'contracts' AND column_name = 'principal'",
            String.class);
        String createdAtDefault = jdbcTemplate.queryForObject(
            "SELECT column_default FROM information_schema.columns "
                + "WHERE table_name = 'contracts' AND column_name = 'created_at'",
            String.class);

        assertThat(numberType).isEqualTo("character varying(40)");
        assertThat(statusType).isEqualTo("character varying(16)");
        assertThat(principalType).isEqualTo("numeric(12,2)");
        assertThat(createdAtDefault).isEqualToIgnoringCase("now()");
    }

    @Test
    void clientForeignKey_ShouldRestrictUpdateAndDelete() {
        // 'r' = RESTRICT in pg_constraint.confupdtype / confdeltype
        String actions = jdbcTemplate.queryForObject(
            "SELECT confupdtype::text || confdeltype::text FROM pg_constraint "
                + "WHERE conname = 'contracts_client_id_fkey'",
            String.class);

        assertThat(actions).isEqualTo("rr");
    }
}
