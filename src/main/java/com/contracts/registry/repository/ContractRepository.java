package com.contracts.registry.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.contracts.registry.domain.Contract;
import com.contracts.registry.domain.ContractStatus;

/**
 * Repository for Contract entity.
 *
 * Writes go through the inherited save/delete methods; the database
 * rejects anything that breaks the table's constraints. Lookups by client
 * and status are served by idx_contracts_client and idx_contracts_status.
 *
 * @see com.contracts.registry.repository.jooq.ContractQueryRepository
 */
@Repository
public interface ContractRepository extends JpaRepository<Contract, Long> {

    /**
     * Find a contract by its unique number.
     *
     * @param number the contract number
     * @return Optional containing the contract if found
     */
    Optional<Contract> findByNumber(String number);

    boolean existsByNumber(String number);

    long countByStatus(ContractStatus status);

    /**
     * Find all contracts of one client, newest first.
     *
     * @param clientId the client ID
     * @return contracts referencing the client
     */
    @Query("SELECT c FROM Contract c WHERE c.client.id = :clientId ORDER BY c.id DESC")
    List<Contract> findByClientId(@Param("clientId") Long clientId);
}
