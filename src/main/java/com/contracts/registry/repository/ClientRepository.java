package com.contracts.registry.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.contracts.registry.domain.Client;

/**
 * Repository for Client entity.
 *
 * Used to resolve the client a contract references. Deleting a client that
 * still has contracts is rejected by contracts_client_id_fkey (ON DELETE RESTRICT).
 */
@Repository
public interface ClientRepository extends JpaRepository<Client, Long> {
}
