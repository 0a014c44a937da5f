package com.contracts.registry.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Writable fields of a contract, used for both insert and full update.
 *
 * Values are passed to the database as given; a null status on insert
 * falls back to {@link ContractStatus#ACTIVE}.
 */
public record ContractDraft(
    String number,
    Long clientId,
    BigDecimal principal,
    ContractStatus status,
    LocalDate startDate,
    LocalDate endDate
) {

    public ContractDraft withStatus(ContractStatus newStatus) {
        return new ContractDraft(number, clientId, principal, newStatus, startDate, endDate);
    }

    public ContractDraft withClientId(Long newClientId) {
        return new ContractDraft(number, newClientId, principal, status, startDate, endDate);
    }
}
