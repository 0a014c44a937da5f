package com.contracts.registry.domain;

import java.time.LocalDate;

import lombok.Builder;

/**
 * Optional criteria for contract lookups. Null fields are ignored;
 * the rest are combined with AND.
 *
 * @param numberContains case-insensitive substring of the contract number
 * @param clientId exact client id (served by idx_contracts_client)
 * @param status exact status (served by idx_contracts_status)
 * @param startFrom start_date lower bound, inclusive
 * @param startTo start_date upper bound, inclusive
 * @param endFrom end_date lower bound, inclusive (served by idx_contracts_end_date)
 * @param endTo end_date upper bound, inclusive
 */
@Builder
public record ContractFilter(
    String numberContains,
    Long clientId,
    ContractStatus status,
    LocalDate startFrom,
    LocalDate startTo,
    LocalDate endFrom,
    LocalDate endTo
) {

    public static ContractFilter none() {
        return ContractFilter.builder().build();
    }
}
