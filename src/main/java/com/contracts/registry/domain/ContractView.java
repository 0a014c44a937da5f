package com.contracts.registry.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Read model of a contract joined with its client's display name
 * ("last first middle", trimmed). The name is null when the client row
 * cannot be read.
 */
public record ContractView(
    Long id,
    String number,
    Long clientId,
    String clientName,
    BigDecimal principal,
    ContractStatus status,
    LocalDate startDate,
    LocalDate endDate,
    LocalDateTime createdAt
) {

    /**
     * Client label for display: the name when known, otherwise the id.
     *
     * @return display label
     */
    public String clientLabel() {
        return clientName != null && !clientName.isBlank() ? clientName : String.valueOf(clientId);
    }
}
