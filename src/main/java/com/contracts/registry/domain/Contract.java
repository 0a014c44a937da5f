package com.contracts.registry.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.Generated;
import org.hibernate.generator.EventType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Contract entity: a financial agreement with a principal amount,
 * a validity period and a lifecycle status.
 *
 * Integrity is enforced by the database, not by this class:
 * - contracts_number_key: number is unique
 * - contracts_principal_check: principal > 0
 * - contracts_status_check: status in (Draft, Active, Closed)
 * - contracts_check: end_date >= start_date
 * - contracts_client_id_fkey: client must exist (ON UPDATE/DELETE RESTRICT)
 *
 * Nullability is checked by the database as well
 * (hibernate.check_nullability is off), so an omitted column
 * surfaces as a not-null violation from PostgreSQL.
 *
 * @see com.contracts.registry.repository.ContractRepository
 */
@Entity
@Table(name = "contracts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "client")
public class Contract {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 40)
    private String number;

    /**
     * Back-reference to the client. Lazy, never cascaded.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "client_id", nullable = false)
    private Client client;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal principal;

    @Convert(converter = ContractStatusConverter.class)
    @Column(nullable = false, length = 16)
    private ContractStatus status;

    @Column(nullable = false, name = "start_date")
    private LocalDate startDate;

    @Column(nullable = false, name = "end_date")
    private LocalDate endDate;

    /**
     * Filled by the column default (NOW()) and read back after insert.
     */
    @Generated(event = EventType.INSERT)
    @Column(nullable = false, name = "created_at", insertable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * Identifier of the referenced client, without initializing the lazy proxy.
     *
     * @return client id, or null if no client is set
     */
    public Long getClientId() {
        return client == null ? null : client.getId();
    }
}
