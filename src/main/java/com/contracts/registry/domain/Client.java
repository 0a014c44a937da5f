package com.contracts.registry.domain;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Client entity: the party a contract is issued to.
 *
 * The clients table is an external collaborator of the contracts table.
 * It is mapped here only so contracts can reference it; contracts never
 * cascade to, or own, their client.
 *
 * Database rules (see V1__create_clients_table.sql):
 * - passport series: exactly 4 digits
 * - passport number: exactly 6 digits
 * - (series, number) pair is unique
 */
@Entity
@Table(name = "clients")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class Client {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, name = "last_name")
    private String lastName;

    @Column(nullable = false, name = "first_name")
    private String firstName;

    @Column(nullable = false, name = "middle_name")
    private String middleName;

    @Column(nullable = false, name = "passport_series", length = 4)
    private String passportSeries;

    @Column(nullable = false, name = "passport_number", length = 6)
    private String passportNumber;

    @Column(nullable = false, name = "birth_date")
    private LocalDate birthDate;

    @Column(nullable = false)
    private String phone;

    @Column(nullable = false)
    private String email;

    @Column(nullable = false)
    private String address;
}
