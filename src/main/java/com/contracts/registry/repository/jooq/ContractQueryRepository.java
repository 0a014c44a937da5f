package com.contracts.registry.repository.jooq;

import static org.jooq.impl.DSL.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SortField;
import org.jooq.Table;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import com.contracts.registry.domain.ContractFilter;
import com.contracts.registry.domain.ContractSort;
import com.contracts.registry.domain.ContractStatus;
import com.contracts.registry.domain.ContractView;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * jOOQ repository for contract lookups.
 *
 * Builds the WHERE clause dynamically from a {@link ContractFilter} and joins
 * the client's display name in the same statement, so a page of contracts
 * costs one query plus one count.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ContractQueryRepository {

    private final DSLContext dsl;

    // Table references (no jOOQ code generation in this project)
    private static final Table<?> CONTRACTS = table("contracts");
    private static final Table<?> CLIENTS = table("clients");

    private static final Field<Long> CONTRACTS_ID = field("contracts.id", Long.class);
    private static final Field<String> CONTRACTS_NUMBER = field("contracts.number", String.class);
    private static final Field<Long> CONTRACTS_CLIENT_ID = field("contracts.client_id", Long.class);
    private static final Field<BigDecimal> CONTRACTS_PRINCIPAL = field("contracts.principal", BigDecimal.class);
    private static final Field<String> CONTRACTS_STATUS = field("contracts.status", String.class);
    private static final Field<LocalDate> CONTRACTS_START_DATE = field("contracts.start_date", LocalDate.class);
    private static final Field<LocalDate> CONTRACTS_END_DATE = field("contracts.end_date", LocalDate.class);
    private static final Field<LocalDateTime> CONTRACTS_CREATED_AT = field("contracts.created_at", LocalDateTime.class);

    private static final Field<Long> CLIENTS_ID = field("clients.id", Long.class);
    private static final Field<String> CLIENTS_LAST_NAME = field("clients.last_name", String.class);
    private static final Field<String> CLIENTS_FIRST_NAME = field("clients.first_name", String.class);
    private static final Field<String> CLIENTS_MIDDLE_NAME = field("clients.middle_name", String.class);

    // "last first middle", trimmed
    private static final Field<String> CLIENT_NAME = trim(concat(
        coalesce(CLIENTS_LAST_NAME, ""), inline(" "),
        coalesce(CLIENTS_FIRST_NAME, ""), inline(" "),
        coalesce(CLIENTS_MIDDLE_NAME, "")
    )).as("client_name");

    /**
     * Counts contracts matching the filter.
     *
     * @param filter lookup criteria
     * @return number of matching contracts
     */
    public long count(ContractFilter filter) {
        Long total = dsl
            .selectCount()
            .from(CONTRACTS)
            .where(conditions(filter))
            .fetchOne(0, Long.class);

        return total == null ? 0L : total.longValue();
    }

    /**
     * Fetches one page of contracts matching the filter.
     *
     * @param filter lookup criteria
     * @param pageable page window and sort; sort properties outside
     *        {@link ContractSort.SortKey} fall back to id, ties are broken by id
     * @return contracts with client names
     */
    public List<ContractView> findPage(ContractFilter filter, Pageable pageable) {
        log.debug("Contract lookup: filter={}, pageable={}", filter, pageable);

        return dsl
            .select(
                CONTRACTS_ID,
                CONTRACTS_NUMBER,
                CONTRACTS_CLIENT_ID,
                CLIENT_NAME,
                CONTRACTS_PRINCIPAL,
                CONTRACTS_STATUS,
                CONTRACTS_START_DATE,
                CONTRACTS_END_DATE,
                CONTRACTS_CREATED_AT
            )
            .from(CONTRACTS)
            .leftJoin(CLIENTS).on(CONTRACTS_CLIENT_ID.eq(CLIENTS_ID))
            .where(conditions(filter))
            .orderBy(orderBy(pageable.getSort()))
            .limit(pageable.getPageSize())
            .offset(pageable.getOffset())
            .fetch()
            .map(this::toView);
    }

    /**
     * Fetches a single contract with its client name.
     *
     * @param contractId the contract ID
     * @return Optional containing the contract if found
     */
    public Optional<ContractView> findViewById(Long contractId) {
        return dsl
            .select(
                CONTRACTS_ID,
                CONTRACTS_NUMBER,
                CONTRACTS_CLIENT_ID,
                CLIENT_NAME,
                CONTRACTS_PRINCIPAL,
                CONTRACTS_STATUS,
                CONTRACTS_START_DATE,
                CONTRACTS_END_DATE,
                CONTRACTS_CREATED_AT
            )
            .from(CONTRACTS)
            .leftJoin(CLIENTS).on(CONTRACTS_CLIENT_ID.eq(CLIENTS_ID))
            .where(CONTRACTS_ID.eq(contractId))
            .fetchOptional()
            .map(this::toView);
    }

    private List<Condition> conditions(ContractFilter filter) {
        List<Condition> conditions = new ArrayList<>();
        if (filter == null) {
            return conditions;
        }

        if (filter.numberContains() != null && !filter.numberContains().isBlank()) {
            conditions.add(CONTRACTS_NUMBER.containsIgnoreCase(filter.numberContains()));
        }
        if (filter.clientId() != null) {
            conditions.add(CONTRACTS_CLIENT_ID.eq(filter.clientId()));
        }
        if (filter.status() != null) {
            conditions.add(CONTRACTS_STATUS.eq(filter.status().getValue()));
        }
        if (filter.startFrom() != null) {
            conditions.add(CONTRACTS_START_DATE.ge(filter.startFrom()));
        }
        if (filter.startTo() != null) {
            conditions.add(CONTRACTS_START_DATE.le(filter.startTo()));
        }
        if (filter.endFrom() != null) {
            conditions.add(CONTRACTS_END_DATE.ge(filter.endFrom()));
        }
        if (filter.endTo() != null) {
            conditions.add(CONTRACTS_END_DATE.le(filter.endTo()));
        }
        return conditions;
    }

    private List<SortField<?>> orderBy(Sort sort) {
        Sort effective = sort == null || sort.isUnsorted() ? ContractSort.DEFAULT : sort;

        List<SortField<?>> fields = new ArrayList<>();
        boolean idSorted = false;
        Sort.Direction tieBreak = Sort.Direction.DESC;

        for (Sort.Order order : effective) {
            ContractSort.SortKey key = ContractSort.SortKey.fromKey(order.getProperty());
            Field<?> field = switch (key) {
                case NUMBER -> CONTRACTS_NUMBER;
                case END_DATE -> CONTRACTS_END_DATE;
                case ID -> CONTRACTS_ID;
            };
            fields.add(order.isAscending() ? field.asc() : field.desc());

            if (fields.size() == 1) {
                tieBreak = order.getDirection();
            }
            idSorted |= key == ContractSort.SortKey.ID;
        }

        if (!idSorted) {
            fields.add(tieBreak.isAscending() ? CONTRACTS_ID.asc() : CONTRACTS_ID.desc());
        }
        return fields;
    }

    private ContractView toView(Record r) {
        return new ContractView(
            r.get(CONTRACTS_ID),
            r.get(CONTRACTS_NUMBER),
            r.get(CONTRACTS_CLIENT_ID),
            r.get(CLIENT_NAME),
            r.get(CONTRACTS_PRINCIPAL),
            ContractStatus.fromValue(r.get(CONTRACTS_STATUS)),
            r.get(CONTRACTS_START_DATE),
            r.get(CONTRACTS_END_DATE),
            r.get(CONTRACTS_CREATED_AT)
        );
    }
}
