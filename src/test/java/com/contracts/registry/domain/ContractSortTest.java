package com.contracts.registry.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.data.domain.Sort;

import com.contracts.registry.domain.ContractSort.SortKey;

class ContractSortTest {

    @ParameterizedTest
    @CsvSource({
        "id, ID",
        "number, NUMBER",
        "end_date, END_DATE",
        "' NUMBER ', NUMBER",
        "principal, ID",
        "created_at, ID",
        "'1; DROP TABLE contracts', ID"
    })
    void fromKey_ShouldAcceptKnownKeysAndFallBackToId(String key, SortKey expected) {
        assertThat(SortKey.fromKey(key)).isEqualTo(expected);
    }

    @Test
    void of_WithMissingValues_ShouldSortByIdDescending() {
        Sort sort = ContractSort.of(null, null);

        assertThat(sort).isEqualTo(ContractSort.DEFAULT);
        assertThat(sort.getOrderFor("id")).isNotNull();
        assertThat(sort.getOrderFor("id").isDescending()).isTrue();
    }

    @Test
    void of_ShouldUseColumnNameAsProperty() {
        assertThat(ContractSort.of("END_DATE", "asc"))
            .isEqualTo(Sort.by(Sort.Direction.ASC, SortKey.END_DATE.getKey()));
        assertThat(ContractSort.of("principal", "asc"))
            .isEqualTo(Sort.by(Sort.Direction.ASC, "id"));
    }

    @Test
    void of_ShouldOnlyTreatAscAsAscending() {
        assertThat(ContractSort.of("number", "ASC").getOrderFor("number").isAscending()).isTrue();
        assertThat(ContractSort.of("number", "asc ").getOrderFor("number").isAscending()).isTrue();
        assertThat(ContractSort.of("number", "desc").getOrderFor("number").isAscending()).isFalse();
        assertThat(ContractSort.of("number", "up").getOrderFor("number").isAscending()).isFalse();
    }
}
