package com.contracts.registry.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;
import org.springframework.dao.DataIntegrityViolationException;

import com.contracts.registry.exception.IntegrityViolationException;
import com.contracts.registry.exception.ViolationType;

class IntegrityViolationTranslatorTest {

    private final IntegrityViolationTranslator translator = new IntegrityViolationTranslator();

    @ParameterizedTest
    @CsvSource({
        "23505, UNIQUE",
        "23514, CHECK",
        "23503, FOREIGN_KEY",
        "23502, NOT_NULL",
        "22001, VALUE_TOO_LONG",
        "22003, NUMERIC_OUT_OF_RANGE",
        "23P01, UNKNOWN",
        "40001, UNKNOWN"
    })
    void translate_ShouldMapSqlState(String sqlState, ViolationType expected) {
        DataIntegrityViolationException ex = new DataIntegrityViolationException(
            "could not execute statement", new SQLException("rejected", sqlState));

        IntegrityViolationException violation = translator.translate(ex);

        assertThat(violation.getType()).isEqualTo(expected);
        assertThat(violation.getConstraintName()).isNull();
        assertThat(violation.getMessage()).contains("SQLSTATE " + sqlState);
        assertThat(violation.getCause()).isSameAs(ex);
    }

    @Test
    void fromSqlState_ShouldRoundTripEveryKnownType() {
        for (ViolationType type : ViolationType.values()) {
            if (type != ViolationType.UNKNOWN) {
                assertThat(ViolationType.fromSqlState(type.getSqlState())).isEqualTo(type);
            }
        }
        assertThat(ViolationType.UNKNOWN.getSqlState()).isNull();
        assertThat(ViolationType.fromSqlState(null)).isEqualTo(ViolationType.UNKNOWN);
    }

    @Test
    void translate_ValueTooLong_ShouldNameSqlState() {
        PSQLException psql = new PSQLException(new ServerErrorMessage(
            "SERROR\0C22001\0Mvalue too long for type character varying(40)\0"));

        IntegrityViolationException violation = translator.translate(
            new DataIntegrityViolationException("insert failed", psql));

        assertThat(violation.getType()).isEqualTo(ViolationType.VALUE_TOO_LONG);
        assertThat(violation.getMessage()).isEqualTo("Value too long for column (SQLSTATE 22001)");
    }

    @Test
    void translate_ShouldReadConstraintFromServerMessage() {
        PSQLException psql = new PSQLException(new ServerErrorMessage(
            "SERROR\0C23505\0Mduplicate key value violates unique constraint\0tcontracts\0ncontracts_number_key\0"));
        DataIntegrityViolationException ex = new DataIntegrityViolationException("insert failed",
            new RuntimeException("wrapper", psql));

        IntegrityViolationException violation = translator.translate(ex);

        assertThat(violation.getType()).isEqualTo(ViolationType.UNIQUE);
        assertThat(violation.getConstraintName()).isEqualTo("contracts_number_key");
        assertThat(violation.getMessage()).contains("contracts_number_key");
    }

    @Test
    void translate_NotNullViolation_ShouldReportColumn() {
        PSQLException psql = new PSQLException(new ServerErrorMessage(
            "SERROR\0C23502\0Mnull value in column \"number\"\0tcontracts\0cnumber\0"));

        IntegrityViolationException violation = translator.translate(
            new DataIntegrityViolationException("insert failed", psql));

        assertThat(violation.getType()).isEqualTo(ViolationType.NOT_NULL);
        assertThat(violation.getConstraintName()).isNull();
        assertThat(violation.getMessage()).contains("column number");
    }

    @Test
    void translate_ShouldSkipSqlExceptionsWithoutState() {
        SQLException inner = new SQLException("check failed", "23514");
        SQLException outer = new SQLException("batch failed", (String) null, inner);

        IntegrityViolationException violation = translator.translate(
            new DataIntegrityViolationException("update failed", outer));

        assertThat(violation.getType()).isEqualTo(ViolationType.CHECK);
    }

    @Test
    void translate_WithoutSqlException_ShouldBeUnknown() {
        IntegrityViolationException violation = translator.translate(
            new DataIntegrityViolationException("no driver details"));

        assertThat(violation.getType()).isEqualTo(ViolationType.UNKNOWN);
        assertThat(violation.getMessage()).isEqualTo("Constraint violation");
    }
}
