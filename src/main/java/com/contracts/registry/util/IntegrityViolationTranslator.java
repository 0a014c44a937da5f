package com.contracts.registry.util;

import java.sql.SQLException;

import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import com.contracts.registry.exception.IntegrityViolationException;
import com.contracts.registry.exception.ViolationType;

/**
 * Translates Spring's {@link DataIntegrityViolationException} into an
 * {@link IntegrityViolationException} that says which rule was broken.
 *
 * The cause chain is walked down to the first {@link SQLException} carrying a
 * SQLSTATE. For PostgreSQL the server error message also names the constraint:
 * <pre>
 * 23505 unique      contracts_number_key
 * 23514 check       contracts_principal_check, contracts_status_check, contracts_check
 * 23503 foreign key contracts_client_id_fkey
 * 23502 not null    (no constraint name; the column is reported instead)
 * 22001 too long    number beyond VARCHAR(40)
 * 22003 overflow    principal beyond NUMERIC(12,2)
 * </pre>
 * Messages name the constraint, else the column, else the SQLSTATE.
 */
@Component
public class IntegrityViolationTranslator {

    public IntegrityViolationException translate(DataIntegrityViolationException ex) {
        SQLException sqlException = findSqlException(ex);

        if (sqlException == null) {
            return new IntegrityViolationException(ViolationType.UNKNOWN, null, describe(ViolationType.UNKNOWN, null, null, null), ex);
        }

        String sqlState = sqlException.getSQLState();
        ViolationType type = ViolationType.fromSqlState(sqlState);
        String constraintName = null;
        String columnName = null;

        if (sqlException instanceof PSQLException psqlException) {
            ServerErrorMessage serverError = psqlException.getServerErrorMessage();
            if (serverError != null) {
                constraintName = serverError.getConstraint();
                columnName = serverError.getColumn();
            }
        }

        return new IntegrityViolationException(type, constraintName, describe(type, sqlState, constraintName, columnName), ex);
    }

    private SQLException findSqlException(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SQLException sqlException && sqlException.getSQLState() != null) {
                return sqlException;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    private String describe(ViolationType type, String sqlState, String constraintName, String columnName) {
        String base = switch (type) {
            case UNIQUE -> "Duplicate value for unique field";
            case CHECK -> "Check constraint violated";
            case FOREIGN_KEY -> "Referenced entity does not exist or is still referenced";
            case NOT_NULL -> "Required column is missing";
            case VALUE_TOO_LONG -> "Value too long for column";
            case NUMERIC_OUT_OF_RANGE -> "Numeric value out of range for column";
            case UNKNOWN -> "Constraint violation";
        };

        if (constraintName != null) {
            return base + " (" + constraintName + ")";
        }
        if (columnName != null) {
            return base + " (column " + columnName + ")";
        }
        if (sqlState != null) {
            return base + " (SQLSTATE " + sqlState + ")";
        }
        return base;
    }
}
