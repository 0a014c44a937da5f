package com.contracts.registry.exception;

/**
 * Kinds of write rejection reported by PostgreSQL, keyed by SQLSTATE.
 *
 * Class 23 (integrity constraint violation) covers the table's constraints.
 * Two class 22 (data exception) states cover the column type limits:
 * number longer than VARCHAR(40), principal beyond NUMERIC(12,2).
 */
public enum ViolationType {

    UNIQUE("23505"),
    CHECK("23514"),
    FOREIGN_KEY("23503"),
    NOT_NULL("23502"),
    VALUE_TOO_LONG("22001"),
    NUMERIC_OUT_OF_RANGE("22003"),
    UNKNOWN(null);

    private final String sqlState;

    ViolationType(String sqlState) {
        this.sqlState = sqlState;
    }

    /**
     * SQLSTATE this type is mapped from, null for {@link #UNKNOWN}.
     */
    public String getSqlState() {
        return sqlState;
    }

    public static ViolationType fromSqlState(String sqlState) {
        if (sqlState != null) {
            for (ViolationType type : values()) {
                if (sqlState.equals(type.sqlState)) {
                    return type;
                }
            }
        }
        return UNKNOWN;
    }
}
