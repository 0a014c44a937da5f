package com.contracts.registry.domain;

/**
 * Lifecycle status of a contract.
 *
 * Persisted as the exact strings {@code Draft}, {@code Active} and {@code Closed};
 * the {@code contracts_status_check} constraint rejects anything else.
 * No transition rules are attached: any status may follow any other.
 */
public enum ContractStatus {

    DRAFT("Draft"),
    ACTIVE("Active"),
    CLOSED("Closed");

    private final String value;

    ContractStatus(String value) {
        this.value = value;
    }

    /**
     * Column value stored in {@code contracts.status}.
     *
     * @return the persisted representation
     */
    public String getValue() {
        return value;
    }

    /**
     * Parses a persisted status value. Matching is case-sensitive, as in the database.
     *
     * @param value the column value
     * @return the matching status
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static ContractStatus fromValue(String value) {
        for (ContractStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown contract status: " + value);
    }
}
