package com.contracts.registry.exception;

/**
 * Raised when a write is rejected by a database constraint.
 *
 * The write is not applied: the surrounding transaction is rolled back.
 * Nothing at this layer retries.
 *
 * @see com.contracts.registry.util.IntegrityViolationTranslator
 */
public class IntegrityViolationException extends RuntimeException {

    private final ViolationType type;
    private final String constraintName;

    public IntegrityViolationException(ViolationType type, String constraintName, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.constraintName = constraintName;
    }

    public ViolationType getType() {
        return type;
    }

    /**
     * Name of the violated constraint, e.g. {@code contracts_number_key}.
     * Null for not-null violations and when the driver does not report it.
     *
     * @return constraint name or null
     */
    public String getConstraintName() {
        return constraintName;
    }
}
