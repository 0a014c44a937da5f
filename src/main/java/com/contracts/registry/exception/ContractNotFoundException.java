package com.contracts.registry.exception;

public class ContractNotFoundException extends RuntimeException {

    private final Long contractId;

    public ContractNotFoundException(Long contractId) {
        super("Contract not found: " + contractId);
        this.contractId = contractId;
    }

    public Long getContractId() {
        return contractId;
    }
}
