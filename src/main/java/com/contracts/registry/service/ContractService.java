package com.contracts.registry.service;

import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.contracts.registry.config.RegistryProperties;
import com.contracts.registry.domain.Contract;
import com.contracts.registry.domain.ContractDraft;
import com.contracts.registry.domain.ContractFilter;
import com.contracts.registry.domain.ContractSort;
import com.contracts.registry.domain.ContractStatus;
import com.contracts.registry.domain.ContractView;
import com.contracts.registry.exception.ContractNotFoundException;
import com.contracts.registry.exception.IntegrityViolationException;
import com.contracts.registry.repository.ClientRepository;
import com.contracts.registry.repository.ContractRepository;
import com.contracts.registry.repository.jooq.ContractQueryRepository;
import com.contracts.registry.util.IntegrityViolationTranslator;
import com.contracts.registry.util.MetricsHelper;

import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Service for reading and writing contracts.
 *
 * Every write runs in its own transaction and is flushed before the method
 * returns, so a constraint failure is raised by the call that caused it and
 * nothing is applied. Failures surface as {@link IntegrityViolationException}
 * (unique, check, foreign key, not null); they are not retried here.
 *
 * Status changes are not validated against any transition table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContractService {

    private final ContractRepository contractRepository;
    private final ClientRepository clientRepository;
    private final ContractQueryRepository contractQueryRepository;
    private final IntegrityViolationTranslator violationTranslator;
    private final MetricsHelper metricsHelper;
    private final RegistryProperties properties;

    /**
     * Inserts a contract. A missing status defaults to Active.
     *
     * @param draft contract fields
     * @return the persisted contract, with id and createdAt populated
     * @throws IntegrityViolationException if a constraint rejects the row
     */
    @Transactional
    @Timed(value = "contracts.create", description = "Time taken to create a contract")
    public Contract createContract(ContractDraft draft) {
        log.info("Creating contract: number={}, clientId={}, principal={}, status={}",
                draft.number(), draft.clientId(), draft.principal(), draft.status());

        ContractDraft effective = draft.status() == null ? draft.withStatus(ContractStatus.ACTIVE) : draft;

        Contract contract = new Contract();
        applyDraft(contract, effective);

        Contract saved = write("create", contract);
        log.info("Contract created: id={}, number={}", saved.getId(), saved.getNumber());

        return saved;
    }

    /**
     * Replaces every writable field of a contract.
     *
     * @param contractId contract ID
     * @param draft new field values
     * @return the updated contract
     * @throws ContractNotFoundException if no contract has this id
     * @throws IntegrityViolationException if a constraint rejects the row
     */
    @Transactional
    @Timed(value = "contracts.update", description = "Time taken to update a contract")
    public Contract updateContract(Long contractId, ContractDraft draft) {
        log.info("Updating contract: id={}, number={}, clientId={}, status={}",
                contractId, draft.number(), draft.clientId(), draft.status());

        Contract contract = contractRepository.findById(contractId)
                .orElseThrow(() -> new ContractNotFoundException(contractId));

        applyDraft(contract, draft);

        return write("update", contract);
    }

    /**
     * Sets a contract's status to Closed, whatever its current status.
     *
     * @param contractId contract ID
     * @return the closed contract
     * @throws ContractNotFoundException if no contract has this id
     */
    @Transactional
    @Timed(value = "contracts.close", description = "Time taken to close a contract")
    public Contract closeContract(Long contractId) {
        log.info("Closing contract: id={}", contractId);

        Contract contract = contractRepository.findById(contractId)
                .orElseThrow(() -> new ContractNotFoundException(contractId));

        if (contract.getStatus() == ContractStatus.CLOSED) {
            log.debug("Contract already closed: id={}", contractId);
        }
        contract.setStatus(ContractStatus.CLOSED);

        return write("close", contract);
    }

    /**
     * Deletes a contract. Nothing references contracts, so no constraint applies.
     *
     * @param contractId contract ID
     * @throws ContractNotFoundException if no contract has this id
     */
    @Transactional
    @Timed(value = "contracts.delete", description = "Time taken to delete a contract")
    public void deleteContract(Long contractId) {
        log.info("Deleting contract: id={}", contractId);

        Contract contract = contractRepository.findById(contractId)
                .orElseThrow(() -> new ContractNotFoundException(contractId));

        contractRepository.delete(contract);
        contractRepository.flush();
        metricsHelper.recordContractWrite("delete", true);

        log.info("Contract deleted: id={}", contractId);
    }

    @Transactional(readOnly = true)
    public Optional<Contract> getContract(Long contractId) {
        log.debug("Getting contract: id={}", contractId);
        return contractRepository.findById(contractId);
    }

    @Transactional(readOnly = true)
    public Optional<Contract> getContractByNumber(String number) {
        log.debug("Getting contract: number={}", number);
        return contractRepository.findByNumber(number);
    }

    /**
     * Gets a contract together with its client's display name.
     *
     * @param contractId contract ID
     * @return the contract view if found
     */
    @Transactional(readOnly = true)
    public Optional<ContractView> getContractView(Long contractId) {
        log.debug("Getting contract view: id={}", contractId);
        return contractQueryRepository.findViewById(contractId);
    }

    /**
     * Gets all contracts of a client, newest first.
     *
     * @param clientId client ID
     * @return the client's contracts, empty if none
     */
    @Transactional(readOnly = true)
    public List<Contract> getContractsByClient(Long clientId) {
        log.debug("Getting contracts for client: clientId={}", clientId);
        return contractRepository.findByClientId(clientId);
    }

    @Transactional(readOnly = true)
    public long countContracts(ContractFilter filter) {
        return contractQueryRepository.count(filter);
    }

    /**
     * Searches contracts using the configured default page size.
     *
     * @see #searchContracts(ContractFilter, Sort, int, int)
     */
    @Transactional(readOnly = true)
    public Page<ContractView> searchContracts(ContractFilter filter, Sort sort, int page) {
        return searchContracts(filter, sort, page, properties.getDefaultPageSize());
    }

    /**
     * Searches contracts page by page.
     *
     * @param filter lookup criteria, null for all contracts
     * @param sort sort order (see {@link ContractSort#of}), null for id descending
     * @param page 1-based page number
     * @param size requested page size, capped at contracts.registry.max-page-size
     * @return the requested page and the total match count
     * @throws IllegalArgumentException if page or size is not positive
     */
    @Transactional(readOnly = true)
    @Timed(value = "contracts.search", description = "Time taken to search contracts")
    public Page<ContractView> searchContracts(ContractFilter filter, Sort sort, int page, int size) {
        if (page <= 0 || size <= 0) {
            throw new IllegalArgumentException("Page and size must be > 0: page=" + page + ", size=" + size);
        }

        return search(filter, PageRequest.of(page - 1, size, sort == null ? ContractSort.DEFAULT : sort));
    }

    /**
     * Searches contracts with a Spring Data page request (0-based page number).
     * An unsorted request sorts by id descending; the page size is capped at
     * contracts.registry.max-page-size.
     *
     * @param filter lookup criteria, null for all contracts
     * @param pageable page request
     * @return the requested page and the total match count
     */
    @Transactional(readOnly = true)
    @Timed(value = "contracts.search", description = "Time taken to search contracts")
    public Page<ContractView> searchContracts(ContractFilter filter, Pageable pageable) {
        return search(filter, pageable == null ? Pageable.unpaged() : pageable);
    }

    private Page<ContractView> search(ContractFilter filter, Pageable pageable) {
        int maxSize = properties.getMaxPageSize();
        Sort sort = pageable.getSort().isSorted() ? pageable.getSort() : ContractSort.DEFAULT;

        Pageable effective = pageable.isUnpaged()
                ? PageRequest.of(0, maxSize, sort)
                : PageRequest.of(pageable.getPageNumber(), Math.min(pageable.getPageSize(), maxSize), sort);
        ContractFilter effectiveFilter = filter == null ? ContractFilter.none() : filter;

        log.debug("Searching contracts: filter={}, pageable={}", effectiveFilter, effective);

        long total = contractQueryRepository.count(effectiveFilter);
        List<ContractView> items = contractQueryRepository.findPage(effectiveFilter, effective);

        return new PageImpl<>(items, effective, total);
    }

    private void applyDraft(Contract contract, ContractDraft draft) {
        contract.setNumber(draft.number());
        contract.setClient(draft.clientId() == null ? null : clientRepository.getReferenceById(draft.clientId()));
        contract.setPrincipal(draft.principal());
        contract.setStatus(draft.status());
        contract.setStartDate(draft.startDate());
        contract.setEndDate(draft.endDate());
    }

    private Contract write(String operation, Contract contract) {
        try {
            Contract saved = contractRepository.saveAndFlush(contract);
            metricsHelper.recordContractWrite(operation, true);
            return saved;
        } catch (DataIntegrityViolationException e) {
            metricsHelper.recordContractWrite(operation, false);
            IntegrityViolationException violation = violationTranslator.translate(e);
            metricsHelper.recordIntegrityViolation(violation.getType(), violation.getConstraintName());
            log.warn("Contract {} rejected: type={}, constraint={}, number={}",
                    operation, violation.getType(), violation.getConstraintName(), contract.getNumber());
            throw violation;
        }
    }
}
