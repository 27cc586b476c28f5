package com.brokerbridge.engine.error;

import com.brokerbridge.engine.contract.Contract;
import com.brokerbridge.engine.contract.ContractDetails;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The broker matched more than one instrument for a contract description.
 *
 * <p>Supply disambiguating fields (conId, expiry, exchange, ...) and register again.</p>
 */
public class AmbiguousContractException extends BrokerSessionException {

    private final transient Contract contract;
    private final transient List<ContractDetails> candidates;

    public AmbiguousContractException(Contract contract, List<ContractDetails> candidates) {
        super("Contract matches " + candidates.size() + " instruments: " + contract + " -> "
                + candidates.stream()
                        .map(details -> details.getContract().toString())
                        .collect(Collectors.joining(", ")));
        this.contract = contract;
        this.candidates = List.copyOf(candidates);
    }

    public Contract getContract() {
        return contract;
    }

    public List<ContractDetails> getCandidates() {
        return candidates;
    }
}
