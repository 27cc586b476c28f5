package com.brokerbridge.engine.error;

import com.brokerbridge.engine.contract.Contract;

/**
 * The broker matched no instrument for a contract description, rejected the
 * lookup, or did not answer in time.
 */
public class UnresolvedContractException extends BrokerSessionException {

    private final transient Contract contract;

    public UnresolvedContractException(Contract contract, String reason) {
        super("Unable to resolve contract " + contract + ": " + reason);
        this.contract = contract;
    }

    public UnresolvedContractException(Contract contract, String reason, Throwable cause) {
        super("Unable to resolve contract " + contract + ": " + reason, cause);
        this.contract = contract;
    }

    public Contract getContract() {
        return contract;
    }
}
