package com.brokerbridge.engine.contract;

import java.util.Objects;

/**
 * Caller handle for a contract resolved and cached by the {@link ContractRegistry}.
 *
 * <p>The internal id is unique within a session and never changes. Every request
 * method that targets an instrument takes a registered contract.</p>
 */
public final class RegisteredContract {

    private final long internalId;
    private final ContractDetails details;

    RegisteredContract(long internalId, ContractDetails details) {
        this.internalId = internalId;
        this.details = Objects.requireNonNull(details, "details");
    }

    public long getInternalId() {
        return internalId;
    }

    public ContractDetails getDetails() {
        return details;
    }

    /**
     * The resolved contract sent upstream with requests.
     */
    public Contract getContract() {
        return details.getContract();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RegisteredContract)) {
            return false;
        }
        RegisteredContract that = (RegisteredContract) o;
        return internalId == that.internalId && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(internalId, details);
    }

    @Override
    public String toString() {
        return "RegisteredContract[" + internalId + ": " + details.getContract() + "]";
    }
}
