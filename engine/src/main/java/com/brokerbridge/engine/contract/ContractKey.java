package com.brokerbridge.engine.contract;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Normalized identity of a {@link Contract}, used as the registry cache key.
 *
 * <p>Strings are trimmed and upper-cased, missing strings and a zero strike or conId
 * count as unset, option rights are reduced to {@code C}/{@code P}, and strikes are
 * compared numerically.</p>
 */
public final class ContractKey {

    private final String value;

    private ContractKey(String value) {
        this.value = value;
    }

    public static ContractKey of(Contract contract) {
        StringBuilder sb = new StringBuilder(64);
        sb.append(contract.getConId() > 0 ? Integer.toString(contract.getConId()) : "").append('|');
        append(sb, contract.getSymbol());
        append(sb, contract.getSecType());
        append(sb, contract.getLastTradeDateOrContractMonth());
        sb.append(contract.getStrike() == 0
                ? ""
                : BigDecimal.valueOf(contract.getStrike()).stripTrailingZeros().toPlainString()).append('|');
        append(sb, normalizeRight(contract.getRight()));
        append(sb, contract.getMultiplier());
        append(sb, contract.getExchange());
        append(sb, contract.getPrimaryExchange());
        append(sb, contract.getCurrency());
        append(sb, contract.getLocalSymbol());
        append(sb, contract.getTradingClass());
        return new ContractKey(sb.toString());
    }

    private static void append(StringBuilder sb, String field) {
        if (field != null) {
            sb.append(field.trim().toUpperCase(Locale.ROOT));
        }
        sb.append('|');
    }

    private static String normalizeRight(String right) {
        if (right == null) {
            return null;
        }
        switch (right.trim().toUpperCase(Locale.ROOT)) {
            case "C":
            case "CALL":
                return "C";
            case "P":
            case "PUT":
                return "P";
            case "?":
            case "0":
                return null;
            default:
                return right;
        }
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ContractKey && value.equals(((ContractKey) o).value));
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
