package com.brokerbridge.engine.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The broker's full description of a resolved instrument.
 */
public final class ContractDetails {

    private final Contract contract;
    private final String marketName;
    private final String longName;
    private final double minTick;
    private final String validExchanges;
    private final String marketRuleIds;
    private final String timeZoneId;
    private final String industry;
    private final String category;

    private ContractDetails(Builder builder) {
        this.contract = Objects.requireNonNull(builder.contract, "contract");
        this.marketName = builder.marketName;
        this.longName = builder.longName;
        this.minTick = builder.minTick;
        this.validExchanges = builder.validExchanges;
        this.marketRuleIds = builder.marketRuleIds;
        this.timeZoneId = builder.timeZoneId;
        this.industry = builder.industry;
        this.category = builder.category;
    }

    /**
     * The resolved contract, with the broker's conId filled in.
     */
    public Contract getContract() {
        return contract;
    }

    public String getMarketName() {
        return marketName;
    }

    public String getLongName() {
        return longName;
    }

    public double getMinTick() {
        return minTick;
    }

    public String getValidExchanges() {
        return validExchanges;
    }

    /**
     * @return the raw comma separated market rule ids, one per valid exchange
     */
    public String getMarketRuleIds() {
        return marketRuleIds;
    }

    /**
     * Distinct market rule ids, parsed.
     */
    public List<Integer> marketRules() {
        if (marketRuleIds == null || marketRuleIds.isBlank()) {
            return Collections.emptyList();
        }
        List<Integer> rules = new ArrayList<>();
        for (String id : marketRuleIds.split(",")) {
            String trimmed = id.trim();
            if (!trimmed.isEmpty()) {
                Integer rule = Integer.valueOf(trimmed);
                if (!rules.contains(rule)) {
                    rules.add(rule);
                }
            }
        }
        return rules;
    }

    public String getTimeZoneId() {
        return timeZoneId;
    }

    public String getIndustry() {
        return industry;
    }

    public String getCategory() {
        return category;
    }

    public static Builder builder(Contract contract) {
        return new Builder(contract);
    }

    public static class Builder {
        private final Contract contract;
        private String marketName;
        private String longName;
        private double minTick;
        private String validExchanges;
        private String marketRuleIds;
        private String timeZoneId;
        private String industry;
        private String category;

        private Builder(Contract contract) {
            this.contract = contract;
        }

        public Builder marketName(String marketName) {
            this.marketName = marketName;
            return this;
        }

        public Builder longName(String longName) {
            this.longName = longName;
            return this;
        }

        public Builder minTick(double minTick) {
            this.minTick = minTick;
            return this;
        }

        public Builder validExchanges(String validExchanges) {
            this.validExchanges = validExchanges;
            return this;
        }

        public Builder marketRuleIds(String marketRuleIds) {
            this.marketRuleIds = marketRuleIds;
            return this;
        }

        public Builder timeZoneId(String timeZoneId) {
            this.timeZoneId = timeZoneId;
            return this;
        }

        public Builder industry(String industry) {
            this.industry = industry;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public ContractDetails build() {
            return new ContractDetails(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContractDetails)) {
            return false;
        }
        ContractDetails that = (ContractDetails) o;
        return Double.compare(that.minTick, minTick) == 0
                && contract.equals(that.contract)
                && Objects.equals(marketName, that.marketName)
                && Objects.equals(longName, that.longName)
                && Objects.equals(validExchanges, that.validExchanges)
                && Objects.equals(marketRuleIds, that.marketRuleIds)
                && Objects.equals(timeZoneId, that.timeZoneId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contract, marketName, longName, minTick, validExchanges, marketRuleIds, timeZoneId);
    }

    @Override
    public String toString() {
        return "ContractDetails[" + contract + ", longName=" + longName + ", minTick=" + minTick + "]";
    }
}
