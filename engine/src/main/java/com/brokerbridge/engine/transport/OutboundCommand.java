package com.brokerbridge.engine.transport;

import com.brokerbridge.engine.contract.Contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded command for the broker. {@code requestId} is the correlation id (the order
 * id for order commands), or -1 for commands the broker answers without one.
 */
public final class OutboundCommand {

    private final CommandType type;
    private final int requestId;
    private final Contract contract;
    private final Map<String, Object> params;

    private OutboundCommand(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type");
        this.requestId = builder.requestId;
        this.contract = builder.contract;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
    }

    public CommandType getType() {
        return type;
    }

    public int getRequestId() {
        return requestId;
    }

    public Contract getContract() {
        return contract;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public Object param(String name) {
        return params.get(name);
    }

    public static Builder builder(CommandType type) {
        return new Builder(type);
    }

    public static class Builder {
        private final CommandType type;
        private int requestId = -1;
        private Contract contract;
        private final Map<String, Object> params = new LinkedHashMap<>();

        private Builder(CommandType type) {
            this.type = type;
        }

        public Builder requestId(int requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder contract(Contract contract) {
            this.contract = contract;
            return this;
        }

        public Builder param(String name, Object value) {
            if (value != null) {
                params.put(name, value);
            }
            return this;
        }

        public Builder params(Map<String, ?> values) {
            values.forEach(this::param);
            return this;
        }

        public OutboundCommand build() {
            return new OutboundCommand(this);
        }
    }

    @Override
    public String toString() {
        return "OutboundCommand[" + type + ", requestId=" + requestId
                + (contract != null ? ", " + contract : "")
                + (params.isEmpty() ? "" : ", " + params) + "]";
    }
}
