package com.brokerbridge.engine.order;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters of an order to place. Validated when built.
 */
public final class OrderSpec {

    private final OrderAction action;
    private final OrderType orderType;
    private final double quantity;
    private final double limitPrice;
    private final double auxPrice;
    private final TimeInForce timeInForce;
    private final String account;
    private final String orderRef;
    private final boolean outsideRth;

    private OrderSpec(Builder builder) {
        this.action = builder.action;
        this.orderType = builder.orderType;
        this.quantity = builder.quantity;
        this.limitPrice = builder.limitPrice;
        this.auxPrice = builder.auxPrice;
        this.timeInForce = builder.timeInForce;
        this.account = builder.account;
        this.orderRef = builder.orderRef;
        this.outsideRth = builder.outsideRth;
    }

    public OrderAction getAction() {
        return action;
    }

    public OrderType getOrderType() {
        return orderType;
    }

    public double getQuantity() {
        return quantity;
    }

    public double getLimitPrice() {
        return limitPrice;
    }

    public double getAuxPrice() {
        return auxPrice;
    }

    public TimeInForce getTimeInForce() {
        return timeInForce;
    }

    public String getAccount() {
        return account;
    }

    public String getOrderRef() {
        return orderRef;
    }

    public boolean isOutsideRth() {
        return outsideRth;
    }

    /**
     * Order fields as sent with a place-order command.
     */
    public Map<String, Object> toParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("action", action.name());
        params.put("orderType", orderType.getCode());
        params.put("totalQuantity", quantity);
        if (orderType.needsLimitPrice()) {
            params.put("lmtPrice", limitPrice);
        }
        if (orderType.needsAuxPrice()) {
            params.put("auxPrice", auxPrice);
        }
        params.put("tif", timeInForce.name());
        if (account != null) {
            params.put("account", account);
        }
        if (orderRef != null) {
            params.put("orderRef", orderRef);
        }
        if (outsideRth) {
            params.put("outsideRth", true);
        }
        return params;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder limit(OrderAction action, double quantity, double limitPrice) {
        return builder().action(action).orderType(OrderType.LIMIT).quantity(quantity).limitPrice(limitPrice);
    }

    public static Builder market(OrderAction action, double quantity) {
        return builder().action(action).orderType(OrderType.MARKET).quantity(quantity);
    }

    public static class Builder {
        private OrderAction action;
        private OrderType orderType = OrderType.LIMIT;
        private double quantity;
        private double limitPrice;
        private double auxPrice;
        private TimeInForce timeInForce = TimeInForce.DAY;
        private String account;
        private String orderRef;
        private boolean outsideRth;

        public Builder action(OrderAction action) {
            this.action = action;
            return this;
        }

        public Builder orderType(OrderType orderType) {
            this.orderType = orderType;
            return this;
        }

        public Builder quantity(double quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder limitPrice(double limitPrice) {
            this.limitPrice = limitPrice;
            return this;
        }

        public Builder auxPrice(double auxPrice) {
            this.auxPrice = auxPrice;
            return this;
        }

        public Builder timeInForce(TimeInForce timeInForce) {
            this.timeInForce = timeInForce;
            return this;
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public Builder orderRef(String orderRef) {
            this.orderRef = orderRef;
            return this;
        }

        public Builder outsideRth(boolean outsideRth) {
            this.outsideRth = outsideRth;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a required field is missing or out of range
         */
        public OrderSpec build() {
            Objects.requireNonNull(action, "action");
            Objects.requireNonNull(orderType, "orderType");
            Objects.requireNonNull(timeInForce, "timeInForce");
            if (!(quantity > 0)) {
                throw new IllegalArgumentException("Quantity must be positive: " + quantity);
            }
            if (orderType.needsLimitPrice() && !(limitPrice > 0)) {
                throw new IllegalArgumentException(orderType + " order needs a positive limit price");
            }
            if (orderType.needsAuxPrice() && !(auxPrice > 0)) {
                throw new IllegalArgumentException(orderType + " order needs a positive stop price");
            }
            return new OrderSpec(this);
        }
    }

    @Override
    public String toString() {
        return String.format("OrderSpec[%s %s %s%s %s]", action, quantity, orderType.getCode(),
                orderType.needsLimitPrice() ? " @" + limitPrice : "", timeInForce);
    }
}
