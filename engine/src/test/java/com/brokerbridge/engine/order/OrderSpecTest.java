package com.brokerbridge.engine.order;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrderSpecTest {

    @Test
    void limitOrderParams() {
        Map<String, Object> params = OrderSpec.limit(OrderAction.BUY, 100, 187.5)
                .timeInForce(TimeInForce.GTC)
                .orderRef("rebalance")
                .build()
                .toParams();

        assertEquals("BUY", params.get("action"));
        assertEquals("LMT", params.get("orderType"));
        assertEquals(100.0, params.get("totalQuantity"));
        assertEquals(187.5, params.get("lmtPrice"));
        assertEquals("GTC", params.get("tif"));
        assertEquals("rebalance", params.get("orderRef"));
        assertFalse(params.containsKey("auxPrice"));
        assertFalse(params.containsKey("account"));
    }

    @Test
    void marketOrderHasNoPrices() {
        Map<String, Object> params = OrderSpec.market(OrderAction.SELL, 5).build().toParams();

        assertEquals("MKT", params.get("orderType"));
        assertFalse(params.containsKey("lmtPrice"));
    }

    @Test
    void stopLimitNeedsBothPrices() {
        assertThrows(IllegalArgumentException.class, () -> OrderSpec.builder()
                .action(OrderAction.SELL).orderType(OrderType.STOP_LIMIT).quantity(10).limitPrice(99).build());

        OrderSpec spec = OrderSpec.builder()
                .action(OrderAction.SELL).orderType(OrderType.STOP_LIMIT).quantity(10).limitPrice(99).auxPrice(100)
                .build();
        assertEquals(100.0, spec.toParams().get("auxPrice"));
    }

    @Test
    void quantityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> OrderSpec.market(OrderAction.BUY, 0).build());
        assertThrows(IllegalArgumentException.class, () -> OrderSpec.limit(OrderAction.BUY, 10, 0).build());
    }

    @Test
    void actionIsRequired() {
        assertThrows(NullPointerException.class, () -> OrderSpec.builder().quantity(1).limitPrice(1).build());
    }
}
