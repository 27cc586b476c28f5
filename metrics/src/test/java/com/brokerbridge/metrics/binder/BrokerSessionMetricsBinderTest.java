package com.brokerbridge.metrics.binder;

import com.brokerbridge.engine.BrokerSession;
import com.brokerbridge.engine.SessionConfig;
import com.brokerbridge.metrics.LoopbackTransport;
import com.brokerbridge.tables.InMemoryTableSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BrokerSessionMetricsBinderTest {

    @Test
    void aggregatesOverSessions() {
        BrokerSession paper = session("paper", false);
        BrokerSession live = session("live", true);
        BrokerSessionMetricsBinder binder = new BrokerSessionMetricsBinder(List.of(paper, live));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        binder.bindTo(registry);

        assertEquals(2.0, registry.get("brokerbridge.sessions.total").gauge().value());
        assertEquals(0.0, registry.get("brokerbridge.sessions.connected.count").gauge().value());
        assertEquals(1.0, registry.get("brokerbridge.sessions.read_only.count").gauge().value());

        paper.connect();
        paper.requestAccountSummary(BrokerSession.ALL_ACCOUNTS);
        paper.requestAccountPositions(BrokerSession.ALL_ACCOUNTS);

        assertEquals(1.0, registry.get("brokerbridge.sessions.connected.count").gauge().value());
        assertEquals(2.0, registry.get("brokerbridge.sessions.requests.open").gauge().value());
        assertEquals(0.0, registry.get("brokerbridge.sessions.orders.live").gauge().value());
    }

    @Test
    void sessionsAddedAfterBindingAreCounted() {
        BrokerSessionMetricsBinder binder = new BrokerSessionMetricsBinder();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        binder.bindTo(registry);
        assertEquals(0.0, registry.get("brokerbridge.sessions.total").gauge().value());

        BrokerSession session = session("late", false);
        binder.addSession(session);
        assertEquals(1.0, registry.get("brokerbridge.sessions.total").gauge().value());

        binder.removeSession(session);
        assertEquals(0.0, registry.get("brokerbridge.sessions.total").gauge().value());
    }

    private static BrokerSession session(String name, boolean readOnly) {
        SessionConfig config = SessionConfig.builder()
                .name(name)
                .readOnly(readOnly)
                .subscribeOnConnect(false)
                .maxRequestsPerSecond(0)
                .build();
        return new BrokerSession(config, new LoopbackTransport(), new InMemoryTableSink());
    }
}
