package com.brokerbridge.metrics.binder;

import com.brokerbridge.engine.BrokerSession;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registers aggregate gauges over a set of broker sessions.
 *
 * <p>Sessions may be added after binding; the gauges read the current set.</p>
 */
public class BrokerSessionMetricsBinder implements MeterBinder {

    private static final Logger log = LoggerFactory.getLogger(BrokerSessionMetricsBinder.class);

    private final List<BrokerSession> sessions = new CopyOnWriteArrayList<>();

    public BrokerSessionMetricsBinder() {
    }

    public BrokerSessionMetricsBinder(Collection<BrokerSession> sessions) {
        this.sessions.addAll(sessions);
    }

    public void addSession(BrokerSession session) {
        sessions.add(session);
    }

    public void removeSession(BrokerSession session) {
        sessions.remove(session);
    }

    public List<BrokerSession> getSessions() {
        return List.copyOf(sessions);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("brokerbridge.sessions.total", sessions, List::size)
                .description("Total registered broker sessions")
                .register(registry);

        Gauge.builder("brokerbridge.sessions.connected.count", sessions,
                        s -> s.stream()
                                .filter(BrokerSession::isConnected)
                                .count())
                .description("Number of connected broker sessions")
                .register(registry);

        Gauge.builder("brokerbridge.sessions.read_only.count", sessions,
                        s -> s.stream()
                                .filter(BrokerSession::isReadOnly)
                                .count())
                .description("Number of read-only broker sessions")
                .register(registry);

        Gauge.builder("brokerbridge.sessions.requests.open", sessions,
                        s -> s.stream()
                                .mapToInt(session -> session.getRequestTracker().getOpenCount())
                                .sum())
                .description("Open requests across all sessions")
                .register(registry);

        Gauge.builder("brokerbridge.sessions.orders.live", sessions,
                        s -> s.stream()
                                .mapToInt(session -> session.getOrderManager().getLiveOrderCount())
                                .sum())
                .description("Live orders across all sessions")
                .register(registry);

        log.info("Registered aggregate broker session metrics");
    }
}
